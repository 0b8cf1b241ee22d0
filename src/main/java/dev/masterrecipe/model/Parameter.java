package dev.masterrecipe.model;

/**
 * A process parameter of a general recipe.
 * {@code key} matches a capability property id; {@code valueString} may carry a {@code >=} or {@code <=} prefix.
 */
public record Parameter(
    String id,
    String description,
    String key,
    String unitOfMeasure,
    String dataType,
    String valueString
) {}
