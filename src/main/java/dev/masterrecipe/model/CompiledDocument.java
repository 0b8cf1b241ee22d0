package dev.masterrecipe.model;

/**
 * The compiled batch information: list header, description and one master recipe.
 */
public record CompiledDocument(
    String listHeaderId,
    String createDate,
    String description,
    MasterRecipe masterRecipe
) {}
