package dev.masterrecipe.model;

/**
 * A step of the procedure logic, bound to a recipe element.
 */
public record Step(
    String id,
    String recipeElementId,
    String description
) {}
