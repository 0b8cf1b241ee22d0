package dev.masterrecipe.model;

import java.util.List;

/**
 * An equipment-agnostic recipe. The order of process elements is the execution order.
 */
public record GeneralRecipe(
    String id,
    List<ProcessElement> processElements
) {}
