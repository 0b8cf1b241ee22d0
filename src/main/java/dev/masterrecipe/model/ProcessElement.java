package dev.masterrecipe.model;

import java.util.List;

/**
 * One abstract operation of a general recipe, e.g. mixing, dosing or heating.
 */
public record ProcessElement(
    String id,
    String description,
    List<Parameter> parameters
) {}
