package dev.masterrecipe.model;

public record MatchedProperty(
    String propertyId,
    String propertyName,
    String propertyUnit
) {}
