package dev.masterrecipe.model;

import java.util.List;

public record CapabilityDetail(
    String capabilityName,
    List<MatchedProperty> matchedProperties
) {}
