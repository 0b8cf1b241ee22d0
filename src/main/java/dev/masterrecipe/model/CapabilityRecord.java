package dev.masterrecipe.model;

import java.util.List;
import java.util.Set;

/**
 * A capability entry of a resource, with the equipment references that realize it.
 */
public record CapabilityRecord(
    Set<String> capabilityNames,
    List<PropertyDescriptor> properties,
    List<String> realizedBy
) {}
