package dev.masterrecipe.model;

import java.util.List;
import java.util.Map;

/**
 * Capability records per resource name.
 */
public record ResourceCapabilityCatalog(Map<String, List<CapabilityRecord>> resources) {

    public boolean contains(String resource) {
        return resources.containsKey(resource);
    }

    /** Capability records of a resource, empty if the resource is unknown. */
    public List<CapabilityRecord> recordsFor(String resource) {
        return resources.getOrDefault(resource, List.of());
    }
}
