package dev.masterrecipe.engine;

import dev.masterrecipe.model.CapabilityRecord;
import dev.masterrecipe.model.PropertyDescriptor;
import dev.masterrecipe.model.ResourceCapabilityCatalog;

import java.util.Collection;
import java.util.Optional;

/**
 * Finds the equipment-internal references ("realized by") behind capabilities and properties.
 * An empty result is a valid outcome; callers write a null marker instead.
 */
public final class PropertyResolver {

    private final ResourceCapabilityCatalog catalog;

    public PropertyResolver(ResourceCapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolve the reference realizing {@code propertyName} of {@code capabilityName} on {@code resource}.
     *
     * @return the realized-by reference of the first matching property, or empty if the resource,
     *         capability or property is unknown
     */
    public Optional<String> resolve(String resource, String capabilityName, String propertyName) {
        if (propertyName == null) {
            return Optional.empty();
        }
        for (CapabilityRecord record : catalog.recordsFor(resource)) {
            if (!record.capabilityNames().contains(capabilityName)) {
                continue;
            }

            // Exact name first, then a case-insensitive pass over the same record
            for (PropertyDescriptor property : record.properties()) {
                if (propertyName.equals(property.name())) {
                    return Optional.ofNullable(property.realizedBy());
                }
            }
            for (PropertyDescriptor property : record.properties()) {
                if (property.name() != null && property.name().equalsIgnoreCase(propertyName)) {
                    return Optional.ofNullable(property.realizedBy());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the reference realizing a capability as a whole: the first realized-by entry of the first
     * record that provides any of {@code capabilities} and carries at least one reference.
     */
    public Optional<String> resolveElementReference(String resource, Collection<String> capabilities) {
        for (CapabilityRecord record : catalog.recordsFor(resource)) {
            boolean provides = record.capabilityNames().stream().anyMatch(capabilities::contains);
            if (provides && !record.realizedBy().isEmpty()) {
                return Optional.of(record.realizedBy().get(0));
            }
        }
        return Optional.empty();
    }
}
