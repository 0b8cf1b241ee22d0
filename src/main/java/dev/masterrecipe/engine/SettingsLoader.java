package dev.masterrecipe.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.masterrecipe.model.CompilerSettings;
import dev.masterrecipe.model.CompilerSettings.PropertyOverride;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link CompilerSettings} from JSON. Every field is optional and falls back to its default.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    public static CompilerSettings loadFromFile(Path path) throws IOException {
        return parseSettings(MAPPER.readTree(path.toFile()));
    }

    public static CompilerSettings loadFromString(String json) throws IOException {
        return parseSettings(MAPPER.readTree(json));
    }

    private static CompilerSettings parseSettings(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return CompilerSettings.defaults();
        }
        return new CompilerSettings(
            text(node, "listHeaderId", CompilerSettings.DEFAULT_LIST_HEADER_ID),
            text(node, "version", CompilerSettings.DEFAULT_VERSION),
            zoneOffset(text(node, "zoneOffset", CompilerSettings.DEFAULT_ZONE_OFFSET)),
            text(node, "productId", CompilerSettings.DEFAULT_PRODUCT_ID),
            text(node, "productName", CompilerSettings.DEFAULT_PRODUCT_NAME),
            text(node, "equipmentRequirementId", CompilerSettings.DEFAULT_EQUIPMENT_REQUIREMENT_ID),
            text(node, "constraintId", CompilerSettings.DEFAULT_CONSTRAINT_ID),
            text(node, "constraintCondition", CompilerSettings.DEFAULT_CONSTRAINT_CONDITION),
            text(node, "equipmentRequirementDescription", CompilerSettings.DEFAULT_EQUIPMENT_REQUIREMENT_DESCRIPTION),
            parseResourcePrefixes(node.get("resourcePrefixes")),
            parseOperationShortNames(node.get("operationShortNames")),
            parsePropertyOverrides(node.get("propertyOverrides"))
        );
    }

    private static String zoneOffset(String value) {
        try {
            ZoneOffset.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zoneOffset '%s': %s".formatted(value, e.getMessage()), e);
        }
        return value;
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static List<String> parseResourcePrefixes(JsonNode node) {
        if (node == null) {
            return CompilerSettings.DEFAULT_RESOURCE_PREFIXES;
        }
        var prefixes = new ArrayList<String>();
        node.forEach(p -> prefixes.add(p.asText()));
        return List.copyOf(prefixes);
    }

    private static Map<String, String> parseOperationShortNames(JsonNode node) {
        if (node == null) {
            return CompilerSettings.DEFAULT_OPERATION_SHORT_NAMES;
        }
        var names = new LinkedHashMap<String, String>();
        for (var entry : node.properties()) {
            names.put(entry.getKey(), entry.getValue().asText());
        }
        return Collections.unmodifiableMap(names);
    }

    private static List<PropertyOverride> parsePropertyOverrides(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        var overrides = new ArrayList<PropertyOverride>();
        for (JsonNode o : node) {
            for (String field : List.of("processElementId", "parameterId", "capabilityName", "propertyName")) {
                if (!o.hasNonNull(field)) {
                    throw new IllegalArgumentException("Property override is missing '%s': %s".formatted(field, o));
                }
            }
            overrides.add(new PropertyOverride(
                o.get("processElementId").asText(),
                o.get("parameterId").asText(),
                o.get("capabilityName").asText(),
                o.get("propertyName").asText()
            ));
        }
        return List.copyOf(overrides);
    }
}
