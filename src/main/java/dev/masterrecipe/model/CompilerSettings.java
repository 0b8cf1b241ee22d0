package dev.masterrecipe.model;

import java.util.List;
import java.util.Map;

/**
 * Document constants and lookup tables used while compiling a master recipe.
 */
public record CompilerSettings(
    String listHeaderId,
    String version,
    String zoneOffset,
    String productId,
    String productName,
    String equipmentRequirementId,
    String constraintId,
    String constraintCondition,
    String equipmentRequirementDescription,
    List<String> resourcePrefixes,
    Map<String, String> operationShortNames,
    List<PropertyOverride> propertyOverrides
) {
    public static final String DEFAULT_LIST_HEADER_ID = "ListHeadID";
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_ZONE_OFFSET = "+01:00";
    public static final String DEFAULT_PRODUCT_ID = "StirredHeatedWater";
    public static final String DEFAULT_PRODUCT_NAME = "Stirred and Heated Water";
    public static final String DEFAULT_EQUIPMENT_REQUIREMENT_ID = "Equipment Requirement for the HCs";
    public static final String DEFAULT_CONSTRAINT_ID = "Material constraint";
    public static final String DEFAULT_CONSTRAINT_CONDITION = "Material == H2O";
    public static final String DEFAULT_EQUIPMENT_REQUIREMENT_DESCRIPTION =
        "Only water is allowed for the stirring and heating process";
    public static final List<String> DEFAULT_RESOURCE_PREFIXES = List.of("resource: ", "2025-04_");
    public static final Map<String, String> DEFAULT_OPERATION_SHORT_NAMES = Map.of(
        "Mixing_of_Liquids", "Mixing",
        "Dosing", "Dosing",
        "Heating_of_liquids", "Heating"
    );

    /**
     * Forces the property lookup of one parameter to a fixed capability/property pair,
     * bypassing the matched properties of the assignment.
     */
    public record PropertyOverride(
        String processElementId,
        String parameterId,
        String capabilityName,
        String propertyName
    ) {}

    public static CompilerSettings defaults() {
        return new CompilerSettings(
            DEFAULT_LIST_HEADER_ID,
            DEFAULT_VERSION,
            DEFAULT_ZONE_OFFSET,
            DEFAULT_PRODUCT_ID,
            DEFAULT_PRODUCT_NAME,
            DEFAULT_EQUIPMENT_REQUIREMENT_ID,
            DEFAULT_CONSTRAINT_ID,
            DEFAULT_CONSTRAINT_CONDITION,
            DEFAULT_EQUIPMENT_REQUIREMENT_DESCRIPTION,
            DEFAULT_RESOURCE_PREFIXES,
            DEFAULT_OPERATION_SHORT_NAMES,
            List.of()
        );
    }

    /**
     * Resource name without the configured prefixes, e.g. {@code "resource: 2025-04_HC10"} becomes {@code "HC10"}.
     */
    public String shortResourceName(String resource) {
        String shortName = resource;
        for (String prefix : resourcePrefixes) {
            shortName = shortName.replace(prefix, "");
        }
        return shortName;
    }

    public String operationShortName(String description) {
        return operationShortNames.getOrDefault(description, description);
    }
}
