package dev.masterrecipe.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.masterrecipe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the compiler inputs from the JSON files written by the upstream parsing and optimization tools.
 */
public final class InputLoader {

    private static final Logger log = LoggerFactory.getLogger(InputLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InputLoader() {}

    public static GeneralRecipe loadRecipe(Path path) throws IOException {
        return parseRecipe(MAPPER.readTree(path.toFile()));
    }

    public static GeneralRecipe loadRecipeFromString(String json) throws IOException {
        return parseRecipe(MAPPER.readTree(json));
    }

    public static List<AssignmentSolution> loadSolutions(Path path) throws IOException {
        return parseSolutions(MAPPER.readTree(path.toFile()));
    }

    public static List<AssignmentSolution> loadSolutionsFromString(String json) throws IOException {
        return parseSolutions(MAPPER.readTree(json));
    }

    public static ResourceCapabilityCatalog loadCatalog(Path path) throws IOException {
        return parseCatalog(MAPPER.readTree(path.toFile()));
    }

    public static ResourceCapabilityCatalog loadCatalogFromString(String json) throws IOException {
        return parseCatalog(MAPPER.readTree(json));
    }

    /**
     * Load the {@code optimal_solution} entry of an optimization report.
     */
    public static SolutionSelection loadSelection(Path path) throws IOException {
        return parseSelection(MAPPER.readTree(path.toFile()));
    }

    public static SolutionSelection loadSelectionFromString(String json) throws IOException {
        return parseSelection(MAPPER.readTree(json));
    }

    // --- general recipe ---

    private static GeneralRecipe parseRecipe(JsonNode root) {
        String id = requiredText(root, "ID", "general recipe");
        var elements = new ArrayList<ProcessElement>();
        for (JsonNode node : requiredArray(root, "ProcessElements", "general recipe " + id)) {
            elements.add(parseProcessElement(node));
        }
        return new GeneralRecipe(id, List.copyOf(elements));
    }

    private static ProcessElement parseProcessElement(JsonNode node) {
        String id = requiredText(node, "ID", "process element");
        String description = optionalText(node, "Description");
        var parameters = new ArrayList<Parameter>();
        if (node.has("Parameters")) {
            for (JsonNode param : node.get("Parameters")) {
                parameters.add(new Parameter(
                    requiredText(param, "ID", "parameter of " + id),
                    optionalText(param, "Description"),
                    optionalText(param, "Key"),
                    optionalText(param, "UnitOfMeasure"),
                    optionalText(param, "DataType"),
                    optionalText(param, "ValueString")
                ));
            }
        }
        return new ProcessElement(id, description, List.copyOf(parameters));
    }

    // --- assignment solutions ---

    private static List<AssignmentSolution> parseSolutions(JsonNode root) {
        var solutions = new ArrayList<AssignmentSolution>();
        for (JsonNode node : requiredArray(root, "solutions", "solutions file")) {
            solutions.add(parseSolution(node));
        }
        return List.copyOf(solutions);
    }

    private static AssignmentSolution parseSolution(JsonNode node) {
        String solutionId = requiredText(node, "solution_id", "solution");
        boolean consistent = node.path("material_flow_consistent").asBoolean(false);
        var assignments = new ArrayList<Assignment>();
        for (JsonNode a : requiredArray(node, "assignments", "solution " + solutionId)) {
            assignments.add(parseAssignment(a, solutionId));
        }
        return new AssignmentSolution(solutionId, consistent, List.copyOf(assignments));
    }

    private static Assignment parseAssignment(JsonNode node, String solutionId) {
        String context = "assignment of solution " + solutionId;
        String stepId = requiredText(node, "step_id", context);
        String resource = requiredText(node, "resource", context);

        var capabilities = new ArrayList<String>();
        node.path("capabilities").forEach(c -> capabilities.add(c.asText()));

        var details = new ArrayList<CapabilityDetail>();
        for (JsonNode detail : node.path("capability_details")) {
            var matched = new ArrayList<MatchedProperty>();
            for (JsonNode prop : detail.path("matched_properties")) {
                matched.add(new MatchedProperty(
                    optionalText(prop, "property_id"),
                    optionalText(prop, "property_name"),
                    optionalText(prop, "property_unit")
                ));
            }
            details.add(new CapabilityDetail(optionalText(detail, "capability_name"), List.copyOf(matched)));
        }
        return new Assignment(stepId, resource, List.copyOf(capabilities), List.copyOf(details));
    }

    // --- resource capability catalog ---

    private static ResourceCapabilityCatalog parseCatalog(JsonNode root) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("Resource capability catalog must be a JSON object");
        }
        var resources = new LinkedHashMap<String, List<CapabilityRecord>>();
        for (var entry : root.properties()) {
            var records = new ArrayList<CapabilityRecord>();
            for (JsonNode record : entry.getValue()) {
                records.add(parseCapabilityRecord(record));
            }
            resources.put(entry.getKey(), List.copyOf(records));
        }
        return new ResourceCapabilityCatalog(Collections.unmodifiableMap(resources));
    }

    private static CapabilityRecord parseCapabilityRecord(JsonNode node) {
        var names = new LinkedHashSet<String>();
        for (JsonNode cap : node.path("capability")) {
            String name = optionalText(cap, "capability_name");
            if (name != null) {
                names.add(name);
            }
        }

        var properties = new ArrayList<PropertyDescriptor>();
        for (JsonNode prop : node.path("properties")) {
            properties.add(new PropertyDescriptor(
                optionalText(prop, "property_name"),
                optionalText(prop, "propertyRealizedBy")));
        }

        var realizedBy = new ArrayList<String>();
        node.path("realized_by").forEach(r -> realizedBy.add(r.asText()));

        return new CapabilityRecord(Collections.unmodifiableSet(names), List.copyOf(properties), List.copyOf(realizedBy));
    }

    // --- optimization report ---

    private static SolutionSelection parseSelection(JsonNode root) {
        JsonNode optimal = root.get("optimal_solution");
        if (optimal == null || optimal.isNull()) {
            throw new IllegalArgumentException("Optimization report has no optimal_solution");
        }
        String solutionId = requiredText(optimal, "solution_id", "optimal_solution");

        var usage = new LinkedHashMap<String, Integer>();
        for (var entry : optimal.path("resource_usage").properties()) {
            usage.put(entry.getKey(), (int) lenientNumber(entry.getValue(), "resource_usage." + entry.getKey()));
        }

        return new SolutionSelection(
            solutionId,
            lenientNumber(optimal.get("composite_score"), "composite_score"),
            lenientNumber(optimal.get("total_energy_cost"), "total_energy_cost"),
            lenientNumber(optimal.get("total_use_cost"), "total_use_cost"),
            lenientNumber(optimal.get("total_co2_footprint"), "total_co2_footprint"),
            optimal.path("material_flow_consistent").asBoolean(false),
            Collections.unmodifiableMap(usage)
        );
    }

    // --- helpers ---

    private static String requiredText(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new IllegalArgumentException("Missing required field '%s' in %s".formatted(field, context));
        }
        return value.asText();
    }

    private static JsonNode requiredArray(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new IllegalArgumentException("Missing required array '%s' in %s".formatted(field, context));
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Numeric report figures are informational; anything unparseable counts as zero.
     */
    static double lenientNumber(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            log.warn("Unable to parse value for {}: {}", field, node.asText());
            return 0.0;
        }
    }
}
