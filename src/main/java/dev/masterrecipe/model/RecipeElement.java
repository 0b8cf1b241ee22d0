package dev.masterrecipe.model;

import java.util.List;

/**
 * A recipe element of the master recipe.
 * Either a begin/end marker or an operation bound to real equipment.
 */
public sealed interface RecipeElement {

    String id();

    String type();

    /** The {@code Begin} or {@code End} element referenced by the synthetic steps. */
    record Marker(String id, String type) implements RecipeElement {
        public static Marker begin() { return new Marker("Init", "Begin"); }
        public static Marker end() { return new Marker("End", "End"); }
    }

    /** Equipment-bound counterpart of a process element. */
    record Operation(
        String id,
        String description,
        String actualEquipmentId,
        String equipmentRequirementId,
        List<String> parameterIds
    ) implements RecipeElement {
        public static final String TYPE = "Operation";

        @Override
        public String type() {
            return TYPE;
        }
    }
}
