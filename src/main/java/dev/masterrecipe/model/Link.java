package dev.masterrecipe.model;

/**
 * A control link from a step to a transition or from a transition to a step.
 */
public record Link(
    String id,
    String fromId,
    NodeType fromType,
    String toId,
    NodeType toType
) {
    public static final String ID_SCOPE = "External";
    public static final String LINK_TYPE = "ControlLink";
    public static final String DEPICTION = "LineAndArrow";
    public static final String EVALUATION_ORDER = "1";
    public static final String DESCRIPTION = "string";

    public enum NodeType {
        STEP("Step"),
        TRANSITION("Transition");

        private final String label;

        NodeType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
