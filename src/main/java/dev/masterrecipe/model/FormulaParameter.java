package dev.masterrecipe.model;

/**
 * A resolved process parameter in the formula section.
 */
public record FormulaParameter(
    String id,
    String description,
    Value value
) {
    public static final String PARAMETER_TYPE = "ProcessParameter";
    public static final String PARAMETER_SUB_TYPE = "ST";
    public static final String DATA_INTERPRETATION = "Constant";

    public record Value(String valueString, String dataType, String unitOfMeasure) {}
}
