package dev.masterrecipe.engine;

import dev.masterrecipe.model.FormulaParameter;
import dev.masterrecipe.model.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Normalizes parameter values, data types and units into the vocabulary of the batch document.
 */
public final class ParameterFormatter {

    private static final Logger log = LoggerFactory.getLogger(ParameterFormatter.class);

    private static final List<String> COMPARISON_PREFIXES = List.of(">=", "<=");

    private static final Map<String, String> DATA_TYPES = Map.of(
        "xs:int", "integer",
        "xs:double", "double",
        "int", "integer",
        "double", "double",
        "duration", "duration"
    );

    private static final Map<String, String> UNIT_LABELS = Map.of(
        "http://si-digital-framework.org/SI/units/second", "Sekunde",
        "http://si-digital-framework.org/SI/units/litre", "Liter",
        "http://si-digital-framework.org/SI/units/degreeCelsius", "Grad Celsius",
        "http://qudt.org/vocab/unit/REV-PER-MIN", "Umdrehungen pro Minute",
        "http://qudt.org/vocab/unit/PERCENT", "Prozent",
        "http://qudt.org/vocab/unit/CYC-PER-SEC", "Zyklen pro Sekunde"
    );

    private ParameterFormatter() {}

    /**
     * Build the formula value of a parameter.
     */
    public static FormulaParameter.Value formatValue(Parameter parameter) {
        return new FormulaParameter.Value(
            normalizeValue(parameter.valueString()),
            mapDataType(parameter.dataType()),
            mapUnit(parameter.unitOfMeasure())
        );
    }

    /**
     * Strip a leading {@code >=} or {@code <=}. The document has no field for the operator, so the
     * comparison is dropped and only the remainder is kept.
     */
    public static String normalizeValue(String valueString) {
        if (valueString == null) {
            return "";
        }
        for (String prefix : COMPARISON_PREFIXES) {
            if (valueString.startsWith(prefix)) {
                log.debug("Dropping comparison operator '{}' from value '{}'", prefix, valueString);
                return valueString.substring(prefix.length());
            }
        }
        return valueString;
    }

    /**
     * Map a data type tag; unknown tags pass through unchanged.
     */
    public static String mapDataType(String dataType) {
        if (dataType == null) {
            return "";
        }
        return DATA_TYPES.getOrDefault(dataType, dataType);
    }

    /**
     * Map a unit URI to its display label; unknown URIs fall back to their last path segment.
     */
    public static String mapUnit(String unitUri) {
        if (unitUri == null) {
            return "";
        }
        String label = UNIT_LABELS.get(unitUri);
        if (label != null) {
            return label;
        }
        int slash = unitUri.lastIndexOf('/');
        return slash < 0 ? unitUri : unitUri.substring(slash + 1);
    }

    /**
     * Parameter description as {@code <short resource>_<description with underscores>}.
     */
    public static String describe(String shortResource, Parameter parameter) {
        String description = parameter.description() == null ? "" : parameter.description();
        return shortResource + "_" + description.replace(' ', '_');
    }
}
