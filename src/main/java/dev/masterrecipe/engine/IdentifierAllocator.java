package dev.masterrecipe.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mutable identifier state for one compile pass.
 * Formula parameters and recipe elements are numbered by two independent counters starting at 1.
 */
public final class IdentifierAllocator {

    public static final String NULL_MARKER = "null";

    /** Fallback tokens for recipe elements without a realized-by reference. */
    public static final Supplier<String> RANDOM_TOKENS = () -> UUID.randomUUID().toString();

    private final Supplier<String> tokenSource;
    private final Map<ParameterKey, String> parameterIds;
    private int parameterCount;
    private int recipeElementCount;

    public IdentifierAllocator(Supplier<String> tokenSource) {
        this.tokenSource = tokenSource;
        this.parameterIds = new LinkedHashMap<>();
        this.parameterCount = 0;
        this.recipeElementCount = 0;
    }

    /**
     * Identifies a parameter by its process element, so equal parameter ids of different elements stay apart.
     */
    public record ParameterKey(String processElementId, String parameterId) {}

    /**
     * Allocated recipe element: its ordinal and the formatted identifier.
     */
    public record ElementId(int ordinal, String id) {}

    /**
     * Allocate the next formula parameter id, {@code <ordinal>:<reference>}, and remember it for {@code key}.
     */
    public String allocateParameter(ParameterKey key, Optional<String> reference) {
        if (parameterIds.containsKey(key)) {
            throw new IllegalStateException("Parameter already allocated: " + key);
        }
        parameterCount++;
        String id = formatOrdinal(parameterCount) + ":" + reference.orElse(NULL_MARKER);
        parameterIds.put(key, id);
        return id;
    }

    /**
     * Allocate the next recipe element id, {@code <ordinal>:<reference>}, falling back to a fresh token.
     */
    public ElementId allocateRecipeElement(Optional<String> reference) {
        recipeElementCount++;
        String suffix = reference.orElseGet(tokenSource);
        return new ElementId(recipeElementCount, formatOrdinal(recipeElementCount) + ":" + suffix);
    }

    public Optional<String> parameterId(ParameterKey key) {
        return Optional.ofNullable(parameterIds.get(key));
    }

    /** Read-only view of all allocated parameter ids, in allocation order. */
    public Map<ParameterKey, String> parameterMapping() {
        return Collections.unmodifiableMap(parameterIds);
    }

    public int parameterCount() { return parameterCount; }
    public int recipeElementCount() { return recipeElementCount; }

    static String formatOrdinal(int ordinal) {
        return "%03d".formatted(ordinal);
    }
}
