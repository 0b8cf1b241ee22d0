package dev.masterrecipe.model;

import java.util.Map;

/**
 * The optimal solution chosen by the external scorer. Only {@code solutionId} drives compilation;
 * the figures are reported after the document is written.
 */
public record SolutionSelection(
    String solutionId,
    double compositeScore,
    double totalEnergyCost,
    double totalUseCost,
    double totalCo2Footprint,
    boolean materialFlowConsistent,
    Map<String, Integer> resourceUsage
) {

    public static SolutionSelection of(String solutionId) {
        return new SolutionSelection(solutionId, 0.0, 0.0, 0.0, 0.0, false, Map.of());
    }
}
