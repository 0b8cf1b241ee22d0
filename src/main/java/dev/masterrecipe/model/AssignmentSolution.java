package dev.masterrecipe.model;

import java.util.List;
import java.util.Optional;

/**
 * One candidate binding of every process element to a resource.
 */
public record AssignmentSolution(
    String solutionId,
    boolean materialFlowConsistent,
    List<Assignment> assignments
) {

    /**
     * First assignment for the given process element, in assignment order.
     */
    public Optional<Assignment> assignmentFor(String processElementId) {
        return assignments.stream()
            .filter(a -> a.stepId().equals(processElementId))
            .findFirst();
    }
}
