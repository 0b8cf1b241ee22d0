package dev.masterrecipe.engine;

import dev.masterrecipe.model.Assignment;
import dev.masterrecipe.model.AssignmentSolution;
import dev.masterrecipe.model.GeneralRecipe;
import dev.masterrecipe.model.Parameter;
import dev.masterrecipe.model.ProcessElement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on the compiler inputs before a compile pass.
 */
public final class InputValidator {

    private InputValidator() {}

    /**
     * Problems found in the inputs. Errors make the compile meaningless; warnings are reported only.
     */
    public record Result(List<String> errors, List<String> warnings) {
        public boolean isValid() { return errors.isEmpty(); }
    }

    public static Result validate(GeneralRecipe recipe, AssignmentSolution solution) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        if (recipe.processElements().isEmpty()) {
            warnings.add("General recipe '%s' has no process elements".formatted(recipe.id()));
        }

        var elementIds = new HashSet<String>();
        for (ProcessElement element : recipe.processElements()) {
            if (element.id() == null || element.id().isBlank()) {
                errors.add("Process element with empty ID in recipe '%s'".formatted(recipe.id()));
                continue;
            }
            if (!elementIds.add(element.id())) {
                errors.add("Duplicate process element ID '%s'".formatted(element.id()));
            }

            Set<String> parameterIds = new HashSet<>();
            for (Parameter parameter : element.parameters()) {
                if (parameter.id() == null || parameter.id().isBlank()) {
                    errors.add("Process element '%s' has a parameter with empty ID".formatted(element.id()));
                } else if (!parameterIds.add(parameter.id())) {
                    errors.add("Process element '%s': duplicate parameter ID '%s'"
                        .formatted(element.id(), parameter.id()));
                }
                if (parameter.valueString() == null) {
                    warnings.add("Parameter '%s' of '%s' has no value".formatted(parameter.id(), element.id()));
                }
            }
        }

        for (Assignment assignment : solution.assignments()) {
            if (!elementIds.contains(assignment.stepId())) {
                warnings.add("Solution %s assigns unknown process element '%s'"
                    .formatted(solution.solutionId(), assignment.stepId()));
            }
        }

        return new Result(errors, warnings);
    }
}
