package dev.masterrecipe.engine;

import dev.masterrecipe.model.Assignment;
import dev.masterrecipe.model.AssignmentSolution;
import dev.masterrecipe.model.CapabilityDetail;
import dev.masterrecipe.model.CompilerSettings;
import dev.masterrecipe.model.GeneralRecipe;
import dev.masterrecipe.model.Link;
import dev.masterrecipe.model.ProcedureLogic;
import dev.masterrecipe.model.ProcessElement;
import dev.masterrecipe.model.RecipeElement;
import dev.masterrecipe.model.Step;
import dev.masterrecipe.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the ordered process elements of a recipe into a linear step/transition graph:
 * {@code Init -> T1 -> op1 -> T2 -> ... -> End}.
 */
public final class ControlFlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowBuilder.class);

    public static final String INITIAL_CONDITION = "true";
    public static final String UNKNOWN_CAPABILITY = "Unknown";

    private final PropertyResolver resolver;
    private final CompilerSettings settings;

    public ControlFlowBuilder(PropertyResolver resolver, CompilerSettings settings) {
        this.resolver = resolver;
        this.settings = settings;
    }

    /**
     * A process element bound to its assignment and allocated recipe element.
     */
    public record OperationBinding(
        ProcessElement element,
        Assignment assignment,
        IdentifierAllocator.ElementId elementId,
        String capabilityName,
        String shortResource
    ) {}

    /**
     * The procedure logic plus the operations it was built from, in recipe element order.
     */
    public record ControlFlow(ProcedureLogic procedureLogic, List<OperationBinding> operations) {}

    /**
     * Build steps, transitions and links. Process elements without an assignment are skipped.
     */
    public ControlFlow build(GeneralRecipe recipe, AssignmentSolution solution, IdentifierAllocator allocator) {
        var steps = new ArrayList<Step>();
        var operations = new ArrayList<OperationBinding>();

        steps.add(new Step(stepId(1), RecipeElement.Marker.begin().id(), "Init"));

        for (ProcessElement element : recipe.processElements()) {
            Optional<Assignment> found = solution.assignmentFor(element.id());
            if (found.isEmpty()) {
                log.warn("No assignment found for process element {}", element.id());
                continue;
            }
            Assignment assignment = found.get();

            String shortResource = settings.shortResourceName(assignment.resource());
            String capabilityName = capabilityName(assignment);
            var elementId = allocator.allocateRecipeElement(
                resolver.resolveElementReference(assignment.resource(), assignment.capabilities()));

            String description = "%s:%s_%s:%s".formatted(
                IdentifierAllocator.formatOrdinal(elementId.ordinal()),
                shortResource, element.description(), capabilityName);

            steps.add(new Step(stepId(steps.size() + 1), elementId.id(), description));
            operations.add(new OperationBinding(element, assignment, elementId, capabilityName, shortResource));
            log.debug("Step {} -> {}", stepId(steps.size()), description);
        }

        steps.add(new Step(stepId(steps.size() + 1), RecipeElement.Marker.end().id(), "End"));

        var logic = new ProcedureLogic(linksFor(steps), steps, transitionsFor(steps));
        return new ControlFlow(logic, List.copyOf(operations));
    }

    /**
     * Two links per consecutive step pair, interleaved: {@code S1->T1, T1->S2, S2->T2, T2->S3, ...}.
     */
    static List<Link> linksFor(List<Step> steps) {
        var links = new ArrayList<Link>();
        for (int i = 0; i < steps.size() - 1; i++) {
            String transitionId = transitionId(i + 1);
            links.add(new Link(linkId(links.size() + 1),
                steps.get(i).id(), Link.NodeType.STEP, transitionId, Link.NodeType.TRANSITION));
            links.add(new Link(linkId(links.size() + 1),
                transitionId, Link.NodeType.TRANSITION, steps.get(i + 1).id(), Link.NodeType.STEP));
        }
        return links;
    }

    /**
     * The first transition fires unconditionally; every later one waits for the step before it.
     */
    static List<Transition> transitionsFor(List<Step> steps) {
        var transitions = new ArrayList<Transition>();
        for (int i = 1; i < steps.size(); i++) {
            String condition = i == 1
                ? INITIAL_CONDITION
                : "Step " + steps.get(i - 1).description() + " is Completed";
            transitions.add(new Transition(transitionId(i), condition));
        }
        return transitions;
    }

    static String capabilityName(Assignment assignment) {
        return assignment.capabilityDetails().stream()
            .map(CapabilityDetail::capabilityName)
            .filter(name -> name != null && !name.isBlank())
            .findFirst()
            .orElse(UNKNOWN_CAPABILITY);
    }

    private static String stepId(int n) { return "S" + n; }
    private static String transitionId(int n) { return "T" + n; }
    private static String linkId(int n) { return "L" + n; }
}
