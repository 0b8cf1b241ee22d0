package dev.masterrecipe.engine;

import dev.masterrecipe.engine.ControlFlowBuilder.ControlFlow;
import dev.masterrecipe.engine.ControlFlowBuilder.OperationBinding;
import dev.masterrecipe.engine.IdentifierAllocator.ParameterKey;
import dev.masterrecipe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Compiles a general recipe and an assignment solution into a master recipe document.
 * Each call to {@code compile} is an independent pass with its own {@link IdentifierAllocator}.
 */
public final class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);

    private final PropertyResolver resolver;
    private final CompilerSettings settings;
    private final Clock clock;
    private final Supplier<String> tokenSource;
    private final ControlFlowBuilder controlFlowBuilder;

    public DocumentAssembler(ResourceCapabilityCatalog catalog, CompilerSettings settings,
                             Clock clock, Supplier<String> tokenSource) {
        this.resolver = new PropertyResolver(catalog);
        this.settings = settings;
        this.clock = clock;
        this.tokenSource = tokenSource;
        this.controlFlowBuilder = new ControlFlowBuilder(resolver, settings);
    }

    public DocumentAssembler(ResourceCapabilityCatalog catalog, CompilerSettings settings) {
        this(catalog, settings, Clock.systemDefaultZone(), IdentifierAllocator.RANDOM_TOKENS);
    }

    /**
     * Compile against the solution named by {@code selection}.
     *
     * @throws IllegalArgumentException if no solution carries the selected id
     */
    public CompiledDocument compile(GeneralRecipe recipe, List<AssignmentSolution> solutions,
                                    SolutionSelection selection) {
        return compile(recipe, selectSolution(solutions, selection));
    }

    /**
     * The solution carrying the selected id.
     *
     * @throws IllegalArgumentException if there is none
     */
    public static AssignmentSolution selectSolution(List<AssignmentSolution> solutions, SolutionSelection selection) {
        return solutions.stream()
            .filter(s -> s.solutionId().equals(selection.solutionId()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Optimal solution %s not found in solutions".formatted(selection.solutionId())));
    }

    /**
     * Compile the recipe against one assignment solution.
     */
    public CompiledDocument compile(GeneralRecipe recipe, AssignmentSolution solution) {
        var allocator = new IdentifierAllocator(tokenSource);
        String timestamp = clock.instant()
            .atOffset(ZoneOffset.of(settings.zoneOffset()))
            .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);

        log.info("Compiling general recipe {} with solution {}", recipe.id(), solution.solutionId());

        List<FormulaParameter> formula = buildFormula(recipe, solution, allocator);
        ControlFlow controlFlow = controlFlowBuilder.build(recipe, solution, allocator);
        List<RecipeElement> recipeElements = buildRecipeElements(controlFlow.operations(), allocator);

        var masterRecipe = new MasterRecipe(
            "MasterRecipe_" + solution.solutionId(),
            settings.version(),
            timestamp,
            "Master recipe based on General Recipe %s and optimized solution %s using resources from optimization"
                .formatted(recipe.id(), solution.solutionId()),
            new MasterRecipe.ProductHeader(settings.productId(), settings.productName()),
            new MasterRecipe.EquipmentRequirement(
                settings.equipmentRequirementId(),
                settings.constraintId(),
                settings.constraintCondition(),
                settings.equipmentRequirementDescription()),
            formula,
            controlFlow.procedureLogic(),
            recipeElements
        );

        log.debug("Parameter mapping: {}", allocator.parameterMapping());
        log.info("Compiled {} parameter(s), {} operation(s), {} step(s)",
            allocator.parameterCount(), allocator.recipeElementCount(), controlFlow.procedureLogic().steps().size());

        return new CompiledDocument(
            settings.listHeaderId(),
            timestamp,
            "This Batch Information includes the Master Recipe based on General Recipe %s and Optimal Solution %s"
                .formatted(recipe.id(), solution.solutionId()),
            masterRecipe
        );
    }

    private List<FormulaParameter> buildFormula(GeneralRecipe recipe, AssignmentSolution solution,
                                                IdentifierAllocator allocator) {
        var formula = new ArrayList<FormulaParameter>();
        for (ProcessElement element : recipe.processElements()) {
            Optional<Assignment> assignment = solution.assignmentFor(element.id());
            if (assignment.isEmpty()) {
                continue;
            }
            String shortResource = settings.shortResourceName(assignment.get().resource());

            for (Parameter parameter : element.parameters()) {
                Optional<String> reference = resolveParameterReference(element, parameter, assignment.get());
                if (reference.isEmpty()) {
                    log.warn("No realizing property for parameter {} of {} on {}",
                        parameter.id(), element.id(), assignment.get().resource());
                }
                String id = allocator.allocateParameter(new ParameterKey(element.id(), parameter.id()), reference);
                formula.add(new FormulaParameter(
                    id,
                    ParameterFormatter.describe(shortResource, parameter),
                    ParameterFormatter.formatValue(parameter)));
            }
        }
        return formula;
    }

    /**
     * A configured override wins; otherwise the first matched property whose id equals the parameter key,
     * whose unit equals the parameter unit and which resolves in the catalog.
     */
    Optional<String> resolveParameterReference(ProcessElement element, Parameter parameter, Assignment assignment) {
        for (CompilerSettings.PropertyOverride override : settings.propertyOverrides()) {
            if (override.processElementId().equals(element.id()) && override.parameterId().equals(parameter.id())) {
                return resolver.resolve(assignment.resource(), override.capabilityName(), override.propertyName());
            }
        }

        for (CapabilityDetail detail : assignment.capabilityDetails()) {
            for (MatchedProperty matched : detail.matchedProperties()) {
                if (Objects.equals(matched.propertyId(), parameter.key())
                        && Objects.equals(matched.propertyUnit(), parameter.unitOfMeasure())) {
                    Optional<String> reference = resolver.resolve(
                        assignment.resource(), detail.capabilityName(), matched.propertyName());
                    if (reference.isPresent()) {
                        return reference;
                    }
                    // Only the first match of a detail is tried, the next detail gets its chance
                    break;
                }
            }
        }
        return Optional.empty();
    }

    private List<RecipeElement> buildRecipeElements(List<OperationBinding> operations, IdentifierAllocator allocator) {
        var elements = new ArrayList<RecipeElement>();
        elements.add(RecipeElement.Marker.begin());
        elements.add(RecipeElement.Marker.end());

        for (OperationBinding operation : operations) {
            ProcessElement element = operation.element();
            List<String> parameterIds = element.parameters().stream()
                .map(p -> allocator.parameterId(new ParameterKey(element.id(), p.id())))
                .flatMap(Optional::stream)
                .toList();

            elements.add(new RecipeElement.Operation(
                operation.elementId().id(),
                "%s_%s_Procedure:%s".formatted(
                    operation.shortResource(),
                    settings.operationShortName(element.description()),
                    operation.capabilityName()),
                operation.shortResource() + "Instance",
                settings.equipmentRequirementId(),
                parameterIds
            ));
        }
        return elements;
    }
}
