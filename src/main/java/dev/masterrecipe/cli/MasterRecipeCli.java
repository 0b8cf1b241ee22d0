package dev.masterrecipe.cli;

import ch.qos.logback.classic.Level;
import dev.masterrecipe.engine.B2mmlWriter;
import dev.masterrecipe.engine.DocumentAssembler;
import dev.masterrecipe.engine.InputLoader;
import dev.masterrecipe.engine.InputValidator;
import dev.masterrecipe.engine.SettingsLoader;
import dev.masterrecipe.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: reads the recipe, solutions, catalog and selected solution, writes the B2MML master recipe.
 */
@Command(
    name = "master-recipe",
    mixinStandardHelpOptions = true,
    description = "Compile a general recipe and an equipment assignment into a B2MML master recipe."
)
public class MasterRecipeCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MasterRecipeCli.class);

    @Option(names = "--recipe", required = true, description = "General recipe JSON (parsed_recipe_output.json)")
    private Path recipeFile;

    @Option(names = "--solutions", required = true, description = "Assignment solutions JSON (solutions.json)")
    private Path solutionsFile;

    @Option(names = "--resources", required = true,
        description = "Resource capability catalog JSON (parsed_resource_capabilities_output.json)")
    private Path resourcesFile;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Selection selection;

    static class Selection {
        @Option(names = "--report", description = "Optimization report JSON naming the optimal solution")
        Path reportFile;

        @Option(names = "--solution-id", description = "Compile this solution instead of reading a report")
        String solutionId;
    }

    @Option(names = "--settings", description = "Optional JSON overriding document constants")
    private Path settingsFile;

    @Option(names = "--output", defaultValue = "MasterRecipe_B2MML.xml",
        description = "Output file (default: ${DEFAULT-VALUE})")
    private Path output;

    @Option(names = "--verbose", description = "Log resolution details")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }

        try {
            log.info("Loading data files...");
            GeneralRecipe recipe = InputLoader.loadRecipe(recipeFile);
            List<AssignmentSolution> solutions = InputLoader.loadSolutions(solutionsFile);
            ResourceCapabilityCatalog catalog = InputLoader.loadCatalog(resourcesFile);
            SolutionSelection selected = selection.reportFile != null
                ? InputLoader.loadSelection(selection.reportFile)
                : SolutionSelection.of(selection.solutionId);
            CompilerSettings settings = settingsFile != null
                ? SettingsLoader.loadFromFile(settingsFile)
                : CompilerSettings.defaults();

            AssignmentSolution solution = DocumentAssembler.selectSolution(solutions, selected);

            InputValidator.Result validation = InputValidator.validate(recipe, solution);
            validation.warnings().forEach(w -> log.warn(w));
            if (!validation.isValid()) {
                validation.errors().forEach(e -> log.error(e));
                System.err.println("Error: invalid input, " + validation.errors().size() + " error(s)");
                return 1;
            }

            log.info("Generating B2MML Master Recipe...");
            CompiledDocument document = new DocumentAssembler(catalog, settings).compile(recipe, solution);
            B2mmlWriter.write(document, output);
            log.info("B2MML Master Recipe saved to {}", output);

            report(selected, settings, document);
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Compilation failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void report(SolutionSelection selected, CompilerSettings settings, CompiledDocument document) {
        log.info("Using optimal solution: {}", selected.solutionId());
        log.info("Composite score: {}", selected.compositeScore());
        selected.resourceUsage().forEach((resource, count) ->
            log.info("  {}: {} step(s)", settings.shortResourceName(resource), count));
        log.info("Total energy cost: {}", selected.totalEnergyCost());
        log.info("Total use cost: {}", selected.totalUseCost());
        log.info("Total CO2 footprint: {}", selected.totalCo2Footprint());
        log.info("Material flow consistent: {}", selected.materialFlowConsistent());

        ProcedureLogic logic = document.masterRecipe().procedureLogic();
        for (Step step : logic.steps()) {
            log.info("{}: {}", step.id(), step.description());
        }
        for (Link link : logic.links()) {
            log.info("{}: {} -> {}", link.id(), link.fromId(), link.toId());
        }
    }
}
