package dev.masterrecipe.engine;

import dev.masterrecipe.model.AssignmentSolution;
import dev.masterrecipe.model.GeneralRecipe;
import dev.masterrecipe.model.ResourceCapabilityCatalog;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Stir-and-heat fixture: Mixing on HC10, Dosing on HC20 (no capability reference), Heating on HC30.
 */
final class TestFixtures {

    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-05-01T08:00:00Z"), ZoneOffset.UTC);

    private TestFixtures() {}

    static Path fixture(String name) {
        try {
            return Path.of(TestFixtures.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static GeneralRecipe recipe() throws IOException {
        return InputLoader.loadRecipe(fixture("recipe.json"));
    }

    static List<AssignmentSolution> solutions() throws IOException {
        return InputLoader.loadSolutions(fixture("solutions.json"));
    }

    static AssignmentSolution solution(String id) throws IOException {
        return solutions().stream()
            .filter(s -> s.solutionId().equals(id))
            .findFirst()
            .orElseThrow();
    }

    static ResourceCapabilityCatalog catalog() throws IOException {
        return InputLoader.loadCatalog(fixture("resources.json"));
    }

    /** Tokens {@code tok-1}, {@code tok-2}, ... */
    static Supplier<String> sequentialTokens() {
        var counter = new AtomicInteger();
        return () -> "tok-" + counter.incrementAndGet();
    }
}
