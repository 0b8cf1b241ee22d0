package dev.masterrecipe.engine;

import dev.masterrecipe.engine.IdentifierAllocator.ParameterKey;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierAllocatorTest {

    @Test
    void parameterIdsAreZeroPaddedAndSequential() {
        var allocator = new IdentifierAllocator(TestFixtures.sequentialTokens());

        String first = allocator.allocateParameter(new ParameterKey("Mixing001", "Speed"), Optional.of("HC10_Speed"));
        String second = allocator.allocateParameter(new ParameterKey("Mixing001", "Time"), Optional.empty());

        assertThat(first).isEqualTo("001:HC10_Speed");
        assertThat(second).isEqualTo("002:null");
        assertThat(allocator.parameterCount()).isEqualTo(2);
    }

    @Test
    void mappingRemembersAllocatedIdsPerElement() {
        var allocator = new IdentifierAllocator(TestFixtures.sequentialTokens());
        allocator.allocateParameter(new ParameterKey("Mixing001", "Amount"), Optional.of("A"));
        allocator.allocateParameter(new ParameterKey("Dosing001", "Amount"), Optional.of("B"));

        assertThat(allocator.parameterId(new ParameterKey("Mixing001", "Amount"))).contains("001:A");
        assertThat(allocator.parameterId(new ParameterKey("Dosing001", "Amount"))).contains("002:B");
        assertThat(allocator.parameterId(new ParameterKey("Heating001", "Amount"))).isEmpty();
        assertThat(allocator.parameterMapping()).hasSize(2);
    }

    @Test
    void recipeElementCounterIsIndependentOfParameterCounter() {
        var allocator = new IdentifierAllocator(TestFixtures.sequentialTokens());
        allocator.allocateParameter(new ParameterKey("Mixing001", "Speed"), Optional.of("X"));
        allocator.allocateParameter(new ParameterKey("Mixing001", "Time"), Optional.of("Y"));

        IdentifierAllocator.ElementId element = allocator.allocateRecipeElement(Optional.of("HC10_Mixing_Service"));

        assertThat(element.ordinal()).isEqualTo(1);
        assertThat(element.id()).isEqualTo("001:HC10_Mixing_Service");
    }

    @Test
    void missingElementReferenceUsesInjectedToken() {
        var allocator = new IdentifierAllocator(TestFixtures.sequentialTokens());

        allocator.allocateRecipeElement(Optional.of("HC10_Mixing_Service"));
        IdentifierAllocator.ElementId second = allocator.allocateRecipeElement(Optional.empty());
        IdentifierAllocator.ElementId third = allocator.allocateRecipeElement(Optional.empty());

        assertThat(second.id()).isEqualTo("002:tok-1");
        assertThat(third.id()).isEqualTo("003:tok-2");
    }

    @Test
    void randomTokensAreUuids() {
        var allocator = new IdentifierAllocator(IdentifierAllocator.RANDOM_TOKENS);

        String id = allocator.allocateRecipeElement(Optional.empty()).id();

        assertThat(id).matches("001:[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    void rejectsSecondAllocationForSameParameter() {
        var allocator = new IdentifierAllocator(TestFixtures.sequentialTokens());
        var key = new ParameterKey("Mixing001", "Speed");
        allocator.allocateParameter(key, Optional.of("X"));

        assertThatThrownBy(() -> allocator.allocateParameter(key, Optional.of("X")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ordinalsWidenPastThreeDigits() {
        assertThat(IdentifierAllocator.formatOrdinal(7)).isEqualTo("007");
        assertThat(IdentifierAllocator.formatOrdinal(1234)).isEqualTo("1234");
    }
}
