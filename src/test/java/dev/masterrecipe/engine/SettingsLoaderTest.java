package dev.masterrecipe.engine;

import dev.masterrecipe.model.CompilerSettings;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsLoaderTest {

    @Test
    void emptyObjectYieldsDefaults() throws IOException {
        assertThat(SettingsLoader.loadFromString("{}")).isEqualTo(CompilerSettings.defaults());
    }

    @Test
    void overridesSelectedFields() throws IOException {
        String json = """
            {
              "productId": "HeatedOil",
              "zoneOffset": "Z",
              "resourcePrefixes": ["plant/"],
              "propertyOverrides": [
                { "processElementId": "Dosing001", "parameterId": "Dosing_Amount001",
                  "capabilityName": "Dosing", "propertyName": "Litre" }
              ]
            }
            """;

        CompilerSettings settings = SettingsLoader.loadFromString(json);

        assertThat(settings.productId()).isEqualTo("HeatedOil");
        assertThat(settings.productName()).isEqualTo(CompilerSettings.DEFAULT_PRODUCT_NAME);
        assertThat(settings.zoneOffset()).isEqualTo("Z");
        assertThat(settings.shortResourceName("plant/HC10")).isEqualTo("HC10");
        assertThat(settings.operationShortNames()).isEqualTo(CompilerSettings.DEFAULT_OPERATION_SHORT_NAMES);
        assertThat(settings.propertyOverrides()).containsExactly(
            new CompilerSettings.PropertyOverride("Dosing001", "Dosing_Amount001", "Dosing", "Litre"));
    }

    @Test
    void rejectsIncompleteOverride() {
        String json = """
            { "propertyOverrides": [ { "processElementId": "Dosing001" } ] }
            """;

        assertThatThrownBy(() -> SettingsLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("parameterId");
    }

    @Test
    void rejectsZoneIdAsOffset() {
        assertThatThrownBy(() -> SettingsLoader.loadFromString("{ \"zoneOffset\": \"CET\" }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid zoneOffset 'CET'");
    }

    @Test
    void acceptsNumericOffset() throws IOException {
        assertThat(SettingsLoader.loadFromString("{ \"zoneOffset\": \"+02:00\" }").zoneOffset()).isEqualTo("+02:00");
    }

    @Test
    void exampleSettingsRestoreDosingLitreLookup() throws IOException {
        CompilerSettings settings = SettingsLoader.loadFromFile(Path.of("settings.example.json"));

        assertThat(settings.propertyOverrides()).containsExactly(
            new CompilerSettings.PropertyOverride("Dosing001", "Dosing_Amount001", "Dosing", "Litre"));
        assertThat(settings.productId()).isEqualTo(CompilerSettings.DEFAULT_PRODUCT_ID);
    }

    @Test
    void defaultShortNamesStripResourcePrefixes() {
        CompilerSettings settings = CompilerSettings.defaults();

        assertThat(settings.shortResourceName("resource: 2025-04_HC10")).isEqualTo("HC10");
        assertThat(settings.operationShortName("Heating_of_liquids")).isEqualTo("Heating");
        assertThat(settings.operationShortName("Cooling")).isEqualTo("Cooling");
    }
}
