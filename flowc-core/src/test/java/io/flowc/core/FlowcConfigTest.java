package io.flowc.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FlowcConfigTest {

    @Test
    void shouldUseDefaults() {
        FlowcConfig config = new FlowcConfig();

        assertThat(config.getDefaultModel()).isEqualTo("gemini-2.5-flash");
        assertThat(config.getDefaultTemperature()).isEqualTo(0.7);
        assertThat(config.getDefaultMaxIterations()).isEqualTo(5);
        assertThat(config.isFailOnWarnings()).isFalse();
        assertThat(config.isSubstituteGlobals()).isTrue();
    }

    @Test
    void shouldReadAllProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("flowc.default-model", "local-model");
        properties.setProperty("flowc.default-temperature", "0.2");
        properties.setProperty("flowc.default-max-iterations", "9");
        properties.setProperty("flowc.fail-on-warnings", "true");
        properties.setProperty("flowc.substitute-globals", "false");

        // When
        FlowcConfig config = FlowcConfig.fromProperties(properties);

        // Then
        assertThat(config.getDefaultModel()).isEqualTo("local-model");
        assertThat(config.getDefaultTemperature()).isEqualTo(0.2);
        assertThat(config.getDefaultMaxIterations()).isEqualTo(9);
        assertThat(config.isFailOnWarnings()).isTrue();
        assertThat(config.isSubstituteGlobals()).isFalse();
    }

    @Test
    void shouldTreatBlankValuesAsAbsent() {
        Properties properties = new Properties();
        properties.setProperty("flowc.default-model", "  ");

        assertThat(FlowcConfig.fromProperties(properties).getDefaultModel())
                .isEqualTo("gemini-2.5-flash");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3"})
    void shouldRejectNonPositiveIterations(String value) {
        Properties properties = new Properties();
        properties.setProperty("flowc.default-max-iterations", value);

        assertThatThrownBy(() -> FlowcConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void shouldRejectMalformedNumbers() {
        Properties properties = new Properties();
        properties.setProperty("flowc.default-max-iterations", "many");

        assertThatThrownBy(() -> FlowcConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("flowc.default-max-iterations is not an integer: many");
    }
}
