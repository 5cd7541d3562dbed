package io.chariot.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChariotConfigurationTest {

    @Test
    @DisplayName("Should use defaults")
    void shouldUseDefaults() {
        ChariotConfiguration configuration = ChariotConfiguration.defaults();

        assertThat(configuration.url()).isEqualTo("mem:");
        assertThat(configuration.echo()).isFalse();
        assertThat(configuration.createSchema()).isTrue();
        assertThat(configuration.colorOutput()).isTrue();
    }

    @Test
    @DisplayName("Should build custom configuration")
    void shouldBuildCustomConfiguration() {
        ChariotConfiguration configuration = ChariotConfiguration.builder()
                .url("mem:trucks")
                .echo(true)
                .createSchema(false)
                .colorOutput(false)
                .build();

        assertThat(configuration.url()).isEqualTo("mem:trucks");
        assertThat(configuration.echo()).isTrue();
        assertThat(configuration.createSchema()).isFalse();
        assertThat(configuration.colorOutput()).isFalse();
    }

    @Test
    @DisplayName("Should reject blank url")
    void shouldRejectBlankUrl() {
        assertThatThrownBy(() -> ChariotConfiguration.builder().url("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("url required");
    }

    @Test
    @DisplayName("Should read chariot keys from properties")
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty(ChariotConfiguration.URL, " mem:props ");
        properties.setProperty(ChariotConfiguration.ECHO, "TRUE");

        ChariotConfiguration configuration = ChariotConfiguration.fromProperties(properties);

        assertThat(configuration.url()).isEqualTo("mem:props");
        assertThat(configuration.echo()).isTrue();
        assertThat(configuration.createSchema()).isTrue();
    }

    @Test
    @DisplayName("Should reject malformed booleans")
    void shouldRejectMalformedBoolean() {
        Properties properties = new Properties();
        properties.setProperty(ChariotConfiguration.COLOR, "sometimes");

        assertThatThrownBy(() -> ChariotConfiguration.fromProperties(properties))
                .isInstanceOf(ChariotException.class)
                .hasMessageContaining("chariot.sql.color");
    }

    @Test
    @DisplayName("Should load a classpath resource")
    void shouldLoadResource() {
        ChariotConfiguration configuration = ChariotConfiguration.load("chariot-test.properties");

        assertThat(configuration.url()).isEqualTo("mem:fixture");
        assertThat(configuration.echo()).isTrue();
        assertThat(configuration.colorOutput()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to defaults for a missing resource")
    void shouldFallBackToDefaults() {
        ChariotConfiguration configuration = ChariotConfiguration.load("no-such-file.properties");

        assertThat(configuration).usingRecursiveComparison().isEqualTo(ChariotConfiguration.defaults());
    }
}
