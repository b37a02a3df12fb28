package com.phillippitts.grillstats.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TemperatureUnitTest {

    @ParameterizedTest
    @CsvSource({
            "F, FAHRENHEIT",
            "c, CELSIUS",
            "celsius, CELSIUS",
            "' Fahrenheit ', FAHRENHEIT"
    })
    void resolvesSymbolsAndNames(String text, TemperatureUnit expected) {
        assertThat(TemperatureUnit.fromSymbol(text)).isEqualTo(expected);
    }

    @Test
    void rejectsUnknownUnits() {
        assertThatThrownBy(() -> TemperatureUnit.fromSymbol("K")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TemperatureUnit.fromSymbol(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsBetweenUnits() {
        assertThat(TemperatureUnit.CELSIUS.fromFahrenheit(212.0)).isCloseTo(100.0, within(1e-9));
        assertThat(TemperatureUnit.CELSIUS.toFahrenheit(-40.0)).isCloseTo(-40.0, within(1e-9));
        assertThat(TemperatureUnit.FAHRENHEIT.fromFahrenheit(203.0)).isEqualTo(203.0);
        assertThat(TemperatureUnit.CELSIUS.convertTo(100.0, TemperatureUnit.FAHRENHEIT)).isCloseTo(212.0, within(1e-9));
        assertThat(TemperatureUnit.CELSIUS.convertTo(21.5, TemperatureUnit.CELSIUS)).isEqualTo(21.5);
    }

    @Test
    void readingRejectsNonFiniteTemperature() {
        assertThatThrownBy(() -> new Reading("smoker-1", "probe-1", Instant.EPOCH, Double.NaN,
                TemperatureUnit.FAHRENHEIT)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Reading("smoker-1", "probe-1", Instant.EPOCH, 150, TemperatureUnit.FAHRENHEIT).channelKey())
                .isEqualTo("smoker-1:probe-1");
    }
}
