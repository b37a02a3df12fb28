package com.phillippitts.grillstats.domain;

/**
 * Unit a channel reports temperatures in. Profiles are authored in Fahrenheit and converted
 * at the edge of the session engine.
 */
public enum TemperatureUnit {
    FAHRENHEIT("F"),
    CELSIUS("C");

    private final String symbol;

    TemperatureUnit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Converts a Fahrenheit value into this unit.
     *
     * @param fahrenheit temperature in degrees Fahrenheit
     * @return the same temperature expressed in this unit
     */
    public double fromFahrenheit(double fahrenheit) {
        return this == FAHRENHEIT ? fahrenheit : (fahrenheit - 32.0) * 5.0 / 9.0;
    }

    /**
     * Converts a value expressed in this unit into Fahrenheit.
     */
    public double toFahrenheit(double value) {
        return this == FAHRENHEIT ? value : value * 9.0 / 5.0 + 32.0;
    }

    /**
     * Converts a value expressed in this unit into {@code target}.
     */
    public double convertTo(double value, TemperatureUnit target) {
        return target == this ? value : target.fromFahrenheit(toFahrenheit(value));
    }

    /**
     * Resolves a unit from its symbol ("F"/"C") or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the text matches no unit
     */
    public static TemperatureUnit fromSymbol(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Temperature unit must not be blank");
        }
        String t = text.trim();
        for (TemperatureUnit unit : values()) {
            if (unit.symbol.equalsIgnoreCase(t) || unit.name().equalsIgnoreCase(t)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown temperature unit: " + text);
    }
}
