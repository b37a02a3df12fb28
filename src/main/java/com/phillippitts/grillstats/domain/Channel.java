package com.phillippitts.grillstats.domain;

import java.util.Objects;

/**
 * One probe of a device.
 *
 * @param id   channel identifier, unique within its device
 * @param name human readable probe name (also used for profile auto-detection)
 * @param type probe placement
 * @param unit unit the channel reports in
 */
public record Channel(String id, String name, ProbeType type, TemperatureUnit unit) {

    public Channel {
        Objects.requireNonNull(id, "Channel id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Channel id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        type = type == null ? ProbeType.FOOD : type;
        unit = unit == null ? TemperatureUnit.FAHRENHEIT : unit;
    }
}
