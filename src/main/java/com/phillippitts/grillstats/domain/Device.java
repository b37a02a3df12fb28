package com.phillippitts.grillstats.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Device metadata as supplied by the device registry. The telemetry core only ever holds a
 * read-through copy of it.
 *
 * @param id       device identifier
 * @param name     display name
 * @param channels probes attached to the device, in display order
 */
public record Device(String id, String name, List<Channel> channels) {

    public Device {
        Objects.requireNonNull(id, "Device id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Device id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public Optional<Channel> channel(String channelId) {
        return channels.stream().filter(c -> c.id().equals(channelId)).findFirst();
    }
}
