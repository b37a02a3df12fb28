package com.phillippitts.grillstats.service.rollup;

import com.phillippitts.grillstats.config.properties.RollupProperties;
import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.domain.Rollup;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent min/max/average per channel.
 *
 * <p>Readings are kept in a bounded per-channel window. On its own cadence, slower than the
 * poll loop, the service computes a {@link Rollup} for every channel with samples in the window
 * and writes it to {@link CacheNamespace#ROLLUPS}. Readers only ever see cached rollups.
 */
@Component
public class RollupService {

    private static final Logger LOG = LogManager.getLogger(RollupService.class);

    private final Map<String, Deque<Reading>> windows = new ConcurrentHashMap<>();
    private final TieredCache cache;
    private final DeviceDirectory directory;
    private final RollupProperties props;
    private final Clock clock;

    public RollupService(TieredCache cache, DeviceDirectory directory, RollupProperties props, Clock clock) {
        this.cache = cache;
        this.directory = directory;
        this.props = props;
        this.clock = clock;
    }

    public void record(Reading reading) {
        Deque<Reading> window = windows.computeIfAbsent(reading.channelKey(), k -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(reading);
            while (window.size() > props.getMaxSamplesPerChannel()) {
                window.removeFirst();
            }
        }
    }

    /**
     * Recomputes and caches the rollup of every channel.
     *
     * @return number of rollups written
     */
    @Scheduled(fixedDelayString = "${grill.rollup.refresh-interval-ms:30000}")
    public int refresh() {
        Instant end = clock.instant();
        Instant start = end.minus(props.getWindow());
        int written = 0;
        try {
            for (Map.Entry<String, Deque<Reading>> entry : windows.entrySet()) {
                Optional<Rollup> rollup = compute(entry.getValue(), start, end);
                if (rollup.isPresent()) {
                    cache.set(CacheNamespace.ROLLUPS, entry.getKey(), rollup.get());
                    written++;
                }
            }
        } catch (CacheUnavailableException e) {
            LOG.warn("Rollup refresh skipped: {}", e.getMessage());
            return written;
        }
        LOG.debug("Refreshed {} rollup(s)", written);
        return written;
    }

    /** Cached rollups of a device's channels; channels without one are omitted. */
    public List<Rollup> rollups(String deviceId) {
        Device device = directory.getDevice(deviceId);
        List<Rollup> result = new ArrayList<>();
        for (Channel channel : device.channels()) {
            cache.get(CacheNamespace.ROLLUPS, Reading.channelKey(deviceId, channel.id()), Rollup.class)
                    .ifPresent(result::add);
        }
        return result;
    }

    private static Optional<Rollup> compute(Deque<Reading> window, Instant start, Instant end) {
        synchronized (window) {
            while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(start)) {
                window.removeFirst();
            }
            if (window.isEmpty()) {
                return Optional.empty();
            }
            Reading first = window.peekFirst();
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            double sum = 0;
            int count = 0;
            for (Reading r : window) {
                if (r.unit() != first.unit()) {
                    continue;
                }
                min = Math.min(min, r.temperature());
                max = Math.max(max, r.temperature());
                sum += r.temperature();
                count++;
            }
            double average = Math.round(sum / count * 10.0) / 10.0;
            return Optional.of(new Rollup(first.deviceId(), first.channelId(), min, max, average, count,
                    first.unit(), start, end));
        }
    }
}
