package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.domain.AlertTransition;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceSnapshot;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Rollup;
import com.phillippitts.grillstats.service.alert.AlertEvaluator;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.orchestration.DevicePollingOrchestrator;
import com.phillippitts.grillstats.service.rollup.RollupService;
import com.phillippitts.grillstats.service.stream.SnapshotAssembler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Devices, their current state and their poll loops.
 */
@RestController
@RequestMapping("/api/devices")
class DeviceController {

    private final DeviceDirectory directory;
    private final TieredCache cache;
    private final SnapshotAssembler snapshots;
    private final AlertEvaluator alerts;
    private final RollupService rollups;
    private final DevicePollingOrchestrator orchestrator;

    DeviceController(DeviceDirectory directory,
                     TieredCache cache,
                     SnapshotAssembler snapshots,
                     AlertEvaluator alerts,
                     RollupService rollups,
                     DevicePollingOrchestrator orchestrator) {
        this.directory = directory;
        this.cache = cache;
        this.snapshots = snapshots;
        this.alerts = alerts;
        this.rollups = rollups;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    List<DeviceSummary> list() {
        return directory.devices().stream()
                .map(d -> new DeviceSummary(d, status(d.id()), orchestrator.isPolling(d.id())))
                .toList();
    }

    @GetMapping("/{deviceId}")
    DeviceSnapshot snapshot(@PathVariable String deviceId) {
        return snapshots.assemble(deviceId);
    }

    @GetMapping("/{deviceId}/alerts")
    List<AlertTransition> firingAlerts(@PathVariable String deviceId) {
        directory.getDevice(deviceId);
        return alerts.firingAlerts(deviceId);
    }

    @GetMapping("/{deviceId}/rollups")
    List<Rollup> rollups(@PathVariable String deviceId) {
        return rollups.rollups(deviceId);
    }

    @PostMapping("/{deviceId}/connect")
    Map<String, Object> connect(@PathVariable String deviceId) {
        boolean started = orchestrator.connect(deviceId);
        return Map.of("deviceId", deviceId, "polling", true, "changed", started);
    }

    @PostMapping("/{deviceId}/disconnect")
    Map<String, Object> disconnect(@PathVariable String deviceId) {
        boolean stopped = orchestrator.disconnect(deviceId);
        return Map.of("deviceId", deviceId, "polling", false, "changed", stopped);
    }

    private DeviceStatus status(String deviceId) {
        return cache.get(CacheNamespace.DEVICE_STATUS, deviceId, DeviceStatus.class)
                .orElse(DeviceStatus.unknown(deviceId, ConnectionStatus.OFFLINE));
    }

    record DeviceSummary(Device device, DeviceStatus status, boolean polling) {}
}
