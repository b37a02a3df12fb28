package com.phillippitts.grillstats.config.properties;

import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.ProbeType;
import com.phillippitts.grillstats.domain.TemperatureUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Devices served by the built-in registry.
 */
@ConfigurationProperties(prefix = "grill.registry")
public class DeviceRegistryProperties {

    private List<DeviceDefinition> devices = new ArrayList<>();

    public List<DeviceDefinition> getDevices() {
        return devices;
    }

    public void setDevices(List<DeviceDefinition> devices) {
        this.devices = devices;
    }

    public static class DeviceDefinition {
        private String id;
        private String name;
        private List<ChannelDefinition> channels = new ArrayList<>();

        public Device toDevice() {
            return new Device(id, name, channels.stream().map(ChannelDefinition::toChannel).toList());
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<ChannelDefinition> getChannels() {
            return channels;
        }

        public void setChannels(List<ChannelDefinition> channels) {
            this.channels = channels;
        }
    }

    public static class ChannelDefinition {
        private String id;
        private String name;
        private ProbeType type = ProbeType.FOOD;
        private String unit = "F";

        public Channel toChannel() {
            return new Channel(id, name, type, TemperatureUnit.fromSymbol(unit));
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public ProbeType getType() {
            return type;
        }

        public void setType(ProbeType type) {
            this.type = type;
        }

        public String getUnit() {
            return unit;
        }

        public void setUnit(String unit) {
            this.unit = unit;
        }
    }
}
