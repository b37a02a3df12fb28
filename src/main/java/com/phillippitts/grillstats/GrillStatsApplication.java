package com.phillippitts.grillstats;

import com.phillippitts.grillstats.config.properties.AlertProperties;
import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.config.properties.DeviceRegistryProperties;
import com.phillippitts.grillstats.config.properties.PollingProperties;
import com.phillippitts.grillstats.config.properties.RemoteDeviceProperties;
import com.phillippitts.grillstats.config.properties.RollupProperties;
import com.phillippitts.grillstats.config.properties.SimulationProperties;
import com.phillippitts.grillstats.config.properties.StreamProperties;
import com.phillippitts.grillstats.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DeviceRegistryProperties.class,
        PollingProperties.class,
        RemoteDeviceProperties.class,
        SimulationProperties.class,
        CacheProperties.class,
        AlertProperties.class,
        StreamProperties.class,
        RollupProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class GrillStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrillStatsApplication.class, args);
    }

}
