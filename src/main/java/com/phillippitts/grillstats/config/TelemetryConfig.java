package com.phillippitts.grillstats.config;

import com.phillippitts.grillstats.config.properties.RemoteDeviceProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure beans of the telemetry core.
 */
@Configuration
public class TelemetryConfig {

    /**
     * Single time source for TTLs, debounce windows and session ticks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for the real device API, only built when devices are polled remotely.
     */
    @Bean(name = "remoteDeviceRestTemplate")
    @ConditionalOnProperty(prefix = "grill.polling", name = "source", havingValue = "remote")
    public RestTemplate remoteDeviceRestTemplate(RestTemplateBuilder builder, RemoteDeviceProperties props) {
        return builder
                .rootUri(props.getBaseUrl())
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }
}
