package com.netflowradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "netflowradar.ingestion.subscriber")
@NoArgsConstructor
@Getter
@Setter
public class SubscriberProperties {

    /** Start the chain log subscriber with the application context. */
    private boolean enabled = true;

    /** How often the watchdog checks that the subscriber task is alive. */
    private long watchdogIntervalMs = 30_000L;
}
