package com.netflowradar.ingestion.job;

import com.netflowradar.ingestion.subscriber.ChainLogSubscriber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic supervision of the chain log subscriber: relaunches its task if it died while still meant to run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriberWatchdogJob {

    private final ChainLogSubscriber chainLogSubscriber;

    @Scheduled(
            fixedDelayString = "${netflowradar.ingestion.subscriber.watchdog-interval-ms:30000}",
            initialDelayString = "${netflowradar.ingestion.subscriber.watchdog-interval-ms:30000}")
    public void runScheduled() {
        if (chainLogSubscriber.restartIfDead()) {
            log.warn("Watchdog restarted the chain log subscriber");
        }
    }
}
