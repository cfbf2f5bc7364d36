package com.netflowradar.ingestion.job;

import com.netflowradar.ingestion.subscriber.ChainLogSubscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriberWatchdogJobTest {

    @Mock
    private ChainLogSubscriber chainLogSubscriber;

    @InjectMocks
    private SubscriberWatchdogJob job;

    @Test
    @DisplayName("scheduled job asks the subscriber to relaunch a dead task")
    void runScheduled_delegatesToSubscriber() {
        when(chainLogSubscriber.restartIfDead()).thenReturn(true);

        job.runScheduled();

        verify(chainLogSubscriber).restartIfDead();
    }
}
