package com.netflowradar.query;

import com.netflowradar.ingestion.subscriber.IngestionStats;
import com.netflowradar.ingestion.subscriber.IngestionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Exposes subscriber counters to the API without letting it reach into ingestion internals.
 */
@Service
@RequiredArgsConstructor
public class IngestionStatusService {

    private final IngestionStats ingestionStats;

    public IngestionStatus current() {
        return ingestionStats.snapshot();
    }
}
