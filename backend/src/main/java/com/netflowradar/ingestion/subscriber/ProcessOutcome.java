package com.netflowradar.ingestion.subscriber;

/**
 * What happened to one received log.
 */
public enum ProcessOutcome {
    DECODE_FAILED,
    /** Decoded, but no monitored address on either side. Nothing persisted. */
    IRRELEVANT,
    RECORDED,
    /** At least one flow for this log could not be committed. */
    STORE_FAILED
}
