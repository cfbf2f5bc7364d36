package com.netflowradar.ingestion.decoder;

public enum DecodeError {
    /** Too few topics, malformed topic slot, or data that is not an unsigned integer. */
    MALFORMED_LOG,
    /** topic0 is not the Transfer signature hash. */
    UNEXPECTED_EVENT
}
