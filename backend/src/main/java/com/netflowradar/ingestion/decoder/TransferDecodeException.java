package com.netflowradar.ingestion.decoder;

import lombok.Getter;

/**
 * Thrown when a log cannot be decoded as a Transfer event. Recoverable: the log is skipped.
 */
@Getter
public class TransferDecodeException extends RuntimeException {

    private final DecodeError error;

    public TransferDecodeException(DecodeError error, String message) {
        super(message);
        this.error = error;
    }

    public TransferDecodeException(DecodeError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
