package com.netflowradar.ingestion.adapter;

/**
 * Thrown when an RPC call or log subscription fails (transport, HTTP or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
