package com.netflowradar.ingestion.adapter.evm;

import com.netflowradar.ingestion.decoder.RawLog;

/**
 * One parsed WebSocket text frame of an eth_subscribe session.
 */
public record SubscriptionFrame(Kind kind, String subscriptionId, RawLog log, String error) {

    public enum Kind {
        /** Response to eth_subscribe carrying the subscription id. */
        SUBSCRIBED,
        /** eth_subscription notification carrying one log. */
        LOG,
        /** JSON-RPC error response. */
        ERROR,
        /** Anything else (other ids, unrelated notifications). */
        IGNORED
    }

    static SubscriptionFrame subscribed(String subscriptionId) {
        return new SubscriptionFrame(Kind.SUBSCRIBED, subscriptionId, null, null);
    }

    static SubscriptionFrame log(String subscriptionId, RawLog log) {
        return new SubscriptionFrame(Kind.LOG, subscriptionId, log, null);
    }

    static SubscriptionFrame error(String error) {
        return new SubscriptionFrame(Kind.ERROR, null, null, error);
    }

    static SubscriptionFrame ignored() {
        return new SubscriptionFrame(Kind.IGNORED, null, null, null);
    }
}
