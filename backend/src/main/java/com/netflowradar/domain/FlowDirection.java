package com.netflowradar.domain;

/**
 * Direction of a recorded transfer relative to the exchange it was attributed to.
 */
public enum FlowDirection {
    INFLOW,
    OUTFLOW
}
