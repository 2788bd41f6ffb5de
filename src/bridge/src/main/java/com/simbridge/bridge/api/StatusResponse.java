package com.simbridge.bridge.api;

import com.simbridge.tracker.model.RouteSpec;

/** Snapshot of bridge state for operators. */
public record StatusResponse(
    String source,
    boolean sourceConnected,
    boolean autoConnect,
    String flightPhase,
    int viewers,
    RouteSpec route,
    String sessionCode,
    String timestamp) {
}
