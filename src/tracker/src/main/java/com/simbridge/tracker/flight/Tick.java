package com.simbridge.tracker.flight;

import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;

/** Input of one state machine step. {@code routeHint} may be null. */
public record Tick(TelemetrySnapshot snapshot, Instant observedAt, RouteSpec routeHint) {}
