package com.simbridge.tracker.flight;

import java.time.Instant;

public record ApproachSample(
    Instant timestamp,
    double altitudeAgl,
    double latitude,
    double longitude,
    double verticalSpeed,
    double groundSpeed) {}
