package com.simbridge.tracker.model;

/**
 * One point of the glide-path trace attached to a landing.
 *
 * @param secondsBeforeTouchdown sample time minus touchdown time, zero or negative
 * @param altitudeAgl height above ground in feet
 * @param distanceNm great-circle distance to the touchdown point
 * @param verticalSpeed feet per minute
 * @param groundSpeed knots
 */
public record ApproachPoint(
    double secondsBeforeTouchdown,
    double altitudeAgl,
    double distanceNm,
    double verticalSpeed,
    double groundSpeed) {}
