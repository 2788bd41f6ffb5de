package com.simbridge.tracker.geo;

/**
 * Running great-circle distance of one flight.
 *
 * <p>Each {@link #advance} moves the reference position to the new fix. The step is only added to
 * the total when it is strictly below the per-tick cap, so slew or warp jumps are skipped without
 * corrupting the running sum. A reference position of exactly (0, 0) means "no fix yet" and
 * contributes nothing.
 *
 * @param lastLatitude latitude of the previous fix
 * @param lastLongitude longitude of the previous fix
 * @param totalNm accumulated distance in nautical miles
 */
public record DistanceAccumulator(double lastLatitude, double lastLongitude, double totalNm) {

  public static DistanceAccumulator empty() {
    return new DistanceAccumulator(0.0, 0.0, 0.0);
  }

  public static DistanceAccumulator startingAt(double latitude, double longitude) {
    return new DistanceAccumulator(latitude, longitude, 0.0);
  }

  public DistanceAccumulator advance(double latitude, double longitude, double maxStepNm) {
    if (!hasFix()) {
      return new DistanceAccumulator(latitude, longitude, totalNm);
    }
    double step = GreatCircle.distanceNm(lastLatitude, lastLongitude, latitude, longitude);
    double total = step < maxStepNm ? totalNm + step : totalNm;
    return new DistanceAccumulator(latitude, longitude, total);
  }

  public boolean hasFix() {
    return lastLatitude != 0.0 || lastLongitude != 0.0;
  }
}
