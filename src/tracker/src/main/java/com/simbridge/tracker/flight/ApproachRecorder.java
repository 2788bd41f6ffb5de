package com.simbridge.tracker.flight;

import com.simbridge.tracker.geo.GreatCircle;
import com.simbridge.tracker.model.ApproachPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rolling window of low-altitude samples, turned into a glide-path trace at touchdown.
 *
 * <p>Instances are immutable; {@link #record} and {@link #cleared} return new recorders. Only
 * samples with {@code 0 < AGL < ceiling} are kept, and the oldest sample is evicted once the
 * capacity is reached.
 */
public final class ApproachRecorder {
  private final int capacity;
  private final double ceilingFt;
  private final List<ApproachSample> samples;

  private ApproachRecorder(int capacity, double ceilingFt, List<ApproachSample> samples) {
    this.capacity = capacity;
    this.ceilingFt = ceilingFt;
    this.samples = samples;
  }

  public static ApproachRecorder empty(int capacity, double ceilingFt) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    return new ApproachRecorder(capacity, ceilingFt, List.of());
  }

  public ApproachRecorder record(ApproachSample sample) {
    if (sample.altitudeAgl() <= 0 || sample.altitudeAgl() >= ceilingFt) {
      return this;
    }
    int from = samples.size() >= capacity ? samples.size() - capacity + 1 : 0;
    List<ApproachSample> next = new ArrayList<>(samples.subList(from, samples.size()));
    next.add(sample);
    return new ApproachRecorder(capacity, ceilingFt, List.copyOf(next));
  }

  public ApproachRecorder cleared() {
    return samples.isEmpty() ? this : new ApproachRecorder(capacity, ceilingFt, List.of());
  }

  /**
   * Converts the buffered samples into trace points relative to the touchdown.
   *
   * @return points ordered by seconds-before-touchdown ascending (oldest first)
   */
  public List<ApproachPoint> toTrace(Instant touchdownAt, double touchdownLatitude, double touchdownLongitude) {
    return samples.stream()
        .map(sample -> new ApproachPoint(
            Rounding.round(Duration.between(touchdownAt, sample.timestamp()).toMillis() / 1000.0, 1),
            Rounding.round(sample.altitudeAgl(), 0),
            Rounding.round(GreatCircle.distanceNm(
                sample.latitude(), sample.longitude(), touchdownLatitude, touchdownLongitude), 2),
            Rounding.round(sample.verticalSpeed(), 0),
            Rounding.round(sample.groundSpeed(), 0)))
        .sorted(Comparator.comparingDouble(ApproachPoint::secondsBeforeTouchdown))
        .toList();
  }

  public List<ApproachSample> samples() {
    return samples;
  }

  public int size() {
    return samples.size();
  }

  public int capacity() {
    return capacity;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ApproachRecorder that)) {
      return false;
    }
    return capacity == that.capacity
        && Double.compare(ceilingFt, that.ceilingFt) == 0
        && samples.equals(that.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(capacity, ceilingFt, samples);
  }
}
