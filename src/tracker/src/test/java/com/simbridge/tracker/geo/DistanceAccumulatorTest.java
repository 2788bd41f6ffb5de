package com.simbridge.tracker.geo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;

class DistanceAccumulatorTest {

  @Test
  void haversineMatchesKnownDistance() {
    // Frankfurt to Munich is roughly 162 NM.
    double distance = GreatCircle.distanceNm(50.0379, 8.5622, 48.3538, 11.7861);

    assertThat(distance).isCloseTo(162.0, within(1.0));
  }

  @Test
  void firstFixContributesNothing() {
    DistanceAccumulator accumulator = DistanceAccumulator.empty().advance(50.0, 8.0, 10.0);

    assertThat(accumulator.totalNm()).isZero();
    assertThat(accumulator.lastLatitude()).isEqualTo(50.0);
  }

  @Test
  void stepsAtOrAboveCapAreSkippedButMoveTheReference() {
    DistanceAccumulator accumulator = DistanceAccumulator.startingAt(50.0, 8.0)
        .advance(50.0 + 20.0 / 60.0, 8.0, 10.0)
        .advance(50.0 + 21.0 / 60.0, 8.0, 10.0);

    assertThat(accumulator.totalNm()).isCloseTo(1.0, within(0.01));
  }

  @Test
  void totalNeverDecreasesNorJumpsMoreThanCap() {
    Random random = new Random(7);
    DistanceAccumulator accumulator = DistanceAccumulator.startingAt(47.0, 9.0);
    for (int i = 0; i < 500; i++) {
      double previous = accumulator.totalNm();
      accumulator = accumulator.advance(
          accumulator.lastLatitude() + (random.nextDouble() - 0.5) * 0.6,
          accumulator.lastLongitude() + (random.nextDouble() - 0.5) * 0.6,
          10.0);

      assertThat(accumulator.totalNm()).isGreaterThanOrEqualTo(previous);
      assertThat(accumulator.totalNm() - previous).isLessThan(10.0);
    }
  }
}
