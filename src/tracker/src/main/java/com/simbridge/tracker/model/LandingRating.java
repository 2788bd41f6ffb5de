package com.simbridge.tracker.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Touchdown quality, classified by absolute vertical speed in feet per minute. */
public enum LandingRating {
  PERFECT("Perfect", 5),
  GOOD("Good", 4),
  ACCEPTABLE("Acceptable", 3),
  HARD("Hard", 2),
  VERY_HARD("Very Hard", 1);

  private final String label;
  private final int score;

  LandingRating(String label, int score) {
    this.label = label;
    this.score = score;
  }

  public static LandingRating fromVerticalSpeed(double verticalSpeedFpm) {
    double magnitude = Math.abs(verticalSpeedFpm);
    if (magnitude < 100) {
      return PERFECT;
    }
    if (magnitude < 200) {
      return GOOD;
    }
    if (magnitude < 300) {
      return ACCEPTABLE;
    }
    if (magnitude < 500) {
      return HARD;
    }
    return VERY_HARD;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public int score() {
    return score;
  }
}
