package com.simbridge.tracker.flight;

final class Rounding {
  private Rounding() {}

  static double round(double value, int decimals) {
    double factor = Math.pow(10, decimals);
    return Math.round(value * factor) / factor;
  }
}
