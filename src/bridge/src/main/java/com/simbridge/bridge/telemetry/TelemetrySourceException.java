package com.simbridge.bridge.telemetry;

/** The simulator link is lost or could not be established. */
public class TelemetrySourceException extends RuntimeException {
  public TelemetrySourceException(String message) {
    super(message);
  }

  public TelemetrySourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
