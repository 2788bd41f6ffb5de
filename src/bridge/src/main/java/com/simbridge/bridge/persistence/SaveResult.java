package com.simbridge.bridge.persistence;

/** Outcome of one flight log submission. */
public record SaveResult(String status, Integer httpStatus, String detail) {

  public static SaveResult saved(int httpStatus) {
    return new SaveResult("saved", httpStatus, null);
  }

  public static SaveResult skipped(String reason) {
    return new SaveResult("skipped", null, reason);
  }

  public static SaveResult rejected(int httpStatus, String body) {
    return new SaveResult("rejected", httpStatus, body);
  }

  public static SaveResult error(String message) {
    return new SaveResult("error", null, message);
  }

  public boolean isSaved() {
    return "saved".equals(status);
  }
}
