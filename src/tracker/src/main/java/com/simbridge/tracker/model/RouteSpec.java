package com.simbridge.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Locale;

/**
 * Planned departure and arrival, as announced by a viewer.
 *
 * <p>Identifiers are trimmed and upper-cased; blank values become {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteSpec(String origin, String destination) {

  public RouteSpec {
    origin = normalize(origin);
    destination = normalize(destination);
  }

  public boolean isEmpty() {
    return origin == null && destination == null;
  }

  private static String normalize(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim().toUpperCase(Locale.ROOT);
  }
}
