package com.simbridge.tracker.flight;

import java.util.List;

/** Result of one state machine step. */
public record Transition(TrackerState state, List<FlightEvent> events) {

  public Transition {
    events = List.copyOf(events);
  }
}
