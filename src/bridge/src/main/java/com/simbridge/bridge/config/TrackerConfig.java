package com.simbridge.bridge.config;

import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.flight.TrackerRules;
import com.simbridge.tracker.geo.AirportDirectory;
import com.simbridge.tracker.geo.StaticAirportDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the flight tracking engine from {@code bridge.rules.*}. */
@Configuration(proxyBeanMethods = false)
public class TrackerConfig {
  private static final Logger log = LoggerFactory.getLogger(TrackerConfig.class);

  @Bean
  public AirportDirectory airportDirectory() {
    return StaticAirportDirectory.fromClasspath();
  }

  @Bean
  public FlightStateMachine flightStateMachine(BridgeProperties properties, AirportDirectory airportDirectory) {
    TrackerRules rules = properties.getRules().toTrackerRules();
    log.info(
        "Flight rules: minFlight={}s, minAgl={}ft, takeoffSpeed=[{}, {}]kt, minG={}, minDistance={}NM",
        rules.minFlightDuration().getSeconds(),
        rules.minAltitudeAglFt(),
        rules.minTakeoffSpeedKt(),
        rules.maxTakeoffSpeedKt(),
        rules.minPeakGForce(),
        rules.minDistanceNm());
    return new FlightStateMachine(rules, airportDirectory);
  }
}
