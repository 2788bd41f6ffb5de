package com.simbridge.tracker.geo;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Airport table bundled with the engine.
 *
 * <p>Rows come from a CSV with header {@code icao,latitude,longitude,name}. Malformed rows are
 * skipped and logged; a missing resource is a packaging error and fails fast.
 */
public class StaticAirportDirectory implements AirportDirectory {
  private static final Logger log = LoggerFactory.getLogger(StaticAirportDirectory.class);
  public static final String DEFAULT_RESOURCE = "/airports.csv";

  private final List<Airport> airports;

  public StaticAirportDirectory(List<Airport> airports) {
    this.airports = List.copyOf(airports);
  }

  public static StaticAirportDirectory fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  public static StaticAirportDirectory fromClasspath(String resource) {
    InputStream in = StaticAirportDirectory.class.getResourceAsStream(resource);
    if (in == null) {
      throw new IllegalStateException("Airport table not found on classpath: " + resource);
    }
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      List<Airport> rows = new ArrayList<>();
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (lineNumber == 1 || line.isBlank()) {
          continue;
        }
        Airport airport = parseRow(line);
        if (airport == null) {
          log.warn("Skipping malformed airport row {}: {}", lineNumber, line);
          continue;
        }
        rows.add(airport);
      }
      log.info("Loaded {} airports from {}", rows.size(), resource);
      return new StaticAirportDirectory(rows);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read airport table " + resource, ex);
    }
  }

  static Airport parseRow(String line) {
    String[] parts = line.split(",", 4);
    if (parts.length < 3 || !IcaoCodes.isValid(parts[0])) {
      return null;
    }
    try {
      return new Airport(
          parts[0].trim().toUpperCase(Locale.ROOT),
          Double.parseDouble(parts[1].trim()),
          Double.parseDouble(parts[2].trim()),
          parts.length > 3 ? parts[3].trim() : null);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  @Override
  public Optional<String> nearest(double latitude, double longitude, double maxDistanceNm) {
    String nearestIcao = null;
    double nearestDistance = Double.MAX_VALUE;
    for (Airport airport : airports) {
      double distance = GreatCircle.distanceNm(latitude, longitude, airport.latitude(), airport.longitude());
      if (distance < nearestDistance && distance <= maxDistanceNm) {
        nearestDistance = distance;
        nearestIcao = airport.icao();
      }
    }
    return Optional.ofNullable(nearestIcao);
  }

  public int size() {
    return airports.size();
  }

  public record Airport(String icao, double latitude, double longitude, String name) {}
}
