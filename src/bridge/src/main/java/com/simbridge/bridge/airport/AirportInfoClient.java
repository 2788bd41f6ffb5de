package com.simbridge.bridge.airport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simbridge.bridge.config.BridgeProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fetches airport coordinates from the public airport info API.
 *
 * <p>Never throws: every transport or payload problem maps to {@link AirportLookupResult#error()}.
 */
@Component
public class AirportInfoClient {
  private static final Logger log = LoggerFactory.getLogger(AirportInfoClient.class);

  private final ObjectMapper objectMapper;
  private final BridgeProperties.AirportApi properties;
  private final HttpClient httpClient;
  private final Counter foundCounter;
  private final Counter notFoundCounter;
  private final Counter errorCounter;

  @Autowired
  public AirportInfoClient(ObjectMapper objectMapper, BridgeProperties properties, MeterRegistry meterRegistry) {
    this(objectMapper, properties, meterRegistry, HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(300, properties.getAirportApi().getTimeoutMs())))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  AirportInfoClient(
      ObjectMapper objectMapper,
      BridgeProperties properties,
      MeterRegistry meterRegistry,
      HttpClient httpClient) {
    this.objectMapper = objectMapper;
    this.properties = properties.getAirportApi();
    this.httpClient = httpClient;
    this.foundCounter = meterRegistry.counter("bridge.airport.lookup.found.total");
    this.notFoundCounter = meterRegistry.counter("bridge.airport.lookup.not_found.total");
    this.errorCounter = meterRegistry.counter("bridge.airport.lookup.error.total");
  }

  /**
   * Looks up one airport.
   *
   * @param icao normalized ICAO code
   * @return found coordinates, not_found, or error when the API could not be reached or parsed
   */
  public AirportLookupResult lookup(String icao) {
    if (!properties.isEnabled()) {
      notFoundCounter.increment();
      return AirportLookupResult.notFound();
    }

    String url = properties.getBaseUrl() + "?icao=" + URLEncoder.encode(icao, StandardCharsets.UTF_8);
    HttpRequest request = HttpRequest.newBuilder()
        .GET()
        .uri(URI.create(url))
        .timeout(Duration.ofMillis(Math.max(300, properties.getTimeoutMs())))
        .header("Accept", "application/json")
        .build();

    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status == 404) {
        notFoundCounter.increment();
        return AirportLookupResult.notFound();
      }
      if (status < 200 || status >= 300) {
        log.warn("Airport API returned status {} for {}", status, icao);
        errorCounter.increment();
        return AirportLookupResult.error();
      }
      return parse(icao, response.body());
    } catch (IOException | InterruptedException | RuntimeException ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn("Airport API lookup failed for {}: {}", icao, ex.getMessage());
      errorCounter.increment();
      return AirportLookupResult.error();
    }
  }

  private AirportLookupResult parse(String icao, String body) throws IOException {
    if (body == null || body.isBlank()) {
      notFoundCounter.increment();
      return AirportLookupResult.notFound();
    }
    AirportInfoResponse info = objectMapper.readValue(body, AirportInfoResponse.class);
    if (info == null || !info.hasCoordinates()) {
      log.debug("Airport {} unknown to the airport API", icao);
      notFoundCounter.increment();
      return AirportLookupResult.notFound();
    }
    foundCounter.increment();
    return AirportLookupResult.found(new AirportCoords(info.latitude(), info.longitude()));
  }
}
