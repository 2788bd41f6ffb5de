package com.simbridge.bridge.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simbridge.bridge.auth.UserSession;
import com.simbridge.bridge.config.BridgeProperties;
import com.simbridge.bridge.relay.RelaySession;
import com.simbridge.tracker.model.FlightRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores completed flights in the remote flight log table over its REST interface.
 *
 * <p>Requests authenticate with the signed-in user's token when available (row level security),
 * otherwise with the project api key. Flights flown without a signed-in user are stored
 * anonymously under the relay session code. Submissions are asynchronous and never throw.
 */
@Component
public class FlightLogClient {
  private static final Logger log = LoggerFactory.getLogger(FlightLogClient.class);
  private static final int MAX_ERROR_BODY = 300;

  private final ObjectMapper objectMapper;
  private final BridgeProperties.Persistence properties;
  private final UserSession userSession;
  private final RelaySession relaySession;
  private final HttpClient httpClient;
  private final Counter savedCounter;
  private final Counter skippedCounter;
  private final Counter errorCounter;

  @Autowired
  public FlightLogClient(
      ObjectMapper objectMapper,
      BridgeProperties properties,
      UserSession userSession,
      RelaySession relaySession,
      MeterRegistry meterRegistry) {
    this(objectMapper, properties, userSession, relaySession, meterRegistry, HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(300, properties.getPersistence().getTimeoutMs())))
        .build());
  }

  FlightLogClient(
      ObjectMapper objectMapper,
      BridgeProperties properties,
      UserSession userSession,
      RelaySession relaySession,
      MeterRegistry meterRegistry,
      HttpClient httpClient) {
    this.objectMapper = objectMapper;
    this.properties = properties.getPersistence();
    this.userSession = userSession;
    this.relaySession = relaySession;
    this.httpClient = httpClient;
    this.savedCounter = meterRegistry.counter("bridge.flights.records.saved.total");
    this.skippedCounter = meterRegistry.counter("bridge.flights.records.skipped.total");
    this.errorCounter = meterRegistry.counter("bridge.flights.records.errors.total");
  }

  public boolean isConfigured() {
    return properties.isConfigured();
  }

  /**
   * Submits one completed flight on behalf of the signed-in user, or anonymously under the session
   * code.
   *
   * @return the eventual outcome; skipped when the log is not configured or the flight has no owner
   */
  public CompletableFuture<SaveResult> submit(FlightRecord record) {
    if (!properties.isConfigured()) {
      log.info("Flight log not configured; flight {} -> {} not stored", record.origin(), record.destination());
      skippedCounter.increment();
      return CompletableFuture.completedFuture(SaveResult.skipped("not configured"));
    }
    Optional<UserSession.Identity> identity = userSession.current();
    String sessionCode = relaySession.code().orElse(null);
    if (identity.isEmpty() && sessionCode == null) {
      log.info("No signed-in user or session code; flight {} -> {} not stored",
          record.origin(), record.destination());
      skippedCounter.increment();
      return CompletableFuture.completedFuture(SaveResult.skipped("no owner"));
    }

    String userId = identity.map(UserSession.Identity::userId).orElse(null);
    FlightRecord owned = record.withOwner(userId, sessionCode);
    String body;
    try {
      body = objectMapper.writeValueAsString(owned);
    } catch (JsonProcessingException ex) {
      errorCounter.increment();
      log.warn("Cannot serialize flight record: {}", ex.getOriginalMessage());
      return CompletableFuture.completedFuture(SaveResult.error(ex.getOriginalMessage()));
    }

    String bearer = identity.map(UserSession.Identity::token).orElse(properties.getApiKey());
    HttpRequest request = HttpRequest.newBuilder()
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .uri(URI.create(properties.getUrl().replaceAll("/+$", "") + "/rest/v1/" + properties.getTable()))
        .timeout(Duration.ofMillis(Math.max(300, properties.getTimeoutMs())))
        .header("Content-Type", "application/json")
        .header("apikey", properties.getApiKey())
        .header("Authorization", "Bearer " + bearer)
        .header("Prefer", "return=representation")
        .build();

    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .thenApply(response -> toResult(owned, response))
        .exceptionally(ex -> {
          errorCounter.increment();
          log.warn("Flight log request failed: {}", ex.getMessage());
          return SaveResult.error(ex.getMessage());
        });
  }

  private SaveResult toResult(FlightRecord record, HttpResponse<String> response) {
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      savedCounter.increment();
      log.info("Flight stored: {} -> {}, score={}", record.origin(), record.destination(), record.score());
      return SaveResult.saved(status);
    }
    errorCounter.increment();
    String detail = truncate(response.body());
    log.warn("Flight log rejected the flight with status {}: {}", status, detail);
    return SaveResult.rejected(status, detail);
  }

  private static String truncate(String body) {
    if (body == null) {
      return null;
    }
    return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
  }
}
