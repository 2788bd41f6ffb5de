package com.simbridge.bridge.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simbridge.bridge.airport.AirportCoordinatesService;
import com.simbridge.bridge.airport.AirportLookupResult;
import com.simbridge.bridge.auth.AuthenticationListener;
import com.simbridge.bridge.relay.RelaySession;
import com.simbridge.bridge.relay.RelaySink;
import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.model.LandingEvent;
import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fan-out of telemetry, landings and route updates to every connected viewer, plus handling of
 * viewer commands ({@code ping}, {@code route}, {@code getAirport}, {@code auth}).
 *
 * <p>Each send is isolated: a connection that fails is dropped from the registry and closed, and
 * delivery continues with the remaining viewers. Every broadcast is also handed to the relay when
 * one is configured.
 */
@Service
public class BroadcastHub {
  private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

  private final ConnectionRegistry registry;
  private final ObjectMapper objectMapper;
  private final FlightStateMachine stateMachine;
  private final AirportCoordinatesService airportCoordinates;
  private final AuthenticationListener authenticationListener;
  private final RelaySession relaySession;
  private final Optional<RelaySink> relay;
  private final Counter sendFailureCounter;
  private final Counter landingCounter;
  private final AtomicReference<RouteSpec> currentRoute = new AtomicReference<>();

  @Autowired
  public BroadcastHub(
      ObjectMapper objectMapper,
      FlightStateMachine stateMachine,
      AirportCoordinatesService airportCoordinates,
      AuthenticationListener authenticationListener,
      RelaySession relaySession,
      Optional<RelaySink> relay,
      MeterRegistry meterRegistry) {
    this(new ConnectionRegistry(), objectMapper, stateMachine, airportCoordinates,
        authenticationListener, relaySession, relay, meterRegistry);
  }

  BroadcastHub(
      ConnectionRegistry registry,
      ObjectMapper objectMapper,
      FlightStateMachine stateMachine,
      AirportCoordinatesService airportCoordinates,
      AuthenticationListener authenticationListener,
      RelaySession relaySession,
      Optional<RelaySink> relay,
      MeterRegistry meterRegistry) {
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.stateMachine = stateMachine;
    this.airportCoordinates = airportCoordinates;
    this.authenticationListener = authenticationListener;
    this.relaySession = relaySession;
    this.relay = relay;
    this.sendFailureCounter = meterRegistry.counter("bridge.hub.send.failures.total");
    this.landingCounter = meterRegistry.counter("bridge.flights.landings.total");
    meterRegistry.gauge("bridge.hub.connections", registry, ConnectionRegistry::size);
  }

  /**
   * Registers a new viewer and sends it the current context.
   *
   * @return false when the hub is shutting down; the connection has been closed then
   */
  public boolean onOpen(ClientConnection connection) {
    if (!registry.register(connection)) {
      log.debug("Rejecting {}: hub closed", connection);
      connection.close();
      return false;
    }
    log.info("Viewer {} connected ({} open)", connection, registry.size());

    RouteSpec route = currentRoute.get();
    if (route != null) {
      sendTo(connection, routePayload(route));
    }
    relaySession.code().ifPresent(code -> {
      ObjectNode placeholder = objectMapper.createObjectNode();
      placeholder.put("connected", false);
      placeholder.put("sessionCode", code);
      sendTo(connection, write(placeholder));
    });
    return true;
  }

  public void onClose(ClientConnection connection) {
    if (registry.remove(connection)) {
      log.info("Viewer {} disconnected ({} open)", connection, registry.size());
    }
  }

  public void onMessage(ClientConnection connection, String payload) {
    InboundMessage message;
    try {
      message = objectMapper.readValue(payload, InboundMessage.class);
    } catch (JsonProcessingException ex) {
      log.debug("Ignoring malformed message from {}: {}", connection, ex.getOriginalMessage());
      return;
    }
    if (message == null || message.type() == null) {
      log.debug("Ignoring message without type from {}", connection);
      return;
    }

    switch (message.type()) {
      case "ping" -> sendTo(connection, "{\"type\":\"pong\"}");
      case "route" -> handleRoute(connection, message);
      case "getAirport" -> handleAirportRequest(connection, message);
      case "auth" -> handleAuth(message);
      default -> log.debug("Ignoring unknown message type '{}' from {}", message.type(), connection);
    }
  }

  private void handleRoute(ClientConnection connection, InboundMessage message) {
    if (message.data() == null || !message.data().isObject()) {
      log.debug("Ignoring route message without data from {}", connection);
      return;
    }
    RouteSpec route;
    try {
      route = objectMapper.treeToValue(message.data(), RouteSpec.class);
    } catch (JsonProcessingException ex) {
      log.debug("Ignoring invalid route from {}: {}", connection, ex.getOriginalMessage());
      return;
    }
    currentRoute.set(route.isEmpty() ? null : route);
    stateMachine.updateRouteHint(route);
    log.info("Route set by {}: {} -> {}", connection, route.origin(), route.destination());
    broadcast(routePayload(route));
  }

  private void handleAirportRequest(ClientConnection connection, InboundMessage message) {
    String icao = message.dataText();
    airportCoordinates.lookup(icao).ifPresentOrElse(
        pending -> pending.thenAccept(result ->
            sendTo(connection, airportPayload(AirportCoordinatesService.normalizeCode(icao), result))),
        () -> log.debug("Ignoring airport request with invalid code from {}", connection));
  }

  private void handleAuth(InboundMessage message) {
    String userId = message.dataText();
    String token = message.token();
    authenticationListener.onAuthenticated(
        userId == null || userId.isEmpty() ? null : userId,
        token == null || token.isEmpty() ? null : token);
  }

  /** Telemetry frame: flat snapshot fields plus {@code connected} and the session code. */
  public void broadcastSnapshot(TelemetrySnapshot snapshot) {
    ObjectNode node = objectMapper.valueToTree(snapshot);
    node.put("connected", true);
    relaySession.code().ifPresent(code -> node.put("sessionCode", code));
    broadcast(write(node));
  }

  /** Source status without telemetry, sent when the simulator link drops or comes back. */
  public void broadcastStatus(boolean connected) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("connected", connected);
    relaySession.code().ifPresent(code -> node.put("sessionCode", code));
    broadcast(write(node));
  }

  public void broadcastLanding(LandingEvent landing) {
    landingCounter.increment();
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", "landing");
    node.set("landing", objectMapper.valueToTree(landing));
    broadcast(write(node));
  }

  void broadcast(String payload) {
    if (payload == null) {
      return;
    }
    for (ClientConnection connection : registry.connections()) {
      sendTo(connection, payload);
    }
    relay.ifPresent(sink -> sink.publish(payload));
  }

  void sendTo(ClientConnection connection, String payload) {
    if (payload == null) {
      return;
    }
    if (!connection.isOpen()) {
      registry.remove(connection);
      return;
    }
    try {
      connection.send(payload);
    } catch (Exception ex) {
      registry.remove(connection);
      sendFailureCounter.increment();
      if (isExpectedClientDisconnect(ex)) {
        log.debug("Viewer {} went away during delivery: {}", connection, rootCauseSummary(ex));
      } else {
        log.warn("Delivery to viewer {} failed, dropping it", connection, ex);
      }
      connection.close();
    }
  }

  public Optional<RouteSpec> currentRoute() {
    return Optional.ofNullable(currentRoute.get());
  }

  public int connectionCount() {
    return registry.size();
  }

  /** Closes every viewer connection; later connection attempts are refused. */
  @jakarta.annotation.PreDestroy
  public void close() {
    int closed = registry.closeAll();
    log.info("Broadcast hub closed, {} viewer(s) disconnected", closed);
  }

  private String routePayload(RouteSpec route) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", "route");
    node.set("route", objectMapper.valueToTree(route));
    return write(node);
  }

  private String airportPayload(String icao, AirportLookupResult result) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", "airportCoords");
    node.put("icao", icao);
    if (result.isFound()) {
      ObjectNode coords = node.putObject("coords");
      coords.put("lat", result.coords().lat());
      coords.put("lon", result.coords().lon());
    } else {
      node.putNull("coords");
      node.put("error", "not_found");
    }
    return write(node);
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      log.warn("Cannot serialize outbound message: {}", ex.getOriginalMessage());
      return null;
    }
  }

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException")
          || className.endsWith("EofException")
          || className.endsWith("SessionLimitExceededException")) {
        return true;
      }
      if (hasDisconnectMessage(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean hasDisconnectMessage(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("broken pipe")
        || normalized.contains("connection reset")
        || normalized.contains("socket closed")
        || normalized.contains("stream closed")
        || normalized.contains("connection abort")
        || normalized.contains("forcibly closed by the remote host");
  }

  private static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }
}
