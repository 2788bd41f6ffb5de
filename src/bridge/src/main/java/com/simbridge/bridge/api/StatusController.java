package com.simbridge.bridge.api;

import com.simbridge.bridge.hub.BroadcastHub;
import com.simbridge.bridge.relay.RelaySession;
import com.simbridge.bridge.telemetry.TelemetryPump;
import com.simbridge.tracker.flight.FlightStateMachine;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints.
 *
 * <ul>
 *   <li>{@code GET /api/status}: source, tracker phase, viewers, route and session code</li>
 *   <li>{@code POST /api/telemetry/connect}: connect now and resume automatic reconnects</li>
 *   <li>{@code POST /api/telemetry/disconnect}: disconnect and stay disconnected</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class StatusController {
  private final TelemetryPump pump;
  private final BroadcastHub hub;
  private final FlightStateMachine stateMachine;
  private final RelaySession relaySession;

  public StatusController(
      TelemetryPump pump,
      BroadcastHub hub,
      FlightStateMachine stateMachine,
      RelaySession relaySession) {
    this.pump = pump;
    this.hub = hub;
    this.stateMachine = stateMachine;
    this.relaySession = relaySession;
  }

  @GetMapping("/status")
  public StatusResponse status() {
    return new StatusResponse(
        pump.sourceName(),
        pump.isConnected(),
        pump.isAutoConnect(),
        stateMachine.phase().label(),
        hub.connectionCount(),
        hub.currentRoute().orElse(null),
        relaySession.code().orElse(null),
        Instant.now().toString());
  }

  @PostMapping("/telemetry/connect")
  public Map<String, Object> connect() {
    boolean changed = pump.connect();
    return Map.of("connected", true, "changed", changed);
  }

  @PostMapping("/telemetry/disconnect")
  public Map<String, Object> disconnect() {
    boolean changed = pump.disconnect();
    return Map.of("connected", false, "changed", changed);
  }
}
