package com.simbridge.bridge.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.simbridge.bridge.hub.BroadcastHub;
import com.simbridge.bridge.relay.RelaySession;
import com.simbridge.bridge.telemetry.TelemetryPump;
import com.simbridge.bridge.telemetry.TelemetrySourceException;
import com.simbridge.tracker.flight.FlightPhase;
import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.model.RouteSpec;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = StatusController.class)
@AutoConfigureMockMvc(addFilters = false)
class StatusControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private TelemetryPump pump;
  @MockBean private BroadcastHub hub;
  @MockBean private FlightStateMachine stateMachine;
  @MockBean private RelaySession relaySession;

  @Test
  void status_returnsBridgeState() throws Exception {
    when(pump.sourceName()).thenReturn("replay:session.ndjson");
    when(pump.isConnected()).thenReturn(true);
    when(pump.isAutoConnect()).thenReturn(true);
    when(stateMachine.phase()).thenReturn(FlightPhase.IDLE);
    when(hub.connectionCount()).thenReturn(2);
    when(hub.currentRoute()).thenReturn(Optional.of(new RouteSpec("EDDF", "EDDM")));
    when(relaySession.code()).thenReturn(Optional.of("ABCD-2345"));

    mockMvc.perform(get("/api/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.source").value("replay:session.ndjson"))
        .andExpect(jsonPath("$.sourceConnected").value(true))
        .andExpect(jsonPath("$.flightPhase").value(FlightPhase.IDLE.label()))
        .andExpect(jsonPath("$.viewers").value(2))
        .andExpect(jsonPath("$.route.origin").value("EDDF"))
        .andExpect(jsonPath("$.sessionCode").value("ABCD-2345"));
  }

  @Test
  void connect_returns200WhenSourceConnects() throws Exception {
    when(pump.connect()).thenReturn(true);

    mockMvc.perform(post("/api/telemetry/connect"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.connected").value(true))
        .andExpect(jsonPath("$.changed").value(true));
  }

  @Test
  void connect_returns503WhenSimulatorIsUnreachable() throws Exception {
    when(pump.connect()).thenThrow(new TelemetrySourceException("simulator not running"));

    mockMvc.perform(post("/api/telemetry/connect"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("source_unavailable"))
        .andExpect(jsonPath("$.message").value("simulator not running"));
  }

  @Test
  void disconnect_returns409WhenPumpIsStopped() throws Exception {
    when(pump.disconnect()).thenThrow(new IllegalStateException("telemetry pump is stopped"));

    mockMvc.perform(post("/api/telemetry/disconnect"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("conflict"));
  }

  @Test
  void disconnect_returns200() throws Exception {
    when(pump.disconnect()).thenReturn(false);

    mockMvc.perform(post("/api/telemetry/disconnect"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.connected").value(false))
        .andExpect(jsonPath("$.changed").value(false));
  }
}
