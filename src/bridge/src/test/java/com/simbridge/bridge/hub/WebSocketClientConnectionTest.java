package com.simbridge.bridge.hub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simbridge.bridge.airport.AirportCoordinatesService;
import com.simbridge.bridge.airport.AirportInfoClient;
import com.simbridge.bridge.auth.UserSession;
import com.simbridge.bridge.relay.RelaySession;
import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.flight.TrackerRules;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

@ExtendWith(MockitoExtension.class)
class WebSocketClientConnectionTest {
  private static final int SEND_TIME_LIMIT_MS = 100;
  private static final int BUFFER_LIMIT = 1024;

  @Mock private WebSocketSession hungSession;
  @Mock private WebSocketSession healthySession;
  @Mock private AirportInfoClient airportInfoClient;
  @Mock private RelaySession relaySession;

  private final CountDownLatch releaseHung = new CountDownLatch(1);
  private final CountDownLatch hungWriteStarted = new CountDownLatch(1);
  private ExecutorService sendExecutor;

  @BeforeEach
  void setUp() throws IOException {
    sendExecutor = Executors.newCachedThreadPool();
    lenient().when(hungSession.getId()).thenReturn("hung");
    lenient().when(hungSession.isOpen()).thenReturn(true);
    lenient().when(healthySession.getId()).thenReturn("healthy");
    lenient().when(healthySession.isOpen()).thenReturn(true);
    lenient().doAnswer(invocation -> {
      hungWriteStarted.countDown();
      releaseHung.await(10, TimeUnit.SECONDS);
      return null;
    }).when(hungSession).sendMessage(any());
    lenient().when(relaySession.code()).thenReturn(Optional.empty());
  }

  @AfterEach
  void tearDown() {
    releaseHung.countDown();
    sendExecutor.shutdownNow();
  }

  @Test
  void broadcast_hungViewerDoesNotStallOthers() throws Exception {
    BroadcastHub hub = newHub();
    WebSocketClientConnection hung = connection(hungSession);
    WebSocketClientConnection healthy = connection(healthySession);
    hub.onOpen(hung);
    hub.onOpen(healthy);

    long started = System.nanoTime();
    hub.broadcast("{\"seq\":1}");
    long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

    assertThat(elapsedMs).isLessThan(1000L);
    verify(healthySession, timeout(2000)).sendMessage(new TextMessage("{\"seq\":1}"));
    assertThat(hungWriteStarted.await(2, TimeUnit.SECONDS)).isTrue();
    assertThat(hub.connectionCount()).isEqualTo(2);
  }

  @Test
  void broadcast_viewerStuckPastSendTimeLimitIsDropped() throws Exception {
    BroadcastHub hub = newHub();
    WebSocketClientConnection hung = connection(hungSession);
    WebSocketClientConnection healthy = connection(healthySession);
    hub.onOpen(hung);
    hub.onOpen(healthy);
    hub.broadcast("{\"seq\":1}");
    assertThat(hungWriteStarted.await(2, TimeUnit.SECONDS)).isTrue();

    Thread.sleep(SEND_TIME_LIMIT_MS * 2L);
    hub.broadcast("{\"seq\":2}");

    assertThat(hub.connectionCount()).isEqualTo(1);
    verify(healthySession, timeout(2000)).sendMessage(new TextMessage("{\"seq\":2}"));
    verify(hungSession).close(any(CloseStatus.class));
  }

  @Test
  void send_deliversPayloadsInOrder() throws Exception {
    List<String> delivered = new ArrayList<>();
    CountDownLatch allDelivered = new CountDownLatch(20);
    doAnswer(invocation -> {
      TextMessage message = invocation.getArgument(0);
      synchronized (delivered) {
        delivered.add(message.getPayload());
      }
      allDelivered.countDown();
      return null;
    }).when(healthySession).sendMessage(any());
    WebSocketClientConnection connection = connection(healthySession);

    for (int i = 0; i < 20; i++) {
      connection.send("m" + i);
    }

    assertThat(allDelivered.await(2, TimeUnit.SECONDS)).isTrue();
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      expected.add("m" + i);
    }
    synchronized (delivered) {
      assertThat(delivered).containsExactlyElementsOf(expected);
    }
  }

  @Test
  void send_overBufferLimitIsRefused() throws Exception {
    WebSocketClientConnection hung = connection(hungSession);
    hung.send("first");
    assertThat(hungWriteStarted.await(2, TimeUnit.SECONDS)).isTrue();

    String large = "x".repeat(BUFFER_LIMIT + 1);

    assertThatThrownBy(() -> hung.send(large)).isInstanceOf(SessionLimitExceededException.class);
  }

  @Test
  void send_afterFailedWriteFails() throws Exception {
    doThrow(new IOException("Broken pipe")).when(healthySession).sendMessage(any());
    WebSocketClientConnection connection = connection(healthySession);

    connection.send("first");
    verify(healthySession, timeout(2000)).close(any(CloseStatus.class));

    assertThatThrownBy(() -> connection.send("second"))
        .isInstanceOf(IOException.class)
        .hasRootCauseMessage("Broken pipe");
  }

  private WebSocketClientConnection connection(WebSocketSession session) {
    return new WebSocketClientConnection(session, sendExecutor, SEND_TIME_LIMIT_MS, BUFFER_LIMIT);
  }

  private BroadcastHub newHub() {
    FlightStateMachine stateMachine =
        new FlightStateMachine(TrackerRules.defaults(), (lat, lon, radius) -> Optional.empty());
    AirportCoordinatesService airports = new AirportCoordinatesService(airportInfoClient, Runnable::run);
    return new BroadcastHub(
        new ConnectionRegistry(),
        new ObjectMapper(),
        stateMachine,
        airports,
        new UserSession(),
        relaySession,
        Optional.empty(),
        new SimpleMeterRegistry());
  }
}
