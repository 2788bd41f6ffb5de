package com.simbridge.bridge.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.simbridge.bridge.config.BridgeProperties;
import com.simbridge.bridge.dispatch.BridgeEventDispatcher;
import com.simbridge.tracker.flight.FlightEvent;
import com.simbridge.tracker.flight.FlightPhase;
import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.flight.TrackerRules;
import com.simbridge.tracker.model.TelemetrySnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TelemetryPumpTest {
  @Mock private BridgeEventDispatcher dispatcher;

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private ScriptedTelemetrySource source;
  private FlightStateMachine stateMachine;
  private SimpleMeterRegistry meterRegistry;
  private TelemetryPump pump;

  @BeforeEach
  void setUp() {
    BridgeProperties properties = new BridgeProperties();
    properties.getTelemetry().setEnabled(false);
    properties.getTelemetry().setRetryInterval(Duration.ofSeconds(5));
    source = new ScriptedTelemetrySource();
    stateMachine = new FlightStateMachine(TrackerRules.defaults(), (lat, lon, radius) -> Optional.empty());
    meterRegistry = new SimpleMeterRegistry();
    pump = new TelemetryPump(source, stateMachine, dispatcher, properties, meterRegistry, clock);
  }

  @AfterEach
  void tearDown() {
    pump.stop();
  }

  @Test
  void tick_connectsThenForwardsSamples() {
    TelemetrySnapshot parked = ground();
    source.enqueue(parked);

    pump.tick();

    assertThat(source.isConnected()).isTrue();
    assertThat(pump.isConnected()).isTrue();
    verify(dispatcher).publishStatus(true);
    verify(dispatcher).publishSnapshot(parked);
    verify(dispatcher).publishFlightEvents(anyList());
    assertThat(meterRegistry.get("bridge.telemetry.ticks.total").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("bridge.telemetry.connected").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void tick_withoutNewSampleDoesNothing() {
    pump.tick();

    verify(dispatcher, never()).publishSnapshot(any());
    assertThat(meterRegistry.get("bridge.telemetry.ticks.total").counter().count()).isZero();
  }

  @Test
  void tick_retriesConnectOnlyAfterRetryInterval() {
    source.refuseConnect(true);

    pump.tick();
    clock.advance(Duration.ofSeconds(2));
    pump.tick();
    assertThat(source.connectCalls()).isEqualTo(1);

    clock.advance(Duration.ofSeconds(3));
    source.refuseConnect(false);
    pump.tick();

    assertThat(source.connectCalls()).isEqualTo(2);
    assertThat(pump.isConnected()).isTrue();
  }

  @Test
  void tick_neverConnectsUnavailableSource() {
    source.unavailable();

    pump.tick();

    assertThat(source.connectCalls()).isZero();
  }

  @Test
  void sourceLossCancelsFlightWithoutLanding() {
    source.enqueue(ground());
    pump.tick();
    clock.advance(Duration.ofSeconds(1));
    source.enqueue(airborne(120.0));
    pump.tick();
    assertThat(stateMachine.phase()).isInstanceOf(FlightPhase.AirborneValidated.class);

    clock.advance(Duration.ofSeconds(1));
    source.loseLinkOnNextPoll();
    pump.tick();

    assertThat(stateMachine.phase()).isEqualTo(FlightPhase.IDLE);
    assertThat(source.isConnected()).isFalse();
    assertThat(pump.isConnected()).isFalse();
    verify(dispatcher).publishFlightEvents(argThat(events ->
        events.size() == 1 && events.get(0) instanceof FlightEvent.FlightCancelled));
    verify(dispatcher, never()).publishFlightEvents(argThat(events ->
        events.stream().anyMatch(FlightEvent.LandingDetected.class::isInstance)));
    verify(dispatcher).publishStatus(false);
    assertThat(meterRegistry.get("bridge.telemetry.errors.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void sourceLossIsFollowedByReconnectAfterRetryInterval() {
    pump.tick();
    source.loseLinkOnNextPoll();
    pump.tick();
    assertThat(source.connectCalls()).isEqualTo(1);

    clock.advance(Duration.ofSeconds(5));
    pump.tick();

    assertThat(source.connectCalls()).isEqualTo(2);
    assertThat(source.isConnected()).isTrue();
  }

  @Test
  void reconnectAfterLossNeedsFreshBaseline() {
    source.enqueue(ground());
    pump.tick();
    source.loseLinkOnNextPoll();
    pump.tick();
    clock.advance(Duration.ofSeconds(5));

    source.enqueue(airborne(120.0));
    pump.tick();

    assertThat(stateMachine.phase()).isEqualTo(FlightPhase.IDLE);
    assertThat(stateMachine.state().hasBaseline()).isTrue();
  }

  @Test
  void manualDisconnectSuspendsAutoReconnect() {
    pump.tick();

    assertThat(pump.disconnect()).isTrue();
    assertThat(pump.isAutoConnect()).isFalse();
    clock.advance(Duration.ofMinutes(1));
    pump.tick();

    assertThat(source.connectCalls()).isEqualTo(1);
    assertThat(source.isConnected()).isFalse();
    assertThat(pump.disconnect()).isFalse();

    assertThat(pump.connect()).isTrue();
    assertThat(source.isConnected()).isTrue();
    assertThat(pump.connect()).isFalse();
  }

  @Test
  void manualConnectPropagatesSourceFailure() {
    source.unavailable();

    assertThatThrownBy(() -> pump.connect())
        .isInstanceOf(TelemetrySourceException.class)
        .hasMessageContaining("simulator not running");
  }

  @Test
  void stop_closesSourceOnPumpThreadAfterRunningPoll() throws Exception {
    BridgeProperties properties = new BridgeProperties();
    properties.getTelemetry().setPollInterval(Duration.ofMillis(50));
    SlowPollSource slow = new SlowPollSource();
    TelemetryPump running = new TelemetryPump(slow, stateMachine, dispatcher, properties, meterRegistry, clock);
    running.start();
    assertThat(slow.pollEntered.await(5, TimeUnit.SECONDS)).isTrue();

    running.stop();

    assertThat(slow.disconnectThread).isEqualTo("telemetry-pump");
    assertThat(slow.disconnectedDuringPoll).isFalse();
    assertThat(running.isConnected()).isFalse();
  }

  @Test
  void controlAfterStopIsRejected() {
    pump.stop();

    assertThatThrownBy(() -> pump.connect()).isInstanceOf(IllegalStateException.class);
    assertThat(source.disconnectCalls()).isGreaterThanOrEqualTo(1);
  }

  /** Source whose poll takes a while, recording any disconnect that overlaps it. */
  private static final class SlowPollSource implements TelemetrySource {
    private final CountDownLatch pollEntered = new CountDownLatch(1);
    private volatile boolean connected;
    private volatile boolean polling;
    private volatile boolean disconnectedDuringPoll;
    private volatile String disconnectThread;

    @Override
    public String name() {
      return "slow";
    }

    @Override
    public void connect() {
      connected = true;
    }

    @Override
    public Optional<TelemetrySnapshot> poll() {
      polling = true;
      pollEntered.countDown();
      try {
        Thread.sleep(300);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } finally {
        polling = false;
      }
      return Optional.empty();
    }

    @Override
    public boolean isConnected() {
      return connected;
    }

    @Override
    public void disconnect() {
      if (polling) {
        disconnectedDuringPoll = true;
      }
      disconnectThread = Thread.currentThread().getName();
      connected = false;
    }
  }

  private static TelemetrySnapshot ground() {
    return TelemetrySnapshot.builder()
        .latitude(45.0)
        .longitude(-30.0)
        .onGround(true)
        .gForce(1.0)
        .build();
  }

  private static TelemetrySnapshot airborne(double groundSpeed) {
    return TelemetrySnapshot.builder()
        .latitude(45.001)
        .longitude(-30.0)
        .onGround(false)
        .groundSpeed(groundSpeed)
        .altitudeAgl(50.0)
        .altitude(400.0)
        .gForce(1.1)
        .build();
  }

  /** Clock that only moves when told to. */
  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
