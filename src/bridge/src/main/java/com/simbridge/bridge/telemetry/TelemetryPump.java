package com.simbridge.bridge.telemetry;

import com.simbridge.bridge.config.BridgeProperties;
import com.simbridge.bridge.dispatch.BridgeEventDispatcher;
import com.simbridge.tracker.flight.FlightEvent;
import com.simbridge.tracker.flight.FlightStateMachine;
import com.simbridge.tracker.model.TelemetrySnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Producer loop: polls the {@link TelemetrySource} at a fixed cadence, feeds the
 * {@link FlightStateMachine} and queues the results for delivery.
 *
 * <p>Everything touching the source runs on the single {@code telemetry-pump} thread, including
 * manual connect/disconnect requests, so ticks are never interleaved. A lost source cancels the
 * flight in progress and is retried every {@code retry-interval} until an operator disconnects it.
 */
@Component
public class TelemetryPump {
  private static final Logger log = LoggerFactory.getLogger(TelemetryPump.class);
  private static final long CONTROL_TIMEOUT_SECONDS = 5;

  private final TelemetrySource source;
  private final FlightStateMachine stateMachine;
  private final BridgeEventDispatcher dispatcher;
  private final BridgeProperties.Telemetry properties;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final Counter tickCounter;
  private final Counter errorCounter;
  private final AtomicInteger connectedGauge;

  private volatile boolean running = false;
  private volatile boolean autoConnect = true;
  private volatile boolean connectFailureLogged = false;
  private Instant nextConnectAttemptAt;

  @Autowired
  public TelemetryPump(
      TelemetrySource source,
      FlightStateMachine stateMachine,
      BridgeEventDispatcher dispatcher,
      BridgeProperties properties,
      MeterRegistry meterRegistry) {
    this(source, stateMachine, dispatcher, properties, meterRegistry, Clock.systemUTC());
  }

  TelemetryPump(
      TelemetrySource source,
      FlightStateMachine stateMachine,
      BridgeEventDispatcher dispatcher,
      BridgeProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.source = source;
    this.stateMachine = stateMachine;
    this.dispatcher = dispatcher;
    this.properties = properties.getTelemetry();
    this.clock = clock;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "telemetry-pump");
      thread.setDaemon(true);
      return thread;
    });
    this.tickCounter = meterRegistry.counter("bridge.telemetry.ticks.total");
    this.errorCounter = meterRegistry.counter("bridge.telemetry.errors.total");
    this.connectedGauge = meterRegistry.gauge("bridge.telemetry.connected", new AtomicInteger(0));
  }

  /** Starts polling unless {@code bridge.telemetry.enabled=false}. */
  @jakarta.annotation.PostConstruct
  public void start() {
    if (!properties.isEnabled()) {
      log.info("Telemetry pump disabled (bridge.telemetry.enabled=false)");
      return;
    }
    long pollMs = Math.max(50L, properties.getPollInterval().toMillis());
    running = true;
    scheduler.scheduleWithFixedDelay(this::runCycle, 0L, pollMs, TimeUnit.MILLISECONDS);
    log.info("Telemetry pump started: source={}, poll={}ms, retry={}s",
        source.name(), pollMs, properties.getRetryInterval().getSeconds());
  }

  /**
   * Stops the loop and releases the source on the pump thread once the running cycle is done.
   * If the cycle does not finish in time the pump is interrupted and the source is left to it.
   */
  @jakarta.annotation.PreDestroy
  public void stop() {
    running = false;
    try {
      scheduler.execute(this::closeSource);
    } catch (RejectedExecutionException ex) {
      log.debug("Telemetry pump already stopped");
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Telemetry pump did not stop within 5s, interrupting it");
        scheduler.shutdownNow();
      }
    } catch (InterruptedException ex) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void closeSource() {
    try {
      source.close();
    } catch (RuntimeException ex) {
      log.warn("Closing telemetry source {} failed", source.name(), ex);
    }
    connectedGauge.set(0);
  }

  private void runCycle() {
    if (!running) {
      return;
    }
    try {
      tick();
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Telemetry cycle failed", ex);
    }
  }

  void tick() {
    if (!source.isConnected()) {
      if (!autoConnect || !source.isAvailable()) {
        return;
      }
      Instant now = clock.instant();
      if (nextConnectAttemptAt != null && now.isBefore(nextConnectAttemptAt)) {
        return;
      }
      if (!tryConnect(now)) {
        return;
      }
    }

    Optional<TelemetrySnapshot> sample;
    try {
      sample = source.poll();
    } catch (TelemetrySourceException ex) {
      errorCounter.increment();
      log.warn("Telemetry source {} lost: {}", source.name(), ex.getMessage());
      releaseSource("telemetry source lost: " + ex.getMessage());
      return;
    }
    if (sample.isEmpty()) {
      return;
    }

    TelemetrySnapshot snapshot = sample.get();
    tickCounter.increment();
    List<FlightEvent> events = stateMachine.accept(snapshot, clock.instant());
    dispatcher.publishSnapshot(snapshot);
    dispatcher.publishFlightEvents(events);
  }

  private boolean tryConnect(Instant now) {
    try {
      openSource();
      return true;
    } catch (TelemetrySourceException ex) {
      nextConnectAttemptAt = now.plus(retryInterval());
      if (!connectFailureLogged) {
        log.info("Telemetry source {} not reachable ({}), retrying every {}s",
            source.name(), ex.getMessage(), retryInterval().getSeconds());
        connectFailureLogged = true;
      } else {
        log.debug("Telemetry source {} still not reachable: {}", source.name(), ex.getMessage());
      }
      return false;
    }
  }

  private void openSource() {
    source.connect();
    connectFailureLogged = false;
    nextConnectAttemptAt = null;
    connectedGauge.set(1);
    log.info("Telemetry source {} connected", source.name());
    dispatcher.publishStatus(true);
  }

  private void releaseSource(String reason) {
    source.disconnect();
    connectedGauge.set(0);
    Instant now = clock.instant();
    nextConnectAttemptAt = now.plus(retryInterval());
    List<FlightEvent> events = stateMachine.disconnect(now, reason);
    dispatcher.publishFlightEvents(events);
    dispatcher.publishStatus(false);
  }

  /**
   * Connects the source now and re-enables automatic reconnects.
   *
   * @return false when the source was already connected
   * @throws TelemetrySourceException when the simulator cannot be reached
   */
  public boolean connect() {
    return callOnPump(() -> {
      autoConnect = true;
      if (source.isConnected()) {
        return false;
      }
      openSource();
      return true;
    });
  }

  /**
   * Disconnects the source and suspends automatic reconnects until {@link #connect()}.
   *
   * @return false when the source was not connected
   */
  public boolean disconnect() {
    return callOnPump(() -> {
      autoConnect = false;
      if (!source.isConnected()) {
        return false;
      }
      log.info("Telemetry source {} disconnected by operator", source.name());
      releaseSource("disconnected by operator");
      return true;
    });
  }

  private <T> T callOnPump(Callable<T> action) {
    Future<T> future;
    try {
      future = scheduler.submit(action);
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("telemetry pump is stopped", ex);
    }
    try {
      return future.get(CONTROL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("telemetry pump action failed", ex.getCause());
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new IllegalStateException("telemetry pump did not respond within " + CONTROL_TIMEOUT_SECONDS + "s", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for the telemetry pump", ex);
    }
  }

  private Duration retryInterval() {
    return properties.getRetryInterval();
  }

  public boolean isConnected() {
    return connectedGauge.get() == 1;
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isAutoConnect() {
    return autoConnect;
  }

  public String sourceName() {
    return source.name();
  }
}
