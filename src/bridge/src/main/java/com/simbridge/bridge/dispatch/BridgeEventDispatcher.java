package com.simbridge.bridge.dispatch;

import com.simbridge.bridge.config.BridgeProperties;
import com.simbridge.bridge.hub.BroadcastHub;
import com.simbridge.bridge.persistence.FlightLogClient;
import com.simbridge.tracker.flight.FlightEvent;
import com.simbridge.tracker.model.TelemetrySnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decouples the telemetry pump from viewer delivery and persistence.
 *
 * <p>The pump offers events to a bounded queue and never blocks. A single consumer thread drains
 * the queue in order. When the queue is full the oldest pending snapshot is dropped; flight and
 * status events are only dropped when no snapshot is left to make room.
 */
@Component
public class BridgeEventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(BridgeEventDispatcher.class);

  private final BroadcastHub hub;
  private final FlightLogClient flightLogClient;
  private final BlockingQueue<BridgeEvent> queue;
  private final ExecutorService executor;
  private final Counter droppedCounter;
  private final Counter rejectionCounter;
  private final Counter errorCounter;

  public BridgeEventDispatcher(
      BroadcastHub hub,
      FlightLogClient flightLogClient,
      BridgeProperties properties,
      MeterRegistry meterRegistry) {
    this.hub = hub;
    this.flightLogClient = flightLogClient;
    this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getDispatch().getQueueCapacity()));
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "bridge-dispatch");
      thread.setDaemon(true);
      return thread;
    });
    this.droppedCounter = meterRegistry.counter("bridge.dispatch.dropped.total");
    this.rejectionCounter = meterRegistry.counter("bridge.flights.rejections.total");
    this.errorCounter = meterRegistry.counter("bridge.dispatch.errors.total");
    meterRegistry.gauge("bridge.dispatch.queue.depth", queue, BlockingQueue::size);
  }

  @jakarta.annotation.PostConstruct
  public void start() {
    executor.submit(this::runLoop);
  }

  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  public void publishSnapshot(TelemetrySnapshot snapshot) {
    offer(new BridgeEvent.SnapshotCaptured(snapshot));
  }

  public void publishStatus(boolean connected) {
    offer(new BridgeEvent.SourceStatusChanged(connected));
  }

  public void publishFlightEvents(List<FlightEvent> events) {
    for (FlightEvent event : events) {
      offer(new BridgeEvent.FlightEventRaised(event));
    }
  }

  void offer(BridgeEvent event) {
    while (!queue.offer(event)) {
      BridgeEvent dropped = dropOldest();
      if (dropped == null) {
        continue;
      }
      droppedCounter.increment();
      log.debug("Dispatch queue full, dropped {}", dropped.getClass().getSimpleName());
    }
  }

  private BridgeEvent dropOldest() {
    Iterator<BridgeEvent> iterator = queue.iterator();
    while (iterator.hasNext()) {
      BridgeEvent candidate = iterator.next();
      if (candidate instanceof BridgeEvent.SnapshotCaptured) {
        iterator.remove();
        return candidate;
      }
    }
    return queue.poll();
  }

  int pending() {
    return queue.size();
  }

  private void runLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      BridgeEvent event;
      try {
        event = queue.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Dispatch loop interrupted during shutdown");
        return;
      }
      try {
        handle(event);
      } catch (Exception ex) {
        errorCounter.increment();
        log.warn("Dispatching {} failed", event.getClass().getSimpleName(), ex);
      }
    }
  }

  void handle(BridgeEvent event) {
    if (event instanceof BridgeEvent.SnapshotCaptured captured) {
      hub.broadcastSnapshot(captured.snapshot());
    } else if (event instanceof BridgeEvent.SourceStatusChanged status) {
      hub.broadcastStatus(status.connected());
    } else if (event instanceof BridgeEvent.FlightEventRaised raised) {
      handleFlightEvent(raised.event());
    }
  }

  private void handleFlightEvent(FlightEvent event) {
    if (event instanceof FlightEvent.LandingDetected detected) {
      hub.broadcastLanding(detected.landing());
    } else if (event instanceof FlightEvent.FlightCompleted completed) {
      flightLogClient.submit(completed.record());
    } else if (event instanceof FlightEvent.LandingRejected
        || event instanceof FlightEvent.TakeoffDiscarded
        || event instanceof FlightEvent.FlightRecordDiscarded) {
      rejectionCounter.increment();
    }
  }
}
