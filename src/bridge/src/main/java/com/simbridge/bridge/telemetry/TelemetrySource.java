package com.simbridge.bridge.telemetry;

import com.simbridge.tracker.model.TelemetrySnapshot;
import java.util.Optional;

/**
 * Simulator link producing one {@link TelemetrySnapshot} per poll.
 *
 * <p>Implementations are driven from a single thread and need not be thread-safe.
 */
public interface TelemetrySource extends AutoCloseable {

  String name();

  /**
   * Opens the link.
   *
   * @throws TelemetrySourceException when the simulator is not reachable
   */
  void connect();

  /**
   * Reads the next sample.
   *
   * @return the sample, or empty when no new data is available yet
   * @throws TelemetrySourceException when the link was lost
   */
  Optional<TelemetrySnapshot> poll();

  boolean isConnected();

  /** False when this source can never connect (for example no simulator configured). */
  default boolean isAvailable() {
    return true;
  }

  void disconnect();

  @Override
  default void close() {
    disconnect();
  }
}
