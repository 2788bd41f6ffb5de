package com.simbridge.bridge.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded session: one JSON snapshot per line, {@code #} comments and blank lines
 * skipped. Each poll returns the next line.
 *
 * <p>At end of file the source either rewinds ({@code loop}) or reports the link as lost.
 */
public class ReplayTelemetrySource implements TelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(ReplayTelemetrySource.class);

  private final Path file;
  private final boolean loop;
  private final ObjectMapper objectMapper;
  private BufferedReader reader;
  private long lineNumber;

  public ReplayTelemetrySource(Path file, boolean loop, ObjectMapper objectMapper) {
    this.file = file;
    this.loop = loop;
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "replay:" + file.getFileName();
  }

  @Override
  public void connect() {
    disconnect();
    try {
      reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
      lineNumber = 0;
      log.info("Replaying telemetry from {} (loop={})", file, loop);
    } catch (IOException ex) {
      throw new TelemetrySourceException("cannot open replay file " + file, ex);
    }
  }

  @Override
  public Optional<TelemetrySnapshot> poll() {
    if (reader == null) {
      throw new TelemetrySourceException("replay source not connected");
    }
    try {
      boolean rewound = false;
      while (true) {
        String line = reader.readLine();
        if (line == null) {
          if (!loop || rewound) {
            disconnect();
            throw new TelemetrySourceException("end of replay file " + file);
          }
          connect();
          rewound = true;
          continue;
        }
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        try {
          return Optional.of(objectMapper.readValue(trimmed, TelemetrySnapshot.class));
        } catch (JsonProcessingException ex) {
          log.warn("Skipping malformed replay line {} in {}: {}", lineNumber, file, ex.getOriginalMessage());
        }
      }
    } catch (IOException ex) {
      disconnect();
      throw new TelemetrySourceException("replay read failed for " + file, ex);
    }
  }

  @Override
  public boolean isConnected() {
    return reader != null;
  }

  @Override
  public void disconnect() {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (IOException ex) {
      log.debug("Closing replay file {} failed: {}", file, ex.getMessage());
    }
    reader = null;
  }
}
