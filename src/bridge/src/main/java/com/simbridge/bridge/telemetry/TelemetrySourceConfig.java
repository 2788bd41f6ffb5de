package com.simbridge.bridge.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simbridge.bridge.config.BridgeProperties;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the {@link TelemetrySource} from {@code bridge.telemetry.source}. */
@Configuration(proxyBeanMethods = false)
public class TelemetrySourceConfig {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySourceConfig.class);

  @Bean(destroyMethod = "")
  public TelemetrySource telemetrySource(BridgeProperties properties, ObjectMapper objectMapper) {
    BridgeProperties.Telemetry telemetry = properties.getTelemetry();
    String source = telemetry.getSource() == null ? "" : telemetry.getSource().trim().toLowerCase(Locale.ROOT);
    switch (source) {
      case "replay":
        if (telemetry.getReplayFile() == null || telemetry.getReplayFile().isBlank()) {
          throw new IllegalStateException("bridge.telemetry.replay-file is required when source=replay");
        }
        return new ReplayTelemetrySource(Path.of(telemetry.getReplayFile()), telemetry.isReplayLoop(), objectMapper);
      case "disabled":
      case "":
        log.info("Telemetry source disabled; the hub serves route and airport requests only");
        return new DisabledTelemetrySource();
      default:
        throw new IllegalStateException("Unknown bridge.telemetry.source: " + telemetry.getSource());
    }
  }
}
