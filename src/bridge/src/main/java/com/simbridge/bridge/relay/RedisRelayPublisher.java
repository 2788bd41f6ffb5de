package com.simbridge.bridge.relay;

import com.simbridge.bridge.config.BridgeProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes broadcast payloads to the Redis channel of the current session.
 *
 * <p>Relay failures are counted and logged; local viewers are never affected by them.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.relay", name = "enabled", havingValue = "true")
public class RedisRelayPublisher implements RelaySink {
  private static final Logger log = LoggerFactory.getLogger(RedisRelayPublisher.class);

  private final StringRedisTemplate redisTemplate;
  private final String channel;
  private final Counter publishedCounter;
  private final Counter errorCounter;

  public RedisRelayPublisher(
      StringRedisTemplate redisTemplate,
      RelaySession session,
      BridgeProperties properties,
      MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.channel = properties.getRelay().getChannelPrefix()
        + session.code().orElseThrow(() -> new IllegalStateException("relay enabled without session code"));
    this.publishedCounter = meterRegistry.counter("bridge.relay.published.total");
    this.errorCounter = meterRegistry.counter("bridge.relay.errors.total");
    log.info("Relaying broadcasts to Redis channel {}", channel);
  }

  @Override
  public void publish(String payload) {
    try {
      redisTemplate.convertAndSend(channel, payload);
      publishedCounter.increment();
    } catch (DataAccessException ex) {
      errorCounter.increment();
      log.warn("Relay publish to {} failed: {}", channel, ex.getMessage());
    }
  }

  public String channel() {
    return channel;
  }
}
