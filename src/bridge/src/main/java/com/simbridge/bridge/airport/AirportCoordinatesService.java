package com.simbridge.bridge.airport;

import com.simbridge.bridge.config.BridgeProperties;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Process-wide cache of airport coordinates in front of {@link AirportInfoClient}.
 *
 * <p>Only successful lookups are cached. Concurrent requests for the same code share one upstream
 * call. Lookups run on a small dedicated pool so socket handlers are never blocked.
 */
@Service
public class AirportCoordinatesService {
  private static final Logger log = LoggerFactory.getLogger(AirportCoordinatesService.class);

  private final AirportInfoClient client;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final Map<String, AirportCoords> cache = new ConcurrentHashMap<>();
  private final Map<String, CompletableFuture<AirportLookupResult>> inFlight = new ConcurrentHashMap<>();

  @Autowired
  public AirportCoordinatesService(AirportInfoClient client, BridgeProperties properties) {
    this(client, lookupPool(Math.max(1, properties.getAirportApi().getLookupThreads())));
  }

  public AirportCoordinatesService(AirportInfoClient client, Executor executor) {
    this.client = client;
    this.executor = executor;
    this.ownedExecutor = executor instanceof ExecutorService service ? service : null;
  }

  /**
   * Resolves coordinates for a code, from cache when possible.
   *
   * @param rawIcao code as typed by the viewer
   * @return empty when the code is not a plausible airport identifier, otherwise the pending lookup
   */
  public Optional<CompletableFuture<AirportLookupResult>> lookup(String rawIcao) {
    String icao = normalizeCode(rawIcao);
    if (icao == null) {
      return Optional.empty();
    }
    AirportCoords cached = cache.get(icao);
    if (cached != null) {
      return Optional.of(CompletableFuture.completedFuture(AirportLookupResult.found(cached)));
    }

    CompletableFuture<AirportLookupResult> pending = new CompletableFuture<>();
    CompletableFuture<AirportLookupResult> existing = inFlight.putIfAbsent(icao, pending);
    if (existing != null) {
      return Optional.of(existing);
    }

    log.debug("Fetching airport coordinates for {}", icao);
    try {
      executor.execute(() -> complete(icao, pending));
    } catch (RejectedExecutionException ex) {
      inFlight.remove(icao, pending);
      pending.complete(AirportLookupResult.error());
    }
    return Optional.of(pending);
  }

  public Optional<AirportCoords> cached(String icao) {
    String normalized = normalizeCode(icao);
    return normalized == null ? Optional.empty() : Optional.ofNullable(cache.get(normalized));
  }

  public int cacheSize() {
    return cache.size();
  }

  /**
   * Trims and upper-cases an airport identifier of 3 or 4 ASCII letters or digits.
   *
   * @return the normalized identifier, or null when it is not one
   */
  public static String normalizeCode(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.length() < 3 || trimmed.length() > 4) {
      return null;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean alphanumeric = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
      if (!alphanumeric) {
        return null;
      }
    }
    return trimmed.toUpperCase(Locale.ROOT);
  }

  private void complete(String icao, CompletableFuture<AirportLookupResult> pending) {
    AirportLookupResult result;
    try {
      result = client.lookup(icao);
    } catch (RuntimeException ex) {
      log.warn("Airport lookup for {} failed", icao, ex);
      result = AirportLookupResult.error();
    }
    if (result.isFound()) {
      cache.put(icao, result.coords());
      log.info("Airport {} resolved to ({}, {})", icao, result.coords().lat(), result.coords().lon());
    }
    inFlight.remove(icao, pending);
    pending.complete(result);
  }

  @jakarta.annotation.PreDestroy
  public void stop() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdownNow();
    try {
      ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static ExecutorService lookupPool(int threads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, runnable -> {
      Thread thread = new Thread(runnable, "airport-lookup-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }
}
