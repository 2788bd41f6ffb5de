package com.simbridge.bridge.config;

import com.simbridge.tracker.flight.TrackerRules;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the bridge service.
 *
 * <p>Values are bound from {@code bridge.*} in {@code application.yml} and environment variables.
 */
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
  private final Telemetry telemetry = new Telemetry();
  private final Rules rules = new Rules();
  private final Hub hub = new Hub();
  private final AirportApi airportApi = new AirportApi();
  private final Persistence persistence = new Persistence();
  private final Relay relay = new Relay();
  private final Dispatch dispatch = new Dispatch();

  public Telemetry getTelemetry() {
    return telemetry;
  }

  public Rules getRules() {
    return rules;
  }

  public Hub getHub() {
    return hub;
  }

  public AirportApi getAirportApi() {
    return airportApi;
  }

  public Persistence getPersistence() {
    return persistence;
  }

  public Relay getRelay() {
    return relay;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  /** Telemetry source selection and producer loop cadence. */
  public static class Telemetry {
    private boolean enabled = true;
    private String source = "disabled";
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration retryInterval = Duration.ofSeconds(5);
    private String replayFile;
    private boolean replayLoop = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getSource() {
      return source;
    }

    public void setSource(String source) {
      this.source = source;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getRetryInterval() {
      return retryInterval;
    }

    public void setRetryInterval(Duration retryInterval) {
      this.retryInterval = retryInterval;
    }

    public String getReplayFile() {
      return replayFile;
    }

    public void setReplayFile(String replayFile) {
      this.replayFile = replayFile;
    }

    public boolean isReplayLoop() {
      return replayLoop;
    }

    public void setReplayLoop(boolean replayLoop) {
      this.replayLoop = replayLoop;
    }
  }

  /** Flight plausibility thresholds; defaults match {@link TrackerRules#defaults()}. */
  public static class Rules {
    private Duration minFlightDuration = Duration.ofSeconds(180);
    private double minAltitudeAglFt = 100.0;
    private double minTakeoffSpeedKt = 40.0;
    private double maxTakeoffSpeedKt = 250.0;
    private double minPeakGForce = 0.5;
    private double minDistanceNm = 5.0;
    private double maxStepNm = 10.0;
    private double approachCeilingFt = 3000.0;
    private int approachCapacity = 60;
    private Duration landingDebounce = Duration.ofSeconds(5);
    private double airportSearchRadiusNm = 10.0;
    private Duration minRecordDuration = Duration.ofSeconds(120);
    private double minRecordDistanceNm = 5.0;

    public TrackerRules toTrackerRules() {
      return new TrackerRules(
          minFlightDuration,
          minAltitudeAglFt,
          minTakeoffSpeedKt,
          maxTakeoffSpeedKt,
          minPeakGForce,
          minDistanceNm,
          maxStepNm,
          approachCeilingFt,
          approachCapacity,
          landingDebounce,
          airportSearchRadiusNm,
          minRecordDuration,
          minRecordDistanceNm);
    }

    public Duration getMinFlightDuration() {
      return minFlightDuration;
    }

    public void setMinFlightDuration(Duration minFlightDuration) {
      this.minFlightDuration = minFlightDuration;
    }

    public double getMinAltitudeAglFt() {
      return minAltitudeAglFt;
    }

    public void setMinAltitudeAglFt(double minAltitudeAglFt) {
      this.minAltitudeAglFt = minAltitudeAglFt;
    }

    public double getMinTakeoffSpeedKt() {
      return minTakeoffSpeedKt;
    }

    public void setMinTakeoffSpeedKt(double minTakeoffSpeedKt) {
      this.minTakeoffSpeedKt = minTakeoffSpeedKt;
    }

    public double getMaxTakeoffSpeedKt() {
      return maxTakeoffSpeedKt;
    }

    public void setMaxTakeoffSpeedKt(double maxTakeoffSpeedKt) {
      this.maxTakeoffSpeedKt = maxTakeoffSpeedKt;
    }

    public double getMinPeakGForce() {
      return minPeakGForce;
    }

    public void setMinPeakGForce(double minPeakGForce) {
      this.minPeakGForce = minPeakGForce;
    }

    public double getMinDistanceNm() {
      return minDistanceNm;
    }

    public void setMinDistanceNm(double minDistanceNm) {
      this.minDistanceNm = minDistanceNm;
    }

    public double getMaxStepNm() {
      return maxStepNm;
    }

    public void setMaxStepNm(double maxStepNm) {
      this.maxStepNm = maxStepNm;
    }

    public double getApproachCeilingFt() {
      return approachCeilingFt;
    }

    public void setApproachCeilingFt(double approachCeilingFt) {
      this.approachCeilingFt = approachCeilingFt;
    }

    public int getApproachCapacity() {
      return approachCapacity;
    }

    public void setApproachCapacity(int approachCapacity) {
      this.approachCapacity = approachCapacity;
    }

    public Duration getLandingDebounce() {
      return landingDebounce;
    }

    public void setLandingDebounce(Duration landingDebounce) {
      this.landingDebounce = landingDebounce;
    }

    public double getAirportSearchRadiusNm() {
      return airportSearchRadiusNm;
    }

    public void setAirportSearchRadiusNm(double airportSearchRadiusNm) {
      this.airportSearchRadiusNm = airportSearchRadiusNm;
    }

    public Duration getMinRecordDuration() {
      return minRecordDuration;
    }

    public void setMinRecordDuration(Duration minRecordDuration) {
      this.minRecordDuration = minRecordDuration;
    }

    public double getMinRecordDistanceNm() {
      return minRecordDistanceNm;
    }

    public void setMinRecordDistanceNm(double minRecordDistanceNm) {
      this.minRecordDistanceNm = minRecordDistanceNm;
    }
  }

  /** WebSocket endpoint and per-connection delivery limits. */
  public static class Hub {
    private String path = "/";
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    private Duration sendTimeLimit = Duration.ofSeconds(5);
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }

    public Duration getSendTimeLimit() {
      return sendTimeLimit;
    }

    public void setSendTimeLimit(Duration sendTimeLimit) {
      this.sendTimeLimit = sendTimeLimit;
    }

    public int getSendBufferSizeLimit() {
      return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
      this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
  }

  /** Airport coordinate lookup used by {@code getAirport} requests. */
  public static class AirportApi {
    private boolean enabled = true;
    private String baseUrl = "https://airport-data.com/api/ap_info.json";
    private int timeoutMs = 5_000;
    private int lookupThreads = 2;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public int getLookupThreads() {
      return lookupThreads;
    }

    public void setLookupThreads(int lookupThreads) {
      this.lookupThreads = lookupThreads;
    }
  }

  /** Remote flight log (REST table endpoint). Disabled while url or api key is blank. */
  public static class Persistence {
    private String url;
    private String apiKey;
    private String table = "flights";
    private int timeoutMs = 10_000;

    public boolean isConfigured() {
      return url != null && !url.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getTable() {
      return table;
    }

    public void setTable(String table) {
      this.table = table;
    }

    public int getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  /** Remote relay of broadcast payloads over Redis pub/sub, addressed by session code. */
  public static class Relay {
    private boolean enabled = false;
    private String channelPrefix = "simbridge:session:";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getChannelPrefix() {
      return channelPrefix;
    }

    public void setChannelPrefix(String channelPrefix) {
      this.channelPrefix = channelPrefix;
    }
  }

  /** Outbound event queue between the producer loop and the fan-out consumers. */
  public static class Dispatch {
    private int queueCapacity = 256;

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }
}
