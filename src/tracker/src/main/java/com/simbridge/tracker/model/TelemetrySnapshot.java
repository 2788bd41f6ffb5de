package com.simbridge.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One telemetry sample as delivered by the simulator once per tick.
 *
 * <p>Core flight values are primitives and always present. Cockpit system values are nullable
 * because not every aircraft exposes them; {@code null} fields are left out of the JSON payload.
 * Free-text fields that are blank or not printable ASCII are dropped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelemetrySnapshot(
    // Sim state
    Double simRate,
    Boolean paused,
    // Aircraft
    String aircraftTitle,
    // Position (feet, degrees)
    double latitude,
    double longitude,
    double altitude,
    double altitudeAgl,
    // Kinematics (knots, feet per minute, G)
    double groundSpeed,
    double verticalSpeed,
    @JsonProperty("gForce") double gForce,
    double heading,
    // Attitude and body accelerations
    double pitch,
    double bank,
    double angleOfAttack,
    double sideslip,
    double headingMagnetic,
    @JsonProperty("lateralG") double lateralG,
    @JsonProperty("longitudinalG") double longitudinalG,
    // Systems
    boolean onGround,
    Boolean enginesRunning,
    Double flapsPosition,
    Boolean gearDown,
    Boolean parkingBrake,
    // Lights
    Boolean lightBeacon,
    Boolean lightStrobe,
    Boolean lightLanding,
    Boolean lightTaxi,
    Boolean lightNav,
    Boolean lightLogo,
    Boolean lightWing,
    Boolean lightCabin,
    Boolean lightPanel,
    // Electrical / APU
    Boolean battery1,
    Boolean battery2,
    Boolean externalPower,
    Boolean avionicsMaster,
    Boolean apuMaster,
    Boolean apuRunning,
    Double apuPctRpm,
    // Engines
    Boolean engineMaster1,
    Boolean engineMaster2,
    @JsonProperty("engine1N1") Double engine1N1,
    @JsonProperty("engine1N2") Double engine1N2,
    @JsonProperty("engine2N1") Double engine2N1,
    @JsonProperty("engine2N2") Double engine2N2,
    Double throttle1,
    Double throttle2,
    // Controls, cabin, transponder
    Boolean spoilersArmed,
    Double spoilersPosition,
    Boolean autopilotMaster,
    Boolean autothrottleArmed,
    Boolean seatbeltSign,
    Boolean noSmokingSign,
    Integer transponderState,
    // Anti-ice / fuel
    Boolean antiIceEngine1,
    Boolean antiIceEngine2,
    Boolean antiIceStructural,
    Boolean pitotHeat,
    Boolean fuelPump1,
    Boolean fuelPump2,
    // GPS flight plan
    Boolean gpsIsActiveFlightPlan,
    Integer gpsWpCount,
    Integer gpsWpIndex,
    Double gpsWpDistance,
    Double gpsWpEte,
    Double gpsEte,
    Double gpsEta,
    // ATC and waypoint identifiers
    String atcId,
    String atcAirline,
    String atcFlightNumber,
    String gpsWpNextId,
    String gpsWpPrevId,
    String gpsApproachAirportId) {

  public TelemetrySnapshot {
    aircraftTitle = printableOrNull(aircraftTitle);
    atcId = printableOrNull(atcId);
    atcAirline = printableOrNull(atcAirline);
    atcFlightNumber = printableOrNull(atcFlightNumber);
    gpsWpNextId = printableOrNull(gpsWpNextId);
    gpsWpPrevId = printableOrNull(gpsWpPrevId);
    gpsApproachAirportId = printableOrNull(gpsApproachAirportId);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.simRate = simRate;
    builder.paused = paused;
    builder.aircraftTitle = aircraftTitle;
    builder.latitude = latitude;
    builder.longitude = longitude;
    builder.altitude = altitude;
    builder.altitudeAgl = altitudeAgl;
    builder.groundSpeed = groundSpeed;
    builder.verticalSpeed = verticalSpeed;
    builder.gForce = gForce;
    builder.heading = heading;
    builder.pitch = pitch;
    builder.bank = bank;
    builder.angleOfAttack = angleOfAttack;
    builder.sideslip = sideslip;
    builder.headingMagnetic = headingMagnetic;
    builder.lateralG = lateralG;
    builder.longitudinalG = longitudinalG;
    builder.onGround = onGround;
    builder.enginesRunning = enginesRunning;
    builder.flapsPosition = flapsPosition;
    builder.gearDown = gearDown;
    builder.parkingBrake = parkingBrake;
    builder.lightBeacon = lightBeacon;
    builder.lightStrobe = lightStrobe;
    builder.lightLanding = lightLanding;
    builder.lightTaxi = lightTaxi;
    builder.lightNav = lightNav;
    builder.lightLogo = lightLogo;
    builder.lightWing = lightWing;
    builder.lightCabin = lightCabin;
    builder.lightPanel = lightPanel;
    builder.battery1 = battery1;
    builder.battery2 = battery2;
    builder.externalPower = externalPower;
    builder.avionicsMaster = avionicsMaster;
    builder.apuMaster = apuMaster;
    builder.apuRunning = apuRunning;
    builder.apuPctRpm = apuPctRpm;
    builder.engineMaster1 = engineMaster1;
    builder.engineMaster2 = engineMaster2;
    builder.engine1N1 = engine1N1;
    builder.engine1N2 = engine1N2;
    builder.engine2N1 = engine2N1;
    builder.engine2N2 = engine2N2;
    builder.throttle1 = throttle1;
    builder.throttle2 = throttle2;
    builder.spoilersArmed = spoilersArmed;
    builder.spoilersPosition = spoilersPosition;
    builder.autopilotMaster = autopilotMaster;
    builder.autothrottleArmed = autothrottleArmed;
    builder.seatbeltSign = seatbeltSign;
    builder.noSmokingSign = noSmokingSign;
    builder.transponderState = transponderState;
    builder.antiIceEngine1 = antiIceEngine1;
    builder.antiIceEngine2 = antiIceEngine2;
    builder.antiIceStructural = antiIceStructural;
    builder.pitotHeat = pitotHeat;
    builder.fuelPump1 = fuelPump1;
    builder.fuelPump2 = fuelPump2;
    builder.gpsIsActiveFlightPlan = gpsIsActiveFlightPlan;
    builder.gpsWpCount = gpsWpCount;
    builder.gpsWpIndex = gpsWpIndex;
    builder.gpsWpDistance = gpsWpDistance;
    builder.gpsWpEte = gpsWpEte;
    builder.gpsEte = gpsEte;
    builder.gpsEta = gpsEta;
    builder.atcId = atcId;
    builder.atcAirline = atcAirline;
    builder.atcFlightNumber = atcFlightNumber;
    builder.gpsWpNextId = gpsWpNextId;
    builder.gpsWpPrevId = gpsWpPrevId;
    builder.gpsApproachAirportId = gpsApproachAirportId;
    return builder;
  }

  static String printableOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        return null;
      }
    }
    return value.trim();
  }

  /** Mutable builder, mainly for telemetry adapters and tests. */
  public static final class Builder {
    private Double simRate;
    private Boolean paused;
    private String aircraftTitle;
    private double latitude;
    private double longitude;
    private double altitude;
    private double altitudeAgl;
    private double groundSpeed;
    private double verticalSpeed;
    private double gForce;
    private double heading;
    private double pitch;
    private double bank;
    private double angleOfAttack;
    private double sideslip;
    private double headingMagnetic;
    private double lateralG;
    private double longitudinalG;
    private boolean onGround;
    private Boolean enginesRunning;
    private Double flapsPosition;
    private Boolean gearDown;
    private Boolean parkingBrake;
    private Boolean lightBeacon;
    private Boolean lightStrobe;
    private Boolean lightLanding;
    private Boolean lightTaxi;
    private Boolean lightNav;
    private Boolean lightLogo;
    private Boolean lightWing;
    private Boolean lightCabin;
    private Boolean lightPanel;
    private Boolean battery1;
    private Boolean battery2;
    private Boolean externalPower;
    private Boolean avionicsMaster;
    private Boolean apuMaster;
    private Boolean apuRunning;
    private Double apuPctRpm;
    private Boolean engineMaster1;
    private Boolean engineMaster2;
    private Double engine1N1;
    private Double engine1N2;
    private Double engine2N1;
    private Double engine2N2;
    private Double throttle1;
    private Double throttle2;
    private Boolean spoilersArmed;
    private Double spoilersPosition;
    private Boolean autopilotMaster;
    private Boolean autothrottleArmed;
    private Boolean seatbeltSign;
    private Boolean noSmokingSign;
    private Integer transponderState;
    private Boolean antiIceEngine1;
    private Boolean antiIceEngine2;
    private Boolean antiIceStructural;
    private Boolean pitotHeat;
    private Boolean fuelPump1;
    private Boolean fuelPump2;
    private Boolean gpsIsActiveFlightPlan;
    private Integer gpsWpCount;
    private Integer gpsWpIndex;
    private Double gpsWpDistance;
    private Double gpsWpEte;
    private Double gpsEte;
    private Double gpsEta;
    private String atcId;
    private String atcAirline;
    private String atcFlightNumber;
    private String gpsWpNextId;
    private String gpsWpPrevId;
    private String gpsApproachAirportId;

    private Builder() {}

    public Builder simRate(Double simRate) {
      this.simRate = simRate;
      return this;
    }

    public Builder paused(Boolean paused) {
      this.paused = paused;
      return this;
    }

    public Builder aircraftTitle(String aircraftTitle) {
      this.aircraftTitle = aircraftTitle;
      return this;
    }

    public Builder latitude(double latitude) {
      this.latitude = latitude;
      return this;
    }

    public Builder longitude(double longitude) {
      this.longitude = longitude;
      return this;
    }

    public Builder altitude(double altitude) {
      this.altitude = altitude;
      return this;
    }

    public Builder altitudeAgl(double altitudeAgl) {
      this.altitudeAgl = altitudeAgl;
      return this;
    }

    public Builder groundSpeed(double groundSpeed) {
      this.groundSpeed = groundSpeed;
      return this;
    }

    public Builder verticalSpeed(double verticalSpeed) {
      this.verticalSpeed = verticalSpeed;
      return this;
    }

    public Builder gForce(double gForce) {
      this.gForce = gForce;
      return this;
    }

    public Builder heading(double heading) {
      this.heading = heading;
      return this;
    }

    public Builder pitch(double pitch) {
      this.pitch = pitch;
      return this;
    }

    public Builder bank(double bank) {
      this.bank = bank;
      return this;
    }

    public Builder angleOfAttack(double angleOfAttack) {
      this.angleOfAttack = angleOfAttack;
      return this;
    }

    public Builder sideslip(double sideslip) {
      this.sideslip = sideslip;
      return this;
    }

    public Builder headingMagnetic(double headingMagnetic) {
      this.headingMagnetic = headingMagnetic;
      return this;
    }

    public Builder lateralG(double lateralG) {
      this.lateralG = lateralG;
      return this;
    }

    public Builder longitudinalG(double longitudinalG) {
      this.longitudinalG = longitudinalG;
      return this;
    }

    public Builder onGround(boolean onGround) {
      this.onGround = onGround;
      return this;
    }

    public Builder enginesRunning(Boolean enginesRunning) {
      this.enginesRunning = enginesRunning;
      return this;
    }

    public Builder flapsPosition(Double flapsPosition) {
      this.flapsPosition = flapsPosition;
      return this;
    }

    public Builder gearDown(Boolean gearDown) {
      this.gearDown = gearDown;
      return this;
    }

    public Builder parkingBrake(Boolean parkingBrake) {
      this.parkingBrake = parkingBrake;
      return this;
    }

    public Builder lightBeacon(Boolean lightBeacon) {
      this.lightBeacon = lightBeacon;
      return this;
    }

    public Builder lightStrobe(Boolean lightStrobe) {
      this.lightStrobe = lightStrobe;
      return this;
    }

    public Builder lightLanding(Boolean lightLanding) {
      this.lightLanding = lightLanding;
      return this;
    }

    public Builder lightTaxi(Boolean lightTaxi) {
      this.lightTaxi = lightTaxi;
      return this;
    }

    public Builder lightNav(Boolean lightNav) {
      this.lightNav = lightNav;
      return this;
    }

    public Builder lightLogo(Boolean lightLogo) {
      this.lightLogo = lightLogo;
      return this;
    }

    public Builder lightWing(Boolean lightWing) {
      this.lightWing = lightWing;
      return this;
    }

    public Builder lightCabin(Boolean lightCabin) {
      this.lightCabin = lightCabin;
      return this;
    }

    public Builder lightPanel(Boolean lightPanel) {
      this.lightPanel = lightPanel;
      return this;
    }

    public Builder battery1(Boolean battery1) {
      this.battery1 = battery1;
      return this;
    }

    public Builder battery2(Boolean battery2) {
      this.battery2 = battery2;
      return this;
    }

    public Builder externalPower(Boolean externalPower) {
      this.externalPower = externalPower;
      return this;
    }

    public Builder avionicsMaster(Boolean avionicsMaster) {
      this.avionicsMaster = avionicsMaster;
      return this;
    }

    public Builder apuMaster(Boolean apuMaster) {
      this.apuMaster = apuMaster;
      return this;
    }

    public Builder apuRunning(Boolean apuRunning) {
      this.apuRunning = apuRunning;
      return this;
    }

    public Builder apuPctRpm(Double apuPctRpm) {
      this.apuPctRpm = apuPctRpm;
      return this;
    }

    public Builder engineMaster1(Boolean engineMaster1) {
      this.engineMaster1 = engineMaster1;
      return this;
    }

    public Builder engineMaster2(Boolean engineMaster2) {
      this.engineMaster2 = engineMaster2;
      return this;
    }

    public Builder engine1N1(Double engine1N1) {
      this.engine1N1 = engine1N1;
      return this;
    }

    public Builder engine1N2(Double engine1N2) {
      this.engine1N2 = engine1N2;
      return this;
    }

    public Builder engine2N1(Double engine2N1) {
      this.engine2N1 = engine2N1;
      return this;
    }

    public Builder engine2N2(Double engine2N2) {
      this.engine2N2 = engine2N2;
      return this;
    }

    public Builder throttle1(Double throttle1) {
      this.throttle1 = throttle1;
      return this;
    }

    public Builder throttle2(Double throttle2) {
      this.throttle2 = throttle2;
      return this;
    }

    public Builder spoilersArmed(Boolean spoilersArmed) {
      this.spoilersArmed = spoilersArmed;
      return this;
    }

    public Builder spoilersPosition(Double spoilersPosition) {
      this.spoilersPosition = spoilersPosition;
      return this;
    }

    public Builder autopilotMaster(Boolean autopilotMaster) {
      this.autopilotMaster = autopilotMaster;
      return this;
    }

    public Builder autothrottleArmed(Boolean autothrottleArmed) {
      this.autothrottleArmed = autothrottleArmed;
      return this;
    }

    public Builder seatbeltSign(Boolean seatbeltSign) {
      this.seatbeltSign = seatbeltSign;
      return this;
    }

    public Builder noSmokingSign(Boolean noSmokingSign) {
      this.noSmokingSign = noSmokingSign;
      return this;
    }

    public Builder transponderState(Integer transponderState) {
      this.transponderState = transponderState;
      return this;
    }

    public Builder antiIceEngine1(Boolean antiIceEngine1) {
      this.antiIceEngine1 = antiIceEngine1;
      return this;
    }

    public Builder antiIceEngine2(Boolean antiIceEngine2) {
      this.antiIceEngine2 = antiIceEngine2;
      return this;
    }

    public Builder antiIceStructural(Boolean antiIceStructural) {
      this.antiIceStructural = antiIceStructural;
      return this;
    }

    public Builder pitotHeat(Boolean pitotHeat) {
      this.pitotHeat = pitotHeat;
      return this;
    }

    public Builder fuelPump1(Boolean fuelPump1) {
      this.fuelPump1 = fuelPump1;
      return this;
    }

    public Builder fuelPump2(Boolean fuelPump2) {
      this.fuelPump2 = fuelPump2;
      return this;
    }

    public Builder gpsIsActiveFlightPlan(Boolean gpsIsActiveFlightPlan) {
      this.gpsIsActiveFlightPlan = gpsIsActiveFlightPlan;
      return this;
    }

    public Builder gpsWpCount(Integer gpsWpCount) {
      this.gpsWpCount = gpsWpCount;
      return this;
    }

    public Builder gpsWpIndex(Integer gpsWpIndex) {
      this.gpsWpIndex = gpsWpIndex;
      return this;
    }

    public Builder gpsWpDistance(Double gpsWpDistance) {
      this.gpsWpDistance = gpsWpDistance;
      return this;
    }

    public Builder gpsWpEte(Double gpsWpEte) {
      this.gpsWpEte = gpsWpEte;
      return this;
    }

    public Builder gpsEte(Double gpsEte) {
      this.gpsEte = gpsEte;
      return this;
    }

    public Builder gpsEta(Double gpsEta) {
      this.gpsEta = gpsEta;
      return this;
    }

    public Builder atcId(String atcId) {
      this.atcId = atcId;
      return this;
    }

    public Builder atcAirline(String atcAirline) {
      this.atcAirline = atcAirline;
      return this;
    }

    public Builder atcFlightNumber(String atcFlightNumber) {
      this.atcFlightNumber = atcFlightNumber;
      return this;
    }

    public Builder gpsWpNextId(String gpsWpNextId) {
      this.gpsWpNextId = gpsWpNextId;
      return this;
    }

    public Builder gpsWpPrevId(String gpsWpPrevId) {
      this.gpsWpPrevId = gpsWpPrevId;
      return this;
    }

    public Builder gpsApproachAirportId(String gpsApproachAirportId) {
      this.gpsApproachAirportId = gpsApproachAirportId;
      return this;
    }

    public TelemetrySnapshot build() {
      return new TelemetrySnapshot(
          simRate,
          paused,
          aircraftTitle,
          latitude,
          longitude,
          altitude,
          altitudeAgl,
          groundSpeed,
          verticalSpeed,
          gForce,
          heading,
          pitch,
          bank,
          angleOfAttack,
          sideslip,
          headingMagnetic,
          lateralG,
          longitudinalG,
          onGround,
          enginesRunning,
          flapsPosition,
          gearDown,
          parkingBrake,
          lightBeacon,
          lightStrobe,
          lightLanding,
          lightTaxi,
          lightNav,
          lightLogo,
          lightWing,
          lightCabin,
          lightPanel,
          battery1,
          battery2,
          externalPower,
          avionicsMaster,
          apuMaster,
          apuRunning,
          apuPctRpm,
          engineMaster1,
          engineMaster2,
          engine1N1,
          engine1N2,
          engine2N1,
          engine2N2,
          throttle1,
          throttle2,
          spoilersArmed,
          spoilersPosition,
          autopilotMaster,
          autothrottleArmed,
          seatbeltSign,
          noSmokingSign,
          transponderState,
          antiIceEngine1,
          antiIceEngine2,
          antiIceStructural,
          pitotHeat,
          fuelPump1,
          fuelPump2,
          gpsIsActiveFlightPlan,
          gpsWpCount,
          gpsWpIndex,
          gpsWpDistance,
          gpsWpEte,
          gpsEte,
          gpsEta,
          atcId,
          atcAirline,
          atcFlightNumber,
          gpsWpNextId,
          gpsWpPrevId,
          gpsApproachAirportId);
    }
  }
}
