package com.simbridge.bridge.hub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/** Viewer command: {@code {"type": ..., "data": ..., "token": ...}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundMessage(String type, JsonNode data, String token) {

  /** Text content of {@code data}, or null when absent or not a scalar. */
  public String dataText() {
    if (data == null || data.isNull() || data.isContainerNode()) {
      return null;
    }
    return data.asText();
  }

  @Override
  public String toString() {
    return "InboundMessage[type=" + type + "]";
  }
}
