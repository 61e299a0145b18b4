/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.telescope.core.capture;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * CaptureEntry is the normalized record of one request/response lifecycle. It
 * is built once, after the response has been sent, and never changes
 * afterwards.
 *
 * <p>
 * Payload fields hold either a Jackson {@code JsonNode} (a decoded structure)
 * or a string (plain text or one of the {@link ExtractedPayload} placeholders).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"batch_id", "ip_address", "uri", "method", "controller_action", "middleware", "headers",
    "payload", "response_status", "response", "duration", "memory", "recorded_at", "trace_id"})
public final class CaptureEntry {

  private final String batchId;
  private final String ipAddress;
  private final String uri;
  private final String method;
  private final String controllerAction;
  private final List<String> middleware;
  private final Map<String, List<String>> headers;
  private final Object payload;
  private final int responseStatus;
  private final Object response;
  private final Long duration;
  private final double memory;
  private final Instant recordedAt;
  private final String traceId;

  private CaptureEntry(Builder builder) {
    if (builder.batchId == null || builder.batchId.isEmpty()) {
      throw new IllegalStateException("batchId is required");
    }
    this.batchId = builder.batchId;
    this.ipAddress = builder.ipAddress != null ? builder.ipAddress : "unknown";
    this.uri = builder.uri != null ? builder.uri : "";
    this.method = builder.method != null ? builder.method : "";
    this.controllerAction = builder.controllerAction != null ? builder.controllerAction : "";
    this.middleware = builder.middleware != null ? List.copyOf(builder.middleware) : List.of();
    this.headers = builder.headers != null ? Headers.copy(builder.headers) : Map.of();
    this.payload = builder.payload != null ? copyOf(builder.payload) : "";
    this.responseStatus = builder.responseStatus;
    this.response = builder.response != null ? copyOf(builder.response) : ExtractedPayload.EMPTY_RESPONSE;
    this.duration = builder.duration;
    this.memory = builder.memory;
    this.recordedAt = builder.recordedAt;
    this.traceId = builder.traceId;
  }

  public static Builder builder() {
    return new Builder();
  }

  // JsonNode trees are mutable; entries keep and hand out private copies
  private static Object copyOf(Object value) {
    return value instanceof JsonNode ? ((JsonNode) value).deepCopy() : value;
  }

  @JsonProperty("batch_id")
  public String getBatchId() {
    return batchId;
  }

  /**
   * Returns the client address: the trusted proxy header, else the peer address,
   * else {@code "unknown"}.
   *
   * @return the client address
   */
  @JsonProperty("ip_address")
  public String getIpAddress() {
    return ipAddress;
  }

  @JsonProperty("uri")
  public String getUri() {
    return uri;
  }

  @JsonProperty("method")
  public String getMethod() {
    return method;
  }

  /**
   * Returns the identifier of the route handler.
   *
   * @return the handler, or an empty string if unresolved
   */
  @JsonProperty("controller_action")
  public String getControllerAction() {
    return controllerAction;
  }

  @JsonProperty("middleware")
  public List<String> getMiddleware() {
    return middleware;
  }

  @JsonProperty("headers")
  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the redacted request payload. A structured payload is returned as
   * a fresh copy.
   *
   * @return a {@code JsonNode} or a string
   */
  @JsonProperty("payload")
  public Object getPayload() {
    return copyOf(payload);
  }

  @JsonProperty("response_status")
  public int getResponseStatus() {
    return responseStatus;
  }

  /**
   * Returns the redacted response payload. A structured payload is returned as
   * a fresh copy.
   *
   * @return a {@code JsonNode} or a string
   */
  @JsonProperty("response")
  public Object getResponse() {
    return copyOf(response);
  }

  /**
   * Returns how long the request took.
   *
   * @return the duration in milliseconds, or null if no start time was recorded
   */
  @JsonProperty("duration")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public Long getDuration() {
    return duration;
  }

  /**
   * Returns the peak memory of the process when the entry was built.
   *
   * @return megabytes, rounded to one decimal
   */
  @JsonProperty("memory")
  public double getMemory() {
    return memory;
  }

  @JsonProperty("recorded_at")
  public Instant getRecordedAt() {
    return recordedAt;
  }

  /**
   * Returns the OpenTelemetry trace that was active when the request completed.
   *
   * @return the trace id, or null if none
   */
  @JsonProperty("trace_id")
  public String getTraceId() {
    return traceId;
  }

  @Override
  public String toString() {
    return "CaptureEntry{batchId=" + batchId + ", method=" + method + ", uri=" + uri + ", status="
        + responseStatus + ", duration=" + duration + "}";
  }

  /**
   * Builder for CaptureEntry.
   */
  public static class Builder {
    private String batchId;
    private String ipAddress;
    private String uri;
    private String method;
    private String controllerAction;
    private List<String> middleware;
    private Map<String, List<String>> headers;
    private Object payload;
    private int responseStatus;
    private Object response;
    private Long duration;
    private double memory;
    private Instant recordedAt;
    private String traceId;

    public Builder batchId(String batchId) {
      this.batchId = batchId;
      return this;
    }

    public Builder ipAddress(String ipAddress) {
      this.ipAddress = ipAddress;
      return this;
    }

    public Builder uri(String uri) {
      this.uri = uri;
      return this;
    }

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder controllerAction(String controllerAction) {
      this.controllerAction = controllerAction;
      return this;
    }

    public Builder middleware(List<String> middleware) {
      this.middleware = middleware;
      return this;
    }

    public Builder headers(Map<String, List<String>> headers) {
      this.headers = headers;
      return this;
    }

    public Builder payload(Object payload) {
      this.payload = payload;
      return this;
    }

    public Builder responseStatus(int responseStatus) {
      this.responseStatus = responseStatus;
      return this;
    }

    public Builder response(Object response) {
      this.response = response;
      return this;
    }

    public Builder duration(Long duration) {
      this.duration = duration;
      return this;
    }

    public Builder memory(double memory) {
      this.memory = memory;
      return this;
    }

    public Builder recordedAt(Instant recordedAt) {
      this.recordedAt = recordedAt;
      return this;
    }

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    public CaptureEntry build() {
      return new CaptureEntry(this);
    }
  }
}
