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

package dev.telescope.core;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CaptureContext carries the request-scoped state of one capture: the batch id
 * that correlates the request across transports, the names of the middleware
 * that handled it, and payloads supplied out of band by transports whose body
 * is not a plain stream (gRPC).
 *
 * <p>
 * The batch id is fixed for the lifetime of the context. The middleware list
 * and the out-of-band payloads are written while the request is handled and
 * read by the deferred capture on another thread.
 */
public class CaptureContext {

  /** Attribute name under which transports store the context on a request. */
  public static final String ATTRIBUTE = CaptureContext.class.getName();

  private static final String GRPC_REQUEST_PAYLOAD = "grpc.request";
  private static final String GRPC_RESPONSE_PAYLOAD = "grpc.response";

  private final String batchId;
  private final String traceId;
  private final List<String> middleware;
  private final Map<String, Object> payloads;

  /**
   * Creates a new CaptureContext.
   *
   * @param batchId
   *            the correlation id, must not be empty
   */
  public CaptureContext(String batchId) {
    this(batchId, null);
  }

  /**
   * Creates a new CaptureContext linked to a trace.
   *
   * @param batchId
   *            the correlation id, must not be empty
   * @param traceId
   *            the OpenTelemetry trace id active when the request arrived, may
   *            be null
   */
  public CaptureContext(String batchId, String traceId) {
    if (batchId == null || batchId.isEmpty()) {
      throw new IllegalArgumentException("batchId is required");
    }
    this.batchId = batchId;
    this.traceId = traceId;
    this.middleware = new CopyOnWriteArrayList<>();
    this.payloads = new ConcurrentHashMap<>();
  }

  /**
   * Returns the batch id.
   *
   * @return the batch id, never empty
   */
  public String getBatchId() {
    return batchId;
  }

  /**
   * Returns the trace the request belongs to.
   *
   * @return the trace id, or null if the request was not traced
   */
  public String getTraceId() {
    return traceId;
  }

  /**
   * Records that a middleware handled this request.
   *
   * @param name
   *            the middleware name
   */
  public void addMiddleware(String name) {
    if (name != null && !name.isEmpty()) {
      middleware.add(name);
    }
  }

  /**
   * Returns the names of the middleware that handled this request, in the order
   * they were entered.
   *
   * @return an immutable snapshot of the middleware names
   */
  public List<String> getMiddleware() {
    return List.copyOf(middleware);
  }

  /**
   * Stores the request payload of a transport that does not expose a readable
   * body.
   *
   * @param payload
   *            the decoded request message, null clears it
   */
  public void setGrpcRequestPayload(Object payload) {
    put(GRPC_REQUEST_PAYLOAD, payload);
  }

  /**
   * Returns the out-of-band request payload.
   *
   * @return the payload, or null if none was stored
   */
  public Object getGrpcRequestPayload() {
    return payloads.get(GRPC_REQUEST_PAYLOAD);
  }

  /**
   * Stores the response payload of a transport that does not expose a readable
   * body.
   *
   * @param payload
   *            the decoded response message, null clears it
   */
  public void setGrpcResponsePayload(Object payload) {
    put(GRPC_RESPONSE_PAYLOAD, payload);
  }

  /**
   * Returns the out-of-band response payload.
   *
   * @return the payload, or null if none was stored
   */
  public Object getGrpcResponsePayload() {
    return payloads.get(GRPC_RESPONSE_PAYLOAD);
  }

  private void put(String key, Object payload) {
    if (payload == null) {
      payloads.remove(key);
    } else {
      payloads.put(key, payload);
    }
  }

  @Override
  public String toString() {
    return "CaptureContext{batchId=" + batchId + ", middleware=" + middleware + "}";
  }
}
