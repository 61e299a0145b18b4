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

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import dev.telescope.core.CaptureContext;

/**
 * EntryBuilder assembles a {@link CaptureEntry} from the facts of a request and
 * its response. Missing facts degrade to empty values; building never fails on
 * their account.
 */
public class EntryBuilder {

  /** Header set by a trusted reverse proxy to the original client address. */
  public static final String REAL_IP_HEADER = "x-real-ip";

  private final SystemProbe probe;

  public EntryBuilder(SystemProbe probe) {
    this.probe = probe;
  }

  /**
   * Builds an entry.
   *
   * @param context
   *            the request's capture context (batch id, middleware, trace)
   * @param request
   *            the request facts
   * @param response
   *            the response facts
   * @param handler
   *            the resolved handler
   * @param headers
   *            the request headers to store, already redacted
   * @param requestPayload
   *            the request payload to store, already redacted
   * @param responsePayload
   *            the extracted and redacted response payload
   * @return the entry
   */
  public CaptureEntry build(CaptureContext context, RequestFacts request, ResponseFacts response,
      HandlerDescriptor handler, Map<String, List<String>> headers, Object requestPayload,
      ExtractedPayload responsePayload) {
    return CaptureEntry.builder().batchId(context.getBatchId()).ipAddress(ipAddress(request))
        .uri(request.getUri()).method(request.getMethod()).controllerAction(handler.getHandler())
        .middleware(context.getMiddleware()).headers(headers).payload(requestPayload)
        .responseStatus(response.getStatus()).response(responsePayload.toValue())
        .duration(durationMillis(request.getStartNanos())).memory(peakMemoryMegabytes())
        .recordedAt(probe.now()).traceId(context.getTraceId()).build();
  }

  static String ipAddress(RequestFacts request) {
    String realIp = request.getHeader(REAL_IP_HEADER);
    if (realIp != null && !realIp.isEmpty()) {
      return realIp;
    }
    String remote = request.getRemoteAddress();
    return remote != null && !remote.isEmpty() ? remote : "unknown";
  }

  Long durationMillis(Long startNanos) {
    if (startNanos == null) {
      return null;
    }
    long elapsed = probe.nanoTime() - startNanos;
    return elapsed > 0 ? TimeUnit.NANOSECONDS.toMillis(elapsed) : 0L;
  }

  double peakMemoryMegabytes() {
    double megabytes = probe.peakMemoryBytes() / 1024.0 / 1024.0;
    return Math.round(megabytes * 10) / 10.0;
  }
}
