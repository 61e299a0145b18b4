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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for CaptureContext.
 */
class CaptureContextTest {

  @Test
  void testBatchIdIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> new CaptureContext(null));
    assertThrows(IllegalArgumentException.class, () -> new CaptureContext(""));
  }

  @Test
  void testMiddlewareNamesKeepOrder() {
    CaptureContext context = new CaptureContext("b-1");
    context.addMiddleware("Auth");
    context.addMiddleware(null);
    context.addMiddleware("");
    context.addMiddleware("RateLimit");

    assertEquals(List.of("Auth", "RateLimit"), context.getMiddleware());
  }

  @Test
  void testMiddlewareSnapshotIsImmutable() {
    CaptureContext context = new CaptureContext("b-1");
    List<String> snapshot = context.getMiddleware();
    context.addMiddleware("Auth");

    assertTrue(snapshot.isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add("x"));
  }

  @Test
  void testGrpcPayloads() {
    CaptureContext context = new CaptureContext("b-1", "trace-1");
    context.setGrpcRequestPayload(Map.of("id", 1));
    context.setGrpcResponsePayload("ok");

    assertEquals(Map.of("id", 1), context.getGrpcRequestPayload());
    assertEquals("ok", context.getGrpcResponsePayload());
    assertEquals("trace-1", context.getTraceId());

    context.setGrpcResponsePayload(null);
    assertNull(context.getGrpcResponsePayload());
  }
}
