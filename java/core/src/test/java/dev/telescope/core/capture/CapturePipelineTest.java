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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;

import dev.telescope.core.CaptureContext;
import dev.telescope.core.telemetry.CaptureTelemetry;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Scope;

/**
 * Tests for CapturePipeline.
 */
class CapturePipelineTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

  private RecorderSink sink;
  private HandlerResolver resolver;
  private SystemProbe probe;
  private CaptureTelemetry telemetry;

  @BeforeEach
  void setUp() {
    sink = mock(RecorderSink.class);
    resolver = mock(HandlerResolver.class);
    when(resolver.resolve(any())).thenReturn(new HandlerDescriptor("AuthController@login", "http",
        TransportKind.HTTP));
    probe = mock(SystemProbe.class);
    when(probe.now()).thenReturn(NOW);
    telemetry = mock(CaptureTelemetry.class);
  }

  private CapturePipeline pipeline(CaptureConfig config) {
    return CapturePipeline.builder().config(config).sink(sink).handlerResolver(resolver)
        .batchIdResolver(new BatchIdResolver(() -> "generated")).probe(probe).telemetry(telemetry)
        .executor(Runnable::run).build();
  }

  private static ResponseFacts jsonResponse(String body) {
    return ResponseFacts.builder().status(200).header("Content-Type", "application/json").body(body).build();
  }

  @Test
  void testCapturesLoginWithRedaction() {
    CapturePipeline pipeline = pipeline(CaptureConfig.builder().hideResponseParameter("data.token").build());
    CaptureContext context = pipeline.begin(null, RpcContext.empty());
    RequestFacts request = RequestFacts.builder().method("POST").uri("/login?next=/home")
        .queryParameter("next", "/home").header("Content-Type", "application/json")
        .header("Authorization", "Bearer abc").header("X-Real-IP", "203.0.113.9")
        .body("{\"email\":\"ada@example.com\",\"password\":\"hunter2\"}").build();

    pipeline.complete(context, request, jsonResponse("{\"data\":{\"token\":\"t-1\",\"expires\":3600}}"));

    ArgumentCaptor<CaptureEntry> captor = ArgumentCaptor.forClass(CaptureEntry.class);
    verify(sink).recordRequest(captor.capture());
    verify(sink, never()).recordService(any());
    CaptureEntry entry = captor.getValue();
    assertEquals("generated", entry.getBatchId());
    assertEquals("203.0.113.9", entry.getIpAddress());
    assertEquals("AuthController@login", entry.getControllerAction());

    JsonNode payload = (JsonNode) entry.getPayload();
    assertEquals("/home", payload.get("next").asText());
    assertEquals("ada@example.com", payload.get("email").asText());
    assertEquals(Redactor.MASK, payload.get("password").asText());

    JsonNode response = (JsonNode) entry.getResponse();
    assertEquals(Redactor.MASK, response.get("data").get("token").asText());
    assertEquals(3600, response.get("data").get("expires").asInt());

    assertEquals(List.of(Redactor.MASK), entry.getHeaders().get("authorization"));
    assertEquals(NOW, entry.getRecordedAt());
    verify(telemetry).recordCapture("request", CaptureTelemetry.Status.RECORDED);
  }

  @Test
  void testDisabledConfigDoesNothing() {
    CapturePipeline pipeline = pipeline(CaptureConfig.builder().disable(CaptureConfig.KIND_REQUEST).build());
    CaptureContext context = new CaptureContext("b-1");

    Optional<CaptureEntry> entry = pipeline.capture(context, RequestFacts.builder().uri("/orders").build(),
        jsonResponse("{}"));

    assertTrue(entry.isEmpty());
    verifyNoInteractions(sink, resolver, probe);
    verify(telemetry).recordCapture(null, CaptureTelemetry.Status.SKIPPED);
  }

  @Test
  void testIgnoredPathSkipsResolution() {
    CapturePipeline pipeline = pipeline(CaptureConfig.builder().ignorePath("health*").build());

    Optional<CaptureEntry> entry = pipeline.capture(new CaptureContext("b-1"),
        RequestFacts.builder().uri("/health/live").build(), jsonResponse("{}"));

    assertTrue(entry.isEmpty());
    verifyNoInteractions(sink, resolver);
  }

  @Test
  void testGrpcGoesToServiceChannel() {
    when(resolver.resolve(any())).thenReturn(new HandlerDescriptor("OrderService/Create", "grpc",
        TransportKind.GRPC));
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    CaptureContext context = new CaptureContext("b-grpc");
    context.setGrpcRequestPayload(Map.of("orderId", "o-1", "password", "secret"));
    context.setGrpcResponsePayload(Map.of("status", "CREATED"));
    ResponseFacts response = ResponseFacts.builder().header("content-type", "application/grpc")
        .body("\u0000\u0000\u0000\u0000\u0007binary").build();

    CaptureEntry entry = pipeline.capture(context, RequestFacts.builder().method("POST")
        .uri("/orders.OrderService/Create").build(), response).orElseThrow();

    verify(sink).recordService(entry);
    verify(sink, never()).recordRequest(any());
    JsonNode payload = (JsonNode) entry.getPayload();
    assertEquals("o-1", payload.get("orderId").asText());
    assertEquals(Redactor.MASK, payload.get("password").asText());
    assertEquals("CREATED", ((JsonNode) entry.getResponse()).get("status").asText());
    verify(telemetry).recordCapture("service", CaptureTelemetry.Status.RECORDED);
  }

  @Test
  void testGrpcWithoutPayloadsIsPurged() {
    when(resolver.resolve(any())).thenReturn(new HandlerDescriptor("Svc/Call", "grpc", TransportKind.GRPC));
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    ResponseFacts response = ResponseFacts.builder().header("content-type", "application/grpc").body("\u0001")
        .build();

    CaptureEntry entry = pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(), response)
        .orElseThrow();

    assertEquals("", entry.getPayload());
    assertEquals(ExtractedPayload.PURGED, entry.getResponse());
  }

  @Test
  void testJsonRpcGoesToServiceChannel() {
    when(resolver.resolve(any())).thenReturn(new HandlerDescriptor("CalculatorService::add", "jsonrpc",
        TransportKind.JSON_RPC));
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(), jsonResponse("{\"result\":3}"));

    verify(sink).recordService(any());
  }

  @Test
  void testQueryParametersWinOverBody() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    RequestFacts request = RequestFacts.builder().uri("/search?q=query&tag=a&tag=b").queryParameter("q", "query")
        .queryParameter("tag", "a").queryParameter("tag", "b").header("content-type", "application/json")
        .body("{\"q\":\"body\",\"page\":2}").build();

    JsonNode payload = (JsonNode) pipeline.capture(new CaptureContext("b-1"), request, jsonResponse("[]"))
        .orElseThrow().getPayload();

    assertEquals("query", payload.get("q").asText());
    assertEquals(2, payload.get("page").asInt());
    assertTrue(payload.get("tag").isArray());
    assertEquals("b", payload.get("tag").get(1).asText());
  }

  @Test
  void testFormBodyIsDecoded() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    RequestFacts request = RequestFacts.builder().method("POST").uri("/register")
        .header("content-type", "application/x-www-form-urlencoded; charset=UTF-8")
        .body("name=Ada+Lovelace&password=pw&password_confirmation=pw&note=a%26b").build();

    JsonNode payload = (JsonNode) pipeline.capture(new CaptureContext("b-1"), request, jsonResponse("{}"))
        .orElseThrow().getPayload();

    assertEquals("Ada Lovelace", payload.get("name").asText());
    assertEquals("a&b", payload.get("note").asText());
    assertEquals(Redactor.MASK, payload.get("password").asText());
    assertEquals(Redactor.MASK, payload.get("password_confirmation").asText());
  }

  @Test
  void testParsedBodyIsPreferredOverRawBody() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    RequestFacts request = RequestFacts.builder().parsedBody(Map.of("parsed", true))
        .header("content-type", "application/json").body("{\"raw\":true}").build();

    JsonNode payload = (JsonNode) pipeline.capture(new CaptureContext("b-1"), request, jsonResponse("{}"))
        .orElseThrow().getPayload();

    assertTrue(payload.get("parsed").asBoolean());
    assertFalse(payload.has("raw"));
  }

  @Test
  void testOverflowingResponseIsPurged() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    ResponseFacts response = ResponseFacts.builder().header("content-type", "application/json").body("{\"a\":")
        .bodyOverflow(true).build();

    CaptureEntry entry = pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(), response)
        .orElseThrow();

    assertEquals(ExtractedPayload.PURGED, entry.getResponse());
  }

  @Test
  void testEmptyResponse() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    CaptureEntry entry = pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(),
        ResponseFacts.builder().status(204).build()).orElseThrow();

    assertEquals(ExtractedPayload.EMPTY_RESPONSE, entry.getResponse());
    assertEquals(204, entry.getResponseStatus());
  }

  @Test
  void testUnresolvedHandler() {
    when(resolver.resolve(any())).thenReturn(null);
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    CaptureEntry entry = pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(),
        jsonResponse("{}")).orElseThrow();

    assertEquals("", entry.getControllerAction());
    verify(sink).recordRequest(entry);
  }

  @Test
  void testTransportResolverOverridesPipelineResolver() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    HandlerResolver transport = request -> new HandlerDescriptor("Svc/Call", "grpc", TransportKind.GRPC);

    pipeline.complete(new CaptureContext("b-1"), RequestFacts.builder().build(), jsonResponse("{}"), transport);

    verify(sink).recordService(any());
    verifyNoInteractions(resolver);
  }

  @Test
  void testSinkFailureIsAbsorbed() {
    doThrow(new IllegalStateException("store down")).when(sink).recordRequest(any());
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    assertDoesNotThrow(() -> pipeline.complete(new CaptureContext("b-1"), RequestFacts.builder().build(),
        jsonResponse("{}")));

    verify(telemetry).recordCapture(null, CaptureTelemetry.Status.FAILED);
    verify(telemetry, never()).recordCapture("request", CaptureTelemetry.Status.RECORDED);
  }

  @Test
  void testRejectedCaptureIsDropped() {
    CapturePipeline pipeline = CapturePipeline.builder().sink(sink).telemetry(telemetry).executor(runnable -> {
      throw new RejectedExecutionException("queue full");
    }).build();

    assertDoesNotThrow(() -> pipeline.complete(new CaptureContext("b-1"), RequestFacts.builder().build(),
        jsonResponse("{}")));

    verifyNoInteractions(sink);
    verify(telemetry).recordCapture(null, CaptureTelemetry.Status.DROPPED);
  }

  @Test
  void testDeferredFactsAreBuiltOnTheCaptureExecutor() {
    List<Runnable> queued = new ArrayList<>();
    AtomicInteger built = new AtomicInteger();
    CapturePipeline pipeline = CapturePipeline.builder().sink(sink).handlerResolver(resolver).probe(probe)
        .telemetry(telemetry).executor(queued::add).build();

    pipeline.complete(new CaptureContext("b-1"), () -> {
      built.incrementAndGet();
      return RequestFacts.builder().method("GET").uri("/users").path("users").build();
    }, () -> {
      built.incrementAndGet();
      return jsonResponse("{\"ok\":true}");
    }, resolver);

    assertEquals(0, built.get());
    verifyNoInteractions(sink);

    queued.forEach(Runnable::run);

    assertEquals(2, built.get());
    ArgumentCaptor<CaptureEntry> entry = ArgumentCaptor.forClass(CaptureEntry.class);
    verify(sink).recordRequest(entry.capture());
    assertEquals("b-1", entry.getValue().getBatchId());
    assertEquals("/users", entry.getValue().getUri());
  }

  @Test
  void testFailingFactsSupplierCountsAsFailedCapture() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    assertDoesNotThrow(() -> pipeline.complete(new CaptureContext("b-1"), () -> {
      throw new IllegalStateException("body gone");
    }, () -> jsonResponse("{}"), resolver));

    verifyNoInteractions(sink);
    verify(telemetry).recordCapture(null, CaptureTelemetry.Status.FAILED);
  }

  @Test
  void testBeginHonorsInboundBatchId() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());

    assertEquals("inbound", pipeline.begin("inbound", RpcContext.empty()).getBatchId());
    assertEquals("carried", pipeline.begin(null, RpcContext.of(Map.of(RpcContext.CARRIER_KEY,
        Map.of(RpcContext.BATCH_ID_KEY, "carried")))).getBatchId());
    assertNull(pipeline.begin(null, RpcContext.empty()).getTraceId());
  }

  @Test
  void testBeginLinksCurrentTrace() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    SpanContext spanContext = SpanContext.create("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7",
        TraceFlags.getSampled(), TraceState.getDefault());

    CaptureContext context;
    try (Scope scope = Span.wrap(spanContext).makeCurrent()) {
      context = pipeline.begin(null, RpcContext.empty());
    }

    assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", context.getTraceId());
  }

  @Test
  void testUpdateConfig() {
    CapturePipeline pipeline = pipeline(CaptureConfig.defaults());
    pipeline.updateConfig(CaptureConfig.builder().disable(CaptureConfig.KIND_REQUEST).build());

    assertFalse(pipeline.getConfig().isEnabled(CaptureConfig.KIND_REQUEST));
    assertTrue(pipeline.capture(new CaptureContext("b-1"), RequestFacts.builder().build(), jsonResponse("{}"))
        .isEmpty());
  }

  @Test
  void testSinkIsRequired() {
    assertThrows(IllegalStateException.class, () -> CapturePipeline.builder().build());
  }

  @Test
  void testDefaultExecutorRunsCaptureOffThread() throws InterruptedException {
    CountDownLatch recorded = new CountDownLatch(1);
    String[] thread = new String[1];
    RecorderSink latchSink = new RecorderSink() {
      @Override
      public void recordRequest(CaptureEntry entry) {
        thread[0] = Thread.currentThread().getName();
        recorded.countDown();
      }

      @Override
      public void recordService(CaptureEntry entry) {
      }
    };

    try (CapturePipeline pipeline = CapturePipeline.builder().sink(latchSink).telemetry(telemetry).build()) {
      pipeline.complete(new CaptureContext("b-1"), RequestFacts.builder().build(), jsonResponse("{}"));

      assertTrue(recorded.await(5, TimeUnit.SECONDS));
      assertTrue(thread[0].startsWith("telescope-capture-"));
    }
  }
}
