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

package dev.telescope.plugins.jetty;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.Callback;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import dev.telescope.core.CaptureContext;
import dev.telescope.core.capture.CaptureConfig;
import dev.telescope.core.capture.CaptureEntry;
import dev.telescope.core.capture.CapturePipeline;
import dev.telescope.core.capture.ExtractedPayload;
import dev.telescope.core.capture.HandlerDescriptor;
import dev.telescope.core.capture.RecorderSink;
import dev.telescope.core.capture.Redactor;
import dev.telescope.core.capture.TransportKind;

/**
 * Tests for TelescopeHandler.
 */
class TelescopeHandlerTest {

  private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
  private final QueueSink sink = new QueueSink();
  private Server server;
  private CapturePipeline pipeline;
  private int port;

  @AfterEach
  void tearDown() throws Exception {
    if (server != null) {
      server.stop();
    }
    if (pipeline != null) {
      pipeline.close();
    }
  }

  private void start(CaptureConfig config, Handler app, TelescopeHandlerOptions options) throws Exception {
    pipeline = CapturePipeline.builder().config(config).sink(sink).build();
    server = new Server();
    ServerConnector connector = new ServerConnector(server);
    connector.setPort(0);
    server.addConnector(connector);
    server.setHandler(new TelescopeHandler(pipeline, app, options));
    server.start();
    port = connector.getLocalPort();
  }

  private void start(CaptureConfig config, Handler app) throws Exception {
    start(config, app, TelescopeHandlerOptions.builder().build());
  }

  private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
    return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpRequest.Builder request(String pathQuery) {
    return HttpRequest.newBuilder(URI.create("http://localhost:" + port + pathQuery));
  }

  @Test
  void testCapturesJsonExchange() throws Exception {
    start(CaptureConfig.builder().hideResponseParameter("data.token").build(),
        new Reply("application/json", "{\"data\":{\"token\":\"t-1\",\"user\":\"ada\"}}"));

    HttpResponse<String> response = send(request("/login?next=home").header("Content-Type", "application/json")
        .header("Authorization", "Bearer secret")
        .POST(HttpRequest.BodyPublishers.ofString("{\"email\":\"ada@example.com\",\"password\":\"hunter2\"}")));

    assertEquals(200, response.statusCode());
    assertTrue(response.body().contains("t-1"));
    String batchId = response.headers().firstValue("batch-id").orElseThrow();

    Recorded recorded = sink.next();
    assertEquals("request", recorded.channel);
    CaptureEntry entry = recorded.entry;
    assertEquals(batchId, entry.getBatchId());
    assertEquals("POST", entry.getMethod());
    assertEquals("/login?next=home", entry.getUri());
    assertEquals(Reply.class.getName(), entry.getControllerAction());
    assertEquals(200, entry.getResponseStatus());
    assertNotEquals("unknown", entry.getIpAddress());
    assertNotNull(entry.getDuration());

    JsonNode payload = (JsonNode) entry.getPayload();
    assertEquals("home", payload.get("next").asText());
    assertEquals("ada@example.com", payload.get("email").asText());
    assertEquals(Redactor.MASK, payload.get("password").asText());

    JsonNode body = (JsonNode) entry.getResponse();
    assertEquals(Redactor.MASK, body.get("data").get("token").asText());
    assertEquals("ada", body.get("data").get("user").asText());
    assertEquals(List.of(Redactor.MASK), entry.getHeaders().get("authorization"));
  }

  @Test
  void testInboundBatchIdIsEchoed() throws Exception {
    start(CaptureConfig.defaults(), new Reply("text/plain", "pong"));

    HttpResponse<String> response = send(request("/ping").header("batch-id", "upstream-42").GET());

    assertEquals("upstream-42", response.headers().firstValue("batch-id").orElseThrow());
    CaptureEntry entry = sink.next().entry;
    assertEquals("upstream-42", entry.getBatchId());
    assertEquals("pong", entry.getResponse());
  }

  @Test
  void testHtmlResponseIsSummarized() throws Exception {
    start(CaptureConfig.defaults(), new Reply("text/html", "<html><body>Welcome</body></html>"));

    send(request("/").GET());

    assertEquals(ExtractedPayload.HTML_RESPONSE, sink.next().entry.getResponse());
  }

  @Test
  void testOversizedResponseIsPurged() throws Exception {
    start(CaptureConfig.builder().sizeLimitKb(1).build(), new Reply("application/json",
        "{\"blob\":\"" + "x".repeat(5_000) + "\"}"));

    HttpResponse<String> response = send(request("/export").GET());

    assertTrue(response.body().length() > 5_000);
    assertEquals(ExtractedPayload.PURGED, sink.next().entry.getResponse());
  }

  @Test
  void testDisabledCaptureIsPassthrough() throws Exception {
    start(CaptureConfig.builder().disable(CaptureConfig.KIND_REQUEST).build(), new Reply("text/plain", "ok"));

    HttpResponse<String> response = send(request("/orders").GET());

    assertEquals("ok", response.body());
    assertTrue(response.headers().firstValue("batch-id").isEmpty());
    assertTrue(sink.isQuiet());
  }

  @Test
  void testIgnoredPathStillGetsBatchId() throws Exception {
    start(CaptureConfig.builder().ignorePath("health*").build(), new Reply("text/plain", "up"));

    HttpResponse<String> response = send(request("/health/live").GET());

    assertTrue(response.headers().firstValue("batch-id").isPresent());
    assertTrue(sink.isQuiet());
  }

  @Test
  void testGrpcPayloadsComeFromContext() throws Exception {
    Handler app = new Handler.Abstract() {
      @Override
      public boolean handle(Request request, Response response, Callback callback) throws Exception {
        Content.Source.asString(request);
        CaptureContext context = TelescopeHandler.captureContext(request);
        context.setGrpcRequestPayload(Map.of("orderId", "o-1"));
        context.setGrpcResponsePayload(Map.of("status", "CREATED"));
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, "application/grpc");
        Content.Sink.write(response, true, "\u0000\u0000\u0000\u0000\u0002ok", callback);
        return true;
      }
    };
    start(CaptureConfig.defaults(), app);

    send(request("/orders.OrderService/Create").header("Content-Type", "application/grpc")
        .POST(HttpRequest.BodyPublishers.ofString("\u0000\u0000\u0000\u0000\u0003abc")));

    Recorded recorded = sink.next();
    assertEquals("service", recorded.channel);
    assertEquals("o-1", ((JsonNode) recorded.entry.getPayload()).get("orderId").asText());
    assertEquals("CREATED", ((JsonNode) recorded.entry.getResponse()).get("status").asText());
  }

  @Test
  void testCustomHandlerResolver() throws Exception {
    TelescopeHandlerOptions options = TelescopeHandlerOptions.builder().serverName("public")
        .handlerResolver(request -> new HandlerDescriptor("OrderController@" + request.getMethod().toLowerCase(Locale.ROOT),
            "public", TransportKind.HTTP))
        .build();
    start(CaptureConfig.defaults(), new Reply("application/json", "[]"), options);

    send(request("/orders").GET());

    assertEquals("OrderController@get", sink.next().entry.getControllerAction());
  }

  @Test
  void testCaptureContextIsAbsentWhenDisabled() throws Exception {
    AtomicReference<CaptureContext> seen = new AtomicReference<>(new CaptureContext("placeholder"));
    Handler app = new Handler.Abstract() {
      @Override
      public boolean handle(Request request, Response response, Callback callback) throws Exception {
        seen.set(TelescopeHandler.captureContext(request));
        Content.Sink.write(response, true, "ok", callback);
        return true;
      }
    };
    start(CaptureConfig.builder().disable(CaptureConfig.KIND_REQUEST).build(), app);

    send(request("/orders").GET());

    assertNull(seen.get());
  }

  @Test
  void testDeclinedRequestIsAnsweredAndCaptured() throws Exception {
    Handler app = new Handler.Abstract() {
      @Override
      public boolean handle(Request request, Response response, Callback callback) {
        return false;
      }
    };
    start(CaptureConfig.defaults(), app);

    HttpResponse<String> response = send(request("/missing").GET());

    assertEquals(404, response.statusCode());
    String batchId = response.headers().firstValue("batch-id").orElseThrow();
    CaptureEntry entry = sink.next().entry;
    assertEquals(batchId, entry.getBatchId());
    assertEquals(404, entry.getResponseStatus());
    assertEquals("/missing", entry.getUri());
  }

  @Test
  void testResponseBodyIsDecodedWithDeclaredCharset() throws Exception {
    Handler app = new Handler.Abstract() {
      @Override
      public boolean handle(Request request, Response response, Callback callback) {
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, "text/plain; charset=ISO-8859-1");
        response.write(true, ByteBuffer.wrap("café".getBytes(StandardCharsets.ISO_8859_1)), callback);
        return true;
      }
    };
    start(CaptureConfig.defaults(), app);

    send(request("/menu").GET());

    assertEquals("café", sink.next().entry.getResponse());
  }

  @Test
  void testCharsetOf() {
    assertEquals(StandardCharsets.ISO_8859_1, TelescopeHandler.charsetOf("text/plain; charset=iso-8859-1"));
    assertEquals(StandardCharsets.UTF_8, TelescopeHandler.charsetOf("application/json"));
    assertEquals(StandardCharsets.UTF_8, TelescopeHandler.charsetOf("text/plain; charset=no-such-charset"));
    assertEquals(StandardCharsets.UTF_8, TelescopeHandler.charsetOf(null));
  }

  private static final class Reply extends Handler.Abstract {
    private final String contentType;
    private final String body;

    Reply(String contentType, String body) {
      this.contentType = contentType;
      this.body = body;
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
      Content.Source.asString(request);
      response.setStatus(200);
      response.getHeaders().put(HttpHeader.CONTENT_TYPE, contentType);
      Content.Sink.write(response, true, body, callback);
      return true;
    }
  }

  private static final class Recorded {
    final String channel;
    final CaptureEntry entry;

    Recorded(String channel, CaptureEntry entry) {
      this.channel = channel;
      this.entry = entry;
    }
  }

  private static final class QueueSink implements RecorderSink {
    private final BlockingQueue<Recorded> recorded = new LinkedBlockingQueue<>();

    @Override
    public void recordRequest(CaptureEntry entry) {
      recorded.add(new Recorded("request", entry));
    }

    @Override
    public void recordService(CaptureEntry entry) {
      recorded.add(new Recorded("service", entry));
    }

    Recorded next() throws InterruptedException {
      Recorded next = recorded.poll(5, TimeUnit.SECONDS);
      assertNotNull(next, "no capture was recorded");
      return next;
    }

    boolean isQuiet() throws InterruptedException {
      return recorded.poll(300, TimeUnit.MILLISECONDS) == null;
    }
  }
}
