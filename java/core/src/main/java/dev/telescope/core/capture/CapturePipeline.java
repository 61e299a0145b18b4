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

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.telescope.core.CaptureContext;
import dev.telescope.core.JsonUtils;
import dev.telescope.core.telemetry.CaptureTelemetry;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * CapturePipeline records request/response pairs.
 *
 * <p>
 * A transport calls {@link #begin(String, RpcContext)} when a request arrives,
 * echoes the returned batch id to the client, and calls
 * {@link #complete(CaptureContext, RequestFacts, ResponseFacts)} once the
 * response has been sent. The capture itself runs later on the pipeline's
 * executor: it evaluates the {@link CaptureDecision}, extracts and redacts the
 * payloads, builds the {@link CaptureEntry} and hands it to the
 * {@link RecorderSink} channel that matches the handler's transport. Nothing
 * that goes wrong during a capture reaches the request.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * CapturePipeline pipeline = CapturePipeline.builder().sink(new LoggingRecorderSink())
 *     .config(CaptureConfig.load()).build();
 *
 * CaptureContext context = pipeline.begin(request.getHeader("batch-id"), RpcContext.empty());
 * // ... handle the request, send the response with the batch-id header ...
 * pipeline.complete(context, requestFacts, responseFacts);
 * }</pre>
 */
public class CapturePipeline implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(CapturePipeline.class);

  /** Header that carries the batch id in and out. */
  public static final String BATCH_ID_HEADER = "batch-id";

  static final String CHANNEL_REQUEST = "request";
  static final String CHANNEL_SERVICE = "service";

  private final AtomicReference<CaptureConfig> config;
  private final RecorderSink sink;
  private final HandlerResolver handlerResolver;
  private final BatchIdResolver batchIdResolver;
  private final EntryBuilder entryBuilder;
  private final CaptureTelemetry telemetry;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  private CapturePipeline(Builder builder) {
    this.config = new AtomicReference<>(builder.config);
    this.sink = builder.sink;
    this.handlerResolver = builder.handlerResolver;
    this.batchIdResolver = builder.batchIdResolver;
    this.entryBuilder = new EntryBuilder(builder.probe);
    this.telemetry = builder.telemetry != null ? builder.telemetry : CaptureTelemetry.getInstance();
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = newCaptureExecutor(builder.captureThreads, builder.queueCapacity);
      this.executor = ownedExecutor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private static ExecutorService newCaptureExecutor(int threads, int queueCapacity) {
    AtomicInteger counter = new AtomicInteger();
    ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(queueCapacity), runnable -> {
          Thread thread = new Thread(runnable, "telescope-capture-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
    pool.allowCoreThreadTimeOut(true);
    return pool;
  }

  /**
   * Returns the config snapshot currently in use.
   *
   * @return the config
   */
  public CaptureConfig getConfig() {
    return config.get();
  }

  /**
   * Replaces the config. Captures already running keep the snapshot they
   * started with.
   *
   * @param newConfig
   *            the new config
   */
  public void updateConfig(CaptureConfig newConfig) {
    config.set(Objects.requireNonNull(newConfig, "config"));
    logger.info("Capture config updated: {}", newConfig);
  }

  /**
   * Starts a capture: establishes the batch id of the request and returns the
   * context that carries it. Must be called on the thread handling the request
   * so the active trace is picked up.
   *
   * @param inboundBatchId
   *            the inbound {@value #BATCH_ID_HEADER} header, may be null
   * @param rpcContext
   *            the RPC side channel, may be null
   * @return the request's capture context
   */
  public CaptureContext begin(String inboundBatchId, RpcContext rpcContext) {
    String batchId = batchIdResolver.resolve(inboundBatchId, rpcContext);
    SpanContext span = Span.current().getSpanContext();
    return new CaptureContext(batchId, span.isValid() ? span.getTraceId() : null);
  }

  /**
   * Schedules the capture of a finished request and returns without waiting for
   * it. If the executor cannot take the work the capture is dropped.
   *
   * @param context
   *            the context returned by {@link #begin(String, RpcContext)}
   * @param request
   *            the request facts
   * @param response
   *            the response facts
   */
  public void complete(CaptureContext context, RequestFacts request, ResponseFacts response) {
    complete(context, request, response, handlerResolver);
  }

  /**
   * Schedules the capture of a finished request, resolving its handler with a
   * transport-specific resolver instead of the pipeline's own.
   *
   * @param context
   *            the context returned by {@link #begin(String, RpcContext)}
   * @param request
   *            the request facts
   * @param response
   *            the response facts
   * @param resolver
   *            the handler resolver to use for this request
   */
  public void complete(CaptureContext context, RequestFacts request, ResponseFacts response,
      HandlerResolver resolver) {
    complete(context, () -> request, () -> response, resolver);
  }

  /**
   * Schedules the capture of a finished request whose facts are assembled on
   * the capture thread. Transports use this to keep body decoding off the
   * request thread. A supplier that throws is counted as a failed capture.
   *
   * @param context
   *            the context returned by {@link #begin(String, RpcContext)}
   * @param request
   *            supplies the request facts
   * @param response
   *            supplies the response facts
   * @param resolver
   *            the handler resolver to use for this request
   */
  public void complete(CaptureContext context, Supplier<RequestFacts> request, Supplier<ResponseFacts> response,
      HandlerResolver resolver) {
    try {
      executor.execute(() -> runCapture(context, request, response, resolver));
    } catch (RejectedExecutionException e) {
      logger.debug("Capture executor rejected batch {}, dropping capture", context.getBatchId());
      telemetry.recordCapture(null, CaptureTelemetry.Status.DROPPED);
    }
  }

  private void runCapture(CaptureContext context, Supplier<RequestFacts> request,
      Supplier<ResponseFacts> response, HandlerResolver resolver) {
    try {
      capture(context, request.get(), response.get(), resolver);
    } catch (RuntimeException e) {
      logger.warn("Failed to capture batch {}", context.getBatchId(), e);
      telemetry.recordCapture(null, CaptureTelemetry.Status.FAILED);
    }
  }

  /**
   * Runs a capture on the calling thread.
   *
   * @param context
   *            the request's capture context
   * @param request
   *            the request facts
   * @param response
   *            the response facts
   * @return the recorded entry, or empty if the request was not captured
   */
  public Optional<CaptureEntry> capture(CaptureContext context, RequestFacts request, ResponseFacts response) {
    return capture(context, request, response, handlerResolver);
  }

  /**
   * Runs a capture on the calling thread with a transport-specific handler
   * resolver.
   *
   * @param context
   *            the request's capture context
   * @param request
   *            the request facts
   * @param response
   *            the response facts
   * @param resolver
   *            the handler resolver to use for this request
   * @return the recorded entry, or empty if the request was not captured
   */
  public Optional<CaptureEntry> capture(CaptureContext context, RequestFacts request, ResponseFacts response,
      HandlerResolver resolver) {
    CaptureConfig snapshot = config.get();
    if (!CaptureDecision.shouldCapture(snapshot, request)) {
      logger.debug("Skipping capture of {} {}", request.getMethod(), request.getPath());
      telemetry.recordCapture(null, CaptureTelemetry.Status.SKIPPED);
      return Optional.empty();
    }

    HandlerDescriptor handler = resolver.resolve(request);
    if (handler == null) {
      handler = HandlerDescriptor.unresolved();
    }

    Object requestPayload = requestPayload(snapshot, context, request, handler);
    ExtractedPayload responsePayload = Redactor.redact(responsePayload(snapshot, context, response),
        snapshot.getHiddenResponseParameters());
    Map<String, List<String>> headers = Redactor.redactHeaders(request.getHeaders(),
        snapshot.getHiddenRequestHeaders());

    CaptureEntry entry = entryBuilder.build(context, request, response, handler, headers, requestPayload,
        responsePayload);

    String channel;
    if (handler.getKind().isService()) {
      sink.recordService(entry);
      channel = CHANNEL_SERVICE;
    } else {
      sink.recordRequest(entry);
      channel = CHANNEL_REQUEST;
    }
    telemetry.recordCapture(channel, CaptureTelemetry.Status.RECORDED);
    logger.debug("Captured {} on {} channel", entry, channel);
    return Optional.of(entry);
  }

  private static ExtractedPayload responsePayload(CaptureConfig snapshot, CaptureContext context,
      ResponseFacts response) {
    if (response.isBodyOverflow()) {
      return ExtractedPayload.purged();
    }
    return PayloadExtractor.extract(response.getBody(), response.getContentType(), snapshot.getSizeLimitKb(),
        context::getGrpcResponsePayload);
  }

  /**
   * Builds the stored request payload. gRPC requests use the out-of-band
   * payload; everything else merges the query parameters with the body fields,
   * the query parameters winning on a name clash.
   */
  private static Object requestPayload(CaptureConfig snapshot, CaptureContext context, RequestFacts request,
      HandlerDescriptor handler) {
    if (handler.getKind() == TransportKind.GRPC) {
      ExtractedPayload grpc = PayloadExtractor.fromOutOfBand(context.getGrpcRequestPayload());
      if (grpc.getKind() == ExtractedPayload.Kind.PURGED) {
        return "";
      }
      return Redactor.redact(grpc, snapshot.getHiddenRequestParameters()).toValue();
    }

    ObjectNode payload = JsonUtils.createObjectNode();
    request.getQueryParameters().forEach((name, values) -> payload.set(name, parameterValue(values)));
    if (request.getParsedBody() != null) {
      request.getParsedBody().forEach((name, value) -> {
        if (!payload.has(name)) {
          payload.set(name, JsonUtils.toJsonNode(value));
        }
      });
    } else if (!request.isBodyOverflow() && !request.getBody().isEmpty()
        && PayloadExtractor.withinLimit(request.getBody(), snapshot.getSizeLimitKb())) {
      mergeBody(payload, request);
    }
    return Redactor.redact(payload, snapshot.getHiddenRequestParameters());
  }

  private static void mergeBody(ObjectNode payload, RequestFacts request) {
    String contentType = request.getContentType() != null
        ? request.getContentType().toLowerCase(Locale.ROOT)
        : "";
    if (contentType.startsWith("application/x-www-form-urlencoded")) {
      ObjectNode form = JsonUtils.createObjectNode();
      for (String pair : request.getBody().split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int eq = pair.indexOf('=');
        String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
        String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
        if (!form.has(name)) {
          form.put(name, value);
        }
      }
      putAbsent(payload, form);
      return;
    }
    JsonNode body = JsonUtils.parseContainer(request.getBody());
    if (body == null) {
      return;
    }
    if (body.isObject()) {
      putAbsent(payload, (ObjectNode) body);
    } else {
      ArrayNode array = (ArrayNode) body;
      for (int i = 0; i < array.size(); i++) {
        if (!payload.has(String.valueOf(i))) {
          payload.set(String.valueOf(i), array.get(i));
        }
      }
    }
  }

  private static void putAbsent(ObjectNode target, ObjectNode source) {
    Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!target.has(field.getKey())) {
        target.set(field.getKey(), field.getValue());
      }
    }
  }

  private static JsonNode parameterValue(List<String> values) {
    if (values.size() == 1) {
      return JsonUtils.toJsonNode(values.get(0));
    }
    return JsonUtils.toJsonNode(values);
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return value;
    }
  }

  /**
   * Stops the pipeline's own executor. Captures that have not started yet are
   * dropped. An executor supplied through the builder is left running.
   */
  @Override
  public void close() {
    if (ownedExecutor != null) {
      List<Runnable> pending = ownedExecutor.shutdownNow();
      if (!pending.isEmpty()) {
        logger.info("Capture pipeline closed, dropped {} pending captures", pending.size());
      }
    }
  }

  /**
   * Builder for CapturePipeline.
   */
  public static class Builder {
    private CaptureConfig config = CaptureConfig.defaults();
    private RecorderSink sink;
    private HandlerResolver handlerResolver = HandlerResolver.unresolved();
    private BatchIdResolver batchIdResolver = new BatchIdResolver();
    private SystemProbe probe = SystemProbe.jvm();
    private CaptureTelemetry telemetry;
    private Executor executor;
    private int captureThreads = 2;
    private int queueCapacity = 1024;

    public Builder config(CaptureConfig config) {
      this.config = config;
      return this;
    }

    public Builder sink(RecorderSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder handlerResolver(HandlerResolver handlerResolver) {
      this.handlerResolver = handlerResolver;
      return this;
    }

    public Builder batchIdResolver(BatchIdResolver batchIdResolver) {
      this.batchIdResolver = batchIdResolver;
      return this;
    }

    public Builder probe(SystemProbe probe) {
      this.probe = probe;
      return this;
    }

    public Builder telemetry(CaptureTelemetry telemetry) {
      this.telemetry = telemetry;
      return this;
    }

    /**
     * Sets the executor that runs deferred captures. When unset the pipeline
     * creates and owns a small pool of daemon threads.
     *
     * @param executor
     *            the executor
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder captureThreads(int captureThreads) {
      if (captureThreads < 1) {
        throw new IllegalArgumentException("captureThreads must be at least 1");
      }
      this.captureThreads = captureThreads;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      if (queueCapacity < 1) {
        throw new IllegalArgumentException("queueCapacity must be at least 1");
      }
      this.queueCapacity = queueCapacity;
      return this;
    }

    public CapturePipeline build() {
      if (sink == null) {
        throw new IllegalStateException("sink is required");
      }
      Objects.requireNonNull(config, "config");
      Objects.requireNonNull(handlerResolver, "handlerResolver");
      Objects.requireNonNull(batchIdResolver, "batchIdResolver");
      Objects.requireNonNull(probe, "probe");
      return new CapturePipeline(this);
    }
  }
}
