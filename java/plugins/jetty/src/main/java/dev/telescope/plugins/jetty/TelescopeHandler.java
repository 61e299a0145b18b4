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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Supplier;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.telescope.core.CaptureContext;
import dev.telescope.core.capture.CaptureConfig;
import dev.telescope.core.capture.CapturePipeline;
import dev.telescope.core.capture.HandlerDescriptor;
import dev.telescope.core.capture.HandlerResolver;
import dev.telescope.core.capture.RequestFacts;
import dev.telescope.core.capture.ResponseFacts;
import dev.telescope.core.capture.TransportKind;

/**
 * TelescopeHandler captures the requests served by the Jetty handler it wraps.
 *
 * <p>
 * For each request it establishes the batch id (from the {@code batch-id}
 * header, else from the {@link dev.telescope.core.capture.RpcContext#CARRIER_KEY}
 * request attribute, else a new one), echoes it on the response, and records
 * the body bytes the application reads and writes. When the response completes
 * successfully the capture is handed to the {@link CapturePipeline}, which
 * decodes the bodies and runs it off the request thread. A request that the
 * wrapped handler declines is answered with 404 and captured like any other.
 *
 * <p>
 * Downstream handlers find the {@link CaptureContext} under the
 * {@link CaptureContext#ATTRIBUTE} request attribute, e.g. to supply gRPC
 * payloads.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * CapturePipeline pipeline = CapturePipeline.builder().sink(new LoggingRecorderSink()).build();
 *
 * Server server = new Server(8080);
 * server.setHandler(new TelescopeHandler(pipeline, appHandler));
 * server.start();
 * }</pre>
 */
public class TelescopeHandler extends Handler.Wrapper {

  private static final Logger logger = LoggerFactory.getLogger(TelescopeHandler.class);

  private final CapturePipeline pipeline;
  private final TelescopeHandlerOptions options;
  private final HandlerResolver handlerResolver;

  /**
   * Creates a TelescopeHandler with default options.
   *
   * @param pipeline
   *            the capture pipeline
   * @param handler
   *            the handler to observe
   */
  public TelescopeHandler(CapturePipeline pipeline, Handler handler) {
    this(pipeline, handler, TelescopeHandlerOptions.builder().build());
  }

  /**
   * Creates a TelescopeHandler with the specified options.
   *
   * @param pipeline
   *            the capture pipeline
   * @param handler
   *            the handler to observe
   * @param options
   *            the handler options
   */
  public TelescopeHandler(CapturePipeline pipeline, Handler handler, TelescopeHandlerOptions options) {
    super(handler);
    this.pipeline = pipeline;
    this.options = options;
    this.handlerResolver = options.getHandlerResolver() != null
        ? options.getHandlerResolver()
        : this::resolveByContentType;
  }

  /**
   * Returns the capture context of a request handled inside a
   * TelescopeHandler.
   *
   * @param request
   *            the request
   * @return the context, or null if the request is not being captured
   */
  public static CaptureContext captureContext(Request request) {
    Object context = request.getAttribute(CaptureContext.ATTRIBUTE);
    return context instanceof CaptureContext ? (CaptureContext) context : null;
  }

  @Override
  public boolean handle(Request request, Response response, Callback callback) throws Exception {
    CaptureConfig config = pipeline.getConfig();
    if (!config.isEnabled(CaptureConfig.KIND_REQUEST)) {
      return super.handle(request, response, callback);
    }

    long startNanos = System.nanoTime();
    CaptureContext context = pipeline.begin(request.getHeaders().get(CapturePipeline.BATCH_ID_HEADER),
        request::getAttribute);
    request.setAttribute(CaptureContext.ATTRIBUTE, context);
    response.getHeaders().put(CapturePipeline.BATCH_ID_HEADER, context.getBatchId());

    int maxBytes = maxCapturedBytes(config.getSizeLimitKb());
    BodyRecorder requestBody = new BodyRecorder(maxBytes);
    BodyRecorder responseBody = new BodyRecorder(maxBytes);
    CapturingRequest capturingRequest = new CapturingRequest(request, requestBody);
    CapturingResponse capturingResponse = new CapturingResponse(capturingRequest, response, responseBody);

    Callback completion = new Callback() {
      @Override
      public void succeeded() {
        Supplier<RequestFacts> requestFacts = null;
        Supplier<ResponseFacts> responseFacts = null;
        try {
          requestFacts = requestFacts(request, requestBody, startNanos);
          responseFacts = responseFacts(response, responseBody);
        } catch (RuntimeException e) {
          logger.warn("Could not read facts for batch {}", context.getBatchId(), e);
        }
        callback.succeeded();
        if (requestFacts != null && responseFacts != null) {
          pipeline.complete(context, requestFacts, responseFacts, handlerResolver);
        }
      }

      @Override
      public void failed(Throwable x) {
        callback.failed(x);
      }

      @Override
      public InvocationType getInvocationType() {
        return callback.getInvocationType();
      }
    };

    if (!super.handle(capturingRequest, capturingResponse, completion)) {
      // nothing downstream took the request; answer it here so it is captured
      Response.writeError(capturingRequest, capturingResponse, completion, HttpStatus.NOT_FOUND_404);
    }
    return true;
  }

  private static int maxCapturedBytes(int sizeLimitKb) {
    // a character takes at most four bytes in UTF-8
    long bytes = sizeLimitKb * 4000L + 4;
    return (int) Math.min(bytes, Integer.MAX_VALUE - 8);
  }

  /**
   * Returns the charset named by a Content-Type value.
   *
   * @param contentType
   *            the header value, may be null
   * @return the declared charset, or UTF-8 if none is declared or it is not
   *         supported
   */
  static Charset charsetOf(String contentType) {
    String name = contentType != null ? MimeTypes.getCharsetFromContentType(contentType) : null;
    if (name == null) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(name);
    } catch (IllegalArgumentException e) {
      logger.debug("Unsupported charset {}, decoding body as UTF-8", name);
      return StandardCharsets.UTF_8;
    }
  }

  // Headers and query are read now; body bytes are decoded on the capture thread.
  private static Supplier<RequestFacts> requestFacts(Request request, BodyRecorder body, long startNanos) {
    RequestFacts.Builder builder = RequestFacts.builder().method(request.getMethod())
        .uri(request.getHttpURI().getPathQuery()).path(request.getHttpURI().getDecodedPath())
        .remoteAddress(Request.getRemoteAddr(request)).startNanos(startNanos);
    for (HttpField field : request.getHeaders()) {
      builder.header(field.getName(), field.getValue());
    }
    Fields query = Request.extractQueryParameters(request);
    for (Fields.Field field : query) {
      for (String value : field.getValues()) {
        builder.queryParameter(field.getName(), value);
      }
    }
    Charset charset = charsetOf(request.getHeaders().get(HttpHeader.CONTENT_TYPE));
    return () -> builder.body(body.text(charset)).bodyOverflow(body.isOverflow()).build();
  }

  private static Supplier<ResponseFacts> responseFacts(Response response, BodyRecorder body) {
    ResponseFacts.Builder builder = ResponseFacts.builder().status(response.getStatus());
    for (HttpField field : response.getHeaders()) {
      builder.header(field.getName(), field.getValue());
    }
    Charset charset = charsetOf(response.getHeaders().get(HttpHeader.CONTENT_TYPE));
    return () -> builder.body(body.text(charset)).bodyOverflow(body.isOverflow()).build();
  }

  private HandlerDescriptor resolveByContentType(RequestFacts request) {
    String contentType = request.getContentType() != null
        ? request.getContentType().toLowerCase(Locale.ROOT)
        : "";
    TransportKind kind = contentType.startsWith("application/grpc") ? TransportKind.GRPC : TransportKind.HTTP;
    Handler handler = getHandler();
    return new HandlerDescriptor(handler != null ? handler.getClass().getName() : "", options.getServerName(),
        kind);
  }
}
