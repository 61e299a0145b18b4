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

package dev.telescope.core.middleware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.telescope.core.CaptureContext;
import dev.telescope.core.capture.CaptureConfig;
import dev.telescope.core.capture.CapturePipeline;
import dev.telescope.core.capture.SystemProbe;

/**
 * CaptureMiddleware feeds requests flowing through a {@link MiddlewareChain}
 * into a {@link CapturePipeline}.
 *
 * <p>
 * It establishes the batch id, passes a fresh {@link CaptureContext} down the
 * chain, echoes the batch id on the response and schedules the capture. When
 * request capture is disabled it passes the request through untouched.
 *
 * @param <I>
 *            The request type
 * @param <O>
 *            The response type
 */
public class CaptureMiddleware<I, O> implements Middleware<I, O> {

  private static final Logger logger = LoggerFactory.getLogger(CaptureMiddleware.class);

  private final CapturePipeline pipeline;
  private final ExchangeAdapter<I, O> adapter;
  private final SystemProbe probe;

  public CaptureMiddleware(CapturePipeline pipeline, ExchangeAdapter<I, O> adapter) {
    this(pipeline, adapter, SystemProbe.jvm());
  }

  public CaptureMiddleware(CapturePipeline pipeline, ExchangeAdapter<I, O> adapter, SystemProbe probe) {
    this.pipeline = pipeline;
    this.adapter = adapter;
    this.probe = probe;
  }

  @Override
  public O handle(I request, CaptureContext context, MiddlewareNext<I, O> next) {
    if (!pipeline.getConfig().isEnabled(CaptureConfig.KIND_REQUEST)) {
      return next.apply(request, context);
    }

    long startNanos = probe.nanoTime();
    CaptureContext captureContext = pipeline.begin(adapter.inboundBatchId(request), adapter.rpcContext(request));

    O response = adapter.withBatchId(next.apply(request, captureContext), captureContext.getBatchId());

    try {
      pipeline.complete(captureContext, adapter.requestFacts(request, startNanos), adapter.responseFacts(response));
    } catch (RuntimeException e) {
      logger.warn("Could not schedule capture for batch {}", captureContext.getBatchId(), e);
    }
    return response;
  }

  /**
   * Returns null: the capture middleware records the chain, it is not part of
   * it.
   */
  @Override
  public String name() {
    return null;
  }
}
