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

import dev.telescope.core.capture.RequestFacts;
import dev.telescope.core.capture.ResponseFacts;
import dev.telescope.core.capture.RpcContext;

/**
 * ExchangeAdapter teaches {@link CaptureMiddleware} how to read a framework's
 * request and response types.
 *
 * @param <I>
 *            The request type
 * @param <O>
 *            The response type
 */
public interface ExchangeAdapter<I, O> {

  /**
   * Returns the inbound batch-id header.
   *
   * @param request
   *            the request
   * @return the header value, or null if absent
   */
  String inboundBatchId(I request);

  /**
   * Returns the RPC side channel of the request.
   *
   * @param request
   *            the request
   * @return the side channel
   */
  default RpcContext rpcContext(I request) {
    return RpcContext.empty();
  }

  /**
   * Describes the request.
   *
   * @param request
   *            the request
   * @param startNanos
   *            the monotonic time at which handling started
   * @return the request facts
   */
  RequestFacts requestFacts(I request, long startNanos);

  /**
   * Describes the finalized response.
   *
   * @param response
   *            the response
   * @return the response facts
   */
  ResponseFacts responseFacts(O response);

  /**
   * Returns the response carrying the batch-id header.
   *
   * @param response
   *            the response
   * @param batchId
   *            the batch id
   * @return the response with the header set, which may be a new instance
   */
  O withBatchId(O response, String batchId);
}
