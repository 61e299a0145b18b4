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

import dev.telescope.core.CaptureContext;

/**
 * MiddlewareNext represents the next function in the middleware chain. It is
 * used by middleware to pass control to the next middleware or the handler.
 *
 * @param <I>
 *            The request type
 * @param <O>
 *            The response type
 */
@FunctionalInterface
public interface MiddlewareNext<I, O> {

  /**
   * Calls the next middleware in the chain or the handler.
   *
   * @param request
   *            the request (may be modified by the middleware)
   * @param context
   *            the capture context (may be supplied by the middleware)
   * @return the response
   */
  O apply(I request, CaptureContext context);
}
