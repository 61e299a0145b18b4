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
 * Middleware is a function that wraps request handling, allowing
 * pre-processing and post-processing of requests and responses.
 *
 * <p>
 * Middleware functions receive the request, the capture context, and a "next"
 * function to call the next middleware in the chain (or the handler if at the
 * end of the chain). The context is null until a {@link CaptureMiddleware} has
 * run, so capture middleware normally goes first.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * Middleware<Req, Res> auth = Middleware.named("auth", (request, context, next) -> {
 * 	if (!request.isAuthorized()) {
 * 		return Res.status(401);
 * 	}
 * 	return next.apply(request, context);
 * });
 * }
 * </pre>
 *
 * @param <I>
 *            The request type
 * @param <O>
 *            The response type
 */
@FunctionalInterface
public interface Middleware<I, O> {

  /**
   * Processes the request through this middleware.
   *
   * @param request
   *            the request
   * @param context
   *            the capture context, null if no capture is active
   * @param next
   *            the next function in the middleware chain
   * @return the response
   */
  O handle(I request, CaptureContext context, MiddlewareNext<I, O> next);

  /**
   * Returns the name recorded in capture entries for this middleware. Null
   * keeps the middleware out of the recorded chain.
   *
   * @return the middleware name
   */
  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Gives a middleware, typically a lambda, a readable name.
   *
   * @param name
   *            the name to record
   * @param middleware
   *            the middleware
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return the named middleware
   */
  static <I, O> Middleware<I, O> named(String name, Middleware<I, O> middleware) {
    return new Middleware<>() {
      @Override
      public O handle(I request, CaptureContext context, MiddlewareNext<I, O> next) {
        return middleware.handle(request, context, next);
      }

      @Override
      public String name() {
        return name;
      }
    };
  }
}
