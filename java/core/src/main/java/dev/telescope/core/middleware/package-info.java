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

/**
 * Middleware support for Telescope.
 *
 * <p>
 * This package provides a framework-neutral middleware chain and the
 * {@link dev.telescope.core.middleware.CaptureMiddleware} that plugs request
 * capture into it. Frameworks without their own interception point can route
 * requests through a chain; frameworks that have one implement an
 * {@link dev.telescope.core.middleware.ExchangeAdapter} and reuse the capture
 * middleware as is.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * MiddlewareChain<Req, Res> chain = new MiddlewareChain<>();
 * chain.use(new CaptureMiddleware<>(pipeline, adapter));
 * chain.use(Middleware.named("auth", authMiddleware));
 *
 * Res response = chain.execute(request, (context, req) -> router.dispatch(req));
 * }
 * </pre>
 *
 * @see dev.telescope.core.middleware.Middleware
 * @see dev.telescope.core.middleware.MiddlewareChain
 * @see dev.telescope.core.middleware.CaptureMiddleware
 */
package dev.telescope.core.middleware;
