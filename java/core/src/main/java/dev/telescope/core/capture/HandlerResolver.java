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

/**
 * HandlerResolver looks up the route handler that served a request. It is
 * supplied by the hosting framework; the capture pipeline only reads the
 * resulting descriptor.
 */
@FunctionalInterface
public interface HandlerResolver {

  /**
   * Resolves the handler for a request.
   *
   * @param request
   *            the request facts
   * @return the handler descriptor, never null
   */
  HandlerDescriptor resolve(RequestFacts request);

  /**
   * Returns a resolver that classifies every request as plain HTTP with no
   * handler identifier.
   *
   * @return the default resolver
   */
  static HandlerResolver unresolved() {
    return request -> HandlerDescriptor.unresolved();
  }
}
