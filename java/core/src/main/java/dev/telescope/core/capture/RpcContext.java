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

import java.util.Map;

/**
 * RpcContext is the side channel an RPC transport uses to carry values that do
 * not travel as HTTP headers, such as the caller's batch id.
 */
@FunctionalInterface
public interface RpcContext {

  /** Key of the map that carries Telescope values between services. */
  String CARRIER_KEY = "telescope.carrier";

  /** Key of the batch id inside the carrier. */
  String BATCH_ID_KEY = "batch-id";

  /**
   * Returns the value stored under a key.
   *
   * @param key
   *            the key
   * @return the value, or null if absent
   */
  Object get(String key);

  /**
   * Returns an empty context.
   *
   * @return a context with no values
   */
  static RpcContext empty() {
    return key -> null;
  }

  /**
   * Returns a context backed by a map.
   *
   * @param values
   *            the values
   * @return a context reading from the map
   */
  static RpcContext of(Map<String, ?> values) {
    return values::get;
  }
}
