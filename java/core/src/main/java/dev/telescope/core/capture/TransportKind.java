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
 * TransportKind classifies the server that handled a request. Every kind other
 * than {@link #HTTP} is service traffic and is recorded on the service channel.
 */
public enum TransportKind {
  HTTP, RPC, JSON_RPC, GRPC;

  /**
   * Returns true if requests of this kind are recorded as service calls.
   *
   * @return true for RPC transports
   */
  public boolean isService() {
    return this != HTTP;
  }
}
