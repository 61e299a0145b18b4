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

import java.util.Objects;

/**
 * HandlerDescriptor identifies the handler that served a request and the kind
 * of server it runs in.
 */
public final class HandlerDescriptor {

  private static final HandlerDescriptor UNRESOLVED = new HandlerDescriptor("", "http", TransportKind.HTTP);

  private final String handler;
  private final String serverName;
  private final TransportKind kind;

  /**
   * Creates a new HandlerDescriptor.
   *
   * @param handler
   *            a human-readable handler identifier, null when unresolved
   * @param serverName
   *            the name of the server that received the request
   * @param kind
   *            the transport kind
   */
  public HandlerDescriptor(String handler, String serverName, TransportKind kind) {
    this.handler = handler != null ? handler : "";
    this.serverName = serverName != null ? serverName : "http";
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the descriptor used when no handler could be resolved.
   *
   * @return a plain HTTP descriptor with an empty handler
   */
  public static HandlerDescriptor unresolved() {
    return UNRESOLVED;
  }

  /**
   * Returns the handler identifier.
   *
   * @return the handler, or an empty string if unresolved
   */
  public String getHandler() {
    return handler;
  }

  public String getServerName() {
    return serverName;
  }

  public TransportKind getKind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HandlerDescriptor)) {
      return false;
    }
    HandlerDescriptor that = (HandlerDescriptor) o;
    return handler.equals(that.handler) && serverName.equals(that.serverName) && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(handler, serverName, kind);
  }

  @Override
  public String toString() {
    return "HandlerDescriptor{handler=" + handler + ", serverName=" + serverName + ", kind=" + kind + "}";
  }
}
