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

import dev.telescope.core.capture.HandlerResolver;

/**
 * Options for configuring the {@link TelescopeHandler}.
 */
public class TelescopeHandlerOptions {

  private final String serverName;
  private final HandlerResolver handlerResolver;

  private TelescopeHandlerOptions(Builder builder) {
    this.serverName = builder.serverName;
    this.handlerResolver = builder.handlerResolver;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the server name reported in handler descriptors.
   *
   * @return the server name
   */
  public String getServerName() {
    return serverName;
  }

  /**
   * Gets the resolver that identifies the handler of a request.
   *
   * @return the resolver, or null to classify by content type
   */
  public HandlerResolver getHandlerResolver() {
    return handlerResolver;
  }

  /**
   * Builder for TelescopeHandlerOptions.
   */
  public static class Builder {
    private String serverName = "http";
    private HandlerResolver handlerResolver;

    public Builder serverName(String serverName) {
      this.serverName = serverName;
      return this;
    }

    public Builder handlerResolver(HandlerResolver handlerResolver) {
      this.handlerResolver = handlerResolver;
      return this;
    }

    public TelescopeHandlerOptions build() {
      return new TelescopeHandlerOptions(this);
    }
  }
}
