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

package dev.telescope.core;

/**
 * Raised when capture settings cannot be loaded or a value cannot be mapped to
 * or from JSON. The capture path itself never lets one of these reach the
 * request being observed.
 */
public class TelescopeException extends RuntimeException {

  /** Error code for a configuration value that cannot be used. */
  public static final String INVALID_CONFIG = "INVALID_CONFIG";

  private final String errorCode;
  private final String configKey;

  public TelescopeException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  private TelescopeException(String message, Throwable cause, String errorCode, String configKey) {
    super(message, cause);
    this.errorCode = errorCode;
    this.configKey = configKey;
  }

  /**
   * Creates an exception for a rejected configuration value.
   *
   * @param key
   *            the property or environment variable that held the value
   * @param message
   *            the error message
   * @param cause
   *            the parse failure, or null
   * @return the exception
   */
  public static TelescopeException invalidConfig(String key, String message, Throwable cause) {
    return new TelescopeException(message, cause, INVALID_CONFIG, key);
  }

  /**
   * Returns the error code.
   *
   * @return {@link #INVALID_CONFIG}, or null for I/O and JSON failures
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns the setting that was rejected.
   *
   * @return the property or environment variable name, or null
   */
  public String getConfigKey() {
    return configKey;
  }
}
