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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.telescope.core.JsonUtils;
import dev.telescope.core.TelescopeException;

/**
 * LoggingRecorderSink writes each entry as one line of JSON to an SLF4J logger.
 * It suits development and log-shipping setups where the log pipeline is the
 * store.
 */
public class LoggingRecorderSink implements RecorderSink {

  private static final Logger defaultLogger = LoggerFactory.getLogger(LoggingRecorderSink.class);

  private final Logger logger;

  /**
   * Creates a sink that logs to this class's logger.
   */
  public LoggingRecorderSink() {
    this(defaultLogger);
  }

  /**
   * Creates a sink that logs to a custom logger.
   *
   * @param logger
   *            the logger to write entries to
   */
  public LoggingRecorderSink(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void recordRequest(CaptureEntry entry) {
    log("request", entry);
  }

  @Override
  public void recordService(CaptureEntry entry) {
    log("service", entry);
  }

  private void log(String channel, CaptureEntry entry) {
    if (!logger.isInfoEnabled()) {
      return;
    }
    try {
      logger.info("[telescope:{}] {}", channel, JsonUtils.toJson(entry));
    } catch (TelescopeException e) {
      logger.warn("[telescope:{}] Could not serialize {}: {}", channel, entry, e.getMessage());
    }
  }
}
