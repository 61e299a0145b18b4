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

package dev.telescope.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * CaptureTelemetry counts what happened to each capture.
 *
 * <p>
 * The counter {@value #METRIC_ENTRIES} carries two attributes: {@code channel}
 * ({@code request}, {@code service}, or {@code none} when nothing was recorded)
 * and {@code status} (one of the {@link Status} values).
 */
public class CaptureTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(CaptureTelemetry.class);
  private static final String METER_NAME = "telescope";

  static final String METRIC_ENTRIES = "telescope/capture/entries";
  static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");
  static final AttributeKey<String> STATUS = AttributeKey.stringKey("status");

  /**
   * Outcome of one capture.
   */
  public enum Status {
    /** The entry reached the sink. */
    RECORDED("recorded"),
    /** The capture decision turned the request down. */
    SKIPPED("skipped"),
    /** Building or dispatching the entry threw. */
    FAILED("failed"),
    /** The executor refused the deferred capture. */
    DROPPED("dropped");

    private final String value;

    Status(String value) {
      this.value = value;
    }

    public String getValue() {
      return value;
    }
  }

  private static CaptureTelemetry instance;

  private final LongCounter entryCounter;

  /**
   * Gets the instance backed by the global OpenTelemetry meter provider.
   *
   * @return the CaptureTelemetry instance
   */
  public static synchronized CaptureTelemetry getInstance() {
    if (instance == null) {
      instance = new CaptureTelemetry(GlobalOpenTelemetry.getMeter(METER_NAME));
    }
    return instance;
  }

  /**
   * Creates a CaptureTelemetry that records on the given meter.
   *
   * @param meter
   *            the meter
   */
  public CaptureTelemetry(Meter meter) {
    entryCounter = meter.counterBuilder(METRIC_ENTRIES)
        .setDescription("Counts request captures by channel and outcome.").setUnit("1").build();
    logger.debug("CaptureTelemetry initialized with OpenTelemetry metrics");
  }

  /**
   * Records the outcome of one capture.
   *
   * @param channel
   *            the sink channel, or null if nothing was recorded
   * @param status
   *            the outcome
   */
  public void recordCapture(String channel, Status status) {
    entryCounter.add(1,
        Attributes.of(CHANNEL, channel != null ? channel : "none", STATUS, status.getValue()));
  }
}
