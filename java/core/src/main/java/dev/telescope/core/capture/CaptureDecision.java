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
 * CaptureDecision decides whether a request is captured at all. It reads only
 * the config snapshot and the request path and has no side effects.
 */
public final class CaptureDecision {

  private CaptureDecision() {
    // Utility class
  }

  /**
   * Decides whether a request should be captured.
   *
   * <p>
   * Capture is off when the {@value CaptureConfig#KIND_REQUEST} kind is
   * disabled. Otherwise a path matching an only-path pattern is always
   * captured, and any other path is captured unless it matches an ignore
   * pattern.
   *
   * @param config
   *            the config snapshot
   * @param request
   *            the request facts
   * @return true if the request should be captured
   */
  public static boolean shouldCapture(CaptureConfig config, RequestFacts request) {
    if (!config.isEnabled(CaptureConfig.KIND_REQUEST)) {
      return false;
    }
    if (config.isPatchOnly(request.getPath())) {
      return true;
    }
    return !config.isPathIgnored(request.getPath());
  }
}
