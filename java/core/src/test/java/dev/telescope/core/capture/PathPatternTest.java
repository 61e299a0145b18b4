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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for PathPattern.
 */
class PathPatternTest {

  @Test
  void testExactMatchIgnoresLeadingSlash() {
    PathPattern pattern = PathPattern.of("/health");

    assertTrue(pattern.matches("health"));
    assertTrue(pattern.matches("/health"));
    assertFalse(pattern.matches("/health/live"));
  }

  @Test
  void testWildcard() {
    PathPattern pattern = PathPattern.of("api/*/status");

    assertTrue(pattern.matches("/api/orders/status"));
    assertTrue(pattern.matches("/api/a/b/status"));
    assertFalse(pattern.matches("/api/orders"));
  }

  @Test
  void testRegexCharactersAreLiteral() {
    PathPattern pattern = PathPattern.of("files/v1.0/(latest)");

    assertTrue(pattern.matches("/files/v1.0/(latest)"));
    assertFalse(pattern.matches("/files/v1x0/(latest)"));
  }

  @Test
  void testNullPathNeverMatches() {
    assertFalse(PathPattern.of("*").matches(null));
  }

  @Test
  void testBlankPatternIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> PathPattern.of(" "));
  }
}
