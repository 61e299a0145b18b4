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

import java.util.regex.Pattern;

/**
 * PathPattern matches request paths against a wildcard pattern in which
 * {@code *} stands for any run of characters, including slashes. Leading
 * slashes are ignored on both sides, so {@code /health} and {@code health} are
 * the same pattern.
 */
public final class PathPattern {

  private final String pattern;
  private final Pattern regex;

  private PathPattern(String pattern) {
    this.pattern = pattern;
    StringBuilder sb = new StringBuilder();
    int start = 0;
    int star;
    while ((star = pattern.indexOf('*', start)) >= 0) {
      sb.append(Pattern.quote(pattern.substring(start, star))).append(".*");
      start = star + 1;
    }
    sb.append(Pattern.quote(pattern.substring(start)));
    this.regex = Pattern.compile(sb.toString(), Pattern.DOTALL);
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern
   *            the wildcard pattern
   * @return the compiled pattern
   */
  public static PathPattern of(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("path pattern must not be blank");
    }
    return new PathPattern(stripLeadingSlashes(pattern.trim()));
  }

  /**
   * Tests a request path against this pattern.
   *
   * @param path
   *            the request path
   * @return true if the whole path matches
   */
  public boolean matches(String path) {
    return path != null && regex.matcher(stripLeadingSlashes(path)).matches();
  }

  private static String stripLeadingSlashes(String value) {
    int i = 0;
    while (i < value.length() && value.charAt(i) == '/') {
      i++;
    }
    return value.substring(i);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PathPattern && pattern.equals(((PathPattern) o).pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return pattern;
  }
}
