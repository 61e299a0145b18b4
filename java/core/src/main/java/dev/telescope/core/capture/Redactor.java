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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Redactor masks sensitive values in captured payloads and headers.
 *
 * <p>
 * Paths are dot-separated; a segment addresses an object field or, on an
 * array, an element index ({@code items.0.token}). A top-level field whose name
 * itself contains dots is matched before the path is split. Only values that
 * are truthy are masked: {@code null}, {@code false}, {@code 0}, {@code ""},
 * {@code "0"} and empty containers are left as they are.
 */
public final class Redactor {

  /** Replacement written over masked values. */
  public static final String MASK = "********";

  private Redactor() {
    // Utility class
  }

  /**
   * Returns a copy of the payload with every truthy value at a hidden path
   * replaced by {@link #MASK}. The input is not modified.
   *
   * @param payload
   *            the payload
   * @param hiddenPaths
   *            dotted paths, applied in order
   * @return the redacted copy
   */
  public static JsonNode redact(JsonNode payload, List<String> hiddenPaths) {
    JsonNode copy = payload.deepCopy();
    if (!copy.isContainerNode()) {
      return copy;
    }
    for (String path : hiddenPaths) {
      if (path != null && !path.isEmpty()) {
        mask(copy, path);
      }
    }
    return copy;
  }

  /**
   * Applies {@link #redact(JsonNode, List)} to structured payloads and returns
   * any other payload unchanged.
   *
   * @param payload
   *            the extracted payload
   * @param hiddenPaths
   *            dotted paths
   * @return the redacted payload
   */
  public static ExtractedPayload redact(ExtractedPayload payload, List<String> hiddenPaths) {
    if (!payload.isStructured() || hiddenPaths.isEmpty()) {
      return payload;
    }
    return ExtractedPayload.structured(redact(payload.getStructure(), hiddenPaths));
  }

  /**
   * Returns a copy of the headers with every value of a hidden header replaced
   * by {@link #MASK}.
   *
   * @param headers
   *            the headers keyed by name
   * @param hiddenHeaders
   *            names to mask, matched case-insensitively
   * @return the redacted copy
   */
  public static Map<String, List<String>> redactHeaders(Map<String, List<String>> headers,
      Collection<String> hiddenHeaders) {
    Set<String> hidden = hiddenHeaders.stream().map(name -> name.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
    Map<String, List<String>> copy = new LinkedHashMap<>();
    headers.forEach((name, values) -> {
      if (hidden.contains(name.toLowerCase(Locale.ROOT))) {
        copy.put(name, values.stream().map(value -> MASK).collect(Collectors.toUnmodifiableList()));
      } else {
        copy.put(name, List.copyOf(values));
      }
    });
    return copy;
  }

  private static void mask(JsonNode root, String path) {
    if (root.isObject() && root.has(path)) {
      maskField((ObjectNode) root, path);
      return;
    }
    String[] segments = path.split("\\.", -1);
    JsonNode current = root;
    for (int i = 0; i < segments.length - 1; i++) {
      current = child(current, segments[i]);
      if (current == null || !current.isContainerNode()) {
        return;
      }
    }
    String last = segments[segments.length - 1];
    if (current.isObject()) {
      maskField((ObjectNode) current, last);
    } else if (current.isArray()) {
      int index = index(last);
      ArrayNode array = (ArrayNode) current;
      if (index >= 0 && index < array.size() && isTruthy(array.get(index))) {
        array.set(index, TextNode.valueOf(MASK));
      }
    }
  }

  private static void maskField(ObjectNode node, String field) {
    if (isTruthy(node.get(field))) {
      node.put(field, MASK);
    }
  }

  private static JsonNode child(JsonNode node, String segment) {
    if (node.isObject()) {
      return node.get(segment);
    }
    if (node.isArray()) {
      int index = index(segment);
      return index >= 0 ? node.get(index) : null;
    }
    return null;
  }

  private static int index(String segment) {
    if (segment.isEmpty() || segment.length() > 9) {
      return -1;
    }
    for (int i = 0; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
    }
    return Integer.parseInt(segment);
  }

  /**
   * Returns true if a value is truthy: present, not null, not false, not zero,
   * not an empty or {@code "0"} string and not an empty container.
   *
   * @param value
   *            the value, may be null
   * @return true if truthy
   */
  static boolean isTruthy(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return false;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isNumber()) {
      return value.doubleValue() != 0.0;
    }
    if (value.isTextual()) {
      String text = value.textValue();
      return !text.isEmpty() && !"0".equals(text);
    }
    if (value.isContainerNode()) {
      return value.size() > 0;
    }
    return true;
  }
}
