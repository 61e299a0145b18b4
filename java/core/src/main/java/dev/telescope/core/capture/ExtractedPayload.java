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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ExtractedPayload is the captured form of a body: a decoded JSON structure,
 * plain text, or one of the sentinel placeholders that stand in for content
 * that was empty, too large, or opaque.
 */
public final class ExtractedPayload {

  /** Placeholder for an empty body. */
  public static final String EMPTY_RESPONSE = "Empty Response";

  /** Placeholder for a body that is neither JSON nor plain text. */
  public static final String HTML_RESPONSE = "HTML Response";

  /** Placeholder for a body over the size limit. */
  public static final String PURGED = "Purged By Telescope";

  /**
   * The shape of an extracted payload.
   */
  public enum Kind {
    STRUCTURED, TEXT, EMPTY, HTML, PURGED
  }

  private static final ExtractedPayload EMPTY = new ExtractedPayload(Kind.EMPTY, EMPTY_RESPONSE);
  private static final ExtractedPayload HTML = new ExtractedPayload(Kind.HTML, HTML_RESPONSE);
  private static final ExtractedPayload PURGED_PAYLOAD = new ExtractedPayload(Kind.PURGED, PURGED);

  private final Kind kind;
  private final Object value;

  private ExtractedPayload(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static ExtractedPayload structured(JsonNode node) {
    return new ExtractedPayload(Kind.STRUCTURED, Objects.requireNonNull(node, "node"));
  }

  public static ExtractedPayload text(String text) {
    return new ExtractedPayload(Kind.TEXT, Objects.requireNonNull(text, "text"));
  }

  public static ExtractedPayload empty() {
    return EMPTY;
  }

  public static ExtractedPayload html() {
    return HTML;
  }

  public static ExtractedPayload purged() {
    return PURGED_PAYLOAD;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isStructured() {
    return kind == Kind.STRUCTURED;
  }

  public boolean isSentinel() {
    return kind == Kind.EMPTY || kind == Kind.HTML || kind == Kind.PURGED;
  }

  /**
   * Returns the decoded structure.
   *
   * @return the JSON node
   * @throws IllegalStateException
   *             if this payload is not structured
   */
  public JsonNode getStructure() {
    if (kind != Kind.STRUCTURED) {
      throw new IllegalStateException("payload is " + kind + ", not STRUCTURED");
    }
    return (JsonNode) value;
  }

  /**
   * Returns the value to store in an entry: a {@link JsonNode} for structured
   * payloads and a string otherwise.
   *
   * @return the entry value
   */
  public Object toValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExtractedPayload)) {
      return false;
    }
    ExtractedPayload that = (ExtractedPayload) o;
    return kind == that.kind && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return kind + ":" + value;
  }
}
