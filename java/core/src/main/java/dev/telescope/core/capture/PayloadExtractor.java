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
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;

import dev.telescope.core.JsonUtils;

/**
 * PayloadExtractor turns a raw body into the payload stored in a capture entry.
 *
 * <p>
 * The rules are applied in order and the first that matches wins:
 * <ol>
 * <li>empty content: {@link ExtractedPayload#EMPTY_RESPONSE}</li>
 * <li>content over the size limit: {@link ExtractedPayload#PURGED}</li>
 * <li>a JSON object or array: the decoded structure</li>
 * <li>a {@code text/plain} content type: the text</li>
 * <li>an {@code application/grpc} content type: the out-of-band payload, or
 * {@link ExtractedPayload#PURGED} if there is none</li>
 * <li>anything else: {@link ExtractedPayload#HTML_RESPONSE}</li>
 * </ol>
 *
 * <p>
 * Size is measured in characters (Unicode code points), and a body is within
 * the limit while {@code characters / 1000 <= sizeLimitKb}. Extraction never
 * throws for any content.
 */
public final class PayloadExtractor {

  private PayloadExtractor() {
    // Utility class
  }

  /**
   * Extracts a payload from content that has no out-of-band channel.
   *
   * @param content
   *            the body text, null is treated as empty
   * @param contentType
   *            the content type header, may be null
   * @param sizeLimitKb
   *            the size limit in kilobytes
   * @return the extracted payload
   */
  public static ExtractedPayload extract(String content, String contentType, int sizeLimitKb) {
    return extract(content, contentType, sizeLimitKb, () -> null);
  }

  /**
   * Extracts a payload.
   *
   * @param content
   *            the body text, null is treated as empty
   * @param contentType
   *            the content type header, may be null
   * @param sizeLimitKb
   *            the size limit in kilobytes
   * @param outOfBand
   *            supplies the payload of transports that do not carry it in the
   *            body; only consulted for gRPC content
   * @return the extracted payload
   */
  public static ExtractedPayload extract(String content, String contentType, int sizeLimitKb,
      Supplier<Object> outOfBand) {
    if (content == null || content.isEmpty()) {
      return ExtractedPayload.empty();
    }
    if (!withinLimit(content, sizeLimitKb)) {
      return ExtractedPayload.purged();
    }
    JsonNode structure = JsonUtils.parseContainer(content);
    if (structure != null) {
      return ExtractedPayload.structured(structure);
    }
    String type = contentType != null ? contentType.toLowerCase(Locale.ROOT) : "";
    if (type.startsWith("text/plain")) {
      return ExtractedPayload.text(content);
    }
    if (type.contains("application/grpc")) {
      return fromOutOfBand(outOfBand.get());
    }
    return ExtractedPayload.html();
  }

  /**
   * Returns true if content fits within the size limit.
   *
   * @param content
   *            the content
   * @param sizeLimitKb
   *            the size limit in kilobytes
   * @return true if within the limit
   */
  public static boolean withinLimit(String content, int sizeLimitKb) {
    int characters = content.codePointCount(0, content.length());
    return characters / 1000.0 <= sizeLimitKb;
  }

  /**
   * Converts a payload supplied out of band. Null, empty strings and empty
   * collections count as missing and give {@link ExtractedPayload#PURGED}.
   *
   * @param payload
   *            the out-of-band payload
   * @return the extracted payload
   */
  static ExtractedPayload fromOutOfBand(Object payload) {
    if (payload == null || isEmptyValue(payload)) {
      return ExtractedPayload.purged();
    }
    if (payload instanceof String) {
      return ExtractedPayload.text((String) payload);
    }
    try {
      JsonNode node = payload instanceof JsonNode ? (JsonNode) payload : JsonUtils.toJsonNode(payload);
      if (node.isContainerNode()) {
        return ExtractedPayload.structured(node);
      }
      return ExtractedPayload.text(node.asText());
    } catch (IllegalArgumentException e) {
      return ExtractedPayload.text(payload.toString());
    }
  }

  private static boolean isEmptyValue(Object payload) {
    if (payload instanceof String) {
      return ((String) payload).isEmpty();
    }
    if (payload instanceof Map) {
      return ((Map<?, ?>) payload).isEmpty();
    }
    if (payload instanceof Collection) {
      return ((Collection<?>) payload).isEmpty();
    }
    if (payload instanceof JsonNode) {
      JsonNode node = (JsonNode) payload;
      return node.isNull() || node.isMissingNode() || (node.isContainerNode() && node.size() == 0);
    }
    return false;
  }
}
