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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides JSON serialization and deserialization utilities for
 * Telescope.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    // "{}garbage" is not a JSON body
    objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws TelescopeException
   *             if serialization fails
   */
  public static String toJson(Object value) throws TelescopeException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new TelescopeException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an object to a JsonNode.
   *
   * @param value
   *            the object to convert
   * @return the JsonNode
   */
  public static JsonNode toJsonNode(Object value) {
    return objectMapper.valueToTree(value);
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws TelescopeException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws TelescopeException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new TelescopeException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a string as a JSON object or array.
   *
   * <p>
   * Scalars, blank input and malformed documents are not containers and yield
   * null rather than an exception, so callers can fall through to other content
   * handling.
   *
   * @param content
   *            the candidate JSON text
   * @return the parsed object or array node, or null
   */
  public static JsonNode parseContainer(String content) {
    if (content == null || content.isBlank()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(content);
      return node != null && node.isContainerNode() ? node : null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  /**
   * Creates an empty object node from the shared mapper.
   *
   * @return a new ObjectNode
   */
  public static ObjectNode createObjectNode() {
    return objectMapper.createObjectNode();
  }
}
