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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;

import dev.telescope.core.JsonUtils;

/**
 * Tests for Redactor.
 */
class RedactorTest {

  private static JsonNode json(String content) {
    return JsonUtils.parseJson(content);
  }

  @Test
  void testNestedTokenIsMasked() {
    JsonNode payload = json("{\"data\":{\"token\":\"abc123\",\"user\":\"ada\"}}");

    JsonNode redacted = Redactor.redact(payload, List.of("data.token"));

    assertEquals(Redactor.MASK, redacted.get("data").get("token").asText());
    assertEquals("ada", redacted.get("data").get("user").asText());
  }

  @Test
  void testInputIsNotMutated() {
    JsonNode payload = json("{\"password\":\"hunter2\"}");

    Redactor.redact(payload, List.of("password"));

    assertEquals("hunter2", payload.get("password").asText());
  }

  @Test
  void testLiteralKeyWithDotWinsOverPath() {
    JsonNode payload = json("{\"a.b\":\"literal\",\"a\":{\"b\":\"nested\"}}");

    JsonNode redacted = Redactor.redact(payload, List.of("a.b"));

    assertEquals(Redactor.MASK, redacted.get("a.b").asText());
    assertEquals("nested", redacted.get("a").get("b").asText());
  }

  @ParameterizedTest
  @ValueSource(strings = {"\"\"", "\"0\"", "0", "0.0", "false", "null", "[]", "{}"})
  void testFalsyValuesAreLeftAlone(String value) {
    JsonNode payload = json("{\"token\":" + value + "}");

    JsonNode redacted = Redactor.redact(payload, List.of("token"));

    assertEquals(payload, redacted);
  }

  @Test
  void testMissingPathIsNoOp() {
    JsonNode payload = json("{\"data\":{\"user\":\"ada\"},\"list\":[1]}");

    JsonNode redacted = Redactor.redact(payload, List.of("data.token", "nothing.here", "list.5", "list.x"));

    assertEquals(payload, redacted);
  }

  @Test
  void testPathThroughArrays() {
    JsonNode payload = json("{\"items\":[{\"secret\":\"s0\"},{\"secret\":\"s1\"}],\"codes\":[\"a\",\"b\"]}");

    JsonNode redacted = Redactor.redact(payload, List.of("items.1.secret", "codes.0"));

    assertEquals("s0", redacted.get("items").get(0).get("secret").asText());
    assertEquals(Redactor.MASK, redacted.get("items").get(1).get("secret").asText());
    assertEquals(Redactor.MASK, redacted.get("codes").get(0).asText());
    assertEquals("b", redacted.get("codes").get(1).asText());
  }

  @Test
  void testContainerValueIsMaskedWhole() {
    JsonNode payload = json("{\"card\":{\"number\":\"4111\",\"cvc\":\"123\"}}");

    JsonNode redacted = Redactor.redact(payload, List.of("card"));

    assertEquals(Redactor.MASK, redacted.get("card").asText());
  }

  @Test
  void testRedactionIsIdempotent() {
    JsonNode payload = json("{\"password\":\"p\",\"nested\":{\"token\":1}}");
    List<String> paths = List.of("password", "nested.token");

    JsonNode once = Redactor.redact(payload, paths);

    assertEquals(once, Redactor.redact(once, paths));
  }

  @Test
  void testTopLevelArrayIndex() {
    JsonNode payload = json("[{\"password\":\"p\"},{\"password\":\"q\"}]");

    JsonNode redacted = Redactor.redact(payload, List.of("0.password"));

    assertEquals(Redactor.MASK, redacted.get(0).get("password").asText());
    assertEquals("q", redacted.get(1).get("password").asText());
  }

  @Test
  void testSentinelPayloadIsReturnedAsIs() {
    ExtractedPayload purged = ExtractedPayload.purged();

    assertSame(purged, Redactor.redact(purged, List.of("token")));
  }

  @Test
  void testStructuredPayloadIsRedacted() {
    ExtractedPayload payload = ExtractedPayload.structured(json("{\"token\":\"t\"}"));

    ExtractedPayload redacted = Redactor.redact(payload, List.of("token"));

    assertEquals(Redactor.MASK, redacted.getStructure().get("token").asText());
  }

  @Test
  void testHeadersAreMaskedCaseInsensitively() {
    Map<String, List<String>> headers = new LinkedHashMap<>();
    headers.put("authorization", List.of("Bearer abc"));
    headers.put("x-api-key", List.of("k1", "k2"));
    headers.put("accept", List.of("*/*"));

    Map<String, List<String>> redacted = Redactor.redactHeaders(headers, Set.of("Authorization", "X-Api-Key"));

    assertEquals(List.of(Redactor.MASK), redacted.get("authorization"));
    assertEquals(List.of(Redactor.MASK, Redactor.MASK), redacted.get("x-api-key"));
    assertEquals(List.of("*/*"), redacted.get("accept"));
    assertEquals(List.of("Bearer abc"), headers.get("authorization"));
  }

  @Test
  void testTruthiness() {
    assertTrue(Redactor.isTruthy(json("\"false\"")));
    assertTrue(Redactor.isTruthy(json("-1")));
    assertTrue(Redactor.isTruthy(json("[0]")));
    assertFalse(Redactor.isTruthy(null));
    assertFalse(Redactor.isTruthy(json("0")));
  }
}
