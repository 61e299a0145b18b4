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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ResponseFacts is the transport-neutral view of a finalized response.
 */
public final class ResponseFacts {

  private final int status;
  private final Map<String, List<String>> headers;
  private final String body;
  private final boolean bodyOverflow;

  private ResponseFacts(Builder builder) {
    this.status = builder.status;
    this.headers = Headers.copy(builder.headers);
    this.body = builder.body != null ? builder.body : "";
    this.bodyOverflow = builder.bodyOverflow;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getStatus() {
    return status;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the first value of a header.
   *
   * @param name
   *            the header name, matched case-insensitively
   * @return the value, or null if absent
   */
  public String getHeader(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public String getContentType() {
    return getHeader("content-type");
  }

  /**
   * Returns the body text that was buffered for capture.
   *
   * @return the body, empty if none
   */
  public String getBody() {
    return body;
  }

  /**
   * Returns true if the transport stopped buffering the body because it was
   * larger than the capture limit.
   *
   * @return true if the body was not fully buffered
   */
  public boolean isBodyOverflow() {
    return bodyOverflow;
  }

  /**
   * Builder for ResponseFacts.
   */
  public static class Builder {
    private int status = 200;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private String body;
    private boolean bodyOverflow;

    public Builder status(int status) {
      this.status = status;
      return this;
    }

    public Builder header(String name, String value) {
      Headers.add(headers, name, value);
      return this;
    }

    public Builder body(String body) {
      this.body = body;
      return this;
    }

    public Builder bodyOverflow(boolean bodyOverflow) {
      this.bodyOverflow = bodyOverflow;
      return this;
    }

    public ResponseFacts build() {
      return new ResponseFacts(this);
    }
  }
}
