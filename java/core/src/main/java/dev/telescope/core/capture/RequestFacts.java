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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RequestFacts is the transport-neutral view of an incoming request that the
 * capture pipeline works from. Transports fill in what they know; anything left
 * unset degrades to an empty value in the captured entry.
 */
public final class RequestFacts {

  private final String method;
  private final String uri;
  private final String path;
  private final Map<String, List<String>> headers;
  private final Map<String, List<String>> queryParameters;
  private final Map<String, Object> parsedBody;
  private final String body;
  private final boolean bodyOverflow;
  private final String remoteAddress;
  private final Long startNanos;

  private RequestFacts(Builder builder) {
    this.method = builder.method != null ? builder.method : "";
    this.uri = builder.uri != null ? builder.uri : "";
    this.path = builder.path != null ? builder.path : pathOf(this.uri);
    this.headers = Headers.copy(builder.headers);
    this.queryParameters = Headers.copy(builder.queryParameters);
    this.parsedBody = builder.parsedBody != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.parsedBody))
        : null;
    this.body = builder.body != null ? builder.body : "";
    this.bodyOverflow = builder.bodyOverflow;
    this.remoteAddress = builder.remoteAddress;
    this.startNanos = builder.startNanos;
  }

  private static String pathOf(String uri) {
    int query = uri.indexOf('?');
    return query >= 0 ? uri.substring(0, query) : uri;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getMethod() {
    return method;
  }

  /**
   * Returns the request target as received, including the query string.
   *
   * @return the URI
   */
  public String getUri() {
    return uri;
  }

  /**
   * Returns the decoded path used for ignore and only-path matching.
   *
   * @return the path
   */
  public String getPath() {
    return path;
  }

  /**
   * Returns the headers keyed by lower-case name.
   *
   * @return the headers, each with its values in arrival order
   */
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

  public Map<String, List<String>> getQueryParameters() {
    return queryParameters;
  }

  /**
   * Returns the body fields the framework already parsed (form posts), or null
   * if it did not parse the body.
   *
   * @return the parsed body fields
   */
  public Map<String, Object> getParsedBody() {
    return parsedBody;
  }

  /**
   * Returns the raw body text that was buffered for capture.
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

  public String getContentType() {
    return getHeader("content-type");
  }

  /**
   * Returns the transport-level peer address.
   *
   * @return the address, or null if unknown
   */
  public String getRemoteAddress() {
    return remoteAddress;
  }

  /**
   * Returns the monotonic timestamp taken when the request arrived.
   *
   * @return the start time in nanoseconds, or null if not recorded
   */
  public Long getStartNanos() {
    return startNanos;
  }

  /**
   * Builder for RequestFacts.
   */
  public static class Builder {
    private String method;
    private String uri;
    private String path;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final Map<String, List<String>> queryParameters = new LinkedHashMap<>();
    private Map<String, Object> parsedBody;
    private String body;
    private boolean bodyOverflow;
    private String remoteAddress;
    private Long startNanos;

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder uri(String uri) {
      this.uri = uri;
      return this;
    }

    public Builder path(String path) {
      this.path = path;
      return this;
    }

    public Builder header(String name, String value) {
      Headers.add(headers, name, value);
      return this;
    }

    public Builder headers(Map<String, List<String>> headers) {
      headers.forEach((name, values) -> values.forEach(value -> header(name, value)));
      return this;
    }

    public Builder queryParameter(String name, String value) {
      queryParameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder parsedBody(Map<String, Object> parsedBody) {
      this.parsedBody = parsedBody;
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

    public Builder remoteAddress(String remoteAddress) {
      this.remoteAddress = remoteAddress;
      return this;
    }

    public Builder startNanos(Long startNanos) {
      this.startNanos = startNanos;
      return this;
    }

    public RequestFacts build() {
      return new RequestFacts(this);
    }
  }
}
