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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.telescope.core.TelescopeException;

/**
 * CaptureConfig is an immutable snapshot of the capture settings. A pipeline
 * reads one snapshot per capture, so a new snapshot can be swapped in while
 * requests are in flight.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * CaptureConfig config = CaptureConfig.builder().sizeLimitKb(128).hideResponseParameter("data.token")
 *     .ignorePath("health*").build();
 * }</pre>
 */
public final class CaptureConfig {

  private static final Logger logger = LoggerFactory.getLogger(CaptureConfig.class);

  /** The capture kind for HTTP and RPC requests. */
  public static final String KIND_REQUEST = "request";

  /** Default payload size limit in kilobytes. */
  public static final int DEFAULT_SIZE_LIMIT_KB = 64;

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "telescope.properties";

  static final String PROP_ENABLED = "telescope.enabled";
  static final String PROP_SIZE_LIMIT = "telescope.size-limit";
  static final String PROP_HIDDEN_RESPONSE = "telescope.hidden-response-parameters";
  static final String PROP_HIDDEN_REQUEST = "telescope.hidden-request-parameters";
  static final String PROP_HIDDEN_HEADERS = "telescope.hidden-request-headers";
  static final String PROP_IGNORE_PATHS = "telescope.ignore-paths";
  static final String PROP_ONLY_PATHS = "telescope.only-paths";
  static final String ENV_SIZE_LIMIT = "TELESCOPE_SIZE_LIMIT";

  private final Set<String> enabledKinds;
  private final int sizeLimitKb;
  private final List<String> hiddenResponseParameters;
  private final List<String> hiddenRequestParameters;
  private final Set<String> hiddenRequestHeaders;
  private final List<PathPattern> ignorePaths;
  private final List<PathPattern> onlyPaths;

  private CaptureConfig(Builder builder) {
    this.enabledKinds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.enabledKinds));
    this.sizeLimitKb = builder.sizeLimitKb;
    this.hiddenResponseParameters = List.copyOf(builder.hiddenResponseParameters);
    this.hiddenRequestParameters = List.copyOf(builder.hiddenRequestParameters);
    this.hiddenRequestHeaders = Collections.unmodifiableSet(new LinkedHashSet<>(builder.hiddenRequestHeaders));
    this.ignorePaths = List.copyOf(builder.ignorePaths);
    this.onlyPaths = List.copyOf(builder.onlyPaths);
  }

  /**
   * Creates a new builder populated with the defaults.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a config with every setting at its default.
   *
   * @return the default config
   */
  public static CaptureConfig defaults() {
    return builder().build();
  }

  /**
   * Loads {@value #RESOURCE} from the classpath, falling back to the defaults
   * when the resource is absent. The {@code TELESCOPE_SIZE_LIMIT} environment
   * variable overrides the size limit.
   *
   * @return the loaded config
   * @throws TelescopeException
   *             if the resource cannot be read or holds an invalid value
   */
  public static CaptureConfig load() throws TelescopeException {
    Properties properties = new Properties();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = CaptureConfig.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
        logger.debug("Loaded capture settings from {}", RESOURCE);
      }
    } catch (IOException e) {
      throw new TelescopeException("Failed to read " + RESOURCE + ": " + e.getMessage(), e);
    }
    return fromProperties(properties, System.getenv());
  }

  /**
   * Builds a config from properties. Keys that are absent keep their defaults;
   * list values are comma-separated.
   *
   * @param properties
   *            the properties
   * @return the config
   * @throws TelescopeException
   *             if a value is invalid
   */
  public static CaptureConfig fromProperties(Properties properties) throws TelescopeException {
    return fromProperties(properties, Map.of());
  }

  static CaptureConfig fromProperties(Properties properties, Map<String, String> env) throws TelescopeException {
    Builder builder = builder();
    if (properties.containsKey(PROP_ENABLED)) {
      builder.enabledKinds(split(properties.getProperty(PROP_ENABLED)));
    }
    String sizeLimit = env.get(ENV_SIZE_LIMIT);
    String sizeLimitSource = ENV_SIZE_LIMIT;
    if (sizeLimit == null || sizeLimit.isBlank()) {
      sizeLimit = properties.getProperty(PROP_SIZE_LIMIT);
      sizeLimitSource = PROP_SIZE_LIMIT;
    }
    if (sizeLimit != null && !sizeLimit.isBlank()) {
      builder.sizeLimitKb(parseSizeLimit(sizeLimitSource, sizeLimit.trim()));
    }
    if (properties.containsKey(PROP_HIDDEN_RESPONSE)) {
      builder.hiddenResponseParameters(split(properties.getProperty(PROP_HIDDEN_RESPONSE)));
    }
    if (properties.containsKey(PROP_HIDDEN_REQUEST)) {
      builder.hiddenRequestParameters(split(properties.getProperty(PROP_HIDDEN_REQUEST)));
    }
    if (properties.containsKey(PROP_HIDDEN_HEADERS)) {
      builder.hiddenRequestHeaders(split(properties.getProperty(PROP_HIDDEN_HEADERS)));
    }
    split(properties.getProperty(PROP_IGNORE_PATHS)).forEach(builder::ignorePath);
    split(properties.getProperty(PROP_ONLY_PATHS)).forEach(builder::onlyPath);
    return builder.build();
  }

  private static int parseSizeLimit(String source, String value) {
    int limit;
    try {
      limit = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw TelescopeException.invalidConfig(source, source + " must be an integer, got '" + value + "'", e);
    }
    if (limit < 0) {
      throw TelescopeException.invalidConfig(source, source + " must not be negative, got " + limit, null);
    }
    return limit;
  }

  private static List<String> split(String value) {
    List<String> items = new ArrayList<>();
    if (value == null) {
      return items;
    }
    for (String item : value.split(",")) {
      String trimmed = item.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  /**
   * Returns true if the given capture kind is enabled.
   *
   * @param kind
   *            the capture kind, e.g. {@value #KIND_REQUEST}
   * @return true if enabled
   */
  public boolean isEnabled(String kind) {
    return enabledKinds.contains(kind);
  }

  public Set<String> getEnabledKinds() {
    return enabledKinds;
  }

  /**
   * Returns the payload size limit in kilobytes (thousands of characters).
   *
   * @return the size limit
   */
  public int getSizeLimitKb() {
    return sizeLimitKb;
  }

  /**
   * Returns the dotted paths masked in response payloads.
   *
   * @return the hidden response paths
   */
  public List<String> getHiddenResponseParameters() {
    return hiddenResponseParameters;
  }

  /**
   * Returns the dotted paths masked in request payloads.
   *
   * @return the hidden request paths
   */
  public List<String> getHiddenRequestParameters() {
    return hiddenRequestParameters;
  }

  /**
   * Returns the lower-case names of request headers whose values are masked.
   *
   * @return the hidden header names
   */
  public Set<String> getHiddenRequestHeaders() {
    return hiddenRequestHeaders;
  }

  public List<PathPattern> getIgnorePaths() {
    return ignorePaths;
  }

  public List<PathPattern> getOnlyPaths() {
    return onlyPaths;
  }

  /**
   * Returns true if the path matches an only-path pattern, which forces capture
   * regardless of the ignore patterns.
   *
   * @param path
   *            the request path
   * @return true if forced
   */
  public boolean isPatchOnly(String path) {
    return matchesAny(onlyPaths, path);
  }

  /**
   * Returns true if the path matches an ignore pattern.
   *
   * @param path
   *            the request path
   * @return true if ignored
   */
  public boolean isPathIgnored(String path) {
    return matchesAny(ignorePaths, path);
  }

  private static boolean matchesAny(List<PathPattern> patterns, String path) {
    for (PathPattern pattern : patterns) {
      if (pattern.matches(path)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a builder seeded with this config's values.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.enabledKinds(enabledKinds);
    builder.sizeLimitKb = sizeLimitKb;
    builder.hiddenResponseParameters(hiddenResponseParameters);
    builder.hiddenRequestParameters(hiddenRequestParameters);
    builder.hiddenRequestHeaders(hiddenRequestHeaders);
    builder.ignorePaths.addAll(ignorePaths);
    builder.onlyPaths.addAll(onlyPaths);
    return builder;
  }

  @Override
  public String toString() {
    return "CaptureConfig{enabledKinds=" + enabledKinds + ", sizeLimitKb=" + sizeLimitKb
        + ", hiddenResponseParameters=" + hiddenResponseParameters + ", hiddenRequestParameters="
        + hiddenRequestParameters + ", hiddenRequestHeaders=" + hiddenRequestHeaders + ", ignorePaths="
        + ignorePaths + ", onlyPaths=" + onlyPaths + "}";
  }

  /**
   * Builder for CaptureConfig.
   */
  public static class Builder {
    private final Set<String> enabledKinds = new LinkedHashSet<>(List.of(KIND_REQUEST));
    private int sizeLimitKb = DEFAULT_SIZE_LIMIT_KB;
    private final List<String> hiddenResponseParameters = new ArrayList<>();
    private final List<String> hiddenRequestParameters = new ArrayList<>(
        List.of("password", "password_confirmation"));
    private final Set<String> hiddenRequestHeaders = new LinkedHashSet<>(List.of("authorization"));
    private final List<PathPattern> ignorePaths = new ArrayList<>();
    private final List<PathPattern> onlyPaths = new ArrayList<>();

    public Builder enabledKinds(Collection<String> kinds) {
      enabledKinds.clear();
      enabledKinds.addAll(kinds);
      return this;
    }

    public Builder enable(String kind) {
      enabledKinds.add(kind);
      return this;
    }

    public Builder disable(String kind) {
      enabledKinds.remove(kind);
      return this;
    }

    public Builder sizeLimitKb(int sizeLimitKb) {
      if (sizeLimitKb < 0) {
        throw new IllegalArgumentException("sizeLimitKb must not be negative");
      }
      this.sizeLimitKb = sizeLimitKb;
      return this;
    }

    public Builder hiddenResponseParameters(Collection<String> paths) {
      hiddenResponseParameters.clear();
      hiddenResponseParameters.addAll(paths);
      return this;
    }

    public Builder hideResponseParameter(String path) {
      hiddenResponseParameters.add(path);
      return this;
    }

    public Builder hiddenRequestParameters(Collection<String> paths) {
      hiddenRequestParameters.clear();
      hiddenRequestParameters.addAll(paths);
      return this;
    }

    public Builder hideRequestParameter(String path) {
      hiddenRequestParameters.add(path);
      return this;
    }

    public Builder hiddenRequestHeaders(Collection<String> names) {
      hiddenRequestHeaders.clear();
      names.forEach(this::hideRequestHeader);
      return this;
    }

    public Builder hideRequestHeader(String name) {
      hiddenRequestHeaders.add(name.toLowerCase(Locale.ROOT));
      return this;
    }

    public Builder ignorePath(String pattern) {
      ignorePaths.add(PathPattern.of(pattern));
      return this;
    }

    public Builder onlyPath(String pattern) {
      onlyPaths.add(PathPattern.of(pattern));
      return this;
    }

    public CaptureConfig build() {
      return new CaptureConfig(this);
    }
  }
}
