// This file is part of OpenTSDB.
// Copyright (C) 2022  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.metricsplit.query.split;

import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import net.metricsplit.utils.DateTime;

/**
 * A small helper config that determines how metric queries are split into
 * partitions at runtime. The chunk size is the ideal duration covered by a
 * single partition before it is aligned to the query step, e.g. "1m" or
 * "500ms". The optional timeout bounds each partition's execution.
 * <p>
 * Loaded from the {@code metricsplit.query.split} block of a Typesafe
 * {@link Config}; defaults live in {@code reference.conf}.
 *
 * @since 1.0
 */
public class SplitConfig {

  /** The config key for the ideal chunk duration. */
  public static final String CHUNK_SIZE_KEY = "metricsplit.query.split.chunk_size";

  /** The config key for the per partition timeout. */
  public static final String TIMEOUT_KEY = "metricsplit.query.split.timeout";

  /** The chunk size used when nothing is configured. */
  public static final String DEFAULT_CHUNK_SIZE = "1m";

  /** The raw chunk size config from the user. */
  protected final String config;

  /** The chunk size in milliseconds. */
  protected final long chunk_size;

  /** The units of the configured chunk size. */
  protected final String units;

  /** The raw timeout config, null when disabled. */
  protected final String timeout_config;

  /** The timeout in milliseconds, 0 when disabled. */
  protected final long timeout;

  /**
   * Ctor without a timeout.
   * @param config A non-null and non-empty duration, e.g. "1m" or "30s".
   * @throws IllegalArgumentException if the duration couldn't be parsed.
   */
  public SplitConfig(final String config) {
    this(config, null);
  }

  /**
   * Default ctor.
   * @param config A non-null and non-empty duration, e.g. "1m" or "30s".
   * @param timeout An optional timeout duration. Null, empty or "0" disables
   * the timeout.
   * @throws IllegalArgumentException if either duration couldn't be parsed.
   */
  public SplitConfig(final String config, final String timeout) {
    if (Strings.isNullOrEmpty(config)) {
      throw new IllegalArgumentException("Chunk size cannot be null or empty.");
    }
    this.config = config.trim();
    chunk_size = DateTime.parseDuration(this.config);
    units = DateTime.getDurationUnits(this.config);

    if (Strings.isNullOrEmpty(timeout) || timeout.trim().equals("0")) {
      timeout_config = null;
      this.timeout = 0;
    } else {
      timeout_config = timeout.trim();
      this.timeout = DateTime.parseDuration(timeout_config);
    }
  }

  /** @return The ideal chunk size in milliseconds, always positive. */
  public long getChunkSize() {
    return chunk_size;
  }

  /** @return The raw chunk size config string. */
  public String getStringConfig() {
    return config;
  }

  /** @return The units of the chunk size, e.g. "m". */
  public String getUnits() {
    return units;
  }

  /** @return The per partition timeout in ms, 0 if disabled. */
  public long getTimeout() {
    return timeout;
  }

  /** @return Whether or not a per partition timeout is configured. */
  public boolean hasTimeout() {
    return timeout > 0;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("chunkSize=")
        .append(config)
        .append(", timeout=")
        .append(timeout_config == null ? "none" : timeout_config)
        .toString();
  }

  /**
   * Loads the split config from the given Typesafe config, falling back to
   * the default chunk size if the key is missing.
   * @param config A non-null config.
   * @return The parsed split config.
   * @throws IllegalArgumentException if a value was present but invalid.
   */
  public static SplitConfig fromConfig(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    try {
      final String chunk_size = config.hasPath(CHUNK_SIZE_KEY) ?
          config.getString(CHUNK_SIZE_KEY) : DEFAULT_CHUNK_SIZE;
      final String timeout = config.hasPath(TIMEOUT_KEY) ?
          config.getString(TIMEOUT_KEY) : null;
      return new SplitConfig(chunk_size, timeout);
    } catch (ConfigException e) {
      throw new IllegalArgumentException("Invalid split configuration", e);
    }
  }

  /**
   * @return The split config loaded from the default Typesafe sources, i.e.
   * system properties, {@code application.conf} and {@code reference.conf}.
   */
  public static SplitConfig load() {
    return fromConfig(ConfigFactory.load());
  }
}
