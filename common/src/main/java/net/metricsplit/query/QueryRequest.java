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
package net.metricsplit.query;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.metricsplit.data.TimeRange;

/**
 * An immutable metric range query as handed to the partitioned executor and,
 * with an overridden range and request ID, to the downstream execution for
 * each partition. Fields the engine does not understand travel in the
 * {@link #options()} map and are copied untouched to every sub-request.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = QueryRequest.Builder.class)
public final class QueryRequest {

  /** The time range of the query. */
  private final TimeRange range;

  /** The sampling step in milliseconds. */
  private final long step;

  /** The ID used to correlate executions. */
  private final String request_id;

  /** The query expression, passed through. */
  private final String query;

  /** The maximum number of samples to gather, 0 for no limit. */
  private final long max_samples;

  /** Pass-through fields. */
  private final ImmutableMap<String, String> options;

  /**
   * Private ctor for the builder.
   * @param builder A non-null builder.
   */
  private QueryRequest(final Builder builder) {
    if (builder.range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    if (builder.step < 1) {
      throw new IllegalArgumentException("Step must be at least 1ms: " 
          + builder.step);
    }
    if (Strings.isNullOrEmpty(builder.requestId)) {
      throw new IllegalArgumentException("Request ID cannot be null or empty.");
    }
    if (builder.maxSamples < 0) {
      throw new IllegalArgumentException("Max samples cannot be negative: " 
          + builder.maxSamples);
    }
    range = builder.range;
    step = builder.step;
    request_id = builder.requestId;
    query = builder.query;
    max_samples = builder.maxSamples;
    options = builder.options == null ? ImmutableMap.<String, String>of() 
        : ImmutableMap.copyOf(builder.options);
  }

  /** @return The non-null time range. */
  @JsonProperty("range")
  public TimeRange range() {
    return range;
  }

  /** @return The step between samples in milliseconds, at least 1. */
  @JsonProperty("step")
  public long step() {
    return step;
  }

  /** @return The non-null and non-empty request ID. */
  @JsonProperty("requestId")
  public String requestId() {
    return request_id;
  }

  /** @return The query expression. May be null. */
  @JsonProperty("query")
  public String query() {
    return query;
  }

  /** @return The max number of samples to collect or 0 if unlimited. */
  @JsonProperty("maxSamples")
  public long maxSamples() {
    return max_samples;
  }

  /** @return The non-null, possibly empty, map of pass-through options. */
  @JsonProperty("options")
  public Map<String, String> options() {
    return options;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QueryRequest other = (QueryRequest) o;
    return Objects.equal(range, other.range)
        && step == other.step
        && Objects.equal(request_id, other.request_id)
        && Objects.equal(query, other.query)
        && max_samples == other.max_samples
        && Objects.equal(options, other.options);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(range, step, request_id, query, max_samples, 
        options);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("requestId=")
        .append(request_id)
        .append(", range=")
        .append(range)
        .append(", step=")
        .append(step)
        .append(", query=")
        .append(query)
        .append(", maxSamples=")
        .append(max_samples)
        .append(", options=")
        .append(options)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * A builder seeded with every field of the given request.
   * @param request A non-null request to clone.
   * @return A new builder populated from the request.
   */
  public static Builder newBuilder(final QueryRequest request) {
    return new Builder()
        .setRange(request.range)
        .setStep(request.step)
        .setRequestId(request.request_id)
        .setQuery(request.query)
        .setMaxSamples(request.max_samples)
        .setOptions(request.options);
  }

  /** The builder. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private TimeRange range;
    @JsonProperty
    private long step;
    @JsonProperty
    private String requestId;
    @JsonProperty
    private String query;
    @JsonProperty
    private long maxSamples;
    @JsonProperty
    private Map<String, String> options;

    /**
     * @param range The non-null time range to query.
     * @return The builder.
     */
    public Builder setRange(final TimeRange range) {
      this.range = range;
      return this;
    }

    /**
     * @param step The sampling step in milliseconds, at least 1.
     * @return The builder.
     */
    public Builder setStep(final long step) {
      this.step = step;
      return this;
    }

    /**
     * @param requestId A non-null and non-empty ID.
     * @return The builder.
     */
    public Builder setRequestId(final String requestId) {
      this.requestId = requestId;
      return this;
    }

    /**
     * @param query The query expression.
     * @return The builder.
     */
    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }

    /**
     * @param maxSamples The sample limit, 0 for unlimited.
     * @return The builder.
     */
    public Builder setMaxSamples(final long maxSamples) {
      this.maxSamples = maxSamples;
      return this;
    }

    /**
     * @param options A map of pass-through options, copied. May be null.
     * @return The builder.
     */
    public Builder setOptions(final Map<String, String> options) {
      this.options = options == null ? null : Maps.newHashMap(options);
      return this;
    }

    /**
     * Adds a single pass-through option.
     * @param key A non-null key.
     * @param value A non-null value.
     * @return The builder.
     */
    public Builder addOption(final String key, final String value) {
      if (options == null) {
        options = Maps.newHashMap();
      }
      options.put(key, value);
      return this;
    }

    /** @return The immutable request. */
    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }
}
