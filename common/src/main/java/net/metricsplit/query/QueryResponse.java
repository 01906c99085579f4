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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.metricsplit.data.TimeSeries;
import net.metricsplit.data.TimeSeriesId;

/**
 * An immutable query response: a set of time series keyed by their ID, in
 * insertion order, along with the loading state and an optional error. While
 * a partitioned query runs, each new accumulated response replaces the
 * previous one; responses are never modified in place. Use
 * {@link #withState(LoadingState)} or {@link #withError(Throwable)} to derive
 * a copy with different status.
 * <p>
 * The error is never serialized.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = QueryResponse.Builder.class)
public final class QueryResponse {

  /** The ID of the request this response answers. May be null. */
  private final String request_id;

  /** The series keyed by ID in insertion order. */
  private final ImmutableMap<TimeSeriesId, TimeSeries> series;

  /** The state of the response. */
  private final LoadingState state;

  /** An optional error, set with an {@link LoadingState#ERROR} state. */
  private final Throwable error;

  /** Cached total sample count. */
  private final long sample_count;

  /**
   * Private ctor for the builder.
   * @param builder A non-null builder.
   */
  private QueryResponse(final Builder builder) {
    request_id = builder.requestId;
    series = ImmutableMap.copyOf(builder.series);
    state = builder.state == null ? LoadingState.RUNNING : builder.state;
    error = builder.error;
    long count = 0;
    for (final TimeSeries ts : series.values()) {
      count += ts.size();
    }
    sample_count = count;
  }

  /** @return The request ID this response is for. May be null. */
  @JsonProperty("requestId")
  public String requestId() {
    return request_id;
  }

  /** @return The non-null, possibly empty, series in insertion order. */
  @JsonProperty("series")
  public Collection<TimeSeries> series() {
    return series.values();
  }

  /** @return The non-null, possibly empty, map of series keyed by ID. */
  @JsonIgnore
  public Map<TimeSeriesId, TimeSeries> seriesMap() {
    return series;
  }

  /**
   * @param id A non-null ID.
   * @return The series with the given ID or null if not present.
   */
  public TimeSeries getSeries(final TimeSeriesId id) {
    return series.get(id);
  }

  /** @return The state of the response. */
  @JsonProperty("state")
  public LoadingState state() {
    return state;
  }

  /** @return An optional error that terminated the query. */
  @JsonIgnore
  public Throwable error() {
    return error;
  }

  /** @return The total number of samples over all series. */
  @JsonIgnore
  public long sampleCount() {
    return sample_count;
  }

  /** @return True if the response has no series. */
  @JsonIgnore
  public boolean isEmpty() {
    return series.isEmpty();
  }

  /**
   * Returns a copy of this response with the given state. The series are 
   * shared as they're immutable.
   * @param state A non-null state.
   * @return A new response, or this one if the state was unchanged.
   */
  public QueryResponse withState(final LoadingState state) {
    if (state == null) {
      throw new IllegalArgumentException("State cannot be null.");
    }
    if (state == this.state) {
      return this;
    }
    return newBuilder(this)
        .setState(state)
        .build();
  }

  /**
   * Returns a copy of this response with the error attached and the state
   * set to {@link LoadingState#ERROR}.
   * @param error A non-null error.
   * @return A new response.
   */
  public QueryResponse withError(final Throwable error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return newBuilder(this)
        .setState(LoadingState.ERROR)
        .setError(error)
        .build();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QueryResponse other = (QueryResponse) o;
    return Objects.equal(request_id, other.request_id)
        && Objects.equal(series, other.series)
        && state == other.state
        && Objects.equal(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(request_id, series, state);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("requestId=")
        .append(request_id)
        .append(", state=")
        .append(state)
        .append(", series=")
        .append(series.size())
        .append(", samples=")
        .append(sample_count)
        .append(", error=")
        .append(error)
        .toString();
  }

  /**
   * @param request_id An optional request ID.
   * @return An empty response in the {@link LoadingState#RUNNING} state.
   */
  public static QueryResponse empty(final String request_id) {
    return newBuilder()
        .setRequestId(request_id)
        .build();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @param response A non-null response to copy.
   * @return A builder populated with the response's fields.
   */
  public static Builder newBuilder(final QueryResponse response) {
    final Builder builder = new Builder()
        .setRequestId(response.request_id)
        .setState(response.state)
        .setError(response.error);
    builder.series.putAll(response.series);
    return builder;
  }

  /** The builder. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String requestId;
    @JsonProperty
    private LoadingState state;
    private Throwable error;
    private final Map<TimeSeriesId, TimeSeries> series = 
        Maps.newLinkedHashMap();

    /**
     * @param requestId The request ID the response answers.
     * @return The builder.
     */
    public Builder setRequestId(final String requestId) {
      this.requestId = requestId;
      return this;
    }

    /**
     * @param state The state of the response.
     * @return The builder.
     */
    public Builder setState(final LoadingState state) {
      this.state = state;
      return this;
    }

    /**
     * @param error An optional error.
     * @return The builder.
     */
    @JsonIgnore
    public Builder setError(final Throwable error) {
      this.error = error;
      return this;
    }

    /**
     * Replaces the series with the given list.
     * @param series A list of series with unique IDs. May be null.
     * @return The builder.
     * @throws IllegalArgumentException if a series ID was duplicated.
     */
    @JsonProperty("series")
    public Builder setSeries(final List<TimeSeries> series) {
      this.series.clear();
      if (series != null) {
        for (final TimeSeries ts : series) {
          addSeries(ts);
        }
      }
      return this;
    }

    /**
     * Adds a series to the response.
     * @param ts A non-null series with an ID not yet present.
     * @return The builder.
     * @throws IllegalArgumentException if the series was null or a series with
     * the same ID was already added.
     */
    public Builder addSeries(final TimeSeries ts) {
      if (ts == null) {
        throw new IllegalArgumentException("Series cannot be null.");
      }
      if (series.containsKey(ts.id())) {
        throw new IllegalArgumentException("Duplicate series: " + ts.id());
      }
      series.put(ts.id(), ts);
      return this;
    }

    /**
     * Adds or replaces a series in the response.
     * @param ts A non-null series.
     * @return The builder.
     */
    public Builder putSeries(final TimeSeries ts) {
      if (ts == null) {
        throw new IllegalArgumentException("Series cannot be null.");
      }
      series.put(ts.id(), ts);
      return this;
    }

    /** @return The immutable response. */
    public QueryResponse build() {
      return new QueryResponse(this);
    }
  }
}
