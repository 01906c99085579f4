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
package net.metricsplit.data;

import java.util.Comparator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

/**
 * Identifies a single time series within a query response by its metric
 * name and the set of tag (label) key and value pairs. Tags are kept sorted by
 * key so that two IDs with the same contents are always equal, regardless of
 * the order the tags were added in.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = TimeSeriesId.Builder.class)
public final class TimeSeriesId implements Comparable<TimeSeriesId> {

  /** The metric name, may be empty for label-only series. */
  private final String metric;

  /** The sorted, immutable tag map. */
  private final ImmutableSortedMap<String, String> tags;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  private TimeSeriesId(final Builder builder) {
    metric = Strings.nullToEmpty(builder.metric);
    tags = ImmutableSortedMap.copyOf(builder.tags);
    if (metric.isEmpty() && tags.isEmpty()) {
      throw new IllegalArgumentException("A time series ID must have a "
          + "metric or at least one tag.");
    }
  }

  /** @return The metric name, may be empty but never null. */
  @JsonProperty("metric")
  public String metric() {
    return metric;
  }

  /** @return The non-null, possibly empty, sorted tag map. */
  @JsonProperty("tags")
  public SortedMap<String, String> tags() {
    return tags;
  }

  @Override
  public int compareTo(final TimeSeriesId other) {
    return ComparisonChain.start()
        .compare(metric, other.metric)
        .compare(tags.entrySet(), other.tags.entrySet(),
            Ordering.from(ENTRY_COMPARATOR).lexicographical())
        .result();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeSeriesId other = (TimeSeriesId) o;
    return Objects.equal(metric, other.metric)
        && Objects.equal(tags, other.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(metric, tags);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(metric)
        .append("{");
    int i = 0;
    for (final Entry<String, String> entry : tags.entrySet()) {
      if (i++ > 0) {
        buf.append(", ");
      }
      buf.append(entry.getKey())
         .append("=\"")
         .append(entry.getValue())
         .append("\"");
    }
    return buf.append("}").toString();
  }

  /** Orders tag pairs by key then value. */
  private static final Comparator<Entry<String, String>> ENTRY_COMPARATOR =
      new Comparator<Entry<String, String>>() {
    @Override
    public int compare(final Entry<String, String> a,
                       final Entry<String, String> b) {
      return ComparisonChain.start()
          .compare(a.getKey(), b.getKey())
          .compare(a.getValue(), b.getValue())
          .result();
    }
  };

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** Builder for the ID. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String metric;
    @JsonProperty
    private Map<String, String> tags = Maps.newTreeMap();

    /**
     * @param metric The metric name.
     * @return The builder.
     */
    public Builder setMetric(final String metric) {
      this.metric = metric;
      return this;
    }

    /**
     * Replaces the tags with a copy of the given map.
     * @param tags A map of tags, may be null.
     * @return The builder.
     */
    public Builder setTags(final Map<String, String> tags) {
      this.tags = Maps.newTreeMap();
      if (tags != null) {
        for (final Entry<String, String> entry : tags.entrySet()) {
          addTag(entry.getKey(), entry.getValue());
        }
      }
      return this;
    }

    /**
     * Adds or replaces a tag pair.
     * @param key A non-null and non-empty tag key.
     * @param value A non-null tag value.
     * @return The builder.
     * @throws IllegalArgumentException if the key was null or empty or the
     * value was null.
     */
    public Builder addTag(final String key, final String value) {
      if (Strings.isNullOrEmpty(key)) {
        throw new IllegalArgumentException("Tag key cannot be null or empty.");
      }
      if (value == null) {
        throw new IllegalArgumentException("Tag value cannot be null for key: "
            + key);
      }
      tags.put(key, value);
      return this;
    }

    /** @return The immutable ID. */
    public TimeSeriesId build() {
      return new TimeSeriesId(this);
    }
  }
}
