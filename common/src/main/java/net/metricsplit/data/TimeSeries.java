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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * An immutable time series: an ID and a list of samples in strictly
 * ascending timestamp order. No two samples share a timestamp.
 *
 * @since 1.0
 */
public final class TimeSeries {

  /** The non-null ID. */
  private final TimeSeriesId id;

  /** The ordered samples. */
  private final ImmutableList<Sample> samples;

  /**
   * Default ctor.
   * @param id A non-null ID.
   * @param samples A list of samples in strictly ascending time order. May be
   * null or empty.
   * @throws IllegalArgumentException if the ID was null, a sample was null or
   * the samples were out of order or duplicated.
   */
  @JsonCreator
  public TimeSeries(@JsonProperty("id") final TimeSeriesId id,
                    @JsonProperty("samples") final List<Sample> samples) {
    if (id == null) {
      throw new IllegalArgumentException("ID cannot be null.");
    }
    this.id = id;
    if (samples == null || samples.isEmpty()) {
      this.samples = ImmutableList.of();
      return;
    }
    long last = Long.MIN_VALUE;
    for (int i = 0; i < samples.size(); i++) {
      final Sample sample = samples.get(i);
      if (sample == null) {
        throw new IllegalArgumentException("Null sample at index " + i
            + " for series " + id);
      }
      if (i > 0 && sample.timestamp() <= last) {
        throw new IllegalArgumentException("Sample at index " + i 
            + " with timestamp " + sample.timestamp() 
            + " is out of order or duplicated for series " + id);
      }
      last = sample.timestamp();
    }
    this.samples = ImmutableList.copyOf(samples);
  }

  /** @return The non-null ID of the series. */
  @JsonProperty("id")
  public TimeSeriesId id() {
    return id;
  }

  /** @return The non-null, possibly empty, immutable list of samples. */
  @JsonProperty("samples")
  public List<Sample> samples() {
    return samples;
  }

  /** @return The number of samples in the series. */
  public int size() {
    return samples.size();
  }

  /** @return Whether or not the series has any samples. */
  @JsonIgnore
  public boolean isEmpty() {
    return samples.isEmpty();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeSeries other = (TimeSeries) o;
    return Objects.equal(id, other.id)
        && Objects.equal(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, samples);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("id=")
        .append(id)
        .append(", samples=")
        .append(samples)
        .toString();
  }
}
