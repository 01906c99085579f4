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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * A single immutable numeric observation of a time series at a timestamp in
 * Unix epoch milliseconds.
 *
 * @since 1.0
 */
public final class Sample {

  /** The timestamp in Unix epoch ms. */
  private final long timestamp;

  /** The value, may be NaN. */
  private final double value;

  /**
   * Default ctor.
   * @param timestamp The timestamp in Unix epoch milliseconds.
   * @param value The value. May be NaN.
   */
  @JsonCreator
  public Sample(@JsonProperty("timestamp") final long timestamp,
                @JsonProperty("value") final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  /** @return The timestamp in Unix epoch ms. */
  @JsonProperty("timestamp")
  public long timestamp() {
    return timestamp;
  }

  /** @return The value of the sample. */
  @JsonProperty("value")
  public double value() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Sample other = (Sample) o;
    return timestamp == other.timestamp
        && Double.compare(value, other.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, value);
  }

  @Override
  public String toString() {
    return timestamp + "=" + value;
  }
}
