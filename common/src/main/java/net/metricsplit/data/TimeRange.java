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
import com.google.common.collect.ComparisonChain;

/**
 * An immutable, inclusive range of time in Unix epoch milliseconds. The
 * start is always less than or equal to the end. A range where both are the
 * same represents a single instant.
 *
 * @since 1.0
 */
public final class TimeRange implements Comparable<TimeRange> {

  /** The inclusive start of the range in ms. */
  private final long start;

  /** The inclusive end of the range in ms. */
  private final long end;

  /**
   * Default ctor.
   * @param start The start timestamp in Unix epoch milliseconds.
   * @param end The end timestamp in Unix epoch milliseconds.
   * @throws IllegalArgumentException if the start was greater than the end.
   */
  @JsonCreator
  public TimeRange(@JsonProperty("start") final long start,
                   @JsonProperty("end") final long end) {
    if (start > end) {
      throw new IllegalArgumentException("Start time " + start
          + " cannot be greater than the end time " + end);
    }
    this.start = start;
    this.end = end;
  }

  /** @return The inclusive start of the range in Unix epoch ms. */
  @JsonProperty("start")
  public long start() {
    return start;
  }

  /** @return The inclusive end of the range in Unix epoch ms. */
  @JsonProperty("end")
  public long end() {
    return end;
  }

  /** @return The width of the range in milliseconds. May be zero. */
  public long duration() {
    return end - start;
  }

  /**
   * @param timestamp A timestamp in Unix epoch ms.
   * @return True if the timestamp falls within the range, inclusive.
   */
  public boolean contains(final long timestamp) {
    return timestamp >= start && timestamp <= end;
  }

  @Override
  public int compareTo(final TimeRange other) {
    return ComparisonChain.start()
        .compare(start, other.start)
        .compare(end, other.end)
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
    final TimeRange other = (TimeRange) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("[")
        .append(start)
        .append(", ")
        .append(end)
        .append("]")
        .toString();
  }
}
