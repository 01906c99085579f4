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

import java.util.List;

import com.google.common.collect.Lists;

import net.metricsplit.data.TimeRange;
import net.metricsplit.query.QueryRequest;

/**
 * Splits a query time range into step aligned partitions of roughly the
 * ideal chunk size. The range is first expanded outward so that both ends
 * fall on the step grid, then the grid points are grouped from the newest
 * end. Every partition except the earliest holds exactly
 * {@code max(chunk / step, 1)} points, so the remainder is always at the
 * oldest end of the range.
 * <p>
 * Groups are computed arithmetically so a large range with a tiny step never
 * materializes its grid.
 *
 * @since 1.0
 */
public final class RangePartitioner {

  /** Upper bound on the number of partitions a single split may produce. */
  public static final long MAX_PARTITIONS = Integer.MAX_VALUE - 8;

  private RangePartitioner() {
    // static utility
  }

  /**
   * Expands the range so both ends lie on the step grid. The start is
   * rounded down and the end rounded up.
   * @param start The start timestamp in ms.
   * @param end The end timestamp in ms.
   * @param step The step in ms, 1 or greater.
   * @return The aligned range.
   * @throws IllegalArgumentException if the step was less than 1, the start
   * was after the end or the aligned end overflowed.
   */
  public static TimeRange expandTimeRange(final long start,
                                          final long end,
                                          final long step) {
    if (step < 1) {
      throw new IllegalArgumentException("Step must be 1 or greater: " + step);
    }
    if (start > end) {
      throw new IllegalArgumentException("Start time " + start
          + " cannot be greater than the end time " + end);
    }
    final long aligned_start = start - Math.floorMod(start, step);
    final long end_offset = Math.floorMod(end, step);
    final long aligned_end;
    if (end_offset == 0) {
      aligned_end = end;
    } else {
      try {
        aligned_end = Math.addExact(end, step - end_offset);
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("End time " + end 
            + " cannot be aligned to step " + step, e);
      }
    }
    return new TimeRange(aligned_start, aligned_end);
  }

  /**
   * Splits the range into aligned partitions.
   * @param start The start timestamp in ms.
   * @param end The end timestamp in ms.
   * @param step The step in ms, 1 or greater.
   * @param ideal_chunk_size The target duration of a partition in ms, 1 or
   * greater.
   * @return A non-empty list of partitions, earliest first.
   * @throws IllegalArgumentException if an argument was invalid or the range
   * would produce too many partitions.
   */
  public static List<TimeRange> split(final long start,
                                      final long end,
                                      final long step,
                                      final long ideal_chunk_size) {
    if (ideal_chunk_size < 1) {
      throw new IllegalArgumentException("Ideal chunk size must be 1 or "
          + "greater: " + ideal_chunk_size);
    }
    final TimeRange aligned = expandTimeRange(start, end, step);
    
    // the span can exceed a long for extreme ranges, so count in steps
    final long intervals = 
        Long.divideUnsigned(aligned.end() - aligned.start(), step);
    if (intervals < 0 || intervals == Long.MAX_VALUE) {
      throw new IllegalArgumentException("Range " + aligned 
          + " has too many points for step " + step);
    }
    final long points = intervals + 1;
    final long points_per_chunk = Math.max(ideal_chunk_size / step, 1);
    final long chunks = (points / points_per_chunk) 
        + (points % points_per_chunk == 0 ? 0 : 1);
    if (chunks > MAX_PARTITIONS) {
      throw new IllegalArgumentException("Range " + aligned + " with step " 
          + step + " would produce " + chunks + " partitions");
    }
    
    final List<TimeRange> partitions = 
        Lists.newArrayListWithCapacity((int) chunks);
    // chunk 0 is the newest, walk backwards so the result is earliest first
    for (long chunk = chunks - 1; chunk >= 0; chunk--) {
      final long newest_point = chunk * points_per_chunk;
      // the next chunk boundary can overflow near Long.MAX_VALUE points
      final long oldest_point = points - 1 - newest_point < points_per_chunk ? 
          points - 1 : newest_point + points_per_chunk - 1;
      partitions.add(new TimeRange(
          aligned.end() - (oldest_point * step),
          aligned.end() - (newest_point * step)));
    }
    return partitions;
  }

  /**
   * Splits the range of the request using its step.
   * @param request A non-null request.
   * @param ideal_chunk_size The target duration of a partition in ms.
   * @return A non-empty list of partitions, earliest first.
   * @throws IllegalArgumentException if the request was null or an argument
   * was invalid.
   */
  public static List<TimeRange> split(final QueryRequest request,
                                      final long ideal_chunk_size) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    return split(request.range().start(), request.range().end(), 
        request.step(), ideal_chunk_size);
  }
}
