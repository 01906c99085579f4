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
package net.metricsplit.query.merge;

import java.util.List;
import java.util.Map.Entry;

import com.google.common.collect.Lists;

import net.metricsplit.data.Sample;
import net.metricsplit.data.TimeSeries;
import net.metricsplit.data.TimeSeriesId;
import net.metricsplit.query.QueryRequest;
import net.metricsplit.query.QueryResponse;

/**
 * The default merger. Series are matched by their {@link TimeSeriesId} and 
 * their samples joined with a linear merge since both sides are sorted. When
 * both sides carry a sample for the same timestamp the accumulator's sample
 * is kept. Series present on one side only are carried over untouched, the
 * accumulator's series first.
 * <p>
 * The limit is reached once the total number of samples meets the request's
 * {@link QueryRequest#maxSamples()}. A limit of 0 never stops the query.
 *
 * @since 1.0
 */
public class TimeSeriesResponseMerger implements ResponseMerger {

  @Override
  public QueryResponse combine(final QueryResponse accumulator,
                               final QueryResponse partial) {
    if (partial == null) {
      throw new IllegalArgumentException("Partial response cannot be null.");
    }
    if (accumulator == null) {
      return partial;
    }
    if (partial.isEmpty()) {
      return accumulator;
    }
    
    final QueryResponse.Builder builder = QueryResponse.newBuilder()
        .setRequestId(accumulator.requestId())
        .setState(accumulator.state());
    for (final TimeSeries ts : accumulator.series()) {
      final TimeSeries other = partial.getSeries(ts.id());
      if (other == null) {
        builder.addSeries(ts);
      } else {
        builder.addSeries(merge(ts, other));
      }
    }
    for (final Entry<TimeSeriesId, TimeSeries> entry : 
        partial.seriesMap().entrySet()) {
      if (accumulator.getSeries(entry.getKey()) == null) {
        builder.addSeries(entry.getValue());
      }
    }
    return builder.build();
  }

  @Override
  public boolean limitReached(final QueryRequest request,
                              final QueryResponse response) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (response == null) {
      throw new IllegalArgumentException("Response cannot be null.");
    }
    return request.maxSamples() > 0 && 
        response.sampleCount() >= request.maxSamples();
  }

  /**
   * Merges the samples of two series with the same ID.
   * @param first The series from the accumulator, wins on duplicates.
   * @param second The series from the partial response.
   * @return A new series with the sorted union of the samples.
   */
  static TimeSeries merge(final TimeSeries first, final TimeSeries second) {
    if (second.isEmpty()) {
      return first;
    }
    if (first.isEmpty()) {
      return new TimeSeries(first.id(), second.samples());
    }
    final List<Sample> left = first.samples();
    final List<Sample> right = second.samples();
    
    // fast paths when the partitions don't interleave
    if (left.get(left.size() - 1).timestamp() < right.get(0).timestamp()) {
      final List<Sample> samples = 
          Lists.newArrayListWithCapacity(left.size() + right.size());
      samples.addAll(left);
      samples.addAll(right);
      return new TimeSeries(first.id(), samples);
    }
    if (right.get(right.size() - 1).timestamp() < left.get(0).timestamp()) {
      final List<Sample> samples = 
          Lists.newArrayListWithCapacity(left.size() + right.size());
      samples.addAll(right);
      samples.addAll(left);
      return new TimeSeries(first.id(), samples);
    }
    
    final List<Sample> samples = 
        Lists.newArrayListWithCapacity(left.size() + right.size());
    int i = 0;
    int j = 0;
    while (i < left.size() && j < right.size()) {
      final Sample l = left.get(i);
      final Sample r = right.get(j);
      if (l.timestamp() < r.timestamp()) {
        samples.add(l);
        i++;
      } else if (l.timestamp() > r.timestamp()) {
        samples.add(r);
        j++;
      } else {
        samples.add(l);
        i++;
        j++;
      }
    }
    while (i < left.size()) {
      samples.add(left.get(i++));
    }
    while (j < right.size()) {
      samples.add(right.get(j++));
    }
    return new TimeSeries(first.id(), samples);
  }
}
