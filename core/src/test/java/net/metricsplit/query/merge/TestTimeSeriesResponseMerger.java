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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Iterator;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.metricsplit.data.Sample;
import net.metricsplit.data.TimeRange;
import net.metricsplit.data.TimeSeries;
import net.metricsplit.data.TimeSeriesId;
import net.metricsplit.query.LoadingState;
import net.metricsplit.query.QueryRequest;
import net.metricsplit.query.QueryResponse;

public class TestTimeSeriesResponseMerger {
  private static final TimeSeriesId ID_A = TimeSeriesId.newBuilder()
      .setMetric("sys.cpu.user")
      .addTag("host", "web01")
      .build();
  private static final TimeSeriesId ID_B = TimeSeriesId.newBuilder()
      .setMetric("sys.cpu.user")
      .addTag("host", "web02")
      .build();
  
  private TimeSeriesResponseMerger merger;
  
  @Before
  public void before() throws Exception {
    merger = new TimeSeriesResponseMerger();
  }
  
  @Test
  public void combineNullAccumulator() throws Exception {
    final QueryResponse partial = response("A_3", series(ID_A, 50, 60));
    assertSame(partial, merger.combine(null, partial));
    
    try {
      merger.combine(partial, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void combineEmptyPartial() throws Exception {
    final QueryResponse acc = response("A_3", series(ID_A, 50, 60));
    assertSame(acc, merger.combine(acc, response("A_2")));
  }
  
  @Test
  public void combineOlderPartial() throws Exception {
    final QueryResponse acc = response("A_3", series(ID_A, 50, 60));
    final QueryResponse merged = merger.combine(acc, 
        response("A_2", series(ID_A, 20, 30, 40)));
    assertEquals("A_3", merged.requestId());
    assertEquals(5, merged.sampleCount());
    assertEquals(timestamps(20, 30, 40, 50, 60), 
        timestamps(merged.getSeries(ID_A)));
  }
  
  @Test
  public void combineNewerPartial() throws Exception {
    final QueryResponse acc = response("A_1", series(ID_A, 0, 10));
    final QueryResponse merged = merger.combine(acc, 
        response("A_2", series(ID_A, 20, 30)));
    assertEquals(timestamps(0, 10, 20, 30), 
        timestamps(merged.getSeries(ID_A)));
  }
  
  @Test
  public void combineInterleavedAndDuplicates() throws Exception {
    final QueryResponse acc = QueryResponse.newBuilder()
        .setRequestId("A")
        .addSeries(new TimeSeries(ID_A, Lists.newArrayList(
            new Sample(10, 1), new Sample(30, 3), new Sample(50, 5))))
        .build();
    final QueryResponse partial = QueryResponse.newBuilder()
        .setRequestId("A")
        .addSeries(new TimeSeries(ID_A, Lists.newArrayList(
            new Sample(20, 2), new Sample(30, 42), new Sample(60, 6))))
        .build();
    final QueryResponse merged = merger.combine(acc, partial);
    final List<Sample> samples = merged.getSeries(ID_A).samples();
    assertEquals(timestamps(10, 20, 30, 50, 60), 
        timestamps(merged.getSeries(ID_A)));
    // accumulator wins the duplicate
    assertEquals(3, samples.get(2).value(), 0.0001);
  }
  
  @Test
  public void combineDisjointSeries() throws Exception {
    final QueryResponse acc = response("A", series(ID_B, 50, 60));
    final QueryResponse merged = merger.combine(acc, 
        response("A", series(ID_A, 20, 30), series(ID_B, 40)));
    assertEquals(2, merged.seriesMap().size());
    assertEquals(5, merged.sampleCount());
    assertEquals(timestamps(40, 50, 60), timestamps(merged.getSeries(ID_B)));
    assertEquals(timestamps(20, 30), timestamps(merged.getSeries(ID_A)));
    
    // accumulator series first
    final Iterator<TimeSeries> it = merged.series().iterator();
    assertEquals(ID_B, it.next().id());
    assertEquals(ID_A, it.next().id());
  }
  
  @Test
  public void combineEmptySeries() throws Exception {
    final QueryResponse acc = response("A", series(ID_A));
    QueryResponse merged = merger.combine(acc, 
        response("A", series(ID_A, 10, 20)));
    assertEquals(timestamps(10, 20), timestamps(merged.getSeries(ID_A)));
    
    merged = merger.combine(response("A", series(ID_A, 10, 20)), 
        response("A", series(ID_A)));
    assertEquals(timestamps(10, 20), timestamps(merged.getSeries(ID_A)));
  }
  
  @Test
  public void combineKeepsAccumulatorState() throws Exception {
    final QueryResponse acc = response("A", series(ID_A, 50))
        .withState(LoadingState.STREAMING);
    final QueryResponse merged = merger.combine(acc, 
        response("A_1", series(ID_A, 10)));
    assertEquals(LoadingState.STREAMING, merged.state());
    assertNull(merged.error());
  }
  
  @Test
  public void combineNewestFirstEqualsChronological() throws Exception {
    final QueryResponse oldest = response("A_1", 
        series(ID_A, 0, 10), series(ID_B, 10));
    final QueryResponse middle = response("A_2", 
        series(ID_A, 20, 30, 40));
    final QueryResponse newest = response("A_3", 
        series(ID_A, 50, 60, 70), series(ID_B, 70));
    
    final QueryResponse newest_first = merger.combine(
        merger.combine(merger.combine(null, newest), middle), oldest);
    final QueryResponse chronological = merger.combine(
        merger.combine(merger.combine(null, oldest), middle), newest);
    
    assertEquals(chronological.seriesMap(), newest_first.seriesMap());
    assertEquals(10, newest_first.sampleCount());
  }
  
  @Test
  public void limitReached() throws Exception {
    final QueryRequest.Builder builder = QueryRequest.newBuilder()
        .setRange(new TimeRange(0, 100))
        .setStep(10)
        .setRequestId("A");
    final QueryResponse response = response("A", series(ID_A, 10, 20, 30));
    
    assertFalse(merger.limitReached(builder.build(), response));
    assertFalse(merger.limitReached(builder.setMaxSamples(4).build(), response));
    assertTrue(merger.limitReached(builder.setMaxSamples(3).build(), response));
    assertTrue(merger.limitReached(builder.setMaxSamples(1).build(), response));
    assertFalse(merger.limitReached(builder.setMaxSamples(1).build(), 
        QueryResponse.empty("A")));
    
    try {
      merger.limitReached(null, response);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      merger.limitReached(builder.build(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  static QueryResponse response(final String id, final TimeSeries... series) {
    final QueryResponse.Builder builder = QueryResponse.newBuilder()
        .setRequestId(id);
    for (final TimeSeries ts : series) {
      builder.addSeries(ts);
    }
    return builder.build();
  }
  
  static TimeSeries series(final TimeSeriesId id, final long... timestamps) {
    final List<Sample> samples = Lists.newArrayList();
    for (final long timestamp : timestamps) {
      samples.add(new Sample(timestamp, timestamp));
    }
    return new TimeSeries(id, samples);
  }
  
  static List<Long> timestamps(final long... timestamps) {
    final List<Long> list = Lists.newArrayList();
    for (final long timestamp : timestamps) {
      list.add(timestamp);
    }
    return list;
  }
  
  static List<Long> timestamps(final TimeSeries series) {
    final List<Long> list = Lists.newArrayList();
    for (final Sample sample : series.samples()) {
      list.add(sample.timestamp());
    }
    return list;
  }
}
