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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.metricsplit.utils.JSON;

public class TestTimeSeriesId {

  @Test
  public void builder() throws Exception {
    TimeSeriesId id = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("host", "web01")
        .addTag("dc", "lga")
        .build();
    assertEquals("sys.cpu.user", id.metric());
    assertEquals(2, id.tags().size());
    assertEquals("dc", id.tags().firstKey());
    assertEquals("sys.cpu.user{dc=\"lga\", host=\"web01\"}", id.toString());
    
    // tags only
    id = TimeSeriesId.newBuilder()
        .addTag("job", "api")
        .build();
    assertEquals("", id.metric());
    
    // metric only
    id = TimeSeriesId.newBuilder()
        .setMetric("up")
        .build();
    assertTrue(id.tags().isEmpty());
    assertEquals("up{}", id.toString());
    
    try {
      TimeSeriesId.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeriesId.newBuilder().addTag(null, "v");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeriesId.newBuilder().addTag("", "v");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeriesId.newBuilder().addTag("k", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void setTagsReplaces() throws Exception {
    final Map<String, String> tags = ImmutableMap.of("host", "web02");
    final TimeSeriesId id = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("dc", "lga")
        .setTags(tags)
        .build();
    assertEquals(tags, id.tags());
  }
  
  @Test
  public void equalsIgnoresTagOrder() throws Exception {
    final TimeSeriesId a = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("host", "web01")
        .addTag("dc", "lga")
        .build();
    final TimeSeriesId b = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("dc", "lga")
        .addTag("host", "web01")
        .build();
    final TimeSeriesId c = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("dc", "lga")
        .addTag("host", "web02")
        .build();
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(0, a.compareTo(b));
    assertNotEquals(a, c);
    assertTrue(a.compareTo(c) < 0);
  }
  
  @Test
  public void compareTo() throws Exception {
    final TimeSeriesId a = TimeSeriesId.newBuilder()
        .setMetric("a")
        .addTag("host", "web01")
        .build();
    final TimeSeriesId b = TimeSeriesId.newBuilder()
        .setMetric("b")
        .build();
    final TimeSeriesId a_more = TimeSeriesId.newBuilder()
        .setMetric("a")
        .addTag("host", "web01")
        .addTag("owner", "ops")
        .build();
    
    final List<TimeSeriesId> ids = Lists.newArrayList(b, a_more, a);
    Collections.sort(ids);
    assertEquals(Lists.newArrayList(a, a_more, b), ids);
  }
  
  @Test
  public void serdes() throws Exception {
    final TimeSeriesId id = TimeSeriesId.newBuilder()
        .setMetric("sys.cpu.user")
        .addTag("host", "web01")
        .build();
    final String json = JSON.serializeToString(id);
    assertTrue(json.contains("\"metric\":\"sys.cpu.user\""));
    assertTrue(json.contains("\"host\":\"web01\""));
    assertEquals(id, JSON.parseToObject(json, TimeSeriesId.class));
  }
}
