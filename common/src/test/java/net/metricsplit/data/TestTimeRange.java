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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.metricsplit.utils.JSON;

public class TestTimeRange {

  @Test
  public void ctor() throws Exception {
    TimeRange range = new TimeRange(1000, 2000);
    assertEquals(1000, range.start());
    assertEquals(2000, range.end());
    assertEquals(1000, range.duration());
    
    range = new TimeRange(1000, 1000);
    assertEquals(0, range.duration());
    
    try {
      new TimeRange(2000, 1000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void contains() throws Exception {
    final TimeRange range = new TimeRange(1000, 2000);
    assertTrue(range.contains(1000));
    assertTrue(range.contains(1500));
    assertTrue(range.contains(2000));
    assertFalse(range.contains(999));
    assertFalse(range.contains(2001));
  }
  
  @Test
  public void equalsAndCompare() throws Exception {
    final TimeRange a = new TimeRange(1000, 2000);
    final TimeRange b = new TimeRange(1000, 2000);
    final TimeRange c = new TimeRange(1000, 3000);
    final TimeRange d = new TimeRange(0, 3000);
    
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertNotEquals(a, null);
    
    assertEquals(0, a.compareTo(b));
    assertTrue(a.compareTo(c) < 0);
    assertTrue(d.compareTo(a) < 0);
    assertEquals("[1000, 2000]", a.toString());
  }
  
  @Test
  public void serdes() throws Exception {
    final TimeRange range = new TimeRange(1000, 2000);
    final String json = JSON.serializeToString(range);
    assertTrue(json.contains("\"start\":1000"));
    assertTrue(json.contains("\"end\":2000"));
    
    assertEquals(range, JSON.parseToObject(json, TimeRange.class));
    
    try {
      JSON.parseToObject("{\"start\":2000,\"end\":1000}", TimeRange.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
