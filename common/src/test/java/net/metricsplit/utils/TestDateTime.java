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
package net.metricsplit.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public final class TestDateTime {

  @Test
  public void parseDuration() {
    assertEquals(500, DateTime.parseDuration("500ms"));
    assertEquals(35000, DateTime.parseDuration("35s"));
    assertEquals(60000, DateTime.parseDuration("1m"));
    assertEquals(3600000, DateTime.parseDuration("1h"));
    assertEquals(86400000L, DateTime.parseDuration("1d"));
    assertEquals(604800000L, DateTime.parseDuration("1w"));
    assertEquals(2592000000L, DateTime.parseDuration("1n"));
    assertEquals(31536000000L, DateTime.parseDuration("1y"));
    // case insensitive units
    assertEquals(3600000, DateTime.parseDuration("1H"));
  }
  
  @Test
  public void parseDurationInvalid() {
    final String[] bad = new String[] { null, "", "m", "1", "0s", "-1s", 
        "1.5h", "1x", "10mn", "9999999999999999y" };
    for (final String duration : bad) {
      try {
        DateTime.parseDuration(duration);
        fail("Expected IllegalArgumentException for " + duration);
      } catch (IllegalArgumentException e) { }
    }
  }
  
  @Test
  public void getDurationUnits() {
    assertEquals("ms", DateTime.getDurationUnits("250ms"));
    assertEquals("m", DateTime.getDurationUnits("1m"));
    assertEquals("y", DateTime.getDurationUnits("2y"));
    try {
      DateTime.getDurationUnits("1q");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      DateTime.getDurationUnits(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void toIsoString() {
    assertEquals("2024-01-01T14:10:03Z", DateTime.toIsoString(1704118203000L));
    assertEquals("1970-01-01T00:00:00.001Z", DateTime.toIsoString(1));
  }
  
  @Test
  public void msFromNanoDiff() {
    assertEquals(1.5, DateTime.msFromNanoDiff(2500000, 1000000), 0.0001);
    assertEquals(0, DateTime.msFromNanoDiff(1000, 1000), 0.0001);
    try {
      DateTime.msFromNanoDiff(1000, 2000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    final long start = DateTime.nanoTime();
    assertTrue(DateTime.msFromNanoDiff(DateTime.nanoTime(), start) >= 0);
  }
}
