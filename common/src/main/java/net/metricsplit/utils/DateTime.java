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

import java.time.Instant;

import com.google.common.base.Strings;

/**
 * Helpers for human readable durations and clock access. All times are Unix
 * epoch milliseconds.
 *
 * @since 1.0
 */
public class DateTime {

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the duration was null, empty or
   * malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    final long interval;
    long multiplier;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " 
          + duration, e);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " 
          + duration);
    }
    final String units = getDurationUnits(duration);
    switch (units) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      case "n": multiplier = 3600 * 24 * 30; break;
      case "y": multiplier = 3600 * 24 * 365; break;
      default: throw new IllegalArgumentException("Invalid duration (suffix): " 
          + duration);
    }
    multiplier *= 1000;
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: " 
          + duration);
    }
    return interval * multiplier;
  }

  /**
   * Returns the suffix or "units" of the duration as a string. The result will
   * be ms, s, m, h, d, w, n or y.
   * @param duration The duration in the format #units, e.g. 1d or 6h
   * @return Just the suffix, e.g. 'd' or 'h'
   * @throws IllegalArgumentException if the duration is null, empty or if
   * the units are invalid.
   */
  public static final String getDurationUnits(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty");
    }
    int unit = 0;
    while (unit < duration.length() &&
        Character.isDigit(duration.charAt(unit))) {
      unit++;
    }
    final String units = duration.substring(unit).toLowerCase();
    if (units.equals("ms") || units.equals("s") || units.equals("m") || 
        units.equals("h") || units.equals("d") || units.equals("w") || 
        units.equals("n") || units.equals("y")) {
      return units;
    }
    throw new IllegalArgumentException("Invalid units in the duration: " 
        + units);
  }

  /**
   * Formats a timestamp for log messages.
   * @param timestamp A Unix epoch timestamp in milliseconds.
   * @return An ISO-8601 UTC string.
   */
  public static String toIsoString(final long timestamp) {
    return Instant.ofEpochMilli(timestamp).toString();
  }

  /**
   * Pass through to {@link System#nanoTime()} so that tests can substitute a
   * clock.
   * @return The current value of the nano timer.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
