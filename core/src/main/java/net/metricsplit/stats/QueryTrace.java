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
package net.metricsplit.stats;

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMap.Builder;

import net.metricsplit.query.QueryRequest;

/**
 * Static helpers building the tag and log maps recorded on OpenTracing spans
 * when an execution finishes. Every outcome map carries a "status" tag and 
 * the name of the thread that completed the execution as "finalThread".
 * 
 * @since 1.0
 */
public final class QueryTrace {

  private QueryTrace() {
    // static helpers
  }

  /**
   * Tags for a successful execution: "status=OK" and "finalThread".
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> successfulTags() {
    return successfulTags((String[]) null);
  }

  /**
   * Tags for a successful execution along with the given pairs.
   * @param tags An optional list of tag key and value pairs in K, V, K, V
   * order. A trailing key without a value and null pairs are skipped.
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> successfulTags(final String... tags) {
    return outcome("OK", null, tags);
  }

  /**
   * Tags for a canceled execution: "status=Canceled", the "error" message 
   * and "finalThread".
   * @param e An optional exception to pull a message from.
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> canceledTags(final Throwable e) {
    return outcome("Canceled", message(e, "Canceled"), (String[]) null);
  }

  /**
   * Tags for a failed execution: "status=Error", the "error" message and
   * "finalThread".
   * @param e An optional exception to pull a message from.
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> exceptionTags(final Throwable e) {
    return exceptionTags(e, (String[]) null);
  }

  /**
   * Tags for a failed execution along with the given pairs.
   * @param e An optional exception to pull a message from.
   * @param tags An optional list of tag key and value pairs in K, V, K, V
   * order.
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> exceptionTags(final Throwable e,
                                                  final String... tags) {
    return outcome("Error", message(e, "Unknown"), tags);
  }

  /**
   * The "exception" log entry for a span.
   * @param e An optional exception.
   * @return A non-null map with the exception or the string "null".
   */
  public static Map<String, Object> exceptionAnnotation(final Throwable e) {
    return ImmutableMap.<String, Object>of("exception", 
        e == null ? "null" : e);
  }

  /**
   * Describes a request when a span is opened for it.
   * @param request A non-null request.
   * @return A non-null immutable map with the request ID, range and step.
   */
  public static Map<String, String> requestTags(final QueryRequest request) {
    return addTags(
        "requestId", request.requestId(),
        "range", request.range().toString(),
        "step", Long.toString(request.step()),
        "startThread", Thread.currentThread().getName());
  }

  /**
   * Creates a map of tags for tracing.
   * @param tags An optional list of tag key and value pairs in K, V, K, V
   * order. A trailing key without a value and null pairs are skipped.
   * @return A non-null immutable map of tags.
   */
  public static Map<String, String> addTags(final String... tags) {
    if (tags == null) {
      return Collections.<String, String>emptyMap();
    }
    return addTags(new ImmutableMap.Builder<String, String>(), tags);
  }

  private static Map<String, String> outcome(final String status,
                                             final String error,
                                             final String... tags) {
    final Builder<String, String> builder = 
        new ImmutableMap.Builder<String, String>()
        .put("status", status);
    if (error != null) {
      builder.put("error", error);
    }
    builder.put("finalThread", Thread.currentThread().getName());
    if (tags != null) {
      return addTags(builder, tags);
    }
    return builder.build();
  }

  private static Map<String, String> addTags(
      final Builder<String, String> builder, final String... tags) {
    for (int i = 0; i + 1 < tags.length; i += 2) {
      if (tags[i] == null || tags[i + 1] == null) {
        continue;
      }
      builder.put(tags[i], tags[i + 1]);
    }
    return builder.build();
  }

  /** Span tags can't be null so fall back to the class or a default. */
  private static String message(final Throwable e, final String missing) {
    if (e == null) {
      return missing;
    }
    return Strings.isNullOrEmpty(e.getMessage()) ? 
        e.getClass().getSimpleName() : e.getMessage();
  }
}
