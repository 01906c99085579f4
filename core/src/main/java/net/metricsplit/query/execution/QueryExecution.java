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
package net.metricsplit.query.execution;

import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.Tracer.SpanBuilder;
import net.metricsplit.query.QueryContext;
import net.metricsplit.query.QueryRequest;

/**
 * A handle on an asynchronous query. Every {@link QueryExecutor} returns one
 * of these so the caller can wait on the {@link #deferred()} for the result
 * or give up through {@link #cancel()}.
 * <p>
 * The deferred is called exactly once, with either a result of type T or an
 * exception. 
 *
 * @param <T> The type of data that's returned by the query.
 * 
 * @since 1.0
 */
public abstract class QueryExecution<T> {
  /** The request that is associated with this execution. */
  protected final QueryRequest request;
  
  /** The deferred that will be called with a result (good data or an exception) */
  protected final Deferred<T> deferred;
  
  /** Flipped once when the deferred is called or the execution canceled. */
  protected final AtomicBoolean completed;
  
  /** An optional tracer span to log results to on completion. */
  protected Span tracer_span;
  
  /**
   * Default ctor.
   * @param request A non-null request.
   * @throws IllegalArgumentException if the request was null.
   */
  public QueryExecution(final QueryRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    this.request = request;
    deferred = new Deferred<T>();
    completed = new AtomicBoolean();
  }
  
  /** @return The deferred that will be called with a result. */
  public Deferred<T> deferred() {
    return deferred;
  }
  
  /**
   * Passes the result to the deferred and triggers its callback chain,
   * finishing the tracer span if set.
   * @param result A non-null result of type T or an exception.
   * @throws IllegalStateException if the deferred was already called.
   */
  protected void callback(final Object result) {
    callback(result, null, null);
  }

  /**
   * Passes the result to the deferred after tagging the span, if set, with
   * the given tags.
   * @param result A non-null result of the type T or an exception.
   * @param trace_tags An optional set of tags for the tracer span.
   * @throws IllegalStateException if the deferred was already called.
   */
  protected void callback(final Object result, 
                          final Map<String, String> trace_tags) {
    callback(result, trace_tags, null);
  }
  
  /**
   * Passes the result to the deferred after tagging the span, if set, with
   * the given tags and log entries.
   * @param result A non-null result of the type T or an exception.
   * @param trace_tags An optional set of tags for the tracer span.
   * @param trace_log An optional set of log events (exceptions, etc) for
   * the tracer span.
   * @throws IllegalStateException if the deferred was already called.
   */
  protected void callback(final Object result, 
                          final Map<String, String> trace_tags,
                          final Map<String, Object> trace_log) {
    if (!completed.compareAndSet(false, true)) {
      throw new IllegalStateException("Callback was already executed: " + this);
    }
    if (tracer_span != null) {
      if (trace_tags != null) {
        for (final Entry<String, String> tag : trace_tags.entrySet()) {
          tracer_span.setTag(tag.getKey(), tag.getValue());
        }
      }
      if (trace_log != null) {
        tracer_span.log(trace_log);
      }
      tracer_span.finish();
    }
    deferred.callback(result);
  }
  
  /**
   * Creates and starts a new tracer span with the given ID, optionally as
   * the child of a parent span. If the context has no {@link Tracer} this is
   * a no-op, but the arguments are still validated.
   * @param context A non-null context to fetch the {@link Tracer} from.
   * @param id A non-null and non-empty ID describing the operation.
   * @param parent An optional parent span.
   * @param tracer_tags An optional set of tags describing the operation.
   * @throws IllegalArgumentException if the context was null or ID was null.
   * @throws IllegalStateException if the span was already set.
   */
  protected void setSpan(final QueryContext context, 
                         final String id,
                         final Span parent, 
                         final Map<String, String> tracer_tags) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("Id cannot be null.");
    }
    if (context.getTracer() == null) {
      return;
    }
    if (tracer_span != null) {
      throw new IllegalStateException("Tracer span was already set.");
    }
    tracer_span = startSpan(context.getTracer(), id, parent, tracer_tags);
  }
  
  /** @return The request associated with this execution. */
  public QueryRequest request() {
    return request;
  }
  
  /** @return Whether or not the query has completed and the deferred has a 
   * result. */
  public boolean completed() {
    return completed.get();
  }
  
  /**
   * Cancels the query if it's outstanding. 
   * <b>WARNING:</b> Implementations must make sure that the {@link #deferred()}
   * is called somehow when a cancellation occurs.
   * <b>Note:</b> Race conditions are possible if the implementation calls into
   * {@link #callback(Object)}. Check the {@link #completed} state.
   */
  public abstract void cancel();

  /** @return The tracer span if set, null if not. */
  public Span tracerSpan() {
    return tracer_span;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append(getClass().getSimpleName())
        .append("{requestId=")
        .append(request.requestId())
        .append(", completed=")
        .append(completed.get())
        .append("}")
        .toString();
  }
  
  /**
   * Builds and starts a span.
   * @param tracer A non-null tracer.
   * @param id A non-null operation name.
   * @param parent An optional parent span.
   * @param tags Optional tags.
   * @return The started span.
   */
  static Span startSpan(final Tracer tracer, 
                        final String id, 
                        final Span parent,
                        final Map<String, String> tags) {
    final SpanBuilder builder = tracer.buildSpan(id);
    if (parent != null) {
      builder.asChildOf(parent);
    }
    if (tags != null) {
      for (final Entry<String, String> entry : tags.entrySet()) {
        builder.withTag(entry.getKey(), entry.getValue());
      }
    }
    return builder.start();
  }
}
