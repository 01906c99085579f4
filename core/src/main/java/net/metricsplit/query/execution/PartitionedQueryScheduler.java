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

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.stumbleupon.async.Callback;

import io.opentracing.Span;
import net.metricsplit.data.TimeRange;
import net.metricsplit.exceptions.PartialResultException;
import net.metricsplit.exceptions.QueryExecutionCanceled;
import net.metricsplit.exceptions.QueryExecutionException;
import net.metricsplit.query.DefaultQueryContext;
import net.metricsplit.query.LoadingState;
import net.metricsplit.query.QueryContext;
import net.metricsplit.query.QueryRequest;
import net.metricsplit.query.QueryResponse;
import net.metricsplit.query.QuerySink;
import net.metricsplit.query.merge.ResponseMerger;
import net.metricsplit.query.merge.TimeSeriesResponseMerger;
import net.metricsplit.query.split.RangePartitioner;
import net.metricsplit.query.split.SplitConfig;
import net.metricsplit.stats.QueryTrace;
import net.metricsplit.utils.DateTime;
import net.metricsplit.utils.JSON;

/**
 * Executes a long range query as a strict sequence of step aligned
 * partitions, newest first, streaming the growing result to a 
 * {@link QuerySink}.
 * <p>
 * The range is split with the {@link RangePartitioner} using the chunk size
 * of the {@link SplitConfig}. Each partition is sent to the downstream 
 * executor as a copy of the original request with the partition's range and
 * an ID of {@code <requestId>_<N>} where N is the partition's index plus one,
 * so the newest partition carries the highest number. Only one partition is
 * in flight at any time. Each result is folded into the accumulator with the
 * {@link ResponseMerger} and the accumulator is emitted in the 
 * {@link LoadingState#STREAMING} state, or {@link LoadingState#DONE} once the
 * oldest partition arrived or the merger reports the request's limit was 
 * reached. {@link QuerySink#onComplete()} follows the final emission.
 * <p>
 * When a partition fails the older partitions are skipped and the sink 
 * receives a single {@link PartialResultException} carrying everything merged
 * so far. Canceling the execution stops further dispatches and emissions; a
 * partition already in flight is canceled and its result dropped.
 * <p>
 * If the config carries a timeout the downstream executor is wrapped in a
 * {@link TimedQueryExecutor}.
 * 
 * @since 1.0
 */
public class PartitionedQueryScheduler extends QueryExecutor<QueryResponse> {
  private static final Logger LOG = LoggerFactory.getLogger(
      PartitionedQueryScheduler.class);
  
  /** Lifecycle of a single partitioned execution. */
  public static enum State {
    IDLE,
    RUNNING,
    STREAMING,
    DONE,
    ERROR,
    CANCELED;
    
    /** @return True if no further emissions will happen. */
    public boolean isTerminal() {
      return this == DONE || this == ERROR || this == CANCELED;
    }
  }
  
  /** Sink used when the caller only waits on the deferred. */
  private static final QuerySink RESULT_ONLY_SINK = new ResultOnlySink();
  
  /** The executor partitions are sent to. */
  private final QueryExecutor<QueryResponse> executor;
  
  /** Folds partition results together. */
  private final ResponseMerger merger;
  
  /** Chunk size and timeout. */
  private final SplitConfig config;
  
  /**
   * Ctor using the default merger and the config loaded from 
   * {@code reference.conf} and its overrides.
   * @param id A non-null and non-empty ID.
   * @param executor The non-null downstream executor.
   * @throws IllegalArgumentException if an argument was null or the loaded
   * config was invalid.
   */
  public PartitionedQueryScheduler(final String id,
                                   final QueryExecutor<QueryResponse> executor) {
    this(id, executor, new TimeSeriesResponseMerger(), SplitConfig.load());
  }
  
  /**
   * Default ctor.
   * @param id A non-null and non-empty ID.
   * @param executor The non-null downstream executor.
   * @param merger The non-null merger.
   * @param config The non-null split config.
   * @throws IllegalArgumentException if an argument was null.
   */
  public PartitionedQueryScheduler(final String id,
                                   final QueryExecutor<QueryResponse> executor,
                                   final ResponseMerger merger,
                                   final SplitConfig config) {
    super(id);
    if (executor == null) {
      throw new IllegalArgumentException("Downstream executor cannot be null.");
    }
    if (merger == null) {
      throw new IllegalArgumentException("Merger cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.merger = merger;
    this.config = config;
    if (config.hasTimeout()) {
      this.executor = new TimedQueryExecutor<QueryResponse>(
          id + "_timed", executor, config.getTimeout());
    } else {
      this.executor = executor;
    }
    registerDownstreamExecutor(this.executor);
  }
  
  /**
   * Starts the request with a default context.
   * @param request A non-null request.
   * @param sink A non-null sink for the emissions.
   * @return The execution handle.
   * @throws IllegalArgumentException if an argument was null or the range
   * could not be split.
   */
  public PartitionedQueryExecution start(final QueryRequest request,
                                         final QuerySink sink) {
    return start(DefaultQueryContext.newBuilder().build(), request, sink, null);
  }
  
  /**
   * Starts the request.
   * @param context A non-null context.
   * @param request A non-null request.
   * @param sink A non-null sink for the emissions.
   * @return The execution handle.
   * @throws IllegalArgumentException if an argument was null or the range
   * could not be split.
   */
  public PartitionedQueryExecution start(final QueryContext context,
                                         final QueryRequest request,
                                         final QuerySink sink) {
    return start(context, request, sink, null);
  }
  
  /**
   * Starts the request. If the scheduler was closed the returned execution
   * has already failed and the sink received the error.
   * @param context A non-null context.
   * @param request A non-null request.
   * @param sink A non-null sink for the emissions.
   * @param upstream_span An optional parent span.
   * @return The execution handle.
   * @throws IllegalArgumentException if an argument was null or the range
   * could not be split.
   */
  public PartitionedQueryExecution start(final QueryContext context,
                                         final QueryRequest request,
                                         final QuerySink sink,
                                         final Span upstream_span) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    return execute(context, request, sink, upstream_span,
        RangePartitioner.split(request, config.getChunkSize()));
  }
  
  /**
   * Starts a request, returning a blocking iterator over the emissions.
   * Closing the iterator cancels the query.
   * @param context A non-null context.
   * @param request A non-null request.
   * @return The iterator.
   * @throws IllegalArgumentException if an argument was null or the range
   * could not be split.
   */
  public QueryResponseIterator iterate(final QueryContext context, 
                                       final QueryRequest request) {
    final QueryResponseIterator iterator = new QueryResponseIterator();
    iterator.setExecution(start(context, request, iterator));
    return iterator;
  }
  
  @Override
  public QueryExecution<QueryResponse> executeQuery(final QueryContext context,
                                                    final QueryRequest request,
                                                    final Span upstream_span) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    try {
      return start(context, request, RESULT_ONLY_SINK, upstream_span);
    } catch (IllegalArgumentException e) {
      return new FailedQueryExecution<QueryResponse>(request, 
          new QueryExecutionException("Unable to split request " 
              + request.requestId() + ": " + e.getMessage(), 400, e));
    }
  }
  
  /** @return The split config. */
  public SplitConfig config() {
    return config;
  }
  
  @VisibleForTesting
  PartitionedQueryExecution execute(final QueryContext context,
                                    final QueryRequest request,
                                    final QuerySink sink,
                                    final Span upstream_span,
                                    final List<TimeRange> partitions) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    final PartitionedQueryExecution execution = 
        new PartitionedQueryExecution(context, request, sink, partitions);
    if (completed.get()) {
      execution.reject(new QueryExecutionException(
          "Scheduler was already closed: " + this, 500));
    } else {
      execution.execute(upstream_span);
    }
    return execution;
  }
  
  /**
   * The handle on a single partitioned query. All state transitions and 
   * emissions to the sink happen while holding the execution's monitor, so
   * once {@link #cancel()} returns the sink will not be called again.
   */
  public class PartitionedQueryExecution extends QueryExecution<QueryResponse> {
    /** The context of the query. */
    private final QueryContext context;
    
    /** Where emissions go. */
    private final QuerySink sink;
    
    /** Partitions, earliest first. */
    private final List<TimeRange> partitions;
    
    /** Signals for the dispatch loop. */
    private final AtomicInteger wip;
    
    /** Current state, written under the monitor. */
    private volatile State state;
    
    /** How many partitions were dispatched. */
    private volatile int executed;
    
    /** The index of the next partition to dispatch. */
    private int next_index;
    
    /** Whether a partition is awaiting its result. */
    private boolean in_flight;
    
    /** The response merged so far, null until the first result. */
    private QueryResponse accumulator;
    
    /** The partition in flight, if any. */
    private QueryExecution<QueryResponse> downstream;
    
    /** When the execution started, in nanos. */
    private long start_time;
    
    PartitionedQueryExecution(final QueryContext context,
                              final QueryRequest request,
                              final QuerySink sink,
                              final List<TimeRange> partitions) {
      super(request);
      this.context = context;
      this.sink = sink;
      this.partitions = partitions == null ? 
          ImmutableList.<TimeRange>of() : ImmutableList.copyOf(partitions);
      wip = new AtomicInteger();
      state = State.IDLE;
      next_index = this.partitions.size() - 1;
    }
    
    /** @return The current state. */
    public State state() {
      return state;
    }
    
    /** @return The partitions of the query, earliest first. */
    public List<TimeRange> partitions() {
      return partitions;
    }
    
    /** @return How many partitions were sent downstream so far. */
    public int executed() {
      return executed;
    }
    
    /** @return The last accumulated response, null before the first. */
    public synchronized QueryResponse accumulator() {
      return accumulator;
    }
    
    /**
     * Stops the execution. No sink call happens once this returns and the
     * deferred resolves with a {@link QueryExecutionCanceled} whose order is
     * the number of partitions sent downstream. A partition that a dispatch
     * on another thread hands to the executor while this runs is canceled 
     * as soon as the executor returns it, and its result is dropped.
     */
    @Override
    public void cancel() {
      final QueryExecution<QueryResponse> in_flight_execution;
      final QueryExecutionCanceled e;
      synchronized (this) {
        if (state.isTerminal()) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Ignoring cancel of finished execution: " + this);
          }
          return;
        }
        state = State.CANCELED;
        in_flight_execution = downstream;
        downstream = null;
        e = new QueryExecutionCanceled("Query " + request.requestId() 
            + " was canceled after " + executed + " of " + partitions.size() 
            + " partitions", 500, executed);
      }
      context.logInfo(e.getMessage());
      if (in_flight_execution != null) {
        cancelQuietly(in_flight_execution);
      }
      resolve(e);
    }
    
    @Override
    public String toString() {
      return new StringBuilder()
          .append("PartitionedQueryExecution{requestId=")
          .append(request.requestId())
          .append(", state=")
          .append(state)
          .append(", executed=")
          .append(executed)
          .append(", partitions=")
          .append(partitions.size())
          .append("}")
          .toString();
    }
    
    void execute(final Span upstream_span) {
      setSpan(context, 
          PartitionedQueryScheduler.this.getClass().getSimpleName(),
          upstream_span,
          QueryTrace.requestTags(request));
      synchronized (this) {
        if (state != State.IDLE) {
          throw new IllegalStateException("Execution was already started: " 
              + this);
        }
        state = State.RUNNING;
        start_time = DateTime.nanoTime();
      }
      outstanding_executions.add(this);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Starting partitioned query: " 
            + JSON.serializeToString(request));
      }
      context.logInfo("Splitting " + request.requestId() + " from " 
          + DateTime.toIsoString(request.range().start()) + " to " 
          + DateTime.toIsoString(request.range().end()) + " into " 
          + partitions.size() + " partitions with step " + request.step() 
          + "ms and chunk size " + config.getStringConfig());
      
      if (partitions.isEmpty()) {
        final Object result;
        synchronized (this) {
          accumulator = QueryResponse.empty(request.requestId())
              .withState(LoadingState.DONE);
          state = State.DONE;
          final Exception sink_error = emit(accumulator);
          result = sink_error != null ? fail(0, sink_error) : complete();
        }
        resolve(result);
        return;
      }
      drain();
    }
    
    void reject(final QueryExecutionException e) {
      synchronized (this) {
        state = State.ERROR;
        try {
          sink.onError(e);
        } catch (Exception ex) {
          LOG.error("Sink threw handling the rejection of " + this, ex);
        }
      }
      resolve(e);
    }
    
    /**
     * Dispatches partitions until no further work is signaled. Results that
     * arrive synchronously signal the loop instead of recursing.
     */
    private void drain() {
      if (wip.getAndIncrement() != 0) {
        return;
      }
      int missed = 1;
      do {
        dispatch();
        missed = wip.addAndGet(-missed);
      } while (missed != 0);
    }
    
    private void dispatch() {
      final int index;
      final QueryRequest sub_request;
      synchronized (this) {
        if (in_flight || next_index < 0 || 
            (state != State.RUNNING && state != State.STREAMING)) {
          return;
        }
        index = next_index;
        sub_request = QueryRequest.newBuilder(request)
            .setRange(partitions.get(index))
            .setRequestId(request.requestId() + "_" + (index + 1))
            .build();
        in_flight = true;
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Dispatching partition " + (index + 1) + " of " 
            + partitions.size() + " " + sub_request.range() + " for " + this);
      }
      context.logDebug("Executing " + sub_request.requestId() + " over " 
          + sub_request.range());
      
      final Span span = context.getTracer() == null ? null : 
        startSpan(context.getTracer(), "partition", tracer_span, 
            QueryTrace.requestTags(sub_request));
      
      final boolean stopped;
      synchronized (this) {
        stopped = state != State.RUNNING && state != State.STREAMING;
        if (stopped) {
          in_flight = false;
        } else {
          executed++;
        }
      }
      if (stopped) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Execution stopped before partition " + (index + 1) 
              + " was sent: " + this);
        }
        finishSpan(span, QueryTrace.canceledTags(null), null);
        return;
      }
      
      final QueryExecution<QueryResponse> execution;
      try {
        execution = executor.executeQuery(context, sub_request, 
            span != null ? span : tracer_span);
        if (execution == null) {
          throw new IllegalStateException("Executor " + executor 
              + " returned a null execution.");
        }
      } catch (Exception e) {
        onPartitionError(index, span, e);
        return;
      }
      
      final boolean canceled;
      synchronized (this) {
        canceled = state == State.CANCELED;
        if (!canceled) {
          downstream = execution;
        }
      }
      if (canceled) {
        cancelQuietly(execution);
      }
      execution.deferred()
        .addCallback(new PartitionCB(index, span))
        .addErrback(new PartitionErrCB(index, span));
    }
    
    private void onPartitionResult(final int index, 
                                   final QueryResponse partial) {
      final Object result;
      boolean more = false;
      synchronized (this) {
        in_flight = false;
        downstream = null;
        if (state != State.RUNNING && state != State.STREAMING) {
          dropped(index);
          return;
        }
        
        QueryResponse merged = null;
        Exception failure = null;
        try {
          if (partial == null) {
            throw new IllegalStateException("Partition " + (index + 1) 
                + " returned a null response");
          }
          merged = merger.combine(accumulator, partial);
          if (merged == null) {
            throw new IllegalStateException("Merger " + merger 
                + " returned a null response");
          }
          more = index > 0 && !merger.limitReached(request, merged);
        } catch (Exception e) {
          failure = e;
        }
        
        if (failure != null) {
          more = false;
          result = fail(index, failure);
        } else {
          final LoadingState loading = more ? 
              LoadingState.STREAMING : LoadingState.DONE;
          accumulator = QueryResponse.newBuilder(merged)
              .setRequestId(request.requestId())
              .setState(loading)
              .setError(null)
              .build();
          state = more ? State.STREAMING : State.DONE;
          next_index = index - 1;
          if (!more && index > 0) {
            context.logInfo("Limit of " + request.maxSamples() 
                + " samples reached for " + request.requestId() + " after " 
                + executed + " of " + partitions.size() + " partitions");
          }
          
          final Exception sink_error = emit(accumulator);
          if (state == State.CANCELED) {
            // canceled from within the sink, the deferred was resolved
            return;
          }
          if (sink_error != null) {
            more = false;
            result = fail(index, sink_error);
          } else if (!more) {
            result = complete();
          } else {
            result = null;
          }
        }
      }
      
      if (result != null) {
        resolve(result);
      }
      if (more) {
        drain();
      }
    }
    
    private void onPartitionError(final int index, 
                                  final Span span,
                                  final Exception e) {
      finishSpan(span, QueryTrace.exceptionTags(e), 
          QueryTrace.exceptionAnnotation(e));
      final Object result;
      synchronized (this) {
        in_flight = false;
        downstream = null;
        if (state != State.RUNNING && state != State.STREAMING) {
          dropped(index);
          return;
        }
        result = fail(index, e);
      }
      resolve(result);
    }
    
    /**
     * Moves to the error state and notifies the sink. Must be called while 
     * holding the monitor.
     * @return The exception to resolve the deferred with.
     */
    private PartialResultException fail(final int index, final Exception e) {
      state = State.ERROR;
      final int order = index + 1;
      final QueryResponse partial = (accumulator != null ? accumulator : 
        QueryResponse.empty(request.requestId())).withError(e);
      accumulator = partial;
      final int status_code = e instanceof QueryExecutionException ? 
          ((QueryExecutionException) e).getStatusCode() : 500;
      final PartialResultException ex = new PartialResultException(
          "Partition " + order + " of " + partitions.size() + " failed for " 
              + request.requestId() + " with " + partial.sampleCount() 
              + " samples merged", status_code, order, partial, e);
      LOG.warn(ex.getMessage() + ": " + this, e);
      context.logWarn(ex.getMessage() + ": " + e.getMessage());
      try {
        sink.onError(ex);
      } catch (Exception sink_ex) {
        LOG.error("Sink threw handling the error of " + this, sink_ex);
      }
      return ex;
    }
    
    /**
     * Sends the response to the sink. Must be called while holding the 
     * monitor.
     * @return Null on success or the exception the sink threw.
     */
    private Exception emit(final QueryResponse response) {
      try {
        sink.onNext(response);
        return null;
      } catch (Exception e) {
        LOG.error("Sink threw handling a " + response.state() 
            + " response for " + this, e);
        return e;
      }
    }
    
    /**
     * Notifies the sink of completion. Must be called while holding the 
     * monitor.
     * @return The final response.
     */
    private QueryResponse complete() {
      try {
        sink.onComplete();
      } catch (Exception e) {
        LOG.error("Sink threw on completion of " + this, e);
      }
      context.logInfo("Completed " + request.requestId() + " after " 
          + executed + " of " + partitions.size() + " partitions with " 
          + accumulator.sampleCount() + " samples in " 
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start_time) + "ms");
      return accumulator;
    }
    
    private void dropped(final int index) {
      if (state == State.CANCELED) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Dropping result of partition " + (index + 1) 
              + " of canceled execution: " + this);
        }
      } else {
        LOG.warn("Dropping result of partition " + (index + 1) 
            + " after the execution finished: " + this);
      }
    }
    
    /** Calls the deferred outside of the monitor. */
    private void resolve(final Object result) {
      outstanding_executions.remove(this);
      try {
        if (result instanceof QueryExecutionCanceled) {
          callback(result, QueryTrace.canceledTags((Exception) result));
        } else if (result instanceof Exception) {
          callback(result, 
              QueryTrace.exceptionTags((Exception) result),
              QueryTrace.exceptionAnnotation((Exception) result));
        } else {
          callback(result, QueryTrace.successfulTags(
              "partitions", Integer.toString(executed)));
        }
      } catch (IllegalStateException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Lost race resolving " + this + " with " + result);
        }
      }
    }
    
    private void cancelQuietly(final QueryExecution<QueryResponse> execution) {
      try {
        execution.cancel();
      } catch (Exception e) {
        LOG.warn("Failed to cancel partition execution " + execution 
            + " of " + this, e);
      }
    }
    
    private void finishSpan(final Span span, 
                            final Map<String, String> tags,
                            final Map<String, Object> log) {
      if (span == null) {
        return;
      }
      for (final Map.Entry<String, String> tag : tags.entrySet()) {
        span.setTag(tag.getKey(), tag.getValue());
      }
      if (log != null) {
        span.log(log);
      }
      span.finish();
    }
    
    /** Handles a partition's result. */
    class PartitionCB implements Callback<Object, QueryResponse> {
      final int index;
      final Span span;
      
      PartitionCB(final int index, final Span span) {
        this.index = index;
        this.span = span;
      }
      
      @Override
      public Object call(final QueryResponse partial) throws Exception {
        finishSpan(span, QueryTrace.successfulTags(
            "samples", partial == null ? "0" : 
              Long.toString(partial.sampleCount())), null);
        onPartitionResult(index, partial);
        return null;
      }
    }
    
    /** Handles a partition's failure. */
    class PartitionErrCB implements Callback<Object, Exception> {
      final int index;
      final Span span;
      
      PartitionErrCB(final int index, final Span span) {
        this.index = index;
        this.span = span;
      }
      
      @Override
      public Object call(final Exception e) throws Exception {
        onPartitionError(index, span, e);
        return null;
      }
    }
  }
  
  /** Discards emissions when the caller only waits on the deferred. */
  private static class ResultOnlySink implements QuerySink {
    @Override
    public void onComplete() {
      // the deferred carries the final response
    }

    @Override
    public void onNext(final QueryResponse response) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Partial response with " + response.sampleCount() 
            + " samples for " + response.requestId());
      }
    }

    @Override
    public void onError(final Throwable t) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Query failed, the deferred carries the error", t);
      }
    }
  }
}
