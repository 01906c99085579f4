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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;
import io.opentracing.Span;
import net.metricsplit.exceptions.QueryExecutionException;
import net.metricsplit.query.QueryContext;
import net.metricsplit.query.QueryRequest;
import net.metricsplit.stats.QueryTrace;

/**
 * A {@link QueryExecutor} wrapper that uses the context's timer to fail a
 * query that is taking too long. On a timeout the execution is called back
 * with a {@link QueryExecutionException} carrying a 408 status code and
 * {@link QueryExecution#cancel()} is called on the downstream query.
 * 
 * @param <T> The type of data the query executor handles.
 * 
 * @since 1.0
 */
public class TimedQueryExecutor<T> extends QueryExecutor<T> {
  private static final Logger LOG = LoggerFactory.getLogger(
      TimedQueryExecutor.class);
  
  /** The downstream executor that queries are passed to. */
  private final QueryExecutor<T> executor;
  
  /** How long, in milliseconds, we wait for each query. */
  private final long timeout;
  
  /**
   * Default ctor.
   * @param id A non-null and non-empty ID for the executor.
   * @param executor The non-null downstream executor.
   * @param timeout The timeout in milliseconds, 1 or greater.
   * @throws IllegalArgumentException if the executor was null or the timeout
   * was less than 1 millisecond.
   */
  public TimedQueryExecutor(final String id,
                            final QueryExecutor<T> executor,
                            final long timeout) {
    super(id);
    if (executor == null) {
      throw new IllegalArgumentException("Downstream executor cannot be null.");
    }
    if (timeout < 1) {
      throw new IllegalArgumentException("Timeout must be greater than zero: " 
          + timeout);
    }
    this.executor = executor;
    this.timeout = timeout;
    registerDownstreamExecutor(executor);
  }

  @Override
  public QueryExecution<T> executeQuery(final QueryContext context,
                                        final QueryRequest request,
                                        final Span upstream_span) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (completed.get()) {
      return new FailedQueryExecution<T>(request, new QueryExecutionException(
            "Timeout executor was already marked as completed: " + this, 500));
    }
    try {
      final TimedQuery timed_query = new TimedQuery(context, request);
      timed_query.execute(upstream_span);
      return timed_query;
    } catch (Exception e) {
      return new FailedQueryExecution<T>(request, new QueryExecutionException(
          "Unexpected exception executing query: " + this, 500, e));
    }
  }
  
  /** @return The timeout in milliseconds. */
  public long timeout() {
    return timeout;
  }
  
  /** Wraps the downstream execution so that on callback the timer task is
   * cancelled. Also the timer task called if the query has timed out. */
  class TimedQuery extends QueryExecution<T> implements TimerTask {
    /** The timeout returned by the timer so we can cancel it. */
    protected Timeout timer_timeout;
    
    /** The downstream execution to wait on (or cancel). */
    protected QueryExecution<T> downstream;
    
    /** The context of the query. */
    private final QueryContext context;
    
    /**
     * Default ctor.
     * @param context A non-null context with a timer.
     * @param request A non-null request.
     */
    TimedQuery(final QueryContext context, final QueryRequest request) {
      super(request);
      if (context == null) {
        throw new IllegalArgumentException("Context cannot be null.");
      }
      this.context = context;
      outstanding_executions.add(this);
    }
    
    void execute(final Span upstream_span) {
      setSpan(context, 
          TimedQueryExecutor.this.getClass().getSimpleName(), 
          upstream_span,
          QueryTrace.requestTags(request));
      
      class ErrCB implements Callback<Object, Exception> {
        @Override
        public Object call(final Exception e) throws Exception {
          complete();
          try {
            callback(e, 
                QueryTrace.exceptionTags(e),
                QueryTrace.exceptionAnnotation(e));
          } catch (IllegalStateException ex) {
            if (LOG.isDebugEnabled()) {
              LOG.debug("Lost race condition calling back with an "
                  + "exception: " + TimedQuery.this);
            }
          }
          return null;
        }
      }

      class SuccessCB implements Callback<Object, T> {
        @Override
        public Object call(final T obj) throws Exception {
          complete();
          try {
            callback(obj, QueryTrace.successfulTags());
          } catch (IllegalStateException ex) {
            if (LOG.isDebugEnabled()) {
              LOG.debug("Dropping result that arrived after the timeout: " 
                  + TimedQuery.this);
            }
          }
          return null;
        }
      }
      
      try {
        if (context.getTimer() == null) {
          throw new IllegalStateException("No timer in the query context.");
        }
        synchronized (this) {
          timer_timeout = context.getTimer()
              .newTimeout(this, timeout, TimeUnit.MILLISECONDS);
        }
        final QueryExecution<T> execution = 
            executor.executeQuery(context, request, 
                tracer_span != null ? tracer_span : upstream_span);
        synchronized (this) {
          downstream = execution;
        }
        execution.deferred()
          .addCallback(new SuccessCB())
          .addErrback(new ErrCB());
      } catch (Exception e) {
        complete();
        final Exception ex = new QueryExecutionException(
            "Unexpected exception executing query: " + this, 500, e);
        try {
          callback(ex,
              QueryTrace.exceptionTags(ex),
              QueryTrace.exceptionAnnotation(ex));
        } catch (IllegalStateException lost) {
          LOG.warn("Execution was already called back when the downstream "
              + "failed: " + this, e);
        }
      }
    }

    @Override
    public void run(final Timeout timeout) throws Exception {
      if (completed.get()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Timeout executed after a successful execution: " + this);
        }
        return;
      }
      final Exception e = new QueryExecutionException(
          "Timed out after " + TimedQueryExecutor.this.timeout + "ms: " + this, 
          408);
      synchronized (this) {
        timer_timeout = null;
      }
      try {
        callback(e,
            QueryTrace.exceptionTags(e),
            QueryTrace.exceptionAnnotation(e));
      } catch (IllegalStateException ex) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Lost race between the result and the timeout: " + this);
        }
      }
      cancelDownstream();
      complete();
    }

    @Override
    public void cancel() {
      cancelDownstream();
      complete();
      if (!completed.get()) {
        final Exception e = new QueryExecutionException(
            "Query was cancelled upstream: " + this, 500); 
        try {
          callback(e, QueryTrace.canceledTags(e));
        } catch (IllegalStateException ex) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Lost race canceling the execution: " + this);
          }
        }
      }
    }
    
    private void cancelDownstream() {
      final QueryExecution<T> execution;
      synchronized (this) {
        execution = downstream;
      }
      if (execution != null && !execution.completed()) {
        try {
          execution.cancel();
        } catch (Exception ex) {
          LOG.warn("Failed to cancel downstream execution: " + execution, ex);
        }
      }
    }
    
    /** If the timeout is not null, we cancel it. Also remove this from the
     * outstanding queries set. */
    private synchronized void complete() {
      if (timer_timeout != null) {
        timer_timeout.cancel();
        timer_timeout = null;
      }
      outstanding_executions.remove(this);
    }
  }
}
