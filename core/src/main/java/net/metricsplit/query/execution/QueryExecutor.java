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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.opentracing.Span;
import net.metricsplit.exceptions.QueryExecutionException;
import net.metricsplit.query.QueryContext;
import net.metricsplit.query.QueryRequest;

/**
 * The capability to execute a single query over its range. Executors may
 * wrap other executors, e.g. to add a timeout or to split a long query into
 * partitions, and close them when they are closed themselves.
 * 
 * @param <T> The type of data returned by the executor.
 * 
 * @since 1.0
 */
public abstract class QueryExecutor<T> {
  private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

  /** The ID of this executor, used in logs and spans. */
  protected final String id;
  
  /** Set to true once the executor has been closed. */
  protected final AtomicBoolean completed;

  /** The list of outstanding executions to be used when closing. */
  protected final Set<QueryExecution<T>> outstanding_executions;
  
  /** Downstream executors to close. */
  protected List<QueryExecutor<T>> downstream_executors;
  
  /**
   * Default ctor.
   * @param id A non-null and non-empty ID for the executor.
   * @throws IllegalArgumentException if the ID was null or empty.
   */
  public QueryExecutor(final String id) {
    if (Strings.isNullOrEmpty(id)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    this.id = id;
    completed = new AtomicBoolean();
    outstanding_executions = Sets.<QueryExecution<T>>newConcurrentHashSet();
  }
  
  /**
   * Runs the given request.
   * @param context A non-null context for the logical query.
   * @param request A non-null request to execute. Implementations must 
   * preserve every field they do not act on.
   * @param upstream_span An optional upstream tracer span.
   * @return A query execution object that will contain a deferred to wait on
   * for a response.
   * @throws IllegalArgumentException if the request was null.
   * @throws QueryExecutionException (in the deferred) if the query failed.
   */
  public abstract QueryExecution<T> executeQuery(final QueryContext context,
                                                 final QueryRequest request,
                                                 final Span upstream_span);
  
  /**
   * Closes the executor. The default marks it completed, cancels any 
   * outstanding executions then closes the downstream executors.
   * @return A non-null deferred that resolves to null once the downstream
   * executors are closed, or an exception.
   */
  public Deferred<Object> close() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Closing executor: " + this);
    }
    completed.set(true);
    cancelOutstanding();
    if (downstream_executors != null) {
      if (downstream_executors.size() == 1) {
        return downstream_executors.get(0).close();
      }
      final List<Deferred<Object>> deferreds = 
          Lists.newArrayListWithExpectedSize(downstream_executors.size());
      for (final QueryExecutor<T> executor : downstream_executors) {
        deferreds.add(executor.close());
      }
      return Deferred.group(deferreds).addCallback(new GroupCB());
    }
    return Deferred.fromResult(null);
  }
  
  /** @return The ID of this executor. */
  public String id() {
    return id;
  }
  
  /** @return Whether or not the executor was closed. */
  public boolean closed() {
    return completed.get();
  }
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + "}";
  }
  
  /**
   * Iterates over outstanding executions and cancels them. There may be a race
   * condition when canceling which is why the exception is caught and logged.
   */
  protected void cancelOutstanding() {
    for (final QueryExecution<T> exec : outstanding_executions) {
      try {
        exec.cancel();
      } catch (Exception e) {
        LOG.error("Exception while canceling execution " + exec 
            + " of executor " + this, e);
      }
    }
  }
  
  /**
   * Adds a downstream executor to close along with this one.
   * @param executor A non-null executor to add.
   * @throws IllegalArgumentException if the executor was null.
   */
  protected void registerDownstreamExecutor(final QueryExecutor<T> executor) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (downstream_executors == null) {
      downstream_executors = Lists.<QueryExecutor<T>>newArrayList(executor);
    } else {
      downstream_executors.add(executor);
    }
  }
  
  @VisibleForTesting
  Set<QueryExecution<T>> outstandingRequests() {
    return outstanding_executions;
  }

  @VisibleForTesting 
  List<QueryExecutor<T>> downstreamExecutors() {
    return downstream_executors;
  }
  
  /** Collapses the group of close results to a single null. */
  private static class GroupCB implements Callback<Object, ArrayList<Object>> {
    @Override
    public Object call(final ArrayList<Object> ignored) throws Exception {
      return null;
    }
  }
}
