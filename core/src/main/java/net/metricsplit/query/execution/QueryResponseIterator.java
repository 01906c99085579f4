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

import java.io.Closeable;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.metricsplit.exceptions.QueryExecutionException;
import net.metricsplit.query.QueryResponse;
import net.metricsplit.query.QuerySink;

/**
 * A blocking iterator over the emissions of a partitioned query. The 
 * iterator is the query's sink: emissions are buffered and handed out in
 * order, {@link #hasNext()} blocks until the next emission or the end of the
 * query. A terminal error is rethrown from {@link #hasNext()} and
 * {@link #next()}; closing the iterator cancels the query.
 * <p>
 * Not thread safe for multiple consumers.
 * 
 * @since 1.0
 */
public class QueryResponseIterator 
    implements Iterator<QueryResponse>, QuerySink, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryResponseIterator.class);
  
  /** Queued marker for the end of the stream. */
  private static final Object COMPLETE = new Object();
  
  /** Emissions, errors and the completion marker in arrival order. */
  private final BlockingQueue<Object> queue;
  
  /** The execution to cancel on close. */
  private volatile QueryExecution<QueryResponse> execution;
  
  /** The next response if fetched by {@link #hasNext()}. */
  private QueryResponse next;
  
  /** The terminal error, rethrown on every call once seen. */
  private RuntimeException error;
  
  /** Set once the stream is exhausted or closed. */
  private volatile boolean finished;
  
  /** Ctor. */
  public QueryResponseIterator() {
    queue = new LinkedBlockingQueue<Object>();
  }
  
  /**
   * @param execution The non-null execution feeding this iterator.
   * @throws IllegalArgumentException if the execution was null.
   */
  public void setExecution(final QueryExecution<QueryResponse> execution) {
    if (execution == null) {
      throw new IllegalArgumentException("Execution cannot be null.");
    }
    this.execution = execution;
  }
  
  @Override
  public void onNext(final QueryResponse response) {
    queue.offer(response);
  }
  
  @Override
  public void onComplete() {
    queue.offer(COMPLETE);
  }
  
  @Override
  public void onError(final Throwable t) {
    queue.offer(t);
  }
  
  /**
   * Blocks until an emission or the end of the query is available.
   * @return True if {@link #next()} will return a response.
   * @throws QueryExecutionException if the query failed, with the 
   * original exception if it was unchecked, or if the wait was interrupted.
   */
  @Override
  public boolean hasNext() {
    if (error != null) {
      throw error;
    }
    if (next != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    final Object event;
    try {
      event = queue.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted waiting for the next "
          + "response", 500, e);
    }
    if (event == COMPLETE) {
      finished = true;
      return false;
    }
    if (event instanceof Throwable) {
      finished = true;
      error = event instanceof RuntimeException ? (RuntimeException) event :
        new QueryExecutionException("Query failed", 500, (Throwable) event);
      throw error;
    }
    next = (QueryResponse) event;
    return true;
  }
  
  @Override
  public QueryResponse next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more responses.");
    }
    final QueryResponse response = next;
    next = null;
    return response;
  }
  
  /** Cancels the query if it is still running and ends the iteration. */
  @Override
  public void close() {
    if (finished) {
      return;
    }
    finished = true;
    next = null;
    final QueryExecution<QueryResponse> execution = this.execution;
    if (execution != null && !execution.completed()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Canceling execution on close: " + execution);
      }
      execution.cancel();
    }
    queue.clear();
  }
}
