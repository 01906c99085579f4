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
package net.metricsplit.exceptions;

/**
 * High level exception thrown or passed through the deferred chain by any
 * portion of a query execution to bubble up to the caller.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 6338254902243113267L;

  /** The order of the execution within a partitioned query. E.g. if a query
   * has 4 partitions, this is the partition number from 1 to 4. -1 if not
   * tied to a partition. */
  protected final int order;

  /** A status code associated with the exception, e.g. an HTTP code. */
  protected final int status_code;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1);
  }

  /**
   * Ctor that sets a partition order for the exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional order of the partition that failed.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order) {
    this(msg, status_code, order, null);
  }

  /**
   * Ctor that sets a descriptive message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable t) {
    this(msg, status_code, -1, t);
  }

  /**
   * Ctor setting a message, partition order, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order An optional order of the partition that failed.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final int order,
                                 final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    this.order = order;
  }

  /** @return The partition order if pertaining to a partitioned query. */
  public int getOrder() {
    return order;
  }

  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }
}
