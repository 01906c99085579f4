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
 * Exception bubbled up when a query is canceled.
 *
 * @since 1.0
 */
public class QueryExecutionCanceled extends QueryExecutionException {
  private static final long serialVersionUID = -2225712915698705683L;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionCanceled(final String msg, final int status_code) {
    super(msg, status_code);
  }

  /**
   * Ctor that sets a partition order for the exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The order of the partition in flight when canceled.
   */
  public QueryExecutionCanceled(final String msg,
                                final int status_code,
                                final int order) {
    super(msg, status_code, order);
  }
}
