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

import net.metricsplit.query.LoadingState;
import net.metricsplit.query.QueryResponse;

/**
 * The terminal error of a partitioned query. Carries the response that had
 * been accumulated before the failing partition so that callers keep the
 * data they already have. The partial response is always in the
 * {@link LoadingState#ERROR} state with the cause attached.
 *
 * @since 1.0
 */
public class PartialResultException extends QueryExecutionException {
  private static final long serialVersionUID = -4170523893527718054L;

  /** The data merged before the failure. */
  private final transient QueryResponse partial_result;

  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param status_code A status code, taken from the cause when possible.
   * @param order The number of the partition that failed.
   * @param partial_result A non-null response in the error state.
   * @param t The cause of the failure.
   * @throws IllegalArgumentException if the partial result was null or not
   * in the error state.
   */
  public PartialResultException(final String msg,
                                final int status_code,
                                final int order,
                                final QueryResponse partial_result,
                                final Throwable t) {
    super(msg, status_code, order, t);
    if (partial_result == null) {
      throw new IllegalArgumentException("Partial result cannot be null.");
    }
    if (partial_result.state() != LoadingState.ERROR) {
      throw new IllegalArgumentException("Partial result must be in the "
          + "ERROR state: " + partial_result.state());
    }
    this.partial_result = partial_result;
  }

  /** @return The non-null response merged before the failure. */
  public QueryResponse getPartialResult() {
    return partial_result;
  }
}
