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
package net.metricsplit.query;

/**
 * Implemented by the caller of a partitioned query to receive the stream of
 * growing responses. This follows the observer pattern:
 * <ol>
 * <li>{@link #onNext(QueryResponse)} is called once per executed partition
 * with the accumulated response so far. Each response holds at least as much
 * data as the one before it.</li>
 * <li>Exactly one terminal call follows: {@link #onComplete()} after the
 * final, {@link LoadingState#DONE} response, or {@link #onError(Throwable)}
 * if a partition failed.</li>
 * </ol>
 * <p>
 * Calls are never concurrent for a single query but may arrive on different
 * threads. After the query is canceled no method is called again.
 *
 * @since 1.0
 */
public interface QuerySink {

  /**
   * Called after the final {@link #onNext(QueryResponse)} to signal the end
   * of data.
   */
  public void onComplete();

  /**
   * Called when a new accumulated response is available.
   * @param next A non-null response in the {@link LoadingState#STREAMING} or
   * {@link LoadingState#DONE} state.
   */
  public void onNext(final QueryResponse next);

  /**
   * Called when execution failed. No further calls will occur.
   * @param t The exception that was thrown. For partitioned queries this is a
   * {@code PartialResultException} holding the data merged before the failure.
   */
  public void onError(final Throwable t);
}
