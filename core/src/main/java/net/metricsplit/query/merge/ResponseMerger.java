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
package net.metricsplit.query.merge;

import net.metricsplit.query.QueryRequest;
import net.metricsplit.query.QueryResponse;

/**
 * Folds partial responses from partitions of a query into a single
 * accumulated response and decides when enough data has been collected.
 * Implementations must be stateless and thread safe; they never mutate
 * their inputs.
 *
 * @since 1.0
 */
public interface ResponseMerger {

  /**
   * Merges a partial response into the accumulator.
   * @param accumulator The response merged so far, null for the first
   * partition.
   * @param partial A non-null partial response to merge.
   * @return The combined response. When the accumulator was null the
   * partial is returned as is.
   * @throws IllegalArgumentException if the partial was null.
   */
  public QueryResponse combine(final QueryResponse accumulator,
                               final QueryResponse partial);

  /**
   * Whether or not the response already satisfies the request's limit.
   * @param request The non-null original request.
   * @param response The non-null accumulated response.
   * @return True if no further partitions should be executed.
   */
  public boolean limitReached(final QueryRequest request,
                              final QueryResponse response);
}
