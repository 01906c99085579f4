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

import net.metricsplit.query.QueryRequest;

/**
 * An execution returned when an executor catches an exception that should
 * bubble upstream immediately, e.g. the executor was closed or the request
 * could not be split. The deferred is already called with the exception.
 *  
 * @param <T> The type of data expected upstream.
 * 
 * @since 1.0
 */
public class FailedQueryExecution<T> extends QueryExecution<T> {
  
  /**
   * Default Ctor.
   * @param request A non-null request associated with the execution.
   * @param ex A non-null exception to pass upstream.
   * @throws IllegalArgumentException if the exception or request were null.
   */
  public FailedQueryExecution(final QueryRequest request, final Exception ex) {
    super(request);
    if (ex == null) {
      throw new IllegalArgumentException("The exception cannot be null.");
    }
    callback(ex);
  }
  
  @Override
  public void cancel() {
    // no-op, already called back
  }

}
