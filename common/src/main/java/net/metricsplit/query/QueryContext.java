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

import java.util.List;

import io.netty.util.Timer;
import io.opentracing.Tracer;

/**
 * Per-request execution context shared by the executors handling a single
 * logical query. Holds the optional tracer and timer and collects user
 * facing log lines describing the execution.
 *
 * @since 1.0
 */
public interface QueryContext {

  /** @return An optional tracer. If null, tracing is disabled. */
  public Tracer getTracer();

  /** @return An optional timer for timeouts. May be null. */
  public Timer getTimer();

  /** @return A non-null, possibly empty, copy of the log lines so far. */
  public List<String> logs();

  /** @param log A message at the warn level. */
  public void logWarn(final String log);

  /** @param log A message at the info level. */
  public void logInfo(final String log);

  /** @param log A message at the debug level. */
  public void logDebug(final String log);
}
