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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import io.netty.util.Timer;
import io.opentracing.Tracer;

/**
 * A simple context built from an optional tracer and timer. Log lines are 
 * kept in memory, prefixed with their level, and only lines at or above the
 * configured level are recorded.
 *
 * @since 1.0
 */
public class DefaultQueryContext implements QueryContext {

  /** The levels we record. */
  public enum LogLevel {
    DEBUG,
    INFO,
    WARN
  }

  private final Tracer tracer;
  private final Timer timer;
  private final LogLevel log_level;
  private final List<String> logs;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  protected DefaultQueryContext(final Builder builder) {
    tracer = builder.tracer;
    timer = builder.timer;
    log_level = builder.log_level == null ? LogLevel.INFO : builder.log_level;
    logs = Lists.newArrayList();
  }

  @Override
  public Tracer getTracer() {
    return tracer;
  }

  @Override
  public Timer getTimer() {
    return timer;
  }

  @Override
  public List<String> logs() {
    synchronized (logs) {
      return ImmutableList.copyOf(logs);
    }
  }

  @Override
  public void logWarn(final String log) {
    log(LogLevel.WARN, log);
  }

  @Override
  public void logInfo(final String log) {
    log(LogLevel.INFO, log);
  }

  @Override
  public void logDebug(final String log) {
    log(LogLevel.DEBUG, log);
  }

  private void log(final LogLevel level, final String log) {
    if (level.ordinal() < log_level.ordinal()) {
      return;
    }
    synchronized (logs) {
      logs.add(level + " " + log);
    }
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** The builder. */
  public static class Builder {
    private Tracer tracer;
    private Timer timer;
    private LogLevel log_level;

    /**
     * @param tracer An optional tracer.
     * @return The builder.
     */
    public Builder setTracer(final Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    /**
     * @param timer An optional timer.
     * @return The builder.
     */
    public Builder setTimer(final Timer timer) {
      this.timer = timer;
      return this;
    }

    /**
     * @param log_level The minimum level to record, INFO by default.
     * @return The builder.
     */
    public Builder setLogLevel(final LogLevel log_level) {
      this.log_level = log_level;
      return this;
    }

    /** @return The context. */
    public DefaultQueryContext build() {
      return new DefaultQueryContext(this);
    }
  }
}
