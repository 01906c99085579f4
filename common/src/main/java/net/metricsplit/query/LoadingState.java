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
 * The state of a response as it moves through a partitioned execution.
 *
 * @since 1.0
 */
public enum LoadingState {
  /** Partitions are being executed and nothing has been emitted yet. */
  RUNNING,

  /** A partial response; more partitions will follow. */
  STREAMING,

  /** The final, complete response. */
  DONE,

  /** Execution failed. The response holds whatever was merged beforehand. */
  ERROR;

  /** @return True if no further responses will follow this state. */
  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
