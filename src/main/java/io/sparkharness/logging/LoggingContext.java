/*
 * Copyright (2025) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sparkharness.logging;

import org.apache.logging.log4j.Level;

/**
 * Handle on the process-wide logging configuration.
 *
 * <p>{@link #setLevel(Level)} is not a scoped save/restore: the new level stays in effect for the
 * rest of the process, including for code unrelated to the caller. Callers that want to raise
 * verbosity temporarily must call {@code setLevel} again with the level they want afterwards.
 */
public interface LoggingContext {

  /**
   * Forces the root logger and every currently registered logger to {@code level}. Never throws;
   * if the logging backend cannot be reached this is a no-op.
   */
  void setLevel(Level level);
}
