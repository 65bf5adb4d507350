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
package io.sparkharness.context;

import static java.util.Objects.requireNonNull;

import io.sparkharness.logging.LoggingContext;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates one compute context for a test class and tears it down afterwards.
 *
 * <p>The lifecycle moves {@code UNINITIALIZED -> ACTIVE -> STOPPED} exactly once; an instance is
 * not reusable. Before the context is created the log level of every registered logger is forced
 * to {@code ERROR}, or to {@code OFF} when logging is disabled, because a local Spark runtime is
 * extremely chatty at {@code INFO}. The level is forced again once the context exists.
 *
 * <p>On {@link #stop()} a silenced run is restored to {@code ERROR}, not to whatever level was in
 * effect before {@link #start(String, boolean)}. Users that want more verbose logs can set the
 * level themselves afterwards.
 *
 * <p>Only one lifecycle may be active in a process at a time.
 */
public class ComputeContextLifecycle {

  private static final Logger LOG = LoggerFactory.getLogger(ComputeContextLifecycle.class);

  /** Number of local workers of every test context. */
  public static final int LOCAL_PARALLELISM = 2;

  /** System properties a local Spark runtime leaves behind that identify the stopped context. */
  static final List<String> PROCESS_MARKERS =
      Arrays.asList("spark.master.port", "spark.driver.port");

  /** Test code run while the context is active. */
  @FunctionalInterface
  public interface ContextBody {
    void run(ComputeContext context) throws Exception;
  }

  private final LoggingContext logging;
  private final ComputeContextFactory factory;

  private ContextState state = ContextState.UNINITIALIZED;
  private boolean loggingDisabled;
  private ComputeContext context;
  private SparkSession session;

  public ComputeContextLifecycle(LoggingContext logging, ComputeContextFactory factory) {
    this.logging = requireNonNull(logging, "logging");
    this.factory = requireNonNull(factory, "factory");
  }

  public ContextState state() {
    return state;
  }

  /**
   * Silences logging and creates the context. If creating the context fails the exception
   * propagates and the lifecycle never becomes active, though {@link #stop()} must still be called.
   */
  public void start(String testIdentity, boolean disableLogging) {
    if (state != ContextState.UNINITIALIZED) {
      throw new LifecycleMisuseException(
          "start() called on a lifecycle that is already " + state);
    }
    loggingDisabled = disableLogging;
    Level level = disableLogging ? Level.OFF : Level.ERROR;
    logging.setLevel(level);

    context = factory.create(testIdentity, LOCAL_PARALLELISM);
    // Spark reloads its default log4j2 config when it finds none, which resets the root to INFO
    logging.setLevel(level);
    session = context.session();
    state = ContextState.ACTIVE;
  }

  /**
   * Releases the context and everything derived from it. Failures while stopping the context are
   * logged rather than thrown, so they never hide the failure of the test itself.
   */
  public void stop() {
    if (state == ContextState.STOPPED) {
      throw new LifecycleMisuseException("stop() called twice");
    }
    state = ContextState.STOPPED;
    session = null;
    ComputeContext toStop = context;
    context = null;
    if (toStop != null) {
      try {
        toStop.stop();
      } catch (RuntimeException e) {
        LOG.warn("Failed to stop compute context '{}'", toStop.name(), e);
      }
    }
    PROCESS_MARKERS.forEach(System::clearProperty);

    // re-enable normal logging for the next test class if it was turned off here
    if (loggingDisabled) {
      logging.setLevel(Level.ERROR);
    }
  }

  /**
   * Runs {@code body} against a fresh context, stopping it on every exit path. A failure of the
   * body propagates unchanged; a failure of the teardown is attached to it as suppressed.
   */
  public void runScoped(String testIdentity, boolean disableLogging, ContextBody body)
      throws Exception {
    Throwable primary = null;
    try {
      start(testIdentity, disableLogging);
      body.run(context);
    } catch (Throwable t) {
      primary = t;
      throw t;
    } finally {
      try {
        stop();
      } catch (RuntimeException e) {
        if (primary != null) {
          primary.addSuppressed(e);
        } else {
          throw e;
        }
      }
    }
  }

  public ComputeContext context() {
    checkActive();
    return context;
  }

  public SparkSession session() {
    checkActive();
    return session;
  }

  private void checkActive() {
    if (state != ContextState.ACTIVE) {
      throw new LifecycleMisuseException("No active compute context; lifecycle is " + state);
    }
  }
}
