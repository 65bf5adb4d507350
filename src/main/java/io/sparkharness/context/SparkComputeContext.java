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

import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.SparkSession;

/** {@link ComputeContext} over a local {@link SparkSession}. */
public class SparkComputeContext implements ComputeContext {

  private final String name;
  private final int parallelism;
  private SparkSession session;
  private JavaSparkContext sparkContext;
  private ContextState state;

  SparkComputeContext(String name, int parallelism, SparkSession session) {
    this.name = requireNonNull(name, "name");
    this.parallelism = parallelism;
    this.session = requireNonNull(session, "session");
    this.sparkContext = JavaSparkContext.fromSparkContext(session.sparkContext());
    this.state = ContextState.ACTIVE;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int parallelism() {
    return parallelism;
  }

  @Override
  public ContextState state() {
    return state;
  }

  @Override
  public SparkSession session() {
    checkActive();
    return session;
  }

  @Override
  public JavaSparkContext sparkContext() {
    checkActive();
    return sparkContext;
  }

  @Override
  public void stop() {
    checkActive();
    state = ContextState.STOPPED;
    SparkSession toStop = session;
    session = null;
    sparkContext = null;
    try {
      toStop.stop();
    } finally {
      SparkSession.clearActiveSession();
      SparkSession.clearDefaultSession();
    }
  }

  private void checkActive() {
    if (state != ContextState.ACTIVE) {
      throw new LifecycleMisuseException(
          "Compute context '" + name + "' is " + state + "; obtain a fresh one per test class");
    }
  }
}
