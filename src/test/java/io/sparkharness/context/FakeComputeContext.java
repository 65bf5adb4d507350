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

import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.SparkSession;

/** A compute context without Spark behind it; it only tracks its state. */
class FakeComputeContext implements ComputeContext {

  private final String name;
  private final int parallelism;
  private final RuntimeException failOnStop;
  private ContextState state = ContextState.ACTIVE;
  int stopCalls;

  FakeComputeContext(String name, int parallelism, RuntimeException failOnStop) {
    this.name = name;
    this.parallelism = parallelism;
    this.failOnStop = failOnStop;
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
    return null;
  }

  @Override
  public JavaSparkContext sparkContext() {
    checkActive();
    return null;
  }

  @Override
  public void stop() {
    checkActive();
    stopCalls++;
    state = ContextState.STOPPED;
    if (failOnStop != null) {
      throw failOnStop;
    }
  }

  private void checkActive() {
    if (state != ContextState.ACTIVE) {
      throw new LifecycleMisuseException(name + " is " + state);
    }
  }
}
