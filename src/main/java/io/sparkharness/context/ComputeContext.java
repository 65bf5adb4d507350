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

/**
 * An execution session owned by exactly one {@link ComputeContextLifecycle}. Once stopped, a
 * context is never reused: the accessors below throw {@link LifecycleMisuseException}.
 */
public interface ComputeContext {

  String name();

  int parallelism();

  ContextState state();

  SparkSession session();

  JavaSparkContext sparkContext();

  /** Releases the underlying session. Calling it on a stopped context is a misuse. */
  void stop();
}
