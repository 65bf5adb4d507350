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

/**
 * Thrown when a compute context or its lifecycle is used outside of its active window, for
 * example after it has been stopped. This is a programming error in the test, not a condition to
 * recover from.
 */
public class LifecycleMisuseException extends IllegalStateException {

  public LifecycleMisuseException(String message) {
    super(message);
  }
}
