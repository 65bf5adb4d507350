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
package io.sparkharness.assertions;

/** Why an equivalence assertion failed. */
public enum MismatchKind {
  /** The compared sequences have different element counts. */
  LENGTH_MISMATCH,
  /** An element-wise comparison failed. */
  VALUE_MISMATCH,
  /** Derived and expected canonical schema strings differ. */
  SCHEMA_MISMATCH,
  /** A pattern has no match in the haystack. */
  PATTERN_NOT_FOUND
}
