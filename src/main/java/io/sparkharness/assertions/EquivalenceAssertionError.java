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

import org.opentest4j.AssertionFailedError;

/**
 * Failure of one of the {@link EquivalenceAssertions}. Extends the opentest4j error so that IDEs
 * and build tools show the expected and actual values side by side.
 */
public class EquivalenceAssertionError extends AssertionFailedError {

  private static final long serialVersionUID = 1L;

  private final MismatchKind kind;

  public EquivalenceAssertionError(
      MismatchKind kind, String message, Object expected, Object actual) {
    super(message, expected, actual);
    this.kind = kind;
  }

  public MismatchKind kind() {
    return kind;
  }
}
