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

import java.math.BigDecimal;

/**
 * Widens the values found in a result row to {@code double} for tolerance comparison.
 *
 * <p>Values that are not numbers, null included, are mapped to {@link #NON_NUMERIC} instead of
 * failing here. They then fail the tolerance check against any reasonable expected value, so a
 * type mismatch shows up as a value mismatch that names the offending element.
 */
final class NumericCoercion {

  /** Stand-in for non-numeric values: the smallest finite double. */
  static final double NON_NUMERIC = -Double.MAX_VALUE;

  enum Kind {
    DOUBLE,
    FLOAT,
    LONG,
    INTEGER,
    SHORT,
    BYTE,
    DECIMAL,
    NON_NUMERIC
  }

  private NumericCoercion() {}

  static Kind classify(Object value) {
    if (value instanceof Double) {
      return Kind.DOUBLE;
    } else if (value instanceof Float) {
      return Kind.FLOAT;
    } else if (value instanceof Long) {
      return Kind.LONG;
    } else if (value instanceof Integer) {
      return Kind.INTEGER;
    } else if (value instanceof Short) {
      return Kind.SHORT;
    } else if (value instanceof Byte) {
      return Kind.BYTE;
    } else if (value instanceof BigDecimal) {
      return Kind.DECIMAL;
    }
    return Kind.NON_NUMERIC;
  }

  static double toDouble(Object value) {
    switch (classify(value)) {
      case DOUBLE:
      case FLOAT:
      case LONG:
      case INTEGER:
      case SHORT:
      case BYTE:
      case DECIMAL:
        return ((Number) value).doubleValue();
      case NON_NUMERIC:
      default:
        return NON_NUMERIC;
    }
  }
}
