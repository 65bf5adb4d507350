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

import io.sparkharness.schema.SchemaDescription;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

/**
 * Data-equivalence assertions for tabular test results.
 *
 * <p>Every method either returns normally or throws an {@link EquivalenceAssertionError} whose
 * message names both compared values. Nothing is retried and nothing is mutated.
 */
public final class EquivalenceAssertions {

  public static final double DEFAULT_EPSILON = 0.01;

  /** Separator between rows in an expected result string. */
  public static final String ROW_SEPARATOR = ";";

  private EquivalenceAssertions() {}

  public static void assertToleranceEqual(List<?> actual, List<Double> expected) {
    assertToleranceEqual(actual, expected, DEFAULT_EPSILON);
  }

  /**
   * Ensure that the actual values are within {@code epsilon} of the expected doubles, position by
   * position. Numbers of any boxed type are widened to double; anything else compares as {@link
   * NumericCoercion#NON_NUMERIC} and so fails the check. A null expected value never matches.
   */
  public static void assertToleranceEqual(List<?> actual, List<Double> expected, double epsilon) {
    assertSameLength(actual, expected);
    for (int i = 0; i < actual.size(); i++) {
      double a = NumericCoercion.toDouble(actual.get(i));
      Double e = expected.get(i);
      if (e == null || !(Math.abs(a - e) < epsilon)) {
        throw new EquivalenceAssertionError(
            MismatchKind.VALUE_MISMATCH,
            String.format(
                "Element %d: actual %s not equal %s within %s", i, actual.get(i), e, epsilon),
            e,
            actual.get(i));
      }
    }
  }

  /** Ensure that two sequences hold the same elements, regardless of their order. */
  public static <T extends Comparable<? super T>> void assertUnorderedEqual(
      List<T> actual, List<T> expected) {
    assertUnorderedEqual(actual, expected, Comparator.<T>naturalOrder());
  }

  /**
   * Sorts copies of both sequences with {@code order} and compares them element by element. A
   * mismatch is reported by its position in the sorted sequences.
   */
  public static <T> void assertUnorderedEqual(
      List<T> actual, List<T> expected, Comparator<? super T> order) {
    assertSameLength(actual, expected);
    Comparator<? super T> nullSafe = Comparator.nullsFirst(order);
    List<T> sortedActual = new ArrayList<>(actual);
    List<T> sortedExpected = new ArrayList<>(expected);
    sortedActual.sort(nullSafe);
    sortedExpected.sort(nullSafe);

    for (int i = 0; i < sortedActual.size(); i++) {
      T a = sortedActual.get(i);
      T e = sortedExpected.get(i);
      if (!Objects.equals(a, e)) {
        throw new EquivalenceAssertionError(
            MismatchKind.VALUE_MISMATCH,
            String.format("Sorted element %d: actual %s not equal %s", i, a, e),
            sortedExpected,
            sortedActual);
      }
    }
  }

  /**
   * Verify that the rows of {@code dataset} match {@code expected}, a {@code ;} separated list of
   * row renderings such as {@code "1,a; 2,b"}. Row order is not significant.
   */
  public static void assertDatasetEqual(Dataset<Row> dataset, String expected) {
    List<String> actualLines = renderRows(dataset);
    List<String> expectedLines =
        Arrays.stream(expected.split(ROW_SEPARATOR)).map(String::trim).collect(Collectors.toList());
    assertUnorderedEqual(actualLines, expectedLines);
  }

  /**
   * Verify that the schema of {@code dataset} matches {@code expectedSchema} in the compact form
   * of {@link SchemaDescription}. Field order is significant.
   */
  public static void assertSchemaEqual(Dataset<Row> dataset, String expectedSchema) {
    String expected = SchemaDescription.fromString(expectedSchema).toString();
    String actual = SchemaDescription.fromDataset(dataset).toString();
    if (!actual.equals(expected)) {
      throw new EquivalenceAssertionError(
          MismatchKind.SCHEMA_MISMATCH,
          "Schema mismatch: expected <" + expected + "> but was <" + actual + ">",
          expected,
          actual);
    }
  }

  /** Schema equality followed by order-insensitive row equality. */
  public static void assertDatasetsSame(Dataset<Row> expected, Dataset<Row> actual) {
    String expectedSchema = SchemaDescription.fromDataset(expected).toString();
    assertSchemaEqual(actual, expectedSchema);
    assertUnorderedEqual(renderRows(actual), renderRows(expected));
  }

  public static void assertMatchesPattern(String haystack, String regex) {
    assertMatchesPattern(haystack, Pattern.compile(regex));
  }

  /** Check that {@code pattern} matches somewhere in {@code haystack}. */
  public static void assertMatchesPattern(String haystack, Pattern pattern) {
    if (!pattern.matcher(haystack).find()) {
      throw new EquivalenceAssertionError(
          MismatchKind.PATTERN_NOT_FOUND,
          "'" + haystack + "' does not match " + pattern.pattern(),
          pattern.pattern(),
          haystack);
    }
  }

  /** Positional field values of each row, comma separated, without the enclosing brackets. */
  static List<String> renderRows(Dataset<Row> dataset) {
    return dataset.collectAsList().stream()
        .map(EquivalenceAssertions::renderRow)
        .collect(Collectors.toList());
  }

  static String renderRow(Row row) {
    String rendered = row.toString();
    if (rendered.startsWith("[")) {
      rendered = rendered.substring(1);
    }
    if (rendered.endsWith("]")) {
      rendered = rendered.substring(0, rendered.length() - 1);
    }
    return rendered;
  }

  private static void assertSameLength(List<?> actual, List<?> expected) {
    if (actual.size() != expected.size()) {
      throw new EquivalenceAssertionError(
          MismatchKind.LENGTH_MISMATCH,
          String.format(
              "Length mismatch: expected %d elements but was %d: expected %s, actual %s",
              expected.size(), actual.size(), expected, actual),
          expected.size(),
          actual.size());
    }
  }
}
