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
package io.sparkharness.data;

import java.util.Objects;

/** How a delimited file is laid out and how strictly it is parsed. Immutable. */
public final class CsvAttributes {

  private final char delimiter;
  private final char quoteChar;
  private final boolean hasHeader;
  private final boolean failAtParsingError;

  public CsvAttributes(
      char delimiter, char quoteChar, boolean hasHeader, boolean failAtParsingError) {
    this.delimiter = delimiter;
    this.quoteChar = quoteChar;
    this.hasHeader = hasHeader;
    this.failAtParsingError = failAtParsingError;
  }

  public static CsvAttributes defaultCsv() {
    return new CsvAttributes(',', '"', false, true);
  }

  public static CsvAttributes defaultCsvWithHeader() {
    return defaultCsv().withHeader(true);
  }

  public static CsvAttributes defaultTsv() {
    return defaultCsv().withDelimiter('\t');
  }

  public char delimiter() {
    return delimiter;
  }

  public char quoteChar() {
    return quoteChar;
  }

  public boolean hasHeader() {
    return hasHeader;
  }

  /** When false, malformed lines become rows of nulls instead of failing the read. */
  public boolean failAtParsingError() {
    return failAtParsingError;
  }

  public CsvAttributes withDelimiter(char newDelimiter) {
    return new CsvAttributes(newDelimiter, quoteChar, hasHeader, failAtParsingError);
  }

  public CsvAttributes withQuoteChar(char newQuoteChar) {
    return new CsvAttributes(delimiter, newQuoteChar, hasHeader, failAtParsingError);
  }

  public CsvAttributes withHeader(boolean newHasHeader) {
    return new CsvAttributes(delimiter, quoteChar, newHasHeader, failAtParsingError);
  }

  public CsvAttributes withFailAtParsingError(boolean fail) {
    return new CsvAttributes(delimiter, quoteChar, hasHeader, fail);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CsvAttributes)) {
      return false;
    }
    CsvAttributes that = (CsvAttributes) o;
    return delimiter == that.delimiter
        && quoteChar == that.quoteChar
        && hasHeader == that.hasHeader
        && failAtParsingError == that.failAtParsingError;
  }

  @Override
  public int hashCode() {
    return Objects.hash(delimiter, quoteChar, hasHeader, failAtParsingError);
  }

  @Override
  public String toString() {
    return "CsvAttributes{delimiter='"
        + delimiter
        + "', quoteChar='"
        + quoteChar
        + "', hasHeader="
        + hasHeader
        + ", failAtParsingError="
        + failAtParsingError
        + '}';
  }
}
