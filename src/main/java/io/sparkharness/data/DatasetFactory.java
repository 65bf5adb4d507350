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

import static java.util.Objects.requireNonNull;

import io.sparkharness.fs.FileSystemProvider;
import io.sparkharness.schema.FieldDescriptor;
import io.sparkharness.schema.FieldType;
import io.sparkharness.schema.SchemaDescription;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.spark.sql.DataFrameReader;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Encoders;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds datasets for tests, either from literal strings or from CSV files with a sibling {@code
 * .schema} file. Both go through Spark's CSV reader, so a value parses the same way in either.
 *
 * <p>Literal data uses {@code ;} between rows and {@code ,} between fields. Rows and fields are
 * trimmed, an empty field is null, and a field can be wrapped in double quotes to contain a comma.
 * Unlike files, literal data is parsed eagerly: a bad row fails {@link #createDataset} with an
 * {@link IllegalArgumentException} naming the row, and the column and value when there is one.
 *
 * <p>Decimals are rounded half up to the column scale and rejected when they need more than the
 * column precision. Spark takes one date format and one timestamp format per read, so a format
 * given on one date (timestamp) column applies to every date (timestamp) column, and two
 * different formats for the same type are rejected.
 */
public class DatasetFactory {

  private static final Logger LOG = LoggerFactory.getLogger(DatasetFactory.class);

  public static final String ROW_DELIMITER = ";";

  /** Extra column that receives the raw text of rows Spark could not parse. */
  static final String CORRUPT_RECORD = "_harness_corrupt_record";

  private final SparkSession session;
  private final FileSystemProvider fs;

  public DatasetFactory(SparkSession session, FileSystemProvider fs) {
    this.session = requireNonNull(session, "session");
    this.fs = requireNonNull(fs, "fs");
  }

  public Dataset<Row> createDataset(String schema, String data) {
    return createDataset(SchemaDescription.fromString(schema), data);
  }

  public Dataset<Row> createDataset(SchemaDescription schema, String data) {
    List<String> lines = new ArrayList<>();
    for (String line : data.split(ROW_DELIMITER)) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    StructType structType = schema.toStructType();
    if (lines.isEmpty()) {
      return session.createDataFrame(Collections.<Row>emptyList(), structType);
    }

    Dataset<String> input = session.createDataset(lines, Encoders.STRING());
    Dataset<Row> typed = literalReader(schema, withCorruptRecord(readSchema(schema))).csv(input);
    List<Row> parsed = withBinaryColumns(typed, schema).collectAsList();

    List<Row> rows = new ArrayList<>(parsed.size());
    for (int i = 0; i < parsed.size(); i++) {
      Row row = parsed.get(i);
      if (!row.isNullAt(schema.size())) {
        throw malformedRow(schema, input, lines.get(i), i, row);
      }
      Object[] values = new Object[schema.size()];
      for (int c = 0; c < values.length; c++) {
        values[c] = row.get(c);
      }
      rows.add(RowFactory.create(values));
    }
    return session.createDataFrame(rows, structType);
  }

  /** Reads {@code path} with the schema from {@link SchemaFile#schemaPathFor(String)}. */
  public Dataset<Row> loadCsv(String path, CsvAttributes attributes) {
    String schemaPath = SchemaFile.schemaPathFor(path);
    if (!fs.exists(schemaPath)) {
      throw new IllegalArgumentException("No schema file " + schemaPath + " for " + path);
    }
    SchemaFile schemaFile = SchemaFile.read(fs, schemaPath);
    return read(path, schemaFile.schema(), schemaFile.applyTo(attributes));
  }

  /**
   * Reads every data file in {@code dir} with one shared schema file and unions them. Hidden files
   * and files starting with {@code _} are skipped.
   */
  public Dataset<Row> loadCsvDirectory(String dir, String schemaPath, CsvAttributes attributes) {
    SchemaFile schemaFile = SchemaFile.read(fs, schemaPath);
    CsvAttributes effective = schemaFile.applyTo(attributes);
    List<String> files =
        fs.list(dir).stream()
            .filter(name -> !name.startsWith(".") && !name.startsWith("_"))
            .map(name -> dir.endsWith("/") ? dir + name : dir + "/" + name)
            .collect(Collectors.toList());
    if (files.isEmpty()) {
      throw new IllegalStateException("There are no data files in " + dir);
    }
    Dataset<Row> combined = null;
    for (String file : files) {
      Dataset<Row> df = read(file, schemaFile.schema(), effective);
      combined = combined == null ? df : combined.union(df);
    }
    return combined;
  }

  private Dataset<Row> read(String path, SchemaDescription schema, CsvAttributes attributes) {
    LOG.debug("Reading {} with {}", path, attributes);
    return withBinaryColumns(reader(schema, readSchema(schema), attributes).csv(path), schema);
  }

  private DataFrameReader reader(
      SchemaDescription schema, StructType readSchema, CsvAttributes attributes) {
    DataFrameReader reader =
        session
            .read()
            .schema(readSchema)
            .option("sep", String.valueOf(attributes.delimiter()))
            .option("quote", String.valueOf(attributes.quoteChar()))
            .option("header", attributes.hasHeader())
            .option("mode", attributes.failAtParsingError() ? "FAILFAST" : "PERMISSIVE");
    Optional<String> dateFormat = sharedFormat(schema, FieldType.DATE);
    if (dateFormat.isPresent()) {
      reader = reader.option("dateFormat", dateFormat.get());
    }
    Optional<String> timestampFormat = sharedFormat(schema, FieldType.TIMESTAMP);
    if (timestampFormat.isPresent()) {
      reader = reader.option("timestampFormat", timestampFormat.get());
    }
    return reader;
  }

  /** Permissive reader for literal rows; bad rows land in {@link #CORRUPT_RECORD}. */
  private DataFrameReader literalReader(SchemaDescription schema, StructType readSchema) {
    return reader(schema, readSchema, CsvAttributes.defaultCsv().withFailAtParsingError(false))
        .option("ignoreLeadingWhiteSpace", true)
        .option("ignoreTrailingWhiteSpace", true)
        .option("columnNameOfCorruptRecord", CORRUPT_RECORD);
  }

  /**
   * Works out why row {@code rowNumber} was rejected by reading the input again with every column
   * as a string. If that read rejects the row too, the field count is wrong. Otherwise the first
   * column that has text but no typed value is the culprit.
   */
  private IllegalArgumentException malformedRow(
      SchemaDescription schema, Dataset<String> input, String line, int rowNumber, Row typed) {
    StructType rawSchema = new StructType();
    for (FieldDescriptor field : schema.fields()) {
      rawSchema = rawSchema.add(field.name(), DataTypes.StringType, true);
    }
    Row raw =
        literalReader(schema, withCorruptRecord(rawSchema))
            .csv(input)
            .collectAsList()
            .get(rowNumber);

    if (!raw.isNullAt(schema.size())) {
      return new IllegalArgumentException(
          String.format(
              "Row %d '%s' does not have the %d fields of schema '%s'",
              rowNumber, line, schema.size(), schema));
    }
    for (int c = 0; c < schema.size(); c++) {
      if (!raw.isNullAt(c) && typed.isNullAt(c)) {
        FieldDescriptor field = schema.fields().get(c);
        return new IllegalArgumentException(
            String.format(
                "Row %d: cannot parse '%s' as %s for column %s",
                rowNumber, raw.getString(c), field.type().tag(), field.name()));
      }
    }
    return new IllegalArgumentException(
        String.format("Row %d '%s' cannot be parsed with schema '%s'", rowNumber, line, schema));
  }

  /** Schema handed to the reader; the CSV source has no binary type, so binary is read as text. */
  private static StructType readSchema(SchemaDescription schema) {
    StructType result = new StructType();
    for (FieldDescriptor field : schema.fields()) {
      result =
          result.add(
              field.name(),
              field.type() == FieldType.BINARY ? DataTypes.StringType : field.sparkType(),
              true);
    }
    return result;
  }

  private static StructType withCorruptRecord(StructType readSchema) {
    return readSchema.add(CORRUPT_RECORD, DataTypes.StringType, true);
  }

  private static Dataset<Row> withBinaryColumns(Dataset<Row> df, SchemaDescription schema) {
    Dataset<Row> result = df;
    for (FieldDescriptor field : schema.fields()) {
      if (field.type() == FieldType.BINARY) {
        String name = field.name();
        result =
            result.withColumn(
                name, result.col("`" + name.replace("`", "``") + "`").cast(DataTypes.BinaryType));
      }
    }
    return result;
  }

  /** The one format the fields of {@code type} agree on, if any of them has one. */
  static Optional<String> sharedFormat(SchemaDescription schema, FieldType type) {
    List<String> formats =
        schema.fields().stream()
            .filter(field -> field.type() == type && field.format().isPresent())
            .map(field -> field.format().get())
            .distinct()
            .collect(Collectors.toList());
    if (formats.size() > 1) {
      throw new IllegalArgumentException(
          String.format(
              "%s columns of '%s' use different formats %s; a CSV read takes only one",
              type.tag(), schema, formats));
    }
    return formats.stream().findFirst();
  }
}
