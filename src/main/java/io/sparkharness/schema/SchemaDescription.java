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
package io.sparkharness.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;

/**
 * Ordered list of fields parsed from the compact schema form, for example {@code
 * "id:Integer; name:String; amount:Decimal[12,2]"}.
 *
 * <p>Convention:
 *
 * <ul>
 *   <li>entries are separated by {@value #DEFAULT_FIELD_DELIMITER} unless another delimiter is
 *       given; a delimiter of {@code ,} cannot be combined with {@code Decimal[p,s]},
 *   <li>name and type are separated by the first {@value FieldDescriptor#NAME_TYPE_SEPARATOR},
 *   <li>whitespace around names, types and entries is ignored, as are blank entries and anything
 *       after {@code //} in an entry.
 * </ul>
 *
 * <p>The canonical rendering joins {@code "name: Type"} entries with {@code "; "}. Two
 * descriptions are equal iff their renderings are equal, so field order matters.
 */
public final class SchemaDescription {

  public static final String DEFAULT_FIELD_DELIMITER = ";";

  private static final String CANONICAL_JOINER = DEFAULT_FIELD_DELIMITER + " ";
  private static final String COMMENT = "//";

  private final List<FieldDescriptor> fields;

  public SchemaDescription(List<FieldDescriptor> fields) {
    this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
  }

  public static SchemaDescription fromString(String schema) {
    return fromString(schema, DEFAULT_FIELD_DELIMITER);
  }

  public static SchemaDescription fromString(String schema, String fieldDelimiter) {
    List<FieldDescriptor> fields = new ArrayList<>();
    for (String entry : schema.split(Pattern.quote(fieldDelimiter))) {
      String cleaned = stripComment(entry).trim();
      if (!cleaned.isEmpty()) {
        fields.add(FieldDescriptor.parse(cleaned));
      }
    }
    return new SchemaDescription(fields);
  }

  public static SchemaDescription fromStructType(StructType structType) {
    List<FieldDescriptor> fields = new ArrayList<>();
    for (StructField field : structType.fields()) {
      fields.add(FieldDescriptor.fromStructField(field));
    }
    return new SchemaDescription(fields);
  }

  public static SchemaDescription fromDataset(Dataset<Row> dataset) {
    return fromStructType(dataset.schema());
  }

  static String stripComment(String entry) {
    int comment = entry.indexOf(COMMENT);
    return comment >= 0 ? entry.substring(0, comment) : entry;
  }

  public List<FieldDescriptor> fields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  public StructType toStructType() {
    return DataTypes.createStructType(
        fields.stream().map(FieldDescriptor::toStructField).collect(Collectors.toList()));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SchemaDescription && toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    return fields.stream()
        .map(FieldDescriptor::toString)
        .collect(Collectors.joining(CANONICAL_JOINER));
  }
}
