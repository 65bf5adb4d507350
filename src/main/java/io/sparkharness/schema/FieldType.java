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

import java.util.Locale;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;

/** Type tags of the compact schema form, with their Spark counterparts. */
public enum FieldType {
  STRING("String", DataTypes.StringType),
  INTEGER("Integer", DataTypes.IntegerType),
  LONG("Long", DataTypes.LongType),
  SHORT("Short", DataTypes.ShortType),
  BYTE("Byte", DataTypes.ByteType),
  FLOAT("Float", DataTypes.FloatType),
  DOUBLE("Double", DataTypes.DoubleType),
  BOOLEAN("Boolean", DataTypes.BooleanType),
  DATE("Date", DataTypes.DateType),
  TIMESTAMP("Timestamp", DataTypes.TimestampType),
  // Spark type depends on precision and scale, see FieldDescriptor#sparkType
  DECIMAL("Decimal", null),
  BINARY("Binary", DataTypes.BinaryType);

  private final String tag;
  private final DataType sparkType;

  FieldType(String tag, DataType sparkType) {
    this.tag = tag;
    this.sparkType = sparkType;
  }

  public String tag() {
    return tag;
  }

  DataType sparkType() {
    return sparkType;
  }

  /** Case-insensitive lookup by tag. */
  public static FieldType fromTag(String tag) {
    String wanted = tag.trim().toLowerCase(Locale.ROOT);
    for (FieldType type : values()) {
      if (type.tag.toLowerCase(Locale.ROOT).equals(wanted)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown schema type: " + tag);
  }
}
