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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Optional;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.DecimalType;
import org.apache.spark.sql.types.StructField;

/**
 * One {@code name: Type} entry of a {@link SchemaDescription}.
 *
 * <p>Decimal fields carry precision and scale, which are part of the rendering. Date and timestamp
 * fields may carry a parse format for literal data; the format is not part of the rendering.
 */
public final class FieldDescriptor {

  public static final String NAME_TYPE_SEPARATOR = ":";

  static final int DEFAULT_DECIMAL_PRECISION = 10;
  static final int DEFAULT_DECIMAL_SCALE = 0;

  private final String name;
  private final FieldType type;
  private final int precision;
  private final int scale;
  private final String format;

  private FieldDescriptor(String name, FieldType type, int precision, int scale, String format) {
    checkArgument(!name.isEmpty(), "field name must not be empty");
    this.name = name;
    this.type = requireNonNull(type, "type");
    this.precision = precision;
    this.scale = scale;
    this.format = format;
  }

  public static FieldDescriptor of(String name, FieldType type) {
    checkArgument(type != FieldType.DECIMAL, "use decimal(name, precision, scale) for decimals");
    return new FieldDescriptor(name, type, 0, 0, null);
  }

  public static FieldDescriptor decimal(String name, int precision, int scale) {
    checkArgument(
        precision > 0 && scale >= 0 && scale <= precision,
        "invalid decimal precision/scale %s,%s for %s",
        precision,
        scale,
        name);
    return new FieldDescriptor(name, FieldType.DECIMAL, precision, scale, null);
  }

  /**
   * Parses {@code name:Type} or {@code name:Type[param]}. The name ends at the first {@code :}, so
   * formats may contain colons.
   */
  public static FieldDescriptor parse(String entry) {
    int sep = entry.indexOf(NAME_TYPE_SEPARATOR);
    checkArgument(sep > 0, "schema entry must look like name:Type, got '%s'", entry);
    String name = entry.substring(0, sep).trim();
    String typeSpec = entry.substring(sep + 1).trim();

    String param = null;
    int open = typeSpec.indexOf('[');
    if (open >= 0) {
      checkArgument(typeSpec.endsWith("]"), "unterminated type parameter in '%s'", entry);
      param = typeSpec.substring(open + 1, typeSpec.length() - 1).trim();
      typeSpec = typeSpec.substring(0, open).trim();
    }
    FieldType type = FieldType.fromTag(typeSpec);

    switch (type) {
      case DECIMAL:
        if (param == null) {
          return decimal(name, DEFAULT_DECIMAL_PRECISION, DEFAULT_DECIMAL_SCALE);
        }
        String[] ps = param.split(",");
        checkArgument(ps.length == 2, "decimal needs [precision,scale], got '%s'", entry);
        try {
          return decimal(name, Integer.parseInt(ps[0].trim()), Integer.parseInt(ps[1].trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid decimal parameters in '" + entry + "'", e);
        }
      case DATE:
      case TIMESTAMP:
        return new FieldDescriptor(
            name, type, 0, 0, param == null || param.isEmpty() ? null : param);
      default:
        checkArgument(param == null, "type %s takes no parameter in '%s'", type.tag(), entry);
        return of(name, type);
    }
  }

  public static FieldDescriptor fromStructField(StructField field) {
    DataType dataType = field.dataType();
    if (dataType instanceof DecimalType) {
      DecimalType decimal = (DecimalType) dataType;
      return decimal(field.name(), decimal.precision(), decimal.scale());
    }
    for (FieldType type : FieldType.values()) {
      if (dataType.equals(type.sparkType())) {
        return of(field.name(), type);
      }
    }
    throw new IllegalArgumentException(
        "Unsupported type " + dataType.simpleString() + " for field " + field.name());
  }

  public String name() {
    return name;
  }

  public FieldType type() {
    return type;
  }

  public int precision() {
    return precision;
  }

  public int scale() {
    return scale;
  }

  /** Parse format of a date or timestamp field, if one was given. */
  public Optional<String> format() {
    return Optional.ofNullable(format);
  }

  public DataType sparkType() {
    return type == FieldType.DECIMAL
        ? DataTypes.createDecimalType(precision, scale)
        : type.sparkType();
  }

  public StructField toStructField() {
    return DataTypes.createStructField(name, sparkType(), true);
  }

  /**
   * The canonical rendering plus the parse format, for example {@code "d: Date[yyyyMMdd]"}. This
   * is what a schema file needs to read the same data back.
   */
  public String toSchemaEntry() {
    return format == null ? toString() : toString() + "[" + format + "]";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldDescriptor && toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    String typeString =
        type == FieldType.DECIMAL ? type.tag() + "[" + precision + "," + scale + "]" : type.tag();
    return name + NAME_TYPE_SEPARATOR + " " + typeString;
  }
}
