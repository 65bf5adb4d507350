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

import static com.google.common.base.Preconditions.checkArgument;

import io.sparkharness.fs.FileSystemProvider;
import io.sparkharness.schema.FieldDescriptor;
import io.sparkharness.schema.SchemaDescription;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A {@code .schema} file that sits next to a CSV file: one {@code name: Type} entry per line,
 * {@code //} comments, and optional {@code @key = value} lines that override how the CSV is read.
 *
 * <pre>
 * &#64;delimiter = |
 * &#64;has-header = true
 * id: Integer     // primary key
 * name: String
 * </pre>
 *
 * Supported keys are {@code delimiter}, {@code quote-char} and {@code has-header}.
 */
public final class SchemaFile {

  public static final String EXTENSION = ".schema";

  private static final String ATTRIBUTE_PREFIX = "@";

  private final SchemaDescription schema;
  private final Map<String, String> attributes;

  SchemaFile(SchemaDescription schema, Map<String, String> attributes) {
    this.schema = schema;
    this.attributes = attributes;
  }

  /** {@code data/people.csv} has its schema in {@code data/people.schema}. */
  public static String schemaPathFor(String dataPath) {
    int slash = dataPath.lastIndexOf('/');
    int dot = dataPath.lastIndexOf('.');
    String base = dot > slash ? dataPath.substring(0, dot) : dataPath;
    return base + EXTENSION;
  }

  public static SchemaFile read(FileSystemProvider fs, String path) {
    return parse(fs.readText(path));
  }

  public static SchemaFile parse(String text) {
    List<String> entries = new ArrayList<>();
    Map<String, String> attributes = new LinkedHashMap<>();
    for (String rawLine : text.split("\\r?\\n")) {
      String line = rawLine.trim();
      if (line.startsWith(ATTRIBUTE_PREFIX)) {
        int eq = line.indexOf('=');
        checkArgument(eq > 0, "schema attribute must look like @key = value, got '%s'", line);
        String key = line.substring(1, eq).trim().toLowerCase(Locale.ROOT);
        attributes.put(key, line.substring(eq + 1).trim());
      } else if (!line.isEmpty()) {
        entries.add(line);
      }
    }
    // one entry per line, so the schema delimiter is the line break
    SchemaDescription schema = SchemaDescription.fromString(String.join("\n", entries), "\n");
    return new SchemaFile(schema, attributes);
  }

  public static void write(FileSystemProvider fs, String path, SchemaDescription schema) {
    String text =
        schema.fields().stream()
            .map(FieldDescriptor::toSchemaEntry)
            .collect(Collectors.joining("\n"));
    fs.writeText(path, text + "\n");
  }

  public SchemaDescription schema() {
    return schema;
  }

  /** {@code defaults} with the {@code @} attributes of this file applied on top. */
  public CsvAttributes applyTo(CsvAttributes defaults) {
    CsvAttributes result = defaults;
    for (Map.Entry<String, String> attribute : attributes.entrySet()) {
      String value = attribute.getValue();
      switch (attribute.getKey()) {
        case "delimiter":
          result = result.withDelimiter(singleChar(attribute.getKey(), value));
          break;
        case "quote-char":
          result = result.withQuoteChar(singleChar(attribute.getKey(), value));
          break;
        case "has-header":
          result = result.withHeader(Boolean.parseBoolean(value));
          break;
        default:
          throw new IllegalArgumentException("Unknown schema attribute @" + attribute.getKey());
      }
    }
    return result;
  }

  private static char singleChar(String key, String value) {
    if ("\\t".equals(value) || "tab".equalsIgnoreCase(value)) {
      return '\t';
    }
    checkArgument(value.length() == 1, "@%s must be a single character, got '%s'", key, value);
    return value.charAt(0);
  }
}
