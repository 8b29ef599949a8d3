/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.internal;

import com.squareup.moshi.JsonWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import okio.Buffer;

/**
 * Writes arbitrary nested payloads as compact JSON with Moshi's streaming writer.
 *
 * <p>Values JSON has no type for are converted the way the APM Server expects them: timestamps to
 * ISO-8601 with microseconds and a trailing 'Z', {@link UUID} to hex without dashes, byte arrays
 * to UTF-8 text, and sets to arrays.
 */
public final class JsonValueWriter {
  static final DateTimeFormatter TIMESTAMP_FORMAT =
    DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

  /** Returns the UTF-8 bytes of {@code {"<name>": value}} on a single line. */
  public static byte[] writeSingleKeyObject(String name, Object value) {
    Buffer buffer = new Buffer();
    JsonWriter writer = JsonWriter.of(buffer);
    writer.setSerializeNulls(true);
    try {
      writer.beginObject();
      writer.name(name);
      writeValue(writer, value);
      writer.endObject();
      writer.close();
    } catch (IOException e) {
      throw new AssertionError(e); // in-memory buffers don't throw
    }
    return buffer.readByteArray();
  }

  static void writeValue(JsonWriter writer, Object value) throws IOException {
    if (value == null) {
      writer.nullValue();
    } else if (value instanceof CharSequence || value instanceof Character) {
      writer.value(value.toString());
    } else if (value instanceof Boolean) {
      writer.value(((Boolean) value).booleanValue());
    } else if (value instanceof Number) {
      writeNumber(writer, (Number) value);
    } else if (value instanceof Map) {
      writer.beginObject();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        writer.name(String.valueOf(entry.getKey()));
        writeValue(writer, entry.getValue());
      }
      writer.endObject();
    } else if (value instanceof Iterable) { // includes sets, where order is unspecified
      writer.beginArray();
      for (Object element : (Iterable<?>) value) {
        writeValue(writer, element);
      }
      writer.endArray();
    } else if (value instanceof byte[]) {
      // String's decoder substitutes malformed input with U+FFFD
      writer.value(new String((byte[]) value, StandardCharsets.UTF_8));
    } else if (value instanceof char[]) {
      writer.value(new String((char[]) value));
    } else if (value.getClass().isArray()) {
      writeArray(writer, value);
    } else if (value instanceof UUID) {
      writer.value(value.toString().replace("-", ""));
    } else if (value instanceof Enum) {
      writer.value(((Enum<?>) value).name());
    } else {
      String timestamp = formatTimestamp(value);
      writer.value(timestamp != null ? timestamp : String.valueOf(value));
    }
  }

  static void writeArray(JsonWriter writer, Object array) throws IOException {
    writer.beginArray();
    if (array instanceof Object[]) {
      for (Object element : (Object[]) array) writeValue(writer, element);
    } else if (array instanceof int[]) {
      for (int element : (int[]) array) writer.value(element);
    } else if (array instanceof long[]) {
      for (long element : (long[]) array) writer.value(element);
    } else if (array instanceof short[]) {
      for (short element : (short[]) array) writer.value(element);
    } else if (array instanceof double[]) {
      for (double element : (double[]) array) writeDouble(writer, element);
    } else if (array instanceof float[]) {
      for (float element : (float[]) array) writeDouble(writer, element);
    } else if (array instanceof boolean[]) {
      for (boolean element : (boolean[]) array) writer.value(element);
    }
    writer.endArray();
  }

  static void writeNumber(JsonWriter writer, Number number) throws IOException {
    if (number instanceof Double || number instanceof Float) {
      writeDouble(writer, number.doubleValue());
    } else if (number instanceof BigDecimal || number instanceof BigInteger) {
      writer.value(number);
    } else {
      writer.value(number.longValue());
    }
  }

  static void writeDouble(JsonWriter writer, double value) throws IOException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      writer.nullValue();
    } else {
      writer.value(value);
    }
  }

  /** Returns null if the input isn't a supported date or time type. */
  static String formatTimestamp(Object value) {
    LocalDateTime utc;
    if (value instanceof Instant) {
      utc = LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
    } else if (value instanceof Date) {
      utc = LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
    } else if (value instanceof OffsetDateTime) {
      utc = ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    } else if (value instanceof ZonedDateTime) {
      utc = LocalDateTime.ofInstant(((ZonedDateTime) value).toInstant(), ZoneOffset.UTC);
    } else if (value instanceof LocalDateTime) {
      utc = (LocalDateTime) value; // no zone information, so written as is
    } else {
      return null;
    }
    return TIMESTAMP_FORMAT.format(utc);
  }

  JsonValueWriter() {
  }
}
