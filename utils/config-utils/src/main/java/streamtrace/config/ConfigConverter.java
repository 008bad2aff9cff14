package streamtrace.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;

/** Parses raw setting values. Every method throws {@link IllegalArgumentException} on bad input. */
public final class ConfigConverter {

  public static final long KILOBYTE = 1024;
  public static final long MEGABYTE = 1024 * KILOBYTE;
  public static final long GIGABYTE = 1024 * MEGABYTE;

  private ConfigConverter() {}

  public static boolean parseBoolean(@Nonnull String value) {
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed) || "1".equals(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed) || "0".equals(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException("not a boolean: '" + value + "'");
  }

  /**
   * Parses a duration such as {@code 5ms}, {@code 10s} or {@code 1m}. A bare number is read in
   * {@code defaultUnit}.
   *
   * @return the duration in milliseconds, may be negative
   */
  public static long parseDurationMillis(@Nonnull String value, TimeUnit defaultUnit) {
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    String number;
    TimeUnit unit;
    if (trimmed.endsWith("ms")) {
      number = trimmed.substring(0, trimmed.length() - 2);
      unit = TimeUnit.MILLISECONDS;
    } else if (trimmed.endsWith("s")) {
      number = trimmed.substring(0, trimmed.length() - 1);
      unit = TimeUnit.SECONDS;
    } else if (trimmed.endsWith("m")) {
      number = trimmed.substring(0, trimmed.length() - 1);
      unit = TimeUnit.MINUTES;
    } else {
      number = trimmed;
      unit = defaultUnit;
    }
    try {
      return unit.toMillis(Long.parseLong(number.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a duration: '" + value + "'", e);
    }
  }

  /** Parses a size such as {@code 750KB} or {@code 1MB}. A bare number is read in bytes. */
  public static long parseSize(@Nonnull String value) {
    String trimmed = value.trim().toUpperCase(Locale.ROOT);
    long multiplier = 1;
    String number = trimmed;
    if (trimmed.endsWith("KB")) {
      multiplier = KILOBYTE;
      number = trimmed.substring(0, trimmed.length() - 2);
    } else if (trimmed.endsWith("MB")) {
      multiplier = MEGABYTE;
      number = trimmed.substring(0, trimmed.length() - 2);
    } else if (trimmed.endsWith("GB")) {
      multiplier = GIGABYTE;
      number = trimmed.substring(0, trimmed.length() - 2);
    } else if (trimmed.endsWith("B")) {
      number = trimmed.substring(0, trimmed.length() - 1);
    }
    try {
      long size = Long.parseLong(number.trim());
      if (size < 0) {
        throw new IllegalArgumentException("negative size: '" + value + "'");
      }
      return size * multiplier;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a size: '" + value + "'", e);
    }
  }

  /** Splits a comma separated list, dropping blank entries. */
  public static List<String> parseList(@Nonnull String value) {
    if (value.trim().isEmpty()) {
      return Collections.emptyList();
    }
    List<String> list = new ArrayList<>();
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        list.add(trimmed);
      }
    }
    return Collections.unmodifiableList(list);
  }
}
