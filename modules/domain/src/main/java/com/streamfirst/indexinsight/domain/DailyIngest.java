package com.streamfirst.indexinsight.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;

/** Daily ingest arithmetic shared by the collector and the report. */
@Slf4j
public final class DailyIngest {

  private static final double BYTES_PER_MEGABYTE = 1024d * 1024d;
  private static final double SECONDS_PER_HOUR = 3600d;

  private DailyIngest() {}

  /**
   * Extrapolates the stored size of an index to a per-day volume from the span its documents
   * cover: {@code size / 1 MiB * 24 / hours}, rounded to two decimals.
   *
   * @return the estimate in megabytes, or 0 when the span is empty or a timestamp is unreadable
   */
  public static double estimateMegabytes(
      long sizeInBytes, String firstTimestamp, String lastTimestamp) {
    if (firstTimestamp == null || lastTimestamp == null) {
      return 0;
    }
    try {
      OffsetDateTime first = parseTimestamp(firstTimestamp);
      OffsetDateTime last = parseTimestamp(lastTimestamp);
      double hours = Duration.between(first, last).toMillis() / 1000d / SECONDS_PER_HOUR;
      if (hours == 0) {
        return 0;
      }
      double megabytes = sizeInBytes / BYTES_PER_MEGABYTE * (24 / hours);
      return roundToCents(megabytes);
    } catch (DateTimeParseException e) {
      log.warn(
          "Cannot estimate daily ingest from timestamps '{}' and '{}': {}",
          firstTimestamp,
          lastTimestamp,
          e.getMessage());
      return 0;
    }
  }

  /** Rounds the exact binary value half-even, so 2.675 (stored as 2.67499...) becomes 2.67. */
  static double roundToCents(double value) {
    return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }

  /** ISO-8601 with an offset or {@code Z}; timestamps without an offset are taken as UTC. */
  static OffsetDateTime parseTimestamp(String timestamp) {
    try {
      return OffsetDateTime.parse(timestamp);
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(timestamp).atOffset(ZoneOffset.UTC);
    }
  }

  /** Converts megabytes to bytes, truncating the fraction. */
  public static long toBytes(double megabytes) {
    return (long) (megabytes * BYTES_PER_MEGABYTE);
  }

  /**
   * Parses a megabyte figure that may use a comma as decimal separator, as spreadsheet exports
   * in some locales do.
   *
   * @throws IllegalArgumentException if the text is not a number
   */
  public static double parseMegabytes(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Daily ingest value is empty");
    }
    try {
      return Double.parseDouble(text.trim().replace(',', '.'));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Daily ingest value is not a number: " + text, e);
    }
  }
}
