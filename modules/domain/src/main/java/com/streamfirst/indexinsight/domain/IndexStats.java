package com.streamfirst.indexinsight.domain;

import java.util.Objects;

/**
 * Raw measurements of one index: primary store size and the timestamps of its oldest and newest
 * documents.
 */
public record IndexStats(
    String index, long primarySizeInBytes, String firstTimestamp, String lastTimestamp) {

  /** Placeholder used when a document carries no {@code @timestamp}. */
  public static final String MISSING_TIMESTAMP = "N/A";

  public IndexStats {
    Objects.requireNonNull(index, "Index name cannot be null");
    if (primarySizeInBytes < 0) {
      throw new IllegalArgumentException("Store size cannot be negative: " + primarySizeInBytes);
    }
    firstTimestamp = firstTimestamp == null ? MISSING_TIMESTAMP : firstTimestamp;
    lastTimestamp = lastTimestamp == null ? MISSING_TIMESTAMP : lastTimestamp;
  }

  /** Converts the measurements into a stats row with the daily ingest estimate. */
  public IndexStatsRow toRow() {
    return new IndexStatsRow(
        index,
        firstTimestamp,
        lastTimestamp,
        DailyIngest.estimateMegabytes(primarySizeInBytes, firstTimestamp, lastTimestamp));
  }
}
