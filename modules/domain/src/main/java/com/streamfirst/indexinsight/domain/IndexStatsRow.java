package com.streamfirst.indexinsight.domain;

import java.util.Objects;

/**
 * Per-index ingest statistics as produced by the collector and consumed by the report. Timestamps
 * are kept as the cluster returned them since rows are passed through to the report unchanged.
 *
 * @param index the index name
 * @param firstTimestamp {@code @timestamp} of the oldest document, or {@code N/A}
 * @param lastTimestamp {@code @timestamp} of the newest document, or {@code N/A}
 * @param dailyIngestMb estimated ingest volume per day in megabytes
 */
public record IndexStatsRow(
    String index, String firstTimestamp, String lastTimestamp, double dailyIngestMb) {
  public IndexStatsRow {
    Objects.requireNonNull(index, "Index name cannot be null");
  }
}
