package com.streamfirst.indexinsight.domain;

import com.streamfirst.indexinsight.domain.naming.ParsedIdentifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One line of the index report: the stats row of an index merged with what its name reveals.
 * The field order of {@link #toDocument()} is the column order of written reports.
 */
@Value
@Builder
public class IndexReportRecord {

  public static final List<String> COLUMNS =
      List.of(
          "index_name",
          "cluster",
          "first_timestamp",
          "last_timestamp",
          "daily_ingest_bytes",
          "scheme",
          "type",
          "dataset",
          "namespace",
          "environment",
          "derived_environment",
          "application",
          "date",
          "iteration");

  @NonNull String indexName;

  @NonNull ClusterName cluster;

  String firstTimestamp;

  String lastTimestamp;

  long dailyIngestBytes;

  /** Decomposed index name */
  @NonNull ParsedIdentifier parsed;

  /** Merges a stats row with the parse result of its index name. */
  public static IndexReportRecord of(
      ClusterName cluster, IndexStatsRow row, ParsedIdentifier parsed) {
    return IndexReportRecord.builder()
        .indexName(row.index())
        .cluster(cluster)
        .firstTimestamp(row.firstTimestamp())
        .lastTimestamp(row.lastTimestamp())
        .dailyIngestBytes(DailyIngest.toBytes(row.dailyIngestMb()))
        .parsed(parsed)
        .build();
  }

  public DocumentId documentId() {
    return DocumentId.of(indexName);
  }

  /** Flat view keyed by {@link #COLUMNS}; absent values map to null. */
  public Map<String, Object> toDocument() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("index_name", indexName);
    document.put("cluster", cluster.value());
    document.put("first_timestamp", firstTimestamp);
    document.put("last_timestamp", lastTimestamp);
    document.put("daily_ingest_bytes", dailyIngestBytes);
    document.put("scheme", parsed.scheme().label());
    document.put("type", parsed.type());
    document.put("dataset", parsed.dataset());
    document.put("namespace", parsed.namespace());
    document.put("environment", parsed.environment());
    document.put("derived_environment", parsed.derivedEnvironment());
    document.put("application", parsed.application());
    document.put("date", parsed.date());
    document.put("iteration", parsed.iteration());
    return Collections.unmodifiableMap(document);
  }
}
