package com.streamfirst.indexinsight.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.indexinsight.domain.naming.IndexNameParser;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndexReportRecordTest {

  private final IndexNameParser parser = new IndexNameParser();

  @Test
  void documentFollowsColumnOrder() {
    IndexStatsRow row =
        new IndexStatsRow(
            ".ds-logs-nginx.access-default-2024.01.15-000001",
            "2024-01-15T00:00:00Z",
            "2024-01-15T12:00:00Z",
            1.5);

    IndexReportRecord record =
        IndexReportRecord.of(new ClusterName("prod"), row, parser.parse(row.index()));
    Map<String, Object> document = record.toDocument();

    assertThat(document.keySet()).containsExactlyElementsOf(IndexReportRecord.COLUMNS);
    assertThat(document)
        .containsEntry("cluster", "prod")
        .containsEntry("daily_ingest_bytes", 1_572_864L)
        .containsEntry("scheme", "datastream-structured")
        .containsEntry("type", "logs")
        .containsEntry("dataset", "nginx")
        .containsEntry("namespace", "access")
        .containsEntry("environment", "default")
        .containsEntry("application", "nginx.access")
        .containsEntry("date", "2024-01-15")
        .containsEntry("iteration", "000001");
  }

  @Test
  void unrecognizedNamesKeepStatsAndNullParts() {
    IndexStatsRow row = new IndexStatsRow("randomname123", "N/A", "N/A", 0);

    IndexReportRecord record =
        IndexReportRecord.of(new ClusterName("prod"), row, parser.parse(row.index()));

    assertThat(record.toDocument())
        .containsEntry("index_name", "randomname123")
        .containsEntry("scheme", "unrecognized")
        .containsEntry("dataset", null)
        .containsEntry("application", null);
    assertThat(record.documentId()).isEqualTo(DocumentId.of("randomname123"));
  }
}
