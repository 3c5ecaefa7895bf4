package com.streamfirst.indexinsight.application;

import com.streamfirst.indexinsight.domain.BulkLoadSummary;
import com.streamfirst.indexinsight.domain.ClusterName;
import com.streamfirst.indexinsight.domain.IndexReportRecord;
import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.domain.naming.IndexNameParser;
import com.streamfirst.indexinsight.domain.naming.NamingScheme;
import com.streamfirst.indexinsight.ports.DocumentStorePort;
import com.streamfirst.indexinsight.ports.IndexStatsSourcePort;
import com.streamfirst.indexinsight.ports.ReportSinkPort;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a stats file into an index report. Every row's index name is decomposed, merged with the
 * row's timestamps and ingest volume, written to the report sink and optionally loaded into a
 * document store.
 */
@Slf4j
public class IndexReportService {

  private final IndexNameParser parser;
  private final IndexStatsSourcePort statsSource;
  private final ReportSinkPort reportSink;
  private final DocumentStorePort documentStore;

  public IndexReportService(
      @NonNull IndexNameParser parser,
      @NonNull IndexStatsSourcePort statsSource,
      @NonNull ReportSinkPort reportSink) {
    this(parser, statsSource, reportSink, null);
  }

  /**
   * @param documentStore the store used when a run asks for loading, may be null
   */
  public IndexReportService(
      @NonNull IndexNameParser parser,
      @NonNull IndexStatsSourcePort statsSource,
      @NonNull ReportSinkPort reportSink,
      DocumentStorePort documentStore) {
    this.parser = parser;
    this.statsSource = statsSource;
    this.reportSink = reportSink;
    this.documentStore = documentStore;
  }

  /**
   * Reads all stats rows and merges each with the decomposition of its index name. Rows are
   * parsed in parallel; the result keeps source order.
   */
  public List<IndexReportRecord> buildReport() {
    ClusterName cluster = statsSource.clusterName();
    List<IndexStatsRow> rows = statsSource.readRows();
    log.debug("Building report for {} indices of cluster {}", rows.size(), cluster);

    return rows.parallelStream()
        .map(row -> IndexReportRecord.of(cluster, row, parser.parse(row.index())))
        .toList();
  }

  /**
   * Builds the report, writes it and, if requested, loads it into the target index.
   *
   * @param targetIndex the document store index, only used when {@code load} is set
   * @param load whether to bulk-load the records
   * @return record counts and the load summary
   * @throws IllegalStateException if loading is requested without a document store
   */
  public ReportOutcome run(String targetIndex, boolean load) {
    if (load && documentStore == null) {
      throw new IllegalStateException("Loading requested but no document store is configured");
    }

    List<IndexReportRecord> records = buildReport();
    reportSink.writeReport(records);
    Map<NamingScheme, Long> perScheme = countPerScheme(records);
    log.info("Wrote report with {} records for cluster {}: {}",
        records.size(), statsSource.clusterName(), perScheme);

    if (perScheme.getOrDefault(NamingScheme.UNRECOGNIZED, 0L) > 0) {
      log.warn("{} index names matched no naming convention and need review",
          perScheme.get(NamingScheme.UNRECOGNIZED));
    }

    Optional<BulkLoadSummary> summary = Optional.empty();
    if (load) {
      summary = Optional.of(load(targetIndex, records));
    }
    return new ReportOutcome(records.size(), perScheme, summary);
  }

  private BulkLoadSummary load(String targetIndex, List<IndexReportRecord> records) {
    if (records.isEmpty()) {
      log.info("Nothing to load into {}", targetIndex);
      return BulkLoadSummary.empty(targetIndex);
    }
    BulkLoadSummary summary = documentStore.bulkLoad(targetIndex, records);
    if (summary.hasFailures()) {
      log.warn("Loaded {} records into {}, {} rejected",
          summary.loaded(), targetIndex, summary.failed());
    } else {
      log.info("Loaded {} records into {}", summary.loaded(), targetIndex);
    }
    return summary;
  }

  private static Map<NamingScheme, Long> countPerScheme(List<IndexReportRecord> records) {
    Map<NamingScheme, Long> counts = new EnumMap<>(NamingScheme.class);
    for (IndexReportRecord record : records) {
      counts.merge(record.getParsed().scheme(), 1L, Long::sum);
    }
    return counts;
  }
}
