package com.streamfirst.indexinsight.adapters.csv;

import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.ports.IndexStatsSinkPort;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes collected stats with a header line. {@link CsvIndexStatsSource} reads the result back
 * whatever the separator, as it detects the separator from that header.
 */
@Slf4j
public class CsvIndexStatsWriter implements IndexStatsSinkPort {

  private final Path file;
  private final char separator;

  public CsvIndexStatsWriter(@NonNull Path file, char separator) {
    this.file = file;
    this.separator = separator;
  }

  @Override
  public void writeRows(List<IndexStatsRow> rows) {
    List<List<Object>> values =
        rows.stream()
            .map(row -> Arrays.<Object>asList(
                row.index(), row.firstTimestamp(), row.lastTimestamp(), row.dailyIngestMb()))
            .toList();
    CsvFiles.writeRows(file, StatsColumns.ALL, separator, values);
    log.info("Wrote {} stats rows to {}", rows.size(), file);
  }
}
