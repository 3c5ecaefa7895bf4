package com.streamfirst.indexinsight.adapters.csv;

import com.streamfirst.indexinsight.domain.IndexReportRecord;
import com.streamfirst.indexinsight.ports.ReportSinkPort;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the index report as comma-separated values with the columns of
 * {@link IndexReportRecord#COLUMNS}. Absent values are written as empty cells.
 */
@Slf4j
public class CsvReportWriter implements ReportSinkPort {

  private static final char SEPARATOR = ',';

  private final Path file;

  public CsvReportWriter(@NonNull Path file) {
    this.file = file;
  }

  @Override
  public void writeReport(List<IndexReportRecord> records) {
    List<List<Object>> rows =
        records.stream()
            .<List<Object>>map(record -> new ArrayList<>(record.toDocument().values()))
            .toList();
    CsvFiles.writeRows(file, IndexReportRecord.COLUMNS, SEPARATOR, rows);
    log.info("Processed data saved to {}", file);
  }
}
