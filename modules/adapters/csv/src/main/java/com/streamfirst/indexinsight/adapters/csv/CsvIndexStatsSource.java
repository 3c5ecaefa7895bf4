package com.streamfirst.indexinsight.adapters.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.streamfirst.indexinsight.domain.ClusterName;
import com.streamfirst.indexinsight.domain.DailyIngest;
import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.ports.IndexStatsSourcePort;
import com.streamfirst.indexinsight.ports.PortException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a stats file with a header line. Columns are looked up by name, so extra columns and any
 * column order are accepted. The cluster is named after the file.
 *
 * <p>Unless a separator is given, it is detected from the header line, so files written by
 * {@link CsvIndexStatsWriter} with any separator and hand-made {@code ;} exports both read.
 */
@Slf4j
public class CsvIndexStatsSource implements IndexStatsSourcePort {

  private final Path file;
  private final Character separator;

  public CsvIndexStatsSource(@NonNull Path file) {
    this.file = file;
    this.separator = null;
  }

  public CsvIndexStatsSource(@NonNull Path file, char separator) {
    this.file = file;
    this.separator = separator;
  }

  @Override
  public ClusterName clusterName() {
    return ClusterName.fromFile(file);
  }

  @Override
  public List<IndexStatsRow> readRows() {
    char columnSeparator = separator != null ? separator : CsvFiles.detectSeparator(file);
    log.debug("Reading stats rows from {} separated by '{}'", file, columnSeparator);
    CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(columnSeparator);

    List<IndexStatsRow> rows = new ArrayList<>();
    try (MappingIterator<Map<String, String>> iterator =
        CsvFiles.MAPPER.readerForMapOf(String.class).with(schema).readValues(file.toFile())) {
      int line = 1;
      while (iterator.hasNext()) {
        line++;
        rows.add(toRow(iterator.next(), line));
      }
    } catch (IOException | RuntimeJsonMappingException e) {
      throw new PortException("Failed to read stats file: " + file, e);
    }

    log.debug("Read {} stats rows from {}", rows.size(), file);
    return rows;
  }

  private IndexStatsRow toRow(Map<String, String> columns, int line) {
    String dailyIngest = column(columns, StatsColumns.DAILY_INGEST_MB, line);
    try {
      return new IndexStatsRow(
          column(columns, StatsColumns.INDEX, line),
          column(columns, StatsColumns.FIRST_TIMESTAMP, line),
          column(columns, StatsColumns.LAST_TIMESTAMP, line),
          DailyIngest.parseMegabytes(dailyIngest));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(file + " line " + line + ": " + e.getMessage(), e);
    }
  }

  private String column(Map<String, String> columns, String name, int line) {
    String value = columns.get(name);
    if (value == null) {
      throw new PortException(file + " line " + line + " has no '" + name + "' column");
    }
    return value;
  }
}
