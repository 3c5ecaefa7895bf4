package com.streamfirst.indexinsight.adapters.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.streamfirst.indexinsight.ports.PortException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Shared CSV plumbing. {@link CsvMapper} is thread-safe once configured. */
final class CsvFiles {

  // quote only cells that contain a separator, quote or line break
  static final CsvMapper MAPPER =
      CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING).build();

  /** Separators recognized in a header line, in order of preference on a tie. */
  static final char[] SEPARATORS = {',', ';', '\t'};

  private CsvFiles() {}

  /**
   * Picks the separator occurring most often in the first line of the file. A header without
   * any known separator is a single column, read with {@code ','}.
   */
  static char detectSeparator(Path file) {
    String header;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      header = reader.readLine();
    } catch (IOException e) {
      throw new PortException("Failed to read CSV header of " + file, e);
    }
    char best = SEPARATORS[0];
    long bestCount = 0;
    for (char candidate : SEPARATORS) {
      long count = header == null ? 0 : header.chars().filter(c -> c == candidate).count();
      if (count > bestCount) {
        best = candidate;
        bestCount = count;
      }
    }
    return best;
  }

  /**
   * Writes a header line followed by the rows, replacing the file. The header is written as a
   * plain row so that it is present even when there are no rows.
   */
  static void writeRows(Path file, List<String> columns, char separator, List<List<Object>> rows) {
    CsvSchema schema = CsvSchema.emptySchema().withoutHeader().withColumnSeparator(separator);
    try (SequenceWriter writer = MAPPER.writer(schema).writeValues(file.toFile())) {
      writer.write(columns);
      for (List<Object> row : rows) {
        writer.write(row);
      }
    } catch (IOException e) {
      throw new PortException("Failed to write CSV file: " + file, e);
    }
  }
}
