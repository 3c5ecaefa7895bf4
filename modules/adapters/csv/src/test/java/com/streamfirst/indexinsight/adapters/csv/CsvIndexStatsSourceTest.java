package com.streamfirst.indexinsight.adapters.csv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.ports.PortException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CsvIndexStatsSourceTest {

  @TempDir Path tempDir;

  @Test
  void readsRowsByColumnName() throws IOException {
    Path file =
        write(
            "prod-eu.stats.csv",
            "daily_ingest_mb;index;extra;first_timestamp;last_timestamp",
            "12,5;metrics.payments.prod;x;2024-01-15T00:00:00Z;2024-01-15T12:00:00Z",
            "0;.ds-logs-app-2024.01.15-000001;y;N/A;N/A");

    CsvIndexStatsSource source = new CsvIndexStatsSource(file, ';');

    assertThat(source.clusterName().value()).isEqualTo("prod-eu");
    assertThat(source.readRows())
        .containsExactly(
            new IndexStatsRow(
                "metrics.payments.prod", "2024-01-15T00:00:00Z", "2024-01-15T12:00:00Z", 12.5),
            new IndexStatsRow(".ds-logs-app-2024.01.15-000001", "N/A", "N/A", 0));
  }

  @Test
  void headerOnlyFileHasNoRows() throws IOException {
    Path file = write("empty.csv", "index;first_timestamp;last_timestamp;daily_ingest_mb");

    assertThat(new CsvIndexStatsSource(file, ';').readRows()).isEmpty();
  }

  @Test
  void missingColumnIsReportedWithLine() throws IOException {
    Path file = write("broken.csv", "index;first_timestamp;daily_ingest_mb", "app.log;N/A;1");

    assertThatThrownBy(() -> new CsvIndexStatsSource(file, ';').readRows())
        .isInstanceOf(PortException.class)
        .hasMessageContaining("line 2")
        .hasMessageContaining("last_timestamp");
  }

  @Test
  void malformedNumberIsReportedWithLine() throws IOException {
    Path file =
        write(
            "bad.csv",
            "index;first_timestamp;last_timestamp;daily_ingest_mb",
            "app.log;N/A;N/A;1",
            "app.other;N/A;N/A;many");

    assertThatThrownBy(() -> new CsvIndexStatsSource(file, ';').readRows())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("line 3")
        .hasMessageContaining("many");
  }

  @Test
  void missingFileIsAPortFailure() {
    CsvIndexStatsSource source = new CsvIndexStatsSource(tempDir.resolve("absent.csv"), ';');

    assertThatThrownBy(source::readRows).isInstanceOf(PortException.class);
  }

  @ParameterizedTest
  @ValueSource(chars = {',', ';', '\t'})
  void writtenStatsReadBackWithDetectedSeparator(char separator) {
    Path file = tempDir.resolve("daily_ingest_report.csv");
    List<IndexStatsRow> rows =
        List.of(
            new IndexStatsRow(
                "logs-a", "2024-01-15T00:00:00.000Z", "2024-01-15T12:00:00.000Z", 2048.0),
            new IndexStatsRow("logs-b", "N/A", "N/A", 0));

    new CsvIndexStatsWriter(file, separator).writeRows(rows);

    assertThat(new CsvIndexStatsSource(file).readRows()).isEqualTo(rows);
  }

  @Test
  void detectsSemicolonExportWithDecimalComma() throws IOException {
    Path file =
        write(
            "prod-eu.csv",
            "index;first_timestamp;last_timestamp;daily_ingest_mb",
            "app.log;N/A;N/A;3,75");

    assertThat(new CsvIndexStatsSource(file).readRows())
        .containsExactly(new IndexStatsRow("app.log", "N/A", "N/A", 3.75));
  }

  @Test
  void missingFileIsAPortFailureWhenDetecting() {
    CsvIndexStatsSource source = new CsvIndexStatsSource(tempDir.resolve("absent.csv"));

    assertThatThrownBy(source::readRows).isInstanceOf(PortException.class);
  }

  private Path write(String name, String... lines) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, List.of(lines), StandardCharsets.UTF_8);
    return file;
  }
}
