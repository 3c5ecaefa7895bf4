package com.streamfirst.indexinsight.adapters;

import com.streamfirst.indexinsight.domain.IndexReportRecord;
import com.streamfirst.indexinsight.ports.ReportSinkPort;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/** In-memory implementation of ReportSinkPort that keeps the last written report. */
@Slf4j
public class InMemoryReportSinkAdapter implements ReportSinkPort {

  private volatile List<IndexReportRecord> report = List.of();
  private final AtomicInteger writeCount = new AtomicInteger();

  @Override
  public void writeReport(List<IndexReportRecord> records) {
    log.debug("Storing report with {} records", records.size());
    report = List.copyOf(records);
    writeCount.incrementAndGet();
  }

  /** Gets the records of the most recent write. */
  public List<IndexReportRecord> getReport() {
    return report;
  }

  /** Gets how many times a report was written. */
  public int getWriteCount() {
    return writeCount.get();
  }
}
