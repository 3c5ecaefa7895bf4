package com.streamfirst.indexinsight.ports;

import com.streamfirst.indexinsight.domain.IndexReportRecord;
import java.util.List;

/** Port for persisting an index report as a table. */
public interface ReportSinkPort {

  /**
   * Writes the records in order, replacing earlier content of the sink.
   *
   * @param records the report records
   * @throws PortException if writing fails
   */
  void writeReport(List<IndexReportRecord> records);
}
