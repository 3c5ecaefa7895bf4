package com.streamfirst.indexinsight.ports;

import com.streamfirst.indexinsight.domain.IndexStatsRow;
import java.util.List;

/**
 * Port for persisting collected ingest statistics, typically as the input of a later report run.
 */
public interface IndexStatsSinkPort {

  /**
   * Writes the rows, replacing earlier content of the sink.
   *
   * @param rows the rows to write
   * @throws PortException if writing fails
   */
  void writeRows(List<IndexStatsRow> rows);
}
