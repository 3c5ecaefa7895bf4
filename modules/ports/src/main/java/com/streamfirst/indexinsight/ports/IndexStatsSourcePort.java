package com.streamfirst.indexinsight.ports;

import com.streamfirst.indexinsight.domain.ClusterName;
import com.streamfirst.indexinsight.domain.IndexStatsRow;
import java.util.List;

/**
 * Port for reading per-index ingest statistics collected from one cluster.
 */
public interface IndexStatsSourcePort {

  /**
   * Gets the label of the cluster the statistics were collected from.
   *
   * @return the cluster name written into every report record
   */
  ClusterName clusterName();

  /**
   * Reads all statistics rows in source order.
   *
   * @return the rows, possibly empty
   * @throws PortException if the source cannot be read or lacks a required column
   * @throws IllegalArgumentException if a row holds an unparsable ingest figure
   */
  List<IndexStatsRow> readRows();
}
