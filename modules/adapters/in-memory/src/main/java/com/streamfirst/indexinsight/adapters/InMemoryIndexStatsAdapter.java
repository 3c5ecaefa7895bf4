package com.streamfirst.indexinsight.adapters;

import com.streamfirst.indexinsight.domain.ClusterName;
import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.ports.IndexStatsSinkPort;
import com.streamfirst.indexinsight.ports.IndexStatsSourcePort;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of both stats ports for testing and development. Rows written through
 * the sink are what the source reads back, so a collector and a report can be chained without
 * files.
 */
@Slf4j
public class InMemoryIndexStatsAdapter implements IndexStatsSourcePort, IndexStatsSinkPort {

  private final ClusterName clusterName;
  private final List<IndexStatsRow> rows = new CopyOnWriteArrayList<>();

  public InMemoryIndexStatsAdapter(ClusterName clusterName) {
    this.clusterName = clusterName;
  }

  public InMemoryIndexStatsAdapter(ClusterName clusterName, List<IndexStatsRow> initialRows) {
    this(clusterName);
    rows.addAll(initialRows);
  }

  @Override
  public ClusterName clusterName() {
    return clusterName;
  }

  @Override
  public List<IndexStatsRow> readRows() {
    log.debug("Reading {} stats rows for cluster {}", rows.size(), clusterName);
    return List.copyOf(rows);
  }

  @Override
  public void writeRows(List<IndexStatsRow> newRows) {
    log.debug("Replacing stats rows for cluster {} with {} rows", clusterName, newRows.size());
    rows.clear();
    rows.addAll(newRows);
  }
}
