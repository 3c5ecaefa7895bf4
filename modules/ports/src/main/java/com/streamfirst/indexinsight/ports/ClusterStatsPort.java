package com.streamfirst.indexinsight.ports;

import com.streamfirst.indexinsight.domain.IndexStats;
import java.time.Instant;
import java.util.List;

/**
 * Port for querying a search cluster about its indices.
 * Abstracts the cluster's REST API so collection logic can run against in-memory data.
 */
public interface ClusterStatsPort {

  /**
   * Lists the names of all indices in the cluster, hidden and data stream backing indices
   * included.
   *
   * @return index names
   * @throws PortException if the cluster cannot be queried
   */
  List<String> listIndices();

  /**
   * Checks whether the index holds at least one document with {@code @timestamp} in
   * {@code [from, to)}.
   *
   * @param index the index to check
   * @param from inclusive lower bound
   * @param to exclusive upper bound
   * @return true if a matching document exists
   * @throws PortException if the search fails
   */
  boolean hasDocumentsBetween(String index, Instant from, Instant to);

  /**
   * Measures an index: primary store size and the timestamps of its oldest and newest documents.
   *
   * @param index the index to measure
   * @return the measurements
   * @throws PortException if the statistics cannot be fetched
   */
  IndexStats fetchStats(String index);
}
