package com.streamfirst.indexinsight.adapters;

import com.streamfirst.indexinsight.domain.IndexStats;
import com.streamfirst.indexinsight.ports.ClusterStatsPort;
import com.streamfirst.indexinsight.ports.PortException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of ClusterStatsPort for testing and development. Simulates a cluster
 * whose indices hold documents at registered timestamps. Indices can be marked as failing to
 * exercise error paths.
 */
@Slf4j
public class InMemoryClusterStatsAdapter implements ClusterStatsPort {

  private final Map<String, IndexStats> statsByIndex = new ConcurrentSkipListMap<>();
  private final Map<String, List<Instant>> documentTimes = new ConcurrentHashMap<>();
  private final Set<String> failingIndices = ConcurrentHashMap.newKeySet();
  private final Set<String> failingStats = ConcurrentHashMap.newKeySet();

  /**
   * Registers an index.
   *
   * @param stats the measurements returned by {@link #fetchStats(String)}
   * @param documentTimestamps {@code @timestamp} values of the documents it holds
   */
  public void registerIndex(IndexStats stats, List<Instant> documentTimestamps) {
    statsByIndex.put(stats.index(), stats);
    documentTimes.put(stats.index(), new ArrayList<>(documentTimestamps));
    log.debug("Registered index {} with {} documents", stats.index(), documentTimestamps.size());
  }

  /** Makes every call concerning the index fail. */
  public void failIndex(String index) {
    failingIndices.add(index);
  }

  /** Makes only {@link #fetchStats(String)} fail for the index. */
  public void failStats(String index) {
    failingStats.add(index);
  }

  @Override
  public List<String> listIndices() {
    return List.copyOf(statsByIndex.keySet());
  }

  @Override
  public boolean hasDocumentsBetween(String index, Instant from, Instant to) {
    checkAvailable(index);
    return documentTimes.getOrDefault(index, List.of()).stream()
        .anyMatch(time -> !time.isBefore(from) && time.isBefore(to));
  }

  @Override
  public IndexStats fetchStats(String index) {
    checkAvailable(index);
    if (failingStats.contains(index)) {
      throw new PortException("Simulated stats failure for index " + index);
    }
    IndexStats stats = statsByIndex.get(index);
    if (stats == null) {
      throw new PortException("Index not found: " + index);
    }
    return stats;
  }

  private void checkAvailable(String index) {
    if (failingIndices.contains(index)) {
      throw new PortException("Simulated failure for index " + index);
    }
  }
}
