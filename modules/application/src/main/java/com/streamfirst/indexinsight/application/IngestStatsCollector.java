package com.streamfirst.indexinsight.application;

import com.streamfirst.indexinsight.domain.IndexStats;
import com.streamfirst.indexinsight.domain.IndexStatsRow;
import com.streamfirst.indexinsight.ports.ClusterStatsPort;
import com.streamfirst.indexinsight.ports.IndexStatsSinkPort;
import com.streamfirst.indexinsight.ports.PortException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects ingest statistics for every index that received data on a given day. The result is
 * the input format of {@link IndexReportService}.
 *
 * <p>Indices are measured one at a time with a pause in between to keep load on the cluster low.
 * An index whose activity check or stats call fails is skipped and logged.
 */
@Slf4j
@RequiredArgsConstructor
public class IngestStatsCollector {

  @NonNull private final ClusterStatsPort clusterStats;
  @NonNull private final IndexStatsSinkPort statsSink;
  @NonNull private final Duration throttle;
  @NonNull private final Clock clock;

  /** Collects statistics for indices active during the current UTC day. */
  public List<IndexStatsRow> collectToday() {
    return collect(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
  }

  /**
   * Collects statistics for indices holding documents timestamped on {@code day} (UTC) and writes
   * them to the stats sink.
   *
   * @param day the day to check activity for
   * @return the written rows
   */
  public List<IndexStatsRow> collect(LocalDate day) {
    Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

    List<String> active = findActiveIndices(from, to);
    log.info("Found {} indices with data between {} and {}", active.size(), from, to);

    List<IndexStatsRow> rows = new ArrayList<>();
    for (String index : active) {
      log.debug("Gathering stats for index {}", index);
      try {
        IndexStats stats = clusterStats.fetchStats(index);
        rows.add(stats.toRow());
      } catch (PortException e) {
        log.error("Failed to fetch stats for index {}", index, e);
      }
      if (!pause()) {
        log.warn(
            "Interrupted after {} of {} indices, writing partial stats",
            rows.size(),
            active.size());
        break;
      }
    }

    statsSink.writeRows(rows);
    log.info("Collected ingest stats for {} indices", rows.size());
    return rows;
  }

  private List<String> findActiveIndices(Instant from, Instant to) {
    List<String> indices;
    try {
      indices = clusterStats.listIndices();
    } catch (PortException e) {
      log.error("Failed to list indices", e);
      return List.of();
    }
    log.info("Checking {} indices for activity", indices.size());

    List<String> active = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (String index : indices) {
      try {
        if (clusterStats.hasDocumentsBetween(index, from, to)) {
          active.add(index);
        }
      } catch (PortException e) {
        log.warn("Failed to search index {}: {}", index, e.getMessage());
        skipped.add(index);
      }
    }
    if (!skipped.isEmpty()) {
      log.warn("Skipped {} indices that could not be searched: {}", skipped.size(), skipped);
    }
    return active;
  }

  /** Sleeps for the throttle interval; returns false if the thread was interrupted. */
  private boolean pause() {
    if (throttle.isZero() || throttle.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(throttle.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
