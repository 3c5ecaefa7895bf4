package com.streamfirst.indexinsight.application;

import com.streamfirst.indexinsight.domain.BulkLoadSummary;
import com.streamfirst.indexinsight.domain.naming.NamingScheme;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a report run.
 *
 * @param records number of records written
 * @param recordsPerScheme how many index names each naming scheme claimed
 * @param bulkLoad the load summary when records were also loaded into a document store
 */
public record ReportOutcome(
    int records, Map<NamingScheme, Long> recordsPerScheme, Optional<BulkLoadSummary> bulkLoad) {

  public ReportOutcome {
    recordsPerScheme = Map.copyOf(recordsPerScheme);
  }

  /** Number of index names no naming convention recognized. */
  public long unrecognized() {
    return recordsPerScheme.getOrDefault(NamingScheme.UNRECOGNIZED, 0L);
  }
}
