package com.streamfirst.indexinsight.domain;

import java.util.List;

/**
 * Outcome of loading report records into a document store.
 *
 * @param targetIndex the index the documents were written to
 * @param loaded number of documents the store accepted
 * @param failedIds ids of documents the store rejected
 */
public record BulkLoadSummary(String targetIndex, int loaded, List<DocumentId> failedIds) {
  public BulkLoadSummary {
    failedIds = List.copyOf(failedIds);
  }

  public static BulkLoadSummary empty(String targetIndex) {
    return new BulkLoadSummary(targetIndex, 0, List.of());
  }

  public int failed() {
    return failedIds.size();
  }

  public boolean hasFailures() {
    return !failedIds.isEmpty();
  }
}
