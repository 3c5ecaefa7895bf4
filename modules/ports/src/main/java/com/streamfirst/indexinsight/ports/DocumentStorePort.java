package com.streamfirst.indexinsight.ports;

import com.streamfirst.indexinsight.domain.BulkLoadSummary;
import com.streamfirst.indexinsight.domain.IndexReportRecord;
import java.util.List;

/**
 * Port for loading report records into a searchable document store. Documents are keyed by
 * {@link IndexReportRecord#documentId()}, so loading the same index twice overwrites.
 */
public interface DocumentStorePort {

  /**
   * Indexes the records into the target index.
   *
   * @param targetIndex the index receiving the documents
   * @param records the records to load
   * @return counts of accepted and rejected documents
   * @throws PortException if the store cannot be reached or rejects the request as a whole
   */
  BulkLoadSummary bulkLoad(String targetIndex, List<IndexReportRecord> records);
}
