package com.streamfirst.indexinsight.adapters;

import com.streamfirst.indexinsight.domain.BulkLoadSummary;
import com.streamfirst.indexinsight.domain.DocumentId;
import com.streamfirst.indexinsight.domain.IndexReportRecord;
import com.streamfirst.indexinsight.ports.DocumentStorePort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of DocumentStorePort for testing and development. Documents are kept
 * per index and keyed by document id, so reloads overwrite like the real store does. A rejection
 * rule can be installed to simulate per-document failures.
 */
@Slf4j
public class InMemoryDocumentStoreAdapter implements DocumentStorePort {

  // index name -> document id -> source document
  private final Map<String, Map<DocumentId, Map<String, Object>>> indices =
      new ConcurrentHashMap<>();
  private volatile Predicate<IndexReportRecord> rejectionRule = record -> false;

  @Override
  public BulkLoadSummary bulkLoad(String targetIndex, List<IndexReportRecord> records) {
    log.debug("Loading {} documents into {}", records.size(), targetIndex);

    Map<DocumentId, Map<String, Object>> documents =
        indices.computeIfAbsent(targetIndex, k -> new ConcurrentHashMap<>());
    int loaded = 0;
    List<DocumentId> failed = new ArrayList<>();
    for (IndexReportRecord record : records) {
      if (rejectionRule.test(record)) {
        failed.add(record.documentId());
        continue;
      }
      documents.put(record.documentId(), record.toDocument());
      loaded++;
    }

    log.debug("Loaded {} documents into {}, rejected {}", loaded, targetIndex, failed.size());
    return new BulkLoadSummary(targetIndex, loaded, failed);
  }

  /** Makes subsequent loads reject records matching the rule. */
  public void rejectWhen(Predicate<IndexReportRecord> rule) {
    this.rejectionRule = rule;
  }

  public Optional<Map<String, Object>> getDocument(String index, DocumentId id) {
    return Optional.ofNullable(indices.getOrDefault(index, Map.of()).get(id));
  }

  public int getDocumentCount(String index) {
    return indices.getOrDefault(index, Map.of()).size();
  }
}
