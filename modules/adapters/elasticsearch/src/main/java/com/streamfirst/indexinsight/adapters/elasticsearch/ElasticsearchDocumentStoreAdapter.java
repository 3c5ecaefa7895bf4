package com.streamfirst.indexinsight.adapters.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.indexinsight.domain.BulkLoadSummary;
import com.streamfirst.indexinsight.domain.DocumentId;
import com.streamfirst.indexinsight.domain.IndexReportRecord;
import com.streamfirst.indexinsight.ports.DocumentStorePort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.RestClient;

/**
 * Loads report records through the {@code _bulk} API. Each record becomes an {@code index}
 * action with the SHA-256 document id, so reruns overwrite. Large reports are sent in batches.
 */
@Slf4j
public class ElasticsearchDocumentStoreAdapter implements DocumentStorePort {

  public static final int DEFAULT_BATCH_SIZE = 500;

  private final RestJson rest;
  private final int batchSize;

  public ElasticsearchDocumentStoreAdapter(RestClient client, ObjectMapper mapper) {
    this(client, mapper, DEFAULT_BATCH_SIZE);
  }

  public ElasticsearchDocumentStoreAdapter(RestClient client, ObjectMapper mapper, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
    this.rest = new RestJson(client, mapper);
    this.batchSize = batchSize;
  }

  @Override
  public BulkLoadSummary bulkLoad(String targetIndex, List<IndexReportRecord> records) {
    int loaded = 0;
    List<DocumentId> failed = new ArrayList<>();

    for (int start = 0; start < records.size(); start += batchSize) {
      List<IndexReportRecord> batch =
          records.subList(start, Math.min(start + batchSize, records.size()));
      log.debug("Sending bulk request with {} documents to {}", batch.size(), targetIndex);

      Request request = new Request("POST", "/_bulk");
      request.setJsonEntity(bulkBody(targetIndex, batch));
      JsonNode response = rest.perform(request, "bulk load into " + targetIndex);

      List<DocumentId> rejected = rejectedIds(response);
      failed.addAll(rejected);
      loaded += batch.size() - rejected.size();
    }

    log.info("Data ingested into Elasticsearch index {}: {} loaded, {} rejected",
        targetIndex, loaded, failed.size());
    return new BulkLoadSummary(targetIndex, loaded, failed);
  }

  private String bulkBody(String targetIndex, List<IndexReportRecord> batch) {
    StringBuilder body = new StringBuilder();
    for (IndexReportRecord record : batch) {
      Map<String, Object> action =
          Map.of("index", Map.of("_index", targetIndex, "_id", record.documentId().value()));
      body.append(rest.toJson(action, "bulk load")).append('\n');
      body.append(rest.toJson(record.toDocument(), "bulk load")).append('\n');
    }
    return body.toString();
  }

  private static List<DocumentId> rejectedIds(JsonNode response) {
    if (!response.path("errors").asBoolean(false)) {
      return List.of();
    }
    List<DocumentId> rejected = new ArrayList<>();
    for (JsonNode item : response.path("items")) {
      JsonNode result = item.path("index");
      if (result.has("error")) {
        String id = result.path("_id").asText();
        log.warn("Document {} rejected: {}", id, result.path("error").path("reason").asText());
        rejected.add(new DocumentId(id));
      }
    }
    return rejected;
  }
}
