package com.streamfirst.indexinsight.adapters.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.indexinsight.domain.IndexStats;
import com.streamfirst.indexinsight.ports.ClusterStatsPort;
import com.streamfirst.indexinsight.ports.PortException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.RestClient;

/**
 * ClusterStatsPort backed by the cat, search and stats APIs. Activity and document age are read
 * from the {@code @timestamp} field.
 */
@Slf4j
public class ElasticsearchClusterStatsAdapter implements ClusterStatsPort {

  static final String TIMESTAMP_FIELD = "@timestamp";

  private final RestJson rest;

  public ElasticsearchClusterStatsAdapter(RestClient client, ObjectMapper mapper) {
    this.rest = new RestJson(client, mapper);
  }

  @Override
  public List<String> listIndices() {
    Request request = new Request("GET", "/_cat/indices");
    request.addParameter("format", "json");
    request.addParameter("h", "index");
    request.addParameter("expand_wildcards", "all");

    List<String> indices = new ArrayList<>();
    for (JsonNode row : rest.perform(request, "list indices")) {
      indices.add(row.path("index").asText());
    }
    log.debug("Cluster reports {} indices", indices.size());
    return indices;
  }

  @Override
  public boolean hasDocumentsBetween(String index, Instant from, Instant to) {
    ObjectNode body = rest.mapper().createObjectNode();
    body.put("size", 1);
    body.putObject("query")
        .putObject("range")
        .putObject(TIMESTAMP_FIELD)
        .put("gte", from.toString())
        .put("lt", to.toString());

    Request request = new Request("POST", "/" + RestJson.path(index) + "/_search");
    request.addParameter("allow_no_indices", "true");
    request.setJsonEntity(rest.toJson(body, "search " + index));

    JsonNode response = rest.perform(request, "search index " + index);
    return response.path("hits").path("total").path("value").asLong(0) > 0;
  }

  @Override
  public IndexStats fetchStats(String index) {
    Request request = new Request("GET", "/" + RestJson.path(index) + "/_stats/store");
    JsonNode stats = rest.perform(request, "fetch stats for " + index);
    JsonNode size =
        stats.path("indices").path(index).path("primaries").path("store").path("size_in_bytes");
    if (!size.isNumber()) {
      throw new PortException("Stats response for " + index + " holds no primary store size");
    }

    return new IndexStats(
        index, size.asLong(), edgeTimestamp(index, "asc"), edgeTimestamp(index, "desc"));
  }

  /** Reads {@code @timestamp} of the first document in the given sort order. */
  private String edgeTimestamp(String index, String order) {
    ObjectNode body = rest.mapper().createObjectNode();
    body.put("size", 1);
    body.putArray("sort").addObject().put(TIMESTAMP_FIELD, order);
    body.putArray("_source").add(TIMESTAMP_FIELD);

    Request request = new Request("POST", "/" + RestJson.path(index) + "/_search");
    request.setJsonEntity(rest.toJson(body, "search " + index));
    JsonNode hits = rest.perform(request, "search index " + index).path("hits").path("hits");

    JsonNode timestamp = hits.path(0).path("_source").path(TIMESTAMP_FIELD);
    return timestamp.isMissingNode() || timestamp.isNull()
        ? IndexStats.MISSING_TIMESTAMP
        : timestamp.asText();
  }
}
