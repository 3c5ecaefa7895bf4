package com.streamfirst.indexinsight.adapters.elasticsearch;

import java.util.Objects;

/**
 * Connection settings for a cluster.
 *
 * @param host base URL, e.g. {@code https://es.example.com:9200}
 * @param apiKey encoded API key sent as {@code Authorization: ApiKey <key>}, may be null
 * @param verifyCertificates false to accept any server certificate (self-signed clusters)
 */
public record ElasticsearchSettings(String host, String apiKey, boolean verifyCertificates) {
  public ElasticsearchSettings {
    Objects.requireNonNull(host, "Elasticsearch host cannot be null");
    if (host.isBlank()) {
      throw new IllegalArgumentException("Elasticsearch host cannot be empty");
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public String toString() {
    return "ElasticsearchSettings{host='" + host + "', apiKey=" + (hasApiKey() ? "***" : "none")
        + ", verifyCertificates=" + verifyCertificates + '}';
  }
}
