package com.streamfirst.indexinsight.adapters.elasticsearch;

import com.streamfirst.indexinsight.ports.PortException;
import java.security.GeneralSecurityException;
import javax.net.ssl.SSLContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpHost;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.message.BasicHeader;
import org.apache.http.ssl.SSLContextBuilder;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

/** Builds low-level REST clients. Callers own the returned client and must close it. */
@Slf4j
public class ElasticsearchClientFactory {

  public RestClient create(ElasticsearchSettings settings) {
    log.info("Connecting to Elasticsearch with {}", settings);
    RestClientBuilder builder = RestClient.builder(HttpHost.create(settings.host()));

    if (settings.hasApiKey()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + settings.apiKey())});
    }
    if (!settings.verifyCertificates()) {
      log.warn("Certificate verification is disabled for {}", settings.host());
      SSLContext trustAll = trustAllContext();
      builder.setHttpClientConfigCallback(
          http ->
              http.setSSLContext(trustAll)
                  .setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE));
    }
    return builder.build();
  }

  private static SSLContext trustAllContext() {
    try {
      return SSLContextBuilder.create().loadTrustMaterial(null, (chain, authType) -> true).build();
    } catch (GeneralSecurityException e) {
      throw new PortException("Failed to create trust-all SSL context", e);
    }
  }
}
