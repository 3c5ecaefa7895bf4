package com.streamfirst.indexinsight.boot;

import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchDocumentStoreAdapter;
import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchSettings;
import com.streamfirst.indexinsight.domain.naming.ParserOptions;
import com.streamfirst.indexinsight.domain.naming.PrefixStripMode;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings bound from the {@code index-insight} prefix. */
@Data
@ConfigurationProperties(prefix = "index-insight")
public class IndexInsightProperties {

  private Elasticsearch elasticsearch = new Elasticsearch();
  private Parser parser = new Parser();
  private Report report = new Report();
  private Collect collect = new Collect();

  @Data
  public static class Elasticsearch {
    /** Cluster URL; required by {@code collect} and by {@code report --ingest}. */
    private String host;

    /** Encoded API key. */
    private String apiKey;

    /** Index receiving report documents. */
    private String targetIndex = "index-insight";

    private boolean verifyCertificates = true;

    private int bulkBatchSize = ElasticsearchDocumentStoreAdapter.DEFAULT_BATCH_SIZE;

    public ElasticsearchSettings toSettings() {
      if (host == null || host.isBlank()) {
        throw new IllegalStateException(
            "Elasticsearch host is not set (ES_HOST or ELASTICSEARCH_HOST)");
      }
      return new ElasticsearchSettings(host, apiKey, verifyCertificates);
    }
  }

  @Data
  public static class Parser {
    private PrefixStripMode stripMode = PrefixStripMode.CHARACTER_CLASS;
    private boolean structuredFirst = true;

    public ParserOptions toOptions() {
      return ParserOptions.builder().stripMode(stripMode).structuredFirst(structuredFirst).build();
    }
  }

  @Data
  public static class Report {
    /**
     * Column separator of stats files read by {@code report}. When unset it is detected from the
     * header line, which accepts the output of {@code collect} as well as {@code ;} exports.
     */
    private Character statsSeparator;
  }

  @Data
  public static class Collect {
    /** Column separator of stats files written by {@code collect}. */
    private char statsSeparator = ',';

    /** Pause between measuring two indices. */
    private Duration throttle = Duration.ofMillis(100);

    private String output = "daily_ingest_report.csv";
  }
}
