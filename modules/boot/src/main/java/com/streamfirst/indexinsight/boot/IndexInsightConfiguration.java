package com.streamfirst.indexinsight.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchClientFactory;
import com.streamfirst.indexinsight.domain.naming.IndexNameParser;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the stateless collaborators. File and cluster adapters depend on command arguments
 * and are created per run by {@link IndexInsightCommandRunner}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(IndexInsightProperties.class)
public class IndexInsightConfiguration {

  @Bean
  public IndexNameParser indexNameParser(IndexInsightProperties properties) {
    var options = properties.getParser().toOptions();
    log.debug("Creating index name parser with {}", options);
    return new IndexNameParser(options);
  }

  @Bean
  public ElasticsearchClientFactory elasticsearchClientFactory() {
    return new ElasticsearchClientFactory();
  }

  @Bean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
