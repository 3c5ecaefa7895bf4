package com.streamfirst.indexinsight.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.indexinsight.adapters.csv.CsvIndexStatsSource;
import com.streamfirst.indexinsight.adapters.csv.CsvIndexStatsWriter;
import com.streamfirst.indexinsight.adapters.csv.CsvReportWriter;
import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchClientFactory;
import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchClusterStatsAdapter;
import com.streamfirst.indexinsight.adapters.elasticsearch.ElasticsearchDocumentStoreAdapter;
import com.streamfirst.indexinsight.application.IndexReportService;
import com.streamfirst.indexinsight.application.IngestStatsCollector;
import com.streamfirst.indexinsight.application.ReportOutcome;
import com.streamfirst.indexinsight.domain.ClusterName;
import com.streamfirst.indexinsight.domain.naming.IndexNameParser;
import com.streamfirst.indexinsight.ports.PortException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.RestClient;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one command per invocation:
 *
 * <pre>
 * collect [--output=stats.csv] [--day=2024-01-15]
 * report  --file=prod.csv [--output=prod-report.csv] [--ingest]
 * </pre>
 *
 * Without a command the runner logs usage and exits; {@code --file} alone implies {@code report}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexInsightCommandRunner implements ApplicationRunner {

  static final String COLLECT = "collect";
  static final String REPORT = "report";

  private final IndexInsightProperties properties;
  private final IndexNameParser parser;
  private final ElasticsearchClientFactory clientFactory;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public void run(ApplicationArguments args) throws IOException {
    Optional<String> command = command(args);
    if (command.isEmpty()) {
      log.info("Usage: collect [--output=<file>] [--day=<yyyy-MM-dd>] | "
          + "report --file=<file> [--output=<file>] [--ingest]");
      return;
    }
    switch (command.get()) {
      case COLLECT -> collect(args);
      case REPORT -> report(args);
      default -> throw new IllegalArgumentException("Unknown command: " + command.get());
    }
  }

  private void collect(ApplicationArguments args) throws IOException {
    IndexInsightProperties.Collect settings = properties.getCollect();
    Path output = Path.of(option(args, "output").orElse(settings.getOutput()));

    try (RestClient client = clientFactory.create(properties.getElasticsearch().toSettings())) {
      IngestStatsCollector collector =
          new IngestStatsCollector(
              new ElasticsearchClusterStatsAdapter(client, objectMapper),
              new CsvIndexStatsWriter(output, settings.getStatsSeparator()),
              settings.getThrottle(),
              clock);
      Optional<String> day = option(args, "day");
      if (day.isPresent()) {
        collector.collect(LocalDate.parse(day.get()));
      } else {
        collector.collectToday();
      }
    }
  }

  ReportOutcome report(ApplicationArguments args) throws IOException {
    Path input =
        Path.of(
            option(args, "file")
                .orElseThrow(
                    () -> new IllegalArgumentException("report requires --file=<stats file>")));
    Path output =
        option(args, "output")
            .map(Path::of)
            .orElseGet(
                () -> input.resolveSibling(ClusterName.fromFile(input).value() + "-report.csv"));
    boolean ingest = args.containsOption("ingest");

    Character separator = properties.getReport().getStatsSeparator();
    var source =
        separator == null
            ? new CsvIndexStatsSource(input)
            : new CsvIndexStatsSource(input, separator);
    var sink = new CsvReportWriter(output);
    IndexInsightProperties.Elasticsearch es = properties.getElasticsearch();

    if (!ingest) {
      var service = new IndexReportService(parser, source, sink);
      return checkOutcome(service.run(es.getTargetIndex(), false));
    }
    if (es.getApiKey() == null || es.getApiKey().isBlank()) {
      throw new IllegalStateException("Elastic API key (ES_API_KEY) is not set");
    }
    try (RestClient client = clientFactory.create(es.toSettings())) {
      var store =
          new ElasticsearchDocumentStoreAdapter(client, objectMapper, es.getBulkBatchSize());
      var service = new IndexReportService(parser, source, sink, store);
      return checkOutcome(service.run(es.getTargetIndex(), true));
    }
  }

  private static ReportOutcome checkOutcome(ReportOutcome outcome) {
    outcome
        .bulkLoad()
        .ifPresent(
            summary -> {
              if (summary.hasFailures()) {
                throw new PortException(
                    summary.failed() + " documents were rejected by " + summary.targetIndex());
              }
            });
    log.info(
        "Report finished: {} records, {} unrecognized", outcome.records(), outcome.unrecognized());
    return outcome;
  }

  private static Optional<String> command(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (!commands.isEmpty()) {
      return Optional.of(commands.get(0));
    }
    return args.containsOption("file") ? Optional.of(REPORT) : Optional.empty();
  }

  private static Optional<String> option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }
}
