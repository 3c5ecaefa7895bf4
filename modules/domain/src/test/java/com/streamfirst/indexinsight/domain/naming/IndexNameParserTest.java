package com.streamfirst.indexinsight.domain.naming;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ConcurrentHashMap;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class IndexNameParserTest {

  private final IndexNameParser parser = new IndexNameParser();

  @Test
  void dottedNameKeepsDefaultEnvironmentWhenSuffixIsNoVersion() {
    ParsedIdentifier parsed = parser.parse("metrics.payments.prod");

    assertThat(parsed.scheme()).isEqualTo(NamingScheme.LEGACY_DOTTED);
    assertThat(parsed.dataset()).isEqualTo("metrics");
    assertThat(parsed.namespace()).isEqualTo("payments");
    assertThat(parsed.environment()).isEqualTo("default");
    assertThat(parsed.application()).isEqualTo("metrics.payments");
    assertThat(parsed.date()).isNull();
    assertThat(parsed.iteration()).isNull();
  }

  @Test
  void backingIndexWithDottedNamespaceIsStructured() {
    ParsedIdentifier parsed = parser.parse(".ds-logs-nginx.access-2024.01.15-000003");

    assertThat(parsed.scheme()).isEqualTo(NamingScheme.DATASTREAM_STRUCTURED);
    assertThat(parsed.type()).isEqualTo("logs");
    assertThat(parsed.dataset()).isEqualTo("nginx");
    assertThat(parsed.namespace()).isEqualTo("access");
    assertThat(parsed.application()).isEqualTo("nginx.access");
    assertThat(parsed.date()).isEqualTo("2024-01-15");
    assertThat(parsed.iteration()).isEqualTo("000003");
    // a namespace without a hyphen carries no environment
    assertThat(parsed.environment()).isNull();
    assertThat(parsed.derivedEnvironment()).isNull();
  }

  @Test
  void malformedDateFallsBackToTextualSplit() {
    ParsedIdentifier parsed = parser.parse(".ds-logs-nginx-2024.1.15-000003");

    assertThat(parsed.scheme()).isEqualTo(NamingScheme.DATASTREAM_TEXTUAL_FALLBACK);
    assertThat(parsed.type()).isEqualTo("logs");
    assertThat(parsed.dataset()).isEqualTo("logs");
    assertThat(parsed.namespace()).isEqualTo("nginx");
    assertThat(parsed.application()).isEqualTo("logs.nginx");
    assertThat(parsed.environment()).isEqualTo("logs.nginx");
    assertThat(parsed.derivedEnvironment()).isNull();
    assertThat(parsed.date()).isNull();
    assertThat(parsed.iteration()).isEqualTo("000003");
  }

  @ParameterizedTest
  @ValueSource(strings = {"randomname123", "logs-nginx-default", "ds-logs-app"})
  void namesWithoutDotOrMarkerAreUnrecognized(String indexName) {
    ParsedIdentifier parsed = parser.parse(indexName);

    assertThat(parsed).isEqualTo(ParsedIdentifier.unrecognized());
    assertThat(parsed.scheme()).isEqualTo(NamingScheme.UNRECOGNIZED);
    assertThat(parsed.isRecognized()).isFalse();
    assertThat(parsed.dataset()).isNull();
    assertThat(parsed.namespace()).isNull();
    assertThat(parsed.environment()).isNull();
    assertThat(parsed.application()).isNull();
    assertThat(parsed.date()).isNull();
    assertThat(parsed.iteration()).isNull();
  }

  @ParameterizedTest
  @NullAndEmptySource
  void nullAndEmptyNamesAreUnrecognized(String indexName) {
    assertThat(parser.parse(indexName).scheme()).isEqualTo(NamingScheme.UNRECOGNIZED);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "metrics.payments.prod",
        "app.log",
        ".kibana_7.17.3",
        "a..b",
        "foo.ds-bar",
        ".ds-logs-nginx.access-default-2024.01.15-000001",
        ".ds-metrics-system-production-2024.03.01-000002",
        ".ds-logs-app-2024.01.15-000001",
        ".ds-logs-web-prod-2024.01.15-x1",
        ".ds-logs-nginx-000001",
        ".ds-sales-eu-prod-2024-01-15",
        ".ds-",
        "plain"
      })
  void applicationIsDatasetJoinedWithNamespace(String indexName) {
    ParsedIdentifier parsed = parser.parse(indexName);
    if (!parsed.isRecognized()) {
      return;
    }

    String expected =
        parsed.namespace() == null ? parsed.dataset() : parsed.dataset() + "." + parsed.namespace();
    assertThat(parsed.application()).isEqualTo(expected);
  }

  @Test
  void parsingIsIdempotentAcrossThreads() {
    String indexName = ".ds-logs-nginx.access-default-2024.01.15-000001";
    ParsedIdentifier expected = parser.parse(indexName);
    Map<ParsedIdentifier, Boolean> results = new ConcurrentHashMap<>();

    IntStream.range(0, 200).parallel().forEach(i -> results.put(parser.parse(indexName), true));

    assertThat(results.keySet()).containsExactly(expected);
  }

  @Test
  void fallbackFirstNeverReachesStructuredConvention() {
    IndexNameParser fallbackFirst = new IndexNameParser(ParserOptions.fallbackFirst());

    ParsedIdentifier parsed = fallbackFirst.parse(".ds-logs-nginx.access-2024.01.15-000003");

    assertThat(parsed.scheme()).isEqualTo(NamingScheme.DATASTREAM_TEXTUAL_FALLBACK);
    assertThat(parsed.dataset()).isEqualTo("logs");
    assertThat(parsed.namespace()).isEqualTo("nginx.access");
    assertThat(parsed.environment()).isEqualTo("logs.nginx.access");
    assertThat(parsed.date()).isEqualTo("2024-01-15");
    assertThat(parsed.iteration()).isEqualTo("000003");
  }

  @Test
  void fallbackFirstStillLetsDottedNamesWin() {
    IndexNameParser fallbackFirst = new IndexNameParser(ParserOptions.fallbackFirst());

    assertThat(fallbackFirst.parse("metrics.payments.prod"))
        .isEqualTo(parser.parse("metrics.payments.prod"));
  }

  @Test
  void literalPrefixStripKeepsLeadingLettersOfDataset() {
    String indexName = ".ds-sales-eu-prod-2024-01-15";
    IndexNameParser literal =
        new IndexNameParser(
            ParserOptions.builder().stripMode(PrefixStripMode.LITERAL_PREFIX).build());

    ParsedIdentifier characterClass = parser.parse(indexName);
    ParsedIdentifier literalPrefix = literal.parse(indexName);

    assertThat(characterClass.dataset()).isEqualTo("ales");
    assertThat(characterClass.application()).isEqualTo("ales.eu-prod");
    assertThat(literalPrefix.dataset()).isEqualTo("sales");
    assertThat(literalPrefix.application()).isEqualTo("sales.eu-prod");
    assertThat(literalPrefix.namespace()).isEqualTo(characterClass.namespace());
  }
}
