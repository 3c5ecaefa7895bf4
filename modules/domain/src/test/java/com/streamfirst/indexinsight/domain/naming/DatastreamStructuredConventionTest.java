package com.streamfirst.indexinsight.domain.naming;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DatastreamStructuredConventionTest {

  private final DatastreamStructuredConvention convention = new DatastreamStructuredConvention();

  @Test
  void splitsEnvironmentOffHyphenatedNamespace() {
    ParsedIdentifier parsed =
        convention.parse(".ds-logs-nginx.access-default-2024.01.15-000001").orElseThrow();

    assertThat(parsed.scheme()).isEqualTo(NamingScheme.DATASTREAM_STRUCTURED);
    assertThat(parsed.dataset()).isEqualTo("nginx");
    assertThat(parsed.namespace()).isEqualTo("access");
    assertThat(parsed.environment()).isEqualTo("default");
    assertThat(parsed.application()).isEqualTo("nginx.access");
    assertThat(parsed.date()).isEqualTo("2024-01-15");
    assertThat(parsed.iteration()).isEqualTo("000001");
  }

  @Test
  void hyphenatedNamespaceUsesSecondaryPattern() {
    ParsedIdentifier parsed =
        convention.parse(".ds-metrics-system-production-2024.03.01-000002").orElseThrow();

    assertThat(parsed.type()).isEqualTo("metrics");
    assertThat(parsed.dataset()).isEqualTo("system");
    assertThat(parsed.namespace()).isEqualTo("production");
    assertThat(parsed.environment()).isNull();
    assertThat(parsed.application()).isEqualTo("system.production");
  }

  @Test
  void missingNamespaceDefaultsEnvironment() {
    ParsedIdentifier parsed = convention.parse(".ds-logs-app-2024.01.15-000001").orElseThrow();

    assertThat(parsed.namespace()).isNull();
    assertThat(parsed.environment()).isEqualTo("default");
    assertThat(parsed.application()).isEqualTo("app");
  }

  @Test
  void multiSegmentNamespaceSplitsOnLastHyphen() {
    ParsedIdentifier parsed =
        convention.parse(".ds-logs-my_app.web.edge-eu-prod-2024.01.15-000007").orElseThrow();

    assertThat(parsed.dataset()).isEqualTo("my_app");
    assertThat(parsed.namespace()).isEqualTo("web.edge-eu");
    assertThat(parsed.environment()).isEqualTo("prod");
    assertThat(parsed.application()).isEqualTo("my_app.web.edge-eu");
  }

  @Test
  void trailingTextAfterGenerationIsIgnored() {
    ParsedIdentifier parsed =
        convention.parse(".ds-logs-app-2024.01.15-000001-restored").orElseThrow();

    assertThat(parsed.iteration()).isEqualTo("000001");
  }

  @Test
  void rejectsNamesWithoutDateAndGeneration() {
    assertThat(convention.parse(".ds-logs-nginx-2024.1.15-000003")).isEmpty();
    assertThat(convention.parse(".ds-logs-web-prod-2024.01.15-x1")).isEmpty();
    assertThat(convention.parse("x.ds-logs-app-2024.01.15-000001")).isEmpty();
  }
}
