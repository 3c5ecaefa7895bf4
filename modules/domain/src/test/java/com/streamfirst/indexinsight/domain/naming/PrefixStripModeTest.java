package com.streamfirst.indexinsight.domain.naming;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PrefixStripModeTest {

  @ParameterizedTest
  @CsvSource({
    ".ds-logs-app,   logs-app,  logs-app",
    ".ds-sales-app,  ales-app,  sales-app",
    ".ds-dev-app,    ev-app,    dev-app",
    "..ds--x,        x,         ..ds--x",
    "logs,           logs,      logs"
  })
  void stripsMarker(String input, String characterClass, String literalPrefix) {
    assertThat(PrefixStripMode.CHARACTER_CLASS.strip(input)).isEqualTo(characterClass);
    assertThat(PrefixStripMode.LITERAL_PREFIX.strip(input)).isEqualTo(literalPrefix);
  }
}
