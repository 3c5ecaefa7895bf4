package com.streamfirst.indexinsight.domain.naming;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Behaviour switches for {@link IndexNameParser}. The defaults keep the output of previously
 * published reports for every name the structured patterns accept.
 */
@Value
@Builder
public class ParserOptions {

  /** How the textual fallback strips the data stream marker. */
  @NonNull @Builder.Default PrefixStripMode stripMode = PrefixStripMode.CHARACTER_CLASS;

  /**
   * Whether marker-bearing names are matched against the structured patterns before the textual
   * fallback. When false the fallback claims every such name and the structured convention is
   * never consulted.
   */
  @Builder.Default boolean structuredFirst = true;

  public static ParserOptions defaults() {
    return ParserOptions.builder().build();
  }

  /** Evaluation order and stripping exactly as the first generation of reports used them. */
  public static ParserOptions fallbackFirst() {
    return ParserOptions.builder().structuredFirst(false).build();
  }
}
