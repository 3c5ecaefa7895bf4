package com.streamfirst.indexinsight.domain.naming;

/**
 * Naming conventions an index name can be classified under. Exactly one scheme is assigned to
 * every parsed identifier; {@link #UNRECOGNIZED} is a regular outcome, not an error.
 */
public enum NamingScheme {
  /** Dot-separated names such as {@code metrics.payments.prod}. */
  LEGACY_DOTTED("legacy-dotted"),
  /** Data stream backing indices that only yield to token splitting. */
  DATASTREAM_TEXTUAL_FALLBACK("datastream-textual-fallback"),
  /** Data stream backing indices matching {@code .ds-<type>-<dataset>[.<namespace>]-<date>-<n>}. */
  DATASTREAM_STRUCTURED("datastream-structured"),
  /** No convention matched. */
  UNRECOGNIZED("unrecognized");

  private final String label;

  NamingScheme(String label) {
    this.label = label;
  }

  /** Label written to reports and loaded documents. */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
