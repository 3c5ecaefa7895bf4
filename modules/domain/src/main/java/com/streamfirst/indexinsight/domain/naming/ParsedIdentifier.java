package com.streamfirst.indexinsight.domain.naming;

import java.util.Objects;
import lombok.Builder;

/**
 * Structured view of an index name. All fields except {@code scheme} are nullable; an
 * {@link NamingScheme#UNRECOGNIZED} record carries nothing else.
 *
 * <p>{@code environment} is the value published in the unified schema. For the textual data
 * stream fallback it holds the application name, so the token that was actually extracted is
 * kept separately in {@code derivedEnvironment}. For every other scheme both fields are equal.
 *
 * @param scheme the convention the name was classified under
 * @param type data stream type, e.g. {@code logs} or {@code metrics}
 * @param dataset leading grouping token
 * @param namespace secondary grouping token, possibly dotted or hyphenated
 * @param environment deployment tier as published
 * @param derivedEnvironment deployment tier as extracted from the name
 * @param application dataset, followed by {@code .namespace} when a namespace is present
 * @param date creation date in {@code yyyy-MM-dd} form
 * @param iteration rollover generation exactly as it appears in the name
 */
@Builder
public record ParsedIdentifier(
    NamingScheme scheme,
    String type,
    String dataset,
    String namespace,
    String environment,
    String derivedEnvironment,
    String application,
    String date,
    String iteration) {

  private static final ParsedIdentifier UNRECOGNIZED =
      ParsedIdentifier.builder().scheme(NamingScheme.UNRECOGNIZED).build();

  public ParsedIdentifier {
    Objects.requireNonNull(scheme, "Naming scheme cannot be null");
  }

  /** The record returned for names no convention accepts. */
  public static ParsedIdentifier unrecognized() {
    return UNRECOGNIZED;
  }

  public boolean isRecognized() {
    return scheme != NamingScheme.UNRECOGNIZED;
  }

  /** Joins dataset and namespace the way every convention composes the application name. */
  static String applicationOf(String dataset, String namespace) {
    return namespace == null ? dataset : dataset + "." + namespace;
  }
}
