package com.streamfirst.indexinsight.domain.naming;

import java.util.Optional;

/**
 * One index naming convention. Implementations are stateless and safe to share between threads.
 */
public interface IdentifierConvention {

  /**
   * Returns whether the guard for this convention accepts the name. A convention whose guard
   * accepts a name is not required to extract anything from it.
   */
  boolean accepts(String indexName);

  /**
   * Extracts fields from a name this convention accepts.
   *
   * @param indexName a non-empty index name
   * @return the parsed record, or empty if the name does not follow this convention after all
   */
  Optional<ParsedIdentifier> parse(String indexName);
}
