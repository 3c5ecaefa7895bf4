package com.streamfirst.indexinsight.domain.naming;

import java.util.List;
import java.util.Optional;
import lombok.NonNull;

/**
 * Classifies index names into {@link ParsedIdentifier} records.
 *
 * <p>Conventions are consulted in a fixed order and the first one that both accepts the name and
 * extracts a record wins:
 *
 * <ol>
 *   <li>{@link LegacyDottedConvention} for dotted names without the {@code .ds-} prefix;
 *   <li>{@link DatastreamStructuredConvention} for names carrying the {@code .ds-} marker;
 *   <li>{@link DatastreamTextualConvention} for marker-bearing names the structured patterns
 *       reject.
 * </ol>
 *
 * <p>With {@link ParserOptions#isStructuredFirst()} disabled the last two swap places. Anything
 * left over is {@link NamingScheme#UNRECOGNIZED}. Instances are immutable and thread-safe, and
 * {@link #parse(String)} never throws.
 */
public final class IndexNameParser {

  private final List<IdentifierConvention> conventions;

  public IndexNameParser() {
    this(ParserOptions.defaults());
  }

  public IndexNameParser(@NonNull ParserOptions options) {
    IdentifierConvention legacy = new LegacyDottedConvention();
    IdentifierConvention structured = new DatastreamStructuredConvention();
    IdentifierConvention textual = new DatastreamTextualConvention(options.getStripMode());
    this.conventions =
        options.isStructuredFirst()
            ? List.of(legacy, structured, textual)
            : List.of(legacy, textual, structured);
  }

  /**
   * Parses a single index name.
   *
   * @param indexName the raw name; null and empty names are unrecognized
   * @return the parsed record, never null
   */
  public ParsedIdentifier parse(String indexName) {
    if (indexName == null || indexName.isEmpty()) {
      return ParsedIdentifier.unrecognized();
    }
    for (IdentifierConvention convention : conventions) {
      if (!convention.accepts(indexName)) {
        continue;
      }
      Optional<ParsedIdentifier> parsed = convention.parse(indexName);
      if (parsed.isPresent()) {
        return parsed.get();
      }
    }
    return ParsedIdentifier.unrecognized();
  }
}
