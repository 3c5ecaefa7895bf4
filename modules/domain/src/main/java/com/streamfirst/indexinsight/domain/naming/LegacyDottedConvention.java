package com.streamfirst.indexinsight.domain.naming;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dot-separated names from before data streams: {@code <dataset>[.<namespace>...].<suffix>}.
 *
 * <p>When the suffix begins with a {@code major.minor.patch} version the name is read as
 * {@code <dataset>[.<namespace>...].<environment>.<version>}. The suffix comes out of a split on
 * dots and so never holds a full version; the rule is kept for names produced elsewhere with the
 * same shape.
 */
public final class LegacyDottedConvention implements IdentifierConvention {

  static final String LEGACY_TYPE = "logs";

  private static final Pattern VERSION = Pattern.compile("\\d+\\.\\d+\\.\\d+");

  @Override
  public boolean accepts(String indexName) {
    return indexName.indexOf('.') >= 0 && !indexName.startsWith(NameTokens.DATASTREAM_PREFIX);
  }

  @Override
  public Optional<ParsedIdentifier> parse(String indexName) {
    List<String> parts = NameTokens.split(indexName, '.');
    int count = parts.size();

    String dataset = parts.get(0);
    String namespace = count > 2 ? NameTokens.join(parts, 1, count - 1, '.') : null;
    String suffix = parts.get(count - 1);
    String environment = NameTokens.DEFAULT_ENVIRONMENT;

    if (VERSION.matcher(suffix).lookingAt()) {
      namespace = count > 3 ? NameTokens.join(parts, 1, count - 2, '.') : null;
      environment = count > 2 ? parts.get(count - 2) : NameTokens.DEFAULT_ENVIRONMENT;
    }
    namespace = NameTokens.emptyToNull(namespace);

    return Optional.of(
        ParsedIdentifier.builder()
            .scheme(NamingScheme.LEGACY_DOTTED)
            .type(LEGACY_TYPE)
            .dataset(dataset)
            .namespace(namespace)
            .environment(environment)
            .derivedEnvironment(environment)
            .application(ParsedIdentifier.applicationOf(dataset, namespace))
            .build());
  }
}
