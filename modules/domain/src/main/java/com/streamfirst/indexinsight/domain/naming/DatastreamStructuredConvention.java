package com.streamfirst.indexinsight.domain.naming;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Data stream backing indices of the form
 * {@code .ds-<type>-<dataset>[.<namespace>]-<yyyy.MM.dd>-<generation>}.
 *
 * <p>The patterns are anchored at the start of the name only. A namespace ending in
 * {@code -<token>} is split there and the token becomes the environment. A namespace without a
 * hyphen leaves the environment null; only a missing namespace defaults it.
 */
public final class DatastreamStructuredConvention implements IdentifierConvention {

  private static final Pattern DOTTED_NAMESPACE =
      Pattern.compile(
          "\\.ds-(?<type>\\w+)-(?<dataset>\\w+)(?:\\.(?<namespace>[\\w.\\-]+))?"
              + "-(?<date>\\d{4}\\.\\d{2}\\.\\d{2})-(?<iteration>\\d+)");

  private static final Pattern HYPHENATED_NAMESPACE =
      Pattern.compile(
          "\\.ds-(?<type>\\w+)-(?<dataset>\\w+)-(?<namespace>\\w+)"
              + "-(?<date>\\d{4}\\.\\d{2}\\.\\d{2})-(?<iteration>\\d+)");

  private static final List<Pattern> PATTERNS = List.of(DOTTED_NAMESPACE, HYPHENATED_NAMESPACE);

  @Override
  public boolean accepts(String indexName) {
    return DatastreamTextualConvention.hasDatastreamMarker(indexName);
  }

  @Override
  public Optional<ParsedIdentifier> parse(String indexName) {
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(indexName);
      if (matcher.lookingAt()) {
        return Optional.of(fromMatch(matcher));
      }
    }
    return Optional.empty();
  }

  private static ParsedIdentifier fromMatch(Matcher matcher) {
    String dataset = matcher.group("dataset");
    String namespace = matcher.group("namespace");
    String environment = null;

    if (namespace == null) {
      environment = NameTokens.DEFAULT_ENVIRONMENT;
    } else {
      String[] split = NameTokens.splitEnvironment(namespace);
      if (split != null) {
        namespace = NameTokens.emptyToNull(split[0]);
        environment = split[1];
      }
    }

    return ParsedIdentifier.builder()
        .scheme(NamingScheme.DATASTREAM_STRUCTURED)
        .type(matcher.group("type"))
        .dataset(dataset)
        .namespace(namespace)
        .environment(environment)
        .derivedEnvironment(environment)
        .application(ParsedIdentifier.applicationOf(dataset, namespace))
        .date(NameTokens.normalizeDate(matcher.group("date")))
        .iteration(matcher.group("iteration"))
        .build();
  }
}
