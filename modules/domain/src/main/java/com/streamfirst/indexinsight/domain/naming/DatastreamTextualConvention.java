package com.streamfirst.indexinsight.domain.naming;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort split of names carrying the {@code .ds-} marker that the structured patterns
 * reject: {@code <dataset>-<namespace...>-<yyyy.MM.dd>-<generation>} after the marker is stripped.
 *
 * <p>Published reports expect the {@code environment} column of these records to hold the
 * application name. That value is kept, and the environment token split off the namespace is
 * reported as {@code derivedEnvironment}.
 */
@Slf4j
@RequiredArgsConstructor
public final class DatastreamTextualConvention implements IdentifierConvention {

  static final String FALLBACK_TYPE = "logs";

  private static final Pattern DATE = Pattern.compile("\\d{4}\\.\\d{2}\\.\\d{2}");
  private static final Pattern GENERATION = Pattern.compile("\\d+");

  @NonNull private final PrefixStripMode stripMode;

  /**
   * Whether the name references a data stream backing index. A plain substring test covers the
   * prefixed form as well as {@code .ds-} followed by any word, dot or hyphen character.
   */
  static boolean hasDatastreamMarker(String indexName) {
    return indexName.contains(NameTokens.DATASTREAM_PREFIX);
  }

  @Override
  public boolean accepts(String indexName) {
    return hasDatastreamMarker(indexName);
  }

  @Override
  public Optional<ParsedIdentifier> parse(String indexName) {
    log.info(
        "Index {} does not match a structured data stream pattern, splitting on hyphens",
        indexName);

    List<String> parts = NameTokens.split(stripMode.strip(indexName), '-');
    int count = parts.size();

    String dataset = parts.get(0);
    String namespace = count > 2 ? NameTokens.join(parts, 1, count - 2, '-') : null;
    String date = null;
    String iteration = null;
    if (count > 1) {
      String dateToken = parts.get(count - 2);
      date = DATE.matcher(dateToken).lookingAt() ? dateToken : null;
      String lastToken = parts.get(count - 1);
      iteration = GENERATION.matcher(lastToken).matches() ? lastToken : null;
    }

    // Only a missing slice widens; three tokens give an empty slice, which stays empty.
    if (namespace == null && count > 1) {
      namespace = NameTokens.join(parts, 1, count, '-');
    }

    String environment = null;
    if (namespace != null) {
      String[] split = NameTokens.splitEnvironment(namespace);
      if (split != null) {
        namespace = split[0];
        environment = split[1];
      }
    }
    namespace = NameTokens.emptyToNull(namespace);
    if (namespace == null) {
      environment = NameTokens.DEFAULT_ENVIRONMENT;
    }

    String application = ParsedIdentifier.applicationOf(dataset, namespace);
    return Optional.of(
        ParsedIdentifier.builder()
            .scheme(NamingScheme.DATASTREAM_TEXTUAL_FALLBACK)
            .type(FALLBACK_TYPE)
            .dataset(dataset)
            .namespace(namespace)
            .environment(application)
            .derivedEnvironment(environment)
            .application(application)
            .date(NameTokens.normalizeDate(date))
            .iteration(iteration)
            .build());
  }
}
