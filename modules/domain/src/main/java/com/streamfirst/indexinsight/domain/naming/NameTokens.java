package com.streamfirst.indexinsight.domain.naming;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Token helpers shared by the conventions. Splits keep empty tokens, including trailing ones. */
final class NameTokens {

  static final String DEFAULT_ENVIRONMENT = "default";
  static final String DATASTREAM_PREFIX = ".ds-";

  private NameTokens() {}

  static List<String> split(String value, char separator) {
    return Arrays.asList(value.split(Pattern.quote(String.valueOf(separator)), -1));
  }

  /** Joins {@code tokens[from, to)} with the separator. */
  static String join(List<String> tokens, int from, int to, char separator) {
    return String.join(String.valueOf(separator), tokens.subList(from, to));
  }

  /** Maps an empty token to null so that absent and empty namespaces look the same. */
  static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  /** Replaces the dots of a {@code yyyy.MM.dd} token with dashes. */
  static String normalizeDate(String date) {
    return date == null ? null : date.replace('.', '-');
  }

  /**
   * Splits a namespace on its last hyphen into {namespace, environment}. Returns null when the
   * namespace has no hyphen.
   */
  static String[] splitEnvironment(String namespace) {
    int lastHyphen = namespace.lastIndexOf('-');
    if (lastHyphen < 0) {
      return null;
    }
    return new String[] {namespace.substring(0, lastHyphen), namespace.substring(lastHyphen + 1)};
  }
}
