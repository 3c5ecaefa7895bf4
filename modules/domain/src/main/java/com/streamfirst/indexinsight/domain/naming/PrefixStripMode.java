package com.streamfirst.indexinsight.domain.naming;

/** How the textual data stream fallback removes the {@code .ds-} marker before splitting. */
public enum PrefixStripMode {
  /**
   * Removes the leading run of {@code '.'}, {@code 'd'}, {@code 's'} and {@code '-'} characters.
   * Over-strips datasets that start with one of those letters ({@code .ds-sales-...} yields
   * {@code ales}); this is what previously published reports contain.
   */
  CHARACTER_CLASS {
    @Override
    String strip(String indexName) {
      int start = 0;
      while (start < indexName.length() && STRIPPED.indexOf(indexName.charAt(start)) >= 0) {
        start++;
      }
      return indexName.substring(start);
    }
  },

  /** Removes the literal {@code .ds-} prefix once. */
  LITERAL_PREFIX {
    @Override
    String strip(String indexName) {
      return indexName.startsWith(NameTokens.DATASTREAM_PREFIX)
          ? indexName.substring(NameTokens.DATASTREAM_PREFIX.length())
          : indexName;
    }
  };

  private static final String STRIPPED = ".ds-";

  abstract String strip(String indexName);
}
