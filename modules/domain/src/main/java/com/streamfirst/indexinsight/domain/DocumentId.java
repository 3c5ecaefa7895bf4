package com.streamfirst.indexinsight.domain;

import java.util.Objects;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Identifier of a report document in the document store. Derived from the index name alone so
 * that reloading a report overwrites earlier documents instead of duplicating them.
 *
 * @param value lowercase hex SHA-256 of the UTF-8 encoded index name
 */
public record DocumentId(String value) {
  public DocumentId {
    Objects.requireNonNull(value, "Document ID cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("Document ID cannot be empty");
    }
  }

  public static DocumentId of(String indexName) {
    Objects.requireNonNull(indexName, "Index name cannot be null");
    return new DocumentId(DigestUtils.sha256Hex(indexName));
  }

  @Override
  public String toString() {
    return value;
  }
}
