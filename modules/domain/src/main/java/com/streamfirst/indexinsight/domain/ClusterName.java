package com.streamfirst.indexinsight.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Label of the cluster a stats file was collected from.
 *
 * @param value the label, e.g. {@code prod-eu}
 */
public record ClusterName(String value) {
  public ClusterName {
    Objects.requireNonNull(value, "Cluster name cannot be null");
  }

  /** Derives the label from a stats file: its file name up to the first dot. */
  public static ClusterName fromFile(Path file) {
    String fileName = file.getFileName().toString();
    int firstDot = fileName.indexOf('.');
    return new ClusterName(firstDot < 0 ? fileName : fileName.substring(0, firstDot));
  }

  @Override
  public String toString() {
    return value;
  }
}
