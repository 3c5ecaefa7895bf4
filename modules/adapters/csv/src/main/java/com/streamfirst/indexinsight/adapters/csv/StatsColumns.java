package com.streamfirst.indexinsight.adapters.csv;

import java.util.List;

/** Column names of stats files. */
final class StatsColumns {

  static final String INDEX = "index";
  static final String FIRST_TIMESTAMP = "first_timestamp";
  static final String LAST_TIMESTAMP = "last_timestamp";
  static final String DAILY_INGEST_MB = "daily_ingest_mb";

  static final List<String> ALL = List.of(INDEX, FIRST_TIMESTAMP, LAST_TIMESTAMP, DAILY_INGEST_MB);

  private StatsColumns() {}
}
