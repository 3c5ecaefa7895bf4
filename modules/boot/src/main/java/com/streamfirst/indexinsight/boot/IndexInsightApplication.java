package com.streamfirst.indexinsight.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Command line entry point. See {@link IndexInsightCommandRunner} for the commands. */
@SpringBootApplication
public class IndexInsightApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(IndexInsightApplication.class, args)));
  }
}
