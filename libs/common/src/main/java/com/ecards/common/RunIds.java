package com.ecards.common;

import java.util.UUID;

/** Correlation ids for one scheduled worker run, written to the {@code run_id} MDC key. */
public final class RunIds {
  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString();
  }
}
