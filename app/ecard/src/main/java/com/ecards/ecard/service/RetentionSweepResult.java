package com.ecards.ecard.service;

public record RetentionSweepResult(int selected, int deleted, int artworkFailures) {

  public static RetentionSweepResult empty() {
    return new RetentionSweepResult(0, 0, 0);
  }
}
