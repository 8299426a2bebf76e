package com.ecards.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class RunIdsTest {

  @Test
  void runIdsAreDistinctUuids() {
    final String first = RunIds.newRunId();
    final String second = RunIds.newRunId();

    assertThat(UUID.fromString(first).toString()).isEqualTo(first);
    assertThat(first).isNotEqualTo(second);
  }
}
