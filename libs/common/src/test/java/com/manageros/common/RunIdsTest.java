package com.manageros.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class RunIdsTest {

  @Test
  void runIdStartsWithUtcStartTime() {
    final Clock clock =
        Clock.fixed(Instant.parse("2026-03-02T09:00:05Z"), ZoneId.of("Asia/Tokyo"));

    assertThat(RunIds.newRunId(clock)).matches("20260302T090005Z-[0-9a-f]{8}");
  }

  @Test
  void runIdsAreUniqueWithinTheSameSecond() {
    final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:05Z"), ZoneId.of("UTC"));

    assertThat(RunIds.newRunId(clock)).isNotEqualTo(RunIds.newRunId(clock));
  }
}
