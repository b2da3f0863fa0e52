package com.scholary.subtitle.batch.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimestampsTest {

  @Test
  void parse_shouldReadCellFormat() {
    assertThat(Timestamps.parse("01:01:01.500")).isEqualTo(3_661_500L);
    assertThat(Timestamps.parse(" 00:00:00.000 ")).isZero();
  }

  @Test
  void parse_shouldAllowHoursPastOneDay() {
    assertThat(Timestamps.parse("25:00:00.000")).isEqualTo(90_000_000L);
  }

  @Test
  void parse_shouldRejectMalformedValues() {
    assertThatThrownBy(() -> Timestamps.parse("00:00:00,000"))
        .isInstanceOf(MalformedTimestampException.class);
    assertThatThrownBy(() -> Timestamps.parse("00:61:00.000"))
        .isInstanceOf(MalformedTimestampException.class);
    assertThatThrownBy(() -> Timestamps.parse(null))
        .isInstanceOf(MalformedTimestampException.class);
  }

  @Test
  void format_shouldUseSeparator() {
    assertThat(Timestamps.format(3_665_750)).isEqualTo("01:01:05.750");
    assertThat(Timestamps.format(5_200, ',')).isEqualTo("00:00:05,200");
  }
}
