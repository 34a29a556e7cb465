package io.datastoreadmin.enums;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RolloverFrequencyTest {

    @Test
    void testFromString() {
        assertThat(RolloverFrequency.fromString("hourly")).isEqualTo(RolloverFrequency.HOURLY);
        assertThat(RolloverFrequency.fromString(" Daily ")).isEqualTo(RolloverFrequency.DAILY);
        assertThat(RolloverFrequency.fromString("MONTHLY")).isEqualTo(RolloverFrequency.MONTHLY);
        assertThat(RolloverFrequency.fromString("yearly")).isEqualTo(RolloverFrequency.YEARLY);
        assertThat(RolloverFrequency.fromString("weekly")).isNull();
        assertThat(RolloverFrequency.fromString(null)).isNull();
    }

    @Test
    void testSuffixFormatting() {
        ZonedDateTime time = ZonedDateTime.of(2020, 4, 3, 7, 25, 43, 0, ZoneOffset.UTC);

        assertThat(RolloverFrequency.HOURLY.getSuffixFormatter().format(time)).isEqualTo("2020-04-03-07");
        assertThat(RolloverFrequency.DAILY.getSuffixFormatter().format(time)).isEqualTo("2020-04-03");
        assertThat(RolloverFrequency.MONTHLY.getSuffixFormatter().format(time)).isEqualTo("2020-04");
        assertThat(RolloverFrequency.YEARLY.getSuffixFormatter().format(time)).isEqualTo("2020");
    }

    @Test
    void testTimeElementsAndUnits() {
        assertThat(RolloverFrequency.HOURLY.getTimeElementCount()).isEqualTo(4);
        assertThat(RolloverFrequency.YEARLY.getTimeElementCount()).isEqualTo(1);
        assertThat(RolloverFrequency.DAILY.getTimeUnit()).isEqualTo(ChronoUnit.DAYS);
    }
}
