package io.github.drompincen.remindpal.protocol.api;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrencePatternTest {

    @Test
    void tagsMatchPersistedFormat() {
        assertThat(RecurrencePattern.daily().toTag()).isEqualTo("daily");
        assertThat(RecurrencePattern.weekly(DayOfWeek.MONDAY).toTag()).isEqualTo("weekly_monday");
        assertThat(RecurrencePattern.monthly(null).toTag()).isEqualTo("monthly");
        assertThat(RecurrencePattern.monthly(31).toTag()).isEqualTo("monthly_31");
    }

    @Test
    void fromTagReadsKnownTags() {
        assertThat(RecurrencePattern.fromTag("weekly_friday"))
                .contains(RecurrencePattern.weekly(DayOfWeek.FRIDAY));
        assertThat(RecurrencePattern.fromTag("MONTHLY_15")).contains(RecurrencePattern.monthly(15));
        assertThat(RecurrencePattern.fromTag("daily")).contains(RecurrencePattern.daily());
    }

    @Test
    void fromTagRejectsUnknownOrBrokenTags() {
        assertThat(RecurrencePattern.fromTag(null)).isEmpty();
        assertThat(RecurrencePattern.fromTag(" ")).isEmpty();
        assertThat(RecurrencePattern.fromTag("yearly")).isEmpty();
        assertThat(RecurrencePattern.fromTag("weekly_funday")).isEmpty();
        assertThat(RecurrencePattern.fromTag("monthly_40")).isEmpty();
        assertThat(RecurrencePattern.fromTag("monthly_x")).isEmpty();
        assertThat(RecurrencePattern.fromTag("daily_extra")).isEmpty();
    }

    @Test
    void dayOfMonthIsValidated() {
        assertThatThrownBy(() -> RecurrencePattern.monthly(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describeIsReadable() {
        assertThat(RecurrencePattern.weekly(DayOfWeek.TUESDAY).describe()).isEqualTo("weekly tuesday");
    }
}
