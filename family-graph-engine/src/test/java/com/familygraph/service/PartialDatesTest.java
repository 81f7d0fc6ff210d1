package com.familygraph.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PartialDatesTest {

    @Test
    void extractsFirstFourDigitYear() {
        assertThat(PartialDates.extractYear("abt 1850").getAsInt()).isEqualTo(1850);
        assertThat(PartialDates.extractYear("2 Mar 1850").getAsInt()).isEqualTo(1850);
        assertThat(PartialDates.extractYear("1850-03-02").getAsInt()).isEqualTo(1850);
    }

    @Test
    void noYearIsEmpty() {
        assertThat(PartialDates.extractYear("unknown")).isEmpty();
        assertThat(PartialDates.extractYear("12345")).isEmpty();
        assertThat(PartialDates.extractYear(null)).isEmpty();
    }

    @Test
    void sortsEarliestFirstWithUndatedLast() {
        List<String> dates = new ArrayList<>(Arrays.asList("1900", null, "1850-03-02", "1850-01-15", "unknown", "abt 1849"));

        dates.sort(PartialDates.EARLIEST_FIRST);

        assertThat(dates.subList(0, 4)).containsExactly("abt 1849", "1850-01-15", "1850-03-02", "1900");
        assertThat(dates.subList(4, 6)).containsExactlyInAnyOrder(null, "unknown");
    }

    @Test
    void sameYearWithoutMonthComparesEqual() {
        assertThat(PartialDates.compare("1850", "abt 1850")).isZero();
        assertThat(PartialDates.compare("abt 1850", "1850")).isZero();
        assertThat(PartialDates.compare(null, "unknown")).isZero();
    }
}
