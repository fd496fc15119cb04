package com.company.radar.util;

import com.company.radar.domain.DailyMetric;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowUtilsTest {

    private static final LocalDate ANCHOR = LocalDate.of(2024, 3, 20);

    @Test
    void shouldSplitFourteenDaysIntoTwoSevenDayHalves() {
        // given
        List<DailyMetric> rows = new ArrayList<>();
        for (int daysAgo = 0; daysAgo < 16; daysAgo++) {
            rows.add(row(ANCHOR.minusDays(daysAgo), 10, 100));
        }

        // when
        WindowSplit split = WindowUtils.split(rows, 7);

        // then
        assertThat(split.getAnchorDate()).isEqualTo(ANCHOR);
        assertThat(split.getLast()).hasSize(7)
                .allMatch(r -> !r.getDate().isBefore(ANCHOR.minusDays(6)));
        assertThat(split.getPrevious()).hasSize(7)
                .allMatch(r -> !r.getDate().isAfter(ANCHOR.minusDays(7))
                        && !r.getDate().isBefore(ANCHOR.minusDays(13)));
    }

    @Test
    void shouldAnchorAtMostRecentDateInsteadOfToday() {
        // given
        LocalDate stale = LocalDate.of(2020, 1, 10);
        List<DailyMetric> rows = List.of(row(stale, 1, 10), row(stale.minusDays(8), 1, 20));

        // when
        WindowSplit split = WindowUtils.split(rows, 7);

        // then
        assertThat(split.getAnchorDate()).isEqualTo(stale);
        assertThat(split.getLast()).extracting(DailyMetric::getImpressions).containsExactly(10L);
        assertThat(split.getPrevious()).extracting(DailyMetric::getImpressions).containsExactly(20L);
    }

    @Test
    void shouldRejectNonPositiveHalfWindow() {
        assertThatThrownBy(() -> WindowUtils.split(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAggregateWithCtrFromSumsAndAveragePositionOverReportedDays() {
        // given
        DailyMetric withoutPosition = row(ANCHOR.minusDays(1), 0, 100);
        withoutPosition.setPosition(null);
        List<DailyMetric> rows = List.of(
                row(ANCHOR, 30, 300),
                row(ANCHOR, 10, 100),
                withoutPosition);

        // when
        WindowAggregate aggregate = WindowUtils.aggregate(rows);

        // then
        assertThat(aggregate.getClicks()).isEqualTo(40);
        assertThat(aggregate.getImpressions()).isEqualTo(500);
        assertThat(aggregate.getCtr()).isEqualTo(0.08);
        assertThat(aggregate.getAvgPosition()).isEqualTo(5.0);
        assertThat(aggregate.getDaysWithData()).isEqualTo(2);
    }

    @Test
    void shouldReturnZerosForEmptyRows() {
        WindowAggregate aggregate = WindowUtils.aggregate(List.of());

        assertThat(aggregate.getImpressions()).isZero();
        assertThat(aggregate.getCtr()).isZero();
        assertThat(aggregate.getAvgPosition()).isZero();
    }

    private static DailyMetric row(LocalDate date, long clicks, long impressions) {
        return DailyMetric.builder()
                .date(date)
                .clicks(clicks)
                .impressions(impressions)
                .ctr(impressions > 0 ? (double) clicks / impressions : 0.0)
                .position(5.0)
                .build();
    }
}
