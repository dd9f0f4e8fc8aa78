package com.gnovoa.scheduler.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps league weeks to calendar dates: one game day per week, always on the same weekday.
 *
 * <p>Weekdays are numbered 0 (Sunday) to 6 (Saturday), the convention used by the HTTP API.
 */
public final class RoundDateCalculator {

    /**
     * @param startDate earliest allowed game day
     * @param targetWeekday 0 = Sunday ... 6 = Saturday
     * @param numberOfRounds how many dates to produce
     * @return the first {@code targetWeekday} on or after {@code startDate}, then one date every 7 days
     * @throws IllegalArgumentException if the weekday is outside 0..6, the start date is missing or
     *     the round count is negative
     */
    public List<LocalDate> calculateRoundDates(LocalDate startDate, int targetWeekday, int numberOfRounds) {
        return calculateRoundDates(startDate, toDayOfWeek(targetWeekday), numberOfRounds);
    }

    public List<LocalDate> calculateRoundDates(LocalDate startDate, DayOfWeek targetDay, int numberOfRounds) {
        if (startDate == null) throw new IllegalArgumentException("startDate is required");
        if (targetDay == null) throw new IllegalArgumentException("targetDay is required");
        if (numberOfRounds < 0) throw new IllegalArgumentException("numberOfRounds must not be negative");

        LocalDate first = startDate.with(TemporalAdjusters.nextOrSame(targetDay));

        List<LocalDate> dates = new ArrayList<>(numberOfRounds);
        for (int i = 0; i < numberOfRounds; i++) {
            dates.add(first.plus(i, ChronoUnit.WEEKS));
        }
        return dates;
    }

    /** Converts the 0 = Sunday numbering to {@link DayOfWeek}. */
    static DayOfWeek toDayOfWeek(int weekday) {
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("Weekday must be between 0 (Sunday) and 6 (Saturday), got " + weekday);
        }
        return weekday == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekday);
    }
}
