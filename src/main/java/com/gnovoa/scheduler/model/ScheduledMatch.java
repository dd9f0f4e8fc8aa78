package com.gnovoa.scheduler.model;

import java.time.LocalDate;

/**
 * A matchup placed on the calendar: which week, which day, which hour and which court.
 *
 * <p>This is what the engine hands to the persistence side; it carries no identifier of its own.
 */
public record ScheduledMatch(
        String homeTeamId,
        String awayTeamId,
        int roundNumber,
        LocalDate date,
        int startHour,
        int courtId
) {
    public static ScheduledMatch of(Matchup matchup, int roundNumber, LocalDate date, int startHour, int courtId) {
        return new ScheduledMatch(matchup.homeTeamId(), matchup.awayTeamId(), roundNumber, date, startHour, courtId);
    }
}
