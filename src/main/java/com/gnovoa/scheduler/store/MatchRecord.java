package com.gnovoa.scheduler.store;

import com.gnovoa.scheduler.model.ScheduledMatch;

import java.time.LocalDateTime;

/**
 * A stored match: the calendar entry built from a {@link ScheduledMatch} plus its result once
 * known. Scores are {@code null} until recorded.
 */
public record MatchRecord(
        String matchId,
        String competitionId,
        String homeTeamId,
        String awayTeamId,
        int roundNumber,
        int courtId,
        String title,
        String description,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Integer homeScore,
        Integer awayScore
) {
    static MatchRecord materialize(String matchId, String competitionId, ScheduledMatch m) {
        LocalDateTime start = m.date().atTime(m.startHour(), 0);
        return new MatchRecord(
                matchId,
                competitionId,
                m.homeTeamId(),
                m.awayTeamId(),
                m.roundNumber(),
                m.courtId(),
                m.homeTeamId() + " vs " + m.awayTeamId(),
                competitionId + " - Round " + m.roundNumber(),
                start,
                start.plusHours(1),
                null,
                null
        );
    }

    public boolean isScored() {
        return homeScore != null && awayScore != null;
    }

    MatchRecord withScore(int home, int away) {
        return new MatchRecord(matchId, competitionId, homeTeamId, awayTeamId, roundNumber, courtId,
                title, description, startTime, endTime, home, away);
    }
}
