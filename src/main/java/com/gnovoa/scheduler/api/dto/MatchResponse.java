package com.gnovoa.scheduler.api.dto;

import com.gnovoa.scheduler.store.MatchRecord;

import java.time.LocalDateTime;

public record MatchResponse(
        String matchId,
        int roundNumber,
        String homeTeam,
        String awayTeam,
        int courtId,
        String title,
        String description,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Integer homeScore,
        Integer awayScore
) {
    public static MatchResponse from(MatchRecord m) {
        return new MatchResponse(
                m.matchId(),
                m.roundNumber(),
                m.homeTeamId(),
                m.awayTeamId(),
                m.courtId(),
                m.title(),
                m.description(),
                m.startTime(),
                m.endTime(),
                m.homeScore(),
                m.awayScore()
        );
    }
}
