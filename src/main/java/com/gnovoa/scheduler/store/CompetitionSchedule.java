package com.gnovoa.scheduler.store;

import java.time.Instant;
import java.util.List;

/** A competition's stored season: its teams in the order they were scheduled, and every match. */
public record CompetitionSchedule(
        String competitionId,
        List<String> teamIds,
        int weeks,
        Instant generatedAt,
        List<MatchRecord> matches
) {
    public CompetitionSchedule {
        teamIds = List.copyOf(teamIds);
        matches = List.copyOf(matches);
    }
}
