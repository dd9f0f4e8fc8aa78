package com.gnovoa.scheduler.model;

import java.util.Objects;

/** A single game between two real teams. Byes never become a matchup. */
public record Matchup(String homeTeamId, String awayTeamId) {

    public Matchup {
        Objects.requireNonNull(homeTeamId, "homeTeamId");
        Objects.requireNonNull(awayTeamId, "awayTeamId");
        if (homeTeamId.isBlank() || awayTeamId.isBlank()) {
            throw new IllegalArgumentException("Team ids must not be blank");
        }
        if (homeTeamId.equals(awayTeamId)) {
            throw new IllegalArgumentException("A team cannot play itself: " + homeTeamId);
        }
    }
}
