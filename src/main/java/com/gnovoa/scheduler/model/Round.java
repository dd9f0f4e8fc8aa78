package com.gnovoa.scheduler.model;

import java.util.List;

/** The matchups played in one week. {@code roundNumber} is 1-based. */
public record Round(int roundNumber, List<Matchup> matchups) {

    public Round {
        matchups = List.copyOf(matchups);
    }
}
