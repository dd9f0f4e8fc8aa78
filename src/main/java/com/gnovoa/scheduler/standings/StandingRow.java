package com.gnovoa.scheduler.standings;

public record StandingRow(
        String teamId,
        int wins,
        int losses,
        int pointsFor,
        int pointsAgainst,
        int gamesPlayed
) {
    public int pointDifferential() {
        return pointsFor - pointsAgainst;
    }
}
