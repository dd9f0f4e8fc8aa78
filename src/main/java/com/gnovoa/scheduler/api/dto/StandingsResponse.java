package com.gnovoa.scheduler.api.dto;

import java.util.List;

public record StandingsResponse(String competitionId, List<Row> standings) {
    public record Row(
            int position,
            String teamId,
            int wins,
            int losses,
            int pointsFor,
            int pointsAgainst,
            int gamesPlayed
    ) {}
}
