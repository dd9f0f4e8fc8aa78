package com.gnovoa.scheduler.api;

import com.gnovoa.scheduler.api.dto.*;
import com.gnovoa.scheduler.model.ScheduledMatch;
import com.gnovoa.scheduler.schedule.ScheduleGenerator;
import com.gnovoa.scheduler.schedule.ScheduleRequest;
import com.gnovoa.scheduler.standings.StandingRow;
import com.gnovoa.scheduler.standings.StandingsCalculator;
import com.gnovoa.scheduler.store.CompetitionSchedule;
import com.gnovoa.scheduler.store.ScheduleStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

@Component
public final class ScheduleFacade {

    private final ScheduleGenerator generator;
    private final ScheduleStore store;
    private final StandingsCalculator standings;

    public ScheduleFacade(ScheduleGenerator generator, ScheduleStore store, StandingsCalculator standings) {
        this.generator = generator;
        this.store = store;
        this.standings = standings;
    }

    public GenerateScheduleResponse generate(String competitionId, GenerateScheduleRequest body) {
        if (body == null || body.teams() == null || body.startDate() == null || body.dayOfWeek() == null
                || body.numberOfWeeks() == null || body.courtIds() == null) {
            throw new IllegalArgumentException(
                    "Missing required fields: teams, startDate, dayOfWeek, numberOfWeeks, courtIds");
        }

        var request = new ScheduleRequest(
                body.teams(), body.numberOfWeeks(), body.startDate(), body.dayOfWeek(), body.courtIds());

        // generate fully before touching the store, so a bad request leaves nothing behind
        List<ScheduledMatch> matches = generator.generateSchedule(request);
        CompetitionSchedule saved = store.save(competitionId, body.teams(), body.numberOfWeeks(), matches);

        return new GenerateScheduleResponse(
                saved.competitionId(),
                saved.matches().size(),
                saved.weeks(),
                saved.matches().stream().map(MatchResponse::from).toList()
        );
    }

    public List<MatchResponse> getMatches(String competitionId) {
        return schedule(competitionId).matches().stream().map(MatchResponse::from).toList();
    }

    public MatchResponse recordScore(String competitionId, String matchId, RecordScoreRequest body) {
        if (body == null || body.homeScore() == null || body.awayScore() == null) {
            throw new IllegalArgumentException("homeScore and awayScore are required");
        }
        return MatchResponse.from(store.recordScore(competitionId, matchId, body.homeScore(), body.awayScore()));
    }

    public StandingsResponse getStandings(String competitionId) {
        List<StandingRow> table = standings.standings(schedule(competitionId));

        List<StandingsResponse.Row> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            StandingRow r = table.get(i);
            rows.add(new StandingsResponse.Row(
                    i + 1, r.teamId(), r.wins(), r.losses(), r.pointsFor(), r.pointsAgainst(), r.gamesPlayed()));
        }
        return new StandingsResponse(competitionId, rows);
    }

    private CompetitionSchedule schedule(String competitionId) {
        return store.find(competitionId)
                .orElseThrow(() -> new NoSuchElementException("No schedule for competition " + competitionId));
    }
}
