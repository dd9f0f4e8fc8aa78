package com.gnovoa.scheduler.api;

import com.gnovoa.scheduler.api.dto.*;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/competitions")
public class ScheduleController {

    private final ScheduleFacade facade;

    public ScheduleController(ScheduleFacade facade) {
        this.facade = facade;
    }

    @PostMapping("/{competitionId}/schedule")
    @ResponseStatus(HttpStatus.CREATED)
    public GenerateScheduleResponse generate(@PathVariable String competitionId,
                                             @RequestBody GenerateScheduleRequest body) {
        return facade.generate(competitionId, body);
    }

    @GetMapping("/{competitionId}/matches")
    public List<MatchResponse> matches(@PathVariable String competitionId) {
        return facade.getMatches(competitionId);
    }

    @PutMapping("/{competitionId}/matches/{matchId}/score")
    public MatchResponse recordScore(@PathVariable String competitionId,
                                     @PathVariable String matchId,
                                     @RequestBody RecordScoreRequest body) {
        return facade.recordScore(competitionId, matchId, body);
    }

    @GetMapping("/{competitionId}/standings")
    public StandingsResponse standings(@PathVariable String competitionId) {
        return facade.getStandings(competitionId);
    }
}
