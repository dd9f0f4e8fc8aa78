package com.gnovoa.scheduler.store;

import com.gnovoa.scheduler.model.ScheduledMatch;

import java.util.List;
import java.util.Optional;

/** Keeps generated schedules and their results. */
public interface ScheduleStore {

    /**
     * Stores a whole season in one step, replacing any earlier schedule for the competition.
     * Either every match is stored or none is.
     */
    CompetitionSchedule save(String competitionId, List<String> teamIds, int weeks, List<ScheduledMatch> matches);

    Optional<CompetitionSchedule> find(String competitionId);

    /**
     * @throws java.util.NoSuchElementException if the competition or match is unknown
     * @throws IllegalArgumentException if a score is negative
     */
    MatchRecord recordScore(String competitionId, String matchId, int homeScore, int awayScore);
}
