package com.gnovoa.scheduler.store;

import com.gnovoa.scheduler.model.ScheduledMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps schedules in memory (no DB).
 *
 * <p>Each competition's schedule is an immutable snapshot; saves and score updates swap the whole
 * snapshot with a single map operation, so readers never see half a season.
 */
public final class InMemoryScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScheduleStore.class);

    private static final Comparator<MatchRecord> PLAY_ORDER = Comparator
            .comparingInt(MatchRecord::roundNumber)
            .thenComparing(MatchRecord::startTime)
            .thenComparingInt(MatchRecord::courtId);

    private final Map<String, CompetitionSchedule> schedules = new ConcurrentHashMap<>();

    @Override
    public CompetitionSchedule save(String competitionId, List<String> teamIds, int weeks, List<ScheduledMatch> matches) {
        Objects.requireNonNull(competitionId, "competitionId");

        List<MatchRecord> records = new ArrayList<>(matches.size());
        for (ScheduledMatch m : matches) {
            records.add(MatchRecord.materialize(UUID.randomUUID().toString(), competitionId, m));
        }
        records.sort(PLAY_ORDER);

        CompetitionSchedule schedule = new CompetitionSchedule(competitionId, teamIds, weeks, Instant.now(), records);
        CompetitionSchedule previous = schedules.put(competitionId, schedule);

        if (previous != null) {
            log.info("Replaced schedule for competition {} ({} -> {} matches)",
                    competitionId, previous.matches().size(), records.size());
        } else {
            log.info("Stored schedule for competition {} ({} matches, {} weeks)", competitionId, records.size(), weeks);
        }
        return schedule;
    }

    @Override
    public Optional<CompetitionSchedule> find(String competitionId) {
        return Optional.ofNullable(schedules.get(competitionId));
    }

    @Override
    public MatchRecord recordScore(String competitionId, String matchId, int homeScore, int awayScore) {
        if (homeScore < 0 || awayScore < 0) {
            throw new IllegalArgumentException("Scores must not be negative");
        }

        MatchRecord[] updated = new MatchRecord[1];
        CompetitionSchedule result = schedules.computeIfPresent(competitionId, (id, current) -> {
            List<MatchRecord> matches = new ArrayList<>(current.matches());
            for (int i = 0; i < matches.size(); i++) {
                if (matches.get(i).matchId().equals(matchId)) {
                    updated[0] = matches.get(i).withScore(homeScore, awayScore);
                    matches.set(i, updated[0]);
                    return new CompetitionSchedule(id, current.teamIds(), current.weeks(), current.generatedAt(), matches);
                }
            }
            return current;
        });

        if (result == null) throw new NoSuchElementException("Competition not found: " + competitionId);
        if (updated[0] == null) throw new NoSuchElementException("Match not found: " + matchId);

        log.info("Recorded score {}-{} for match {} in competition {}", homeScore, awayScore, matchId, competitionId);
        return updated[0];
    }
}
