package com.gnovoa.scheduler.schedule;

import com.gnovoa.scheduler.model.Round;
import com.gnovoa.scheduler.model.ScheduledMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Builds a complete season: pairings, then dates, then slots and courts.
 *
 * <p>Stateless and free of side effects; storing the result is up to the caller. Any invalid input
 * aborts the whole generation, a partial schedule is never returned.
 */
public final class ScheduleGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleGenerator.class);

    private final RoundRobinScheduler scheduler;
    private final RoundDateCalculator dateCalculator;
    private final SlotAssigner slotAssigner;

    public ScheduleGenerator(RoundRobinScheduler scheduler, RoundDateCalculator dateCalculator, SlotAssigner slotAssigner) {
        this.scheduler = scheduler;
        this.dateCalculator = dateCalculator;
        this.slotAssigner = slotAssigner;
    }

    public List<ScheduledMatch> generateSchedule(ScheduleRequest request) {
        return generateSchedule(
                request.teamIds(),
                request.numberOfWeeks(),
                request.startDate(),
                request.dayOfWeek(),
                request.courtIds());
    }

    /**
     * @throws IllegalArgumentException on fewer than 2 teams, fewer than 1 week, an invalid weekday,
     *     no courts, or more games per week than slots times courts
     */
    public List<ScheduledMatch> generateSchedule(
            List<String> teamIds, int numberOfWeeks, LocalDate startDate, int dayOfWeek, List<Integer> courtIds) {

        List<Round> rounds = scheduler.generatePairings(teamIds, numberOfWeeks);
        checkCapacity(teamIds.size(), courtIds);

        List<LocalDate> dates = dateCalculator.calculateRoundDates(startDate, dayOfWeek, numberOfWeeks);
        List<ScheduledMatch> matches = slotAssigner.assignSlots(rounds, dates, courtIds);

        log.debug("Generated {} matches for {} teams over {} weeks starting {} on {} court(s)",
                matches.size(), teamIds.size(), numberOfWeeks, dates.get(0), courtIds.size());
        return matches;
    }

    /** Wrapping past the last hour would put two games on one court at once, so refuse instead. */
    private void checkCapacity(int teamCount, List<Integer> courtIds) {
        if (courtIds == null || courtIds.isEmpty()) {
            throw new IllegalArgumentException("At least one court is required");
        }
        int perWeek = teamCount / 2;
        int capacity = slotAssigner.policy().size() * courtIds.size();
        if (perWeek > capacity) {
            throw new IllegalArgumentException("Each week has " + perWeek + " games but only " + capacity
                    + " slot/court combinations (" + slotAssigner.policy().size() + " slots x "
                    + courtIds.size() + " courts)");
        }
    }
}
