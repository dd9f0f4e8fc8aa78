package com.gnovoa.scheduler.schedule;

import com.gnovoa.scheduler.model.Matchup;
import com.gnovoa.scheduler.model.Round;
import com.gnovoa.scheduler.model.ScheduledMatch;

import java.time.LocalDate;
import java.util.*;

/**
 * Places each round's matchups into time slots and courts, rotating the good slots fairly.
 *
 * <p>Every team carries a slot debt. Playing in a slot better than average lowers it, a worse slot
 * raises it. At the start of each round matchups are ordered by the <em>higher</em> of their two
 * teams' debts, so one badly served team is compensated ahead of two mildly served ones:
 *
 * <pre>
 *   A(+3) vs B(+3)  -> sum 6, max 3
 *   C(+5) vs D(0)   -> sum 5, max 5   -> C/D gets the first slot
 * </pre>
 *
 * <p>All courts are filled at the best hour before moving to the next hour. Ties keep the round's
 * own order, so results are deterministic.
 */
public final class SlotAssigner {

    /** Scheduled matches plus the debt each team ended with. */
    public record Assignment(List<ScheduledMatch> matches, Map<String, Double> finalDebt) {}

    private final SlotPolicy policy;

    public SlotAssigner(SlotPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public SlotPolicy policy() {
        return policy;
    }

    /**
     * @param rounds rounds in play order
     * @param dates game day of each round, same length as {@code rounds}
     * @param courtIds available courts, in preference order
     * @return matches in round order, then in slot order within the round
     * @throws IllegalArgumentException if no court is given, a court repeats, or the list lengths
     *     differ
     */
    public List<ScheduledMatch> assignSlots(List<Round> rounds, List<LocalDate> dates, List<Integer> courtIds) {
        return assign(rounds, dates, courtIds).matches();
    }

    public Assignment assign(List<Round> rounds, List<LocalDate> dates, List<Integer> courtIds) {
        validate(rounds, dates, courtIds);

        SlotDebt debt = new SlotDebt();
        for (Round round : rounds) {
            for (Matchup m : round.matchups()) {
                debt.register(m.homeTeamId());
                debt.register(m.awayTeamId());
            }
        }

        double average = policy.averageWeight();
        int courtsPerSlot = courtIds.size();
        List<ScheduledMatch> scheduled = new ArrayList<>();

        for (int r = 0; r < rounds.size(); r++) {
            Round round = rounds.get(r);
            LocalDate date = dates.get(r);

            for (ListIterator<Matchup> it = byMaxDebt(round.matchups(), debt).listIterator(); it.hasNext(); ) {
                int matchIndex = it.nextIndex();
                Matchup matchup = it.next();

                SlotPolicy.TimeSlot slot = policy.slotAt(matchIndex / courtsPerSlot);
                int courtId = courtIds.get(matchIndex % courtsPerSlot);

                scheduled.add(ScheduledMatch.of(matchup, round.roundNumber(), date, slot.hour(), courtId));

                double change = average - slot.weight();
                debt.add(matchup.homeTeamId(), change);
                debt.add(matchup.awayTeamId(), change);
            }
        }

        return new Assignment(List.copyOf(scheduled), debt.snapshot());
    }

    /** Stable sort, highest max debt first. Keys are read before any debt in this round changes. */
    static List<Matchup> byMaxDebt(List<Matchup> matchups, SlotDebt debt) {
        Map<Matchup, Double> key = new IdentityHashMap<>();
        for (Matchup m : matchups) {
            key.put(m, Math.max(debt.of(m.homeTeamId()), debt.of(m.awayTeamId())));
        }

        List<Matchup> sorted = new ArrayList<>(matchups);
        sorted.sort(Comparator.comparingDouble((Matchup m) -> key.get(m)).reversed());
        return sorted;
    }

    private static void validate(List<Round> rounds, List<LocalDate> dates, List<Integer> courtIds) {
        if (courtIds == null || courtIds.isEmpty()) {
            throw new IllegalArgumentException("At least one court is required");
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer id : courtIds) {
            if (id == null || !seen.add(id)) {
                throw new IllegalArgumentException("Court ids must be distinct and non-null: " + courtIds);
            }
        }
        if (rounds == null || dates == null || rounds.size() != dates.size()) {
            throw new IllegalArgumentException("Every round needs exactly one date (rounds="
                    + (rounds == null ? 0 : rounds.size()) + ", dates=" + (dates == null ? 0 : dates.size()) + ")");
        }
    }
}
