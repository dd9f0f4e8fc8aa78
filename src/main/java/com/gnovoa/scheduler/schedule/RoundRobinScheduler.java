package com.gnovoa.scheduler.schedule;

import com.gnovoa.scheduler.model.Matchup;
import com.gnovoa.scheduler.model.Round;

import java.util.*;

/**
 * Generates weekly league pairings with the circle method.
 *
 * <p>Provides:
 * <ul>
 *   <li>Any team count of 2 or more (odd counts get a bye seat, one team sits out each week)</li>
 *   <li>Any season length; longer seasons repeat the cycle, shorter ones stop part way</li>
 *   <li>Home/away rebalancing so a pairing that recurs in a later cycle swaps roles</li>
 * </ul>
 *
 * <p>The scheduler is fully deterministic: the same team order and week count always give the same
 * rounds.
 */
public final class RoundRobinScheduler {

    /** A position on the circle: either a real team or the bye. */
    private record Seat(String teamId) {
        static final Seat BYE = new Seat(null);

        boolean isBye() {
            return teamId == null;
        }
    }

    /**
     * Generates one round per week.
     *
     * <p>For week {@code w} the rotation used is {@code r = w mod (n - 1)} and the cycle is
     * {@code c = w / (n - 1)}. The first seat is home when {@code (r + c)} is even. In the first
     * cycle that alternates week by week; in every later cycle each pairing is played with home
     * and away swapped relative to the cycle before.
     *
     * <p>Parity is taken on {@code r}, not on the absolute week: {@code n} is always even, so
     * {@code (w + c)} has the same parity one cycle later and would never swap.
     *
     * @param teamIds distinct team ids, in the order that fixes the circle
     * @param numberOfWeeks number of rounds to produce, at least 1
     * @return {@code numberOfWeeks} rounds, numbered from 1
     *
     * @throws IllegalArgumentException if fewer than 2 distinct teams are given, an id is blank or
     *     repeated, or {@code numberOfWeeks} is below 1
     */
    public List<Round> generatePairings(List<String> teamIds, int numberOfWeeks) {
        validate(teamIds, numberOfWeeks);

        List<Seat> seats = seatsFor(teamIds);
        int n = seats.size();
        int cycleLength = roundsPerCycle(teamIds.size());

        List<Round> rounds = new ArrayList<>(numberOfWeeks);
        for (int week = 0; week < numberOfWeeks; week++) {
            int roundInCycle = week % cycleLength;
            int cycle = week / cycleLength;
            boolean firstSeatHome = (roundInCycle + cycle) % 2 == 0;

            List<Seat> rotated = rotate(seats, roundInCycle);

            List<Matchup> matchups = new ArrayList<>(n / 2);
            for (int i = 0; i < n / 2; i++) {
                Seat a = rotated.get(i);
                Seat b = rotated.get(n - 1 - i);
                if (a.isBye() || b.isBye()) continue;

                matchups.add(firstSeatHome
                        ? new Matchup(a.teamId(), b.teamId())
                        : new Matchup(b.teamId(), a.teamId()));
            }

            rounds.add(new Round(week + 1, matchups));
        }
        return rounds;
    }

    static int roundsPerCycle(int teamCount) {
        int n = teamCount % 2 == 0 ? teamCount : teamCount + 1;
        return n - 1;
    }

    private static List<Seat> seatsFor(List<String> teamIds) {
        List<Seat> seats = new ArrayList<>(teamIds.size() + 1);
        for (String id : teamIds) seats.add(new Seat(id));
        if (seats.size() % 2 != 0) seats.add(Seat.BYE);
        return seats;
    }

    /** First seat stays put; each step moves the last seat to the front of the rest. */
    private static List<Seat> rotate(List<Seat> seats, int rotations) {
        List<Seat> list = new ArrayList<>(seats);
        Seat fixed = list.remove(0);

        for (int r = 0; r < rotations; r++) {
            Seat last = list.remove(list.size() - 1);
            list.add(0, last);
        }

        list.add(0, fixed);
        return list;
    }

    private static void validate(List<String> teamIds, int numberOfWeeks) {
        if (teamIds == null || teamIds.size() < 2) {
            throw new IllegalArgumentException("Need at least 2 teams to generate pairings");
        }
        Set<String> seen = new HashSet<>();
        for (String id : teamIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Team ids must not be blank");
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate team id " + id);
            }
        }
        if (numberOfWeeks < 1) {
            throw new IllegalArgumentException("numberOfWeeks must be at least 1");
        }
    }
}
