package com.gnovoa.scheduler.standings;

import com.gnovoa.scheduler.store.CompetitionSchedule;
import com.gnovoa.scheduler.store.MatchRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the league table from recorded scores. Nothing is stored; the table is rebuilt on every
 * call.
 *
 * <p>Only matches with both scores count. A level score adds to points for and against but is
 * neither a win nor a loss, and is not counted as a game played.
 */
public final class StandingsCalculator {

    private static final Comparator<StandingRow> TABLE_ORDER = Comparator
            .comparingInt(StandingRow::wins).reversed()
            .thenComparing(Comparator.comparingInt(StandingRow::pointDifferential).reversed());

    public List<StandingRow> standings(CompetitionSchedule schedule) {
        List<StandingRow> rows = new ArrayList<>(schedule.teamIds().size());

        for (String teamId : schedule.teamIds()) {
            int wins = 0, losses = 0, pointsFor = 0, pointsAgainst = 0;

            for (MatchRecord m : schedule.matches()) {
                if (!m.isScored()) continue;

                int own, other;
                if (m.homeTeamId().equals(teamId)) {
                    own = m.homeScore();
                    other = m.awayScore();
                } else if (m.awayTeamId().equals(teamId)) {
                    own = m.awayScore();
                    other = m.homeScore();
                } else {
                    continue;
                }

                pointsFor += own;
                pointsAgainst += other;
                if (own > other) wins++;
                else if (own < other) losses++;
            }

            rows.add(new StandingRow(teamId, wins, losses, pointsFor, pointsAgainst, wins + losses));
        }

        rows.sort(TABLE_ORDER); // stable: equal rows keep team order
        return rows;
    }
}
