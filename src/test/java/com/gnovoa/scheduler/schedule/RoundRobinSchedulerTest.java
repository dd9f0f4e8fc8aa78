package com.gnovoa.scheduler.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.scheduler.model.Matchup;
import com.gnovoa.scheduler.model.Round;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoundRobinSchedulerTest {

  private final RoundRobinScheduler scheduler = new RoundRobinScheduler();

  @Test
  @DisplayName("Four teams follow the circle rotation with the first seat fixed")
  void fourTeamsCircleRotation() {
    List<Round> rounds = scheduler.generatePairings(List.of("A", "B", "C", "D"), 3);

    assertThat(rounds).extracting(Round::roundNumber).containsExactly(1, 2, 3);
    assertThat(rounds.get(0).matchups())
        .containsExactly(new Matchup("A", "D"), new Matchup("B", "C"));
    assertThat(rounds.get(1).matchups())
        .containsExactly(new Matchup("C", "A"), new Matchup("B", "D"));
    assertThat(rounds.get(2).matchups())
        .containsExactly(new Matchup("A", "B"), new Matchup("C", "D"));
  }

  @Test
  @DisplayName("No team appears twice in the same round")
  void noTeamTwicePerRound() {
    for (int teamCount = 2; teamCount <= 13; teamCount++) {
      List<String> teams = teams(teamCount);
      for (Round round : scheduler.generatePairings(teams, 3 * teamCount)) {
        List<String> playing = new ArrayList<>();
        round.matchups().forEach(m -> {
          playing.add(m.homeTeamId());
          playing.add(m.awayTeamId());
        });
        assertThat(playing).doesNotHaveDuplicates();
        assertThat(round.matchups()).hasSize(teamCount / 2);
        assertThat(playing).allMatch(teams::contains);
      }
    }
  }

  @Test
  @DisplayName("One full cycle with an even team count meets every pair exactly once")
  void fullCycleMeetsEveryPairOnce() {
    List<String> teams = teams(8);
    List<Round> rounds = scheduler.generatePairings(teams, 7);

    Map<Set<String>, Integer> meetings = new HashMap<>();
    rounds.forEach(r -> r.matchups().forEach(
        m -> meetings.merge(Set.of(m.homeTeamId(), m.awayTeamId()), 1, Integer::sum)));

    assertThat(meetings).hasSize(8 * 7 / 2);
    assertThat(meetings.values()).containsOnly(1);
  }

  @Test
  @DisplayName("A pairing met again in the second cycle swaps home and away")
  void secondCycleSwapsHomeAndAway() {
    for (int teamCount : new int[] {4, 5, 6, 7, 10}) {
      List<String> teams = teams(teamCount);
      int cycle = RoundRobinScheduler.roundsPerCycle(teamCount);
      List<Round> rounds = scheduler.generatePairings(teams, 2 * cycle);

      for (int week = 0; week < cycle; week++) {
        List<Matchup> first = rounds.get(week).matchups();
        List<Matchup> second = rounds.get(week + cycle).matchups();

        assertThat(second)
            .as("%d teams, week %d", teamCount, week + 1)
            .containsExactlyElementsOf(first.stream().map(m -> new Matchup(m.awayTeamId(), m.homeTeamId())).toList());
      }
    }
  }

  @Test
  @DisplayName("Home and away alternate within the first cycle")
  void homeAwayAlternatesWithinCycle() {
    List<Round> rounds = scheduler.generatePairings(List.of("A", "B", "C", "D", "E", "F"), 5);

    // the fixed team is home in even weeks and away in odd ones
    for (int week = 0; week < 5; week++) {
      Matchup fixedTeamGame = rounds.get(week).matchups().get(0);
      if (week % 2 == 0) assertThat(fixedTeamGame.homeTeamId()).isEqualTo("A");
      else assertThat(fixedTeamGame.awayTeamId()).isEqualTo("A");
    }
  }

  @Test
  @DisplayName("Two teams play every week with home and away alternating")
  void twoTeamsAlternate() {
    List<Round> rounds = scheduler.generatePairings(List.of("A", "B"), 4);

    assertThat(rounds).allMatch(r -> r.matchups().size() == 1);
    assertThat(rounds.stream().map(r -> r.matchups().get(0)).toList())
        .containsExactly(
            new Matchup("A", "B"),
            new Matchup("B", "A"),
            new Matchup("A", "B"),
            new Matchup("B", "A"));
  }

  @Test
  @DisplayName("Odd team count gives each team one bye per cycle and never outputs the bye")
  void oddTeamCountByes() {
    List<String> teams = teams(5);

    List<Round> fourWeeks = scheduler.generatePairings(teams, 4);
    List<String> byes = fourWeeks.stream().map(r -> byeOf(teams, r)).toList();
    assertThat(fourWeeks).allMatch(r -> r.matchups().size() == 2);
    assertThat(byes).hasSize(4).doesNotHaveDuplicates();

    List<Round> fullCycle = scheduler.generatePairings(teams, 5);
    assertThat(fullCycle.stream().map(r -> byeOf(teams, r)).toList())
        .containsExactlyInAnyOrderElementsOf(teams);
  }

  @Test
  @DisplayName("Games per team differ by at most one bye per cycle")
  void gamesPerTeamBalanced() {
    List<String> teams = teams(7);
    List<Round> rounds = scheduler.generatePairings(teams, 17);

    Map<String, Long> games = rounds.stream()
        .flatMap(r -> r.matchups().stream())
        .flatMap(m -> Stream.of(m.homeTeamId(), m.awayTeamId()))
        .collect(Collectors.groupingBy(t -> t, Collectors.counting()));

    long min = Collections.min(games.values());
    long max = Collections.max(games.values());
    assertThat(max - min).isLessThanOrEqualTo(1); // byes in the partial third cycle
    assertThat(games).containsOnlyKeys(teams);
  }

  @Test
  @DisplayName("Shorter seasons stop part way through the cycle")
  void partialSeasonIsAccepted() {
    List<Round> rounds = scheduler.generatePairings(teams(10), 3);

    assertThat(rounds).hasSize(3);
    assertThat(rounds).allMatch(r -> r.matchups().size() == 5);
  }

  @Test
  @DisplayName("Same input produces the same rounds")
  void deterministic() {
    List<String> teams = teams(9);
    assertThat(scheduler.generatePairings(teams, 20)).isEqualTo(scheduler.generatePairings(teams, 20));
  }

  @Test
  @DisplayName("Rejects fewer than two teams, duplicates, blanks and empty seasons")
  void rejectsInvalidInput() {
    assertThatThrownBy(() -> scheduler.generatePairings(List.of("A"), 3))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("at least 2 teams");
    assertThatThrownBy(() -> scheduler.generatePairings(List.of(), 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> scheduler.generatePairings(List.of("A", "A"), 3))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate");
    assertThatThrownBy(() -> scheduler.generatePairings(List.of("A", " "), 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> scheduler.generatePairings(List.of("A", "B"), 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("numberOfWeeks");
  }

  private static String byeOf(List<String> teams, Round round) {
    List<String> idle = teams.stream()
        .filter(t -> round.matchups().stream().noneMatch(m -> plays(m, t)))
        .toList();
    assertThat(idle).hasSize(1);
    return idle.get(0);
  }

  static boolean plays(Matchup m, String teamId) {
    return m.homeTeamId().equals(teamId) || m.awayTeamId().equals(teamId);
  }

  static List<String> teams(int count) {
    return IntStream.rangeClosed(1, count).mapToObj(i -> "team-" + i).toList();
  }
}
