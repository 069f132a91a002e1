package org.handhistory.service.parsing.winners;

import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class WinnerStrategyTest {

    private static final Pattern COLLECTED = Pattern.compile("^Seat (?<seat>\\d+): (?<name>.+?) .*collected \\((?<amount>[\\d,]+)\\)");
    private static final Pattern SHOWED_AND_WON = Pattern.compile("^Seat (?<seat>\\d+): (?<name>.+?) .*showed \\[.*\\] and won");

    HandHistory hand;

    @BeforeEach
    void init() {
        hand = new HandHistory("test", "");
        hand.setPlayers(new ArrayList<>(List.of(
                new Player("alice", 1000, 1, null),
                new Player("bob smith", 800, 2, null),
                Player.emptySeat(3))));
    }

    @Test
    void collected_readsSeatsThatCollected() {
        List<String> lines = List.of(
                "Board: [8h 4h Tc]",
                "Seat 1: alice didn't bet (folded)",
                "Seat 2: bob smith (button) collected (230), mucked");

        assertThat(new CollectedWinnerStrategy(COLLECTED).winners(lines, hand))
                .containsExactly("bob smith");
    }

    @Test
    void collected_splitPot() {
        List<String> lines = List.of(
                "Seat 1: alice collected (115), mucked",
                "Seat 2: bob smith collected (115), mucked");

        assertThat(new CollectedWinnerStrategy(COLLECTED).winners(lines, hand))
                .containsExactly("alice", "bob smith");
    }

    @Test
    void collected_ignoresShowdownLines() {
        List<String> lines = List.of("Seat 1: alice showed [Ad Kh] and won (835) with a pair of Kings");
        assertThat(new CollectedWinnerStrategy(COLLECTED).winners(lines, hand)).isEmpty();
    }

    @Test
    void collected_unknownSeatFallsBackToPrintedName() {
        List<String> lines = List.of("Seat 3: ghost collected (10), mucked");
        assertThat(new CollectedWinnerStrategy(COLLECTED).winners(lines, hand)).containsExactly("ghost");
    }

    @Test
    void collected_namesContainingTheKeywordAreNotWinners() {
        hand.setPlayers(new ArrayList<>(List.of(
                new Player("uncollected", 1000, 1, null),
                new Player("bob smith", 800, 2, null))));
        List<String> lines = List.of(
                "Seat 1: uncollected didn't bet (folded)",
                "Seat 2: bob smith collected (20), mucked");

        assertThat(new CollectedWinnerStrategy(COLLECTED).winners(lines, hand)).containsExactly("bob smith");
    }

    @Test
    void showdown_namesContainingTheKeywordAreNotWinners() {
        hand.setPlayers(new ArrayList<>(List.of(
                new Player("wonka", 1000, 1, null),
                new Player("bob smith", 800, 2, null))));
        List<String> lines = List.of(
                "Seat 1: wonka (small blind) folded before the Flop",
                "Seat 2: bob smith showed [Ad Kh] and won (835) with a pair of Kings");

        assertThat(new ShowdownWinnerStrategy(SHOWED_AND_WON).winners(lines, hand)).containsExactly("bob smith");
    }

    @Test
    void showdown_readsSeatsThatShowedAndWon() {
        List<String> lines = List.of(
                "Seat 1: alice (big blind) showed [Kc Qs] and lost with a pair of Kings",
                "Seat 2: bob smith showed [Ad Kh] and won (835) with a pair of Kings");

        assertThat(new ShowdownWinnerStrategy(SHOWED_AND_WON).winners(lines, hand))
                .containsExactly("bob smith");
    }

    @Test
    void showdown_ignoresCollectedLines() {
        List<String> lines = List.of("Seat 1: alice collected (230), mucked");
        assertThat(new ShowdownWinnerStrategy(SHOWED_AND_WON).winners(lines, hand)).isEmpty();
    }
}
