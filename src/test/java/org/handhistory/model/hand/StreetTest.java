package org.handhistory.model.hand;

import org.handhistory.model.card.Card;
import org.handhistory.model.enums.Action;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StreetTest {

    private static Street flop(String a, String b, String c) {
        return new Street(List.of(Card.of(a), Card.of(b), Card.of(c)), List.of(), null);
    }

    @Test
    void monotoneFlop() {
        Street s = flop("2h", "7h", "Kh");
        assertThat(s.isMonotone()).isTrue();
        assertThat(s.isRainbow()).isFalse();
        assertThat(s.hasFlushDraw()).isTrue();
    }

    @Test
    void rainbowFlop() {
        Street s = flop("2c", "7d", "Kh");
        assertThat(s.isRainbow()).isTrue();
        assertThat(s.isMonotone()).isFalse();
        assertThat(s.hasFlushDraw()).isFalse();
    }

    @Test
    void twoToneFlopIsNeitherRainbowNorMonotone() {
        Street s = flop("8h", "4h", "Tc");
        assertThat(s.isRainbow()).isFalse();
        assertThat(s.isMonotone()).isFalse();
        assertThat(s.hasFlushDraw()).isTrue();
    }

    @Test
    void pairedAndTripletBoards() {
        assertThat(flop("9c", "9d", "2h").hasPair()).isTrue();
        assertThat(flop("9c", "9d", "2h").isTriplet()).isFalse();
        assertThat(flop("9c", "9d", "9h").isTriplet()).isTrue();
        assertThat(flop("9c", "Td", "2h").hasPair()).isFalse();
    }

    @Test
    void connectedCardsGiveStraightDrawAndGutshot() {
        Street s = flop("5c", "6d", "Kh");
        assertThat(s.hasStraightDraw()).isTrue();
        assertThat(s.hasGutshot()).isTrue();
    }

    @Test
    void fourApartIsOnlyAGutshot() {
        Street s = flop("Kd", "9c", "5d");
        assertThat(s.hasStraightDraw()).isFalse();
        assertThat(s.hasGutshot()).isTrue();
    }

    @Test
    void farApartHasNoDraw() {
        Street s = flop("2c", "8d", "Ah");
        assertThat(s.hasStraightDraw()).isFalse();
        assertThat(s.hasGutshot()).isFalse();
    }

    @Test
    void aceIsHighOnlyForDistance() {
        // A and 2 are 12 apart in the canonical order
        assertThat(flop("Ac", "2d", "8h").hasGutshot()).isFalse();
        assertThat(flop("Ac", "Kd", "4h").hasStraightDraw()).isTrue();
    }

    @Test
    void players_inFirstAppearanceOrder() {
        Street s = new Street(List.of(Card.of("8h"), Card.of("4h"), Card.of("Tc")), List.of(
                new PlayerAction("bob", Action.CHECK, null),
                new PlayerAction("alice", Action.BET, new BigDecimal("120")),
                new PlayerAction("bob", Action.FOLD, null)), null);

        assertThat(s.players()).contains(List.of("bob", "alice"));
    }

    @Test
    void players_emptyWhenNoActions() {
        assertThat(flop("2c", "7d", "Kh").players()).isEmpty();
    }

    @Test
    void cardsAreCopied() {
        List<Card> cards = new java.util.ArrayList<>(List.of(Card.of("2c"), Card.of("7d"), Card.of("Kh")));
        Street s = new Street(cards, null, new BigDecimal("230"));
        cards.clear();
        assertThat(s.getCards()).hasSize(3);
        assertThat(s.getActions()).isEmpty();
        assertThat(s.getPot()).isEqualByComparingTo("230");
    }

    @Test
    void fewerThanThreeCardsIsNotAStreet() {
        assertThatThrownBy(() -> new Street(List.of(Card.of("As")), List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Street(List.of(Card.of("As"), Card.of("Ks")), List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
