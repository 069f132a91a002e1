package org.handhistory.model.hand;

import org.handhistory.model.card.Card;
import org.handhistory.model.card.Combo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HandHistoryTest {

    HandHistory hand;

    @BeforeEach
    void init() {
        hand = new HandHistory("test", "  raw text \r\nsecond line ");
        hand.setPlayers(new ArrayList<>(List.of(
                new Player("alice", 1000, 1, null),
                new Player("bob", 800, 2, null),
                Player.emptySeat(3))));
    }

    @Test
    void raw_isStrippedAndNormalized() {
        assertThat(hand.getRaw()).isEqualTo("raw text \nsecond line");
    }

    @Test
    void board_nullWithoutFlop() {
        hand.setTurn(Card.of("2s"));
        assertThat(hand.getBoard()).isNull();
    }

    @Test
    void board_concatenatesStreetsWithoutGaps() {
        hand.setFlop(new Street(List.of(Card.of("Kd"), Card.of("9c"), Card.of("5d")), List.of(), null));
        assertThat(hand.getBoard()).containsExactly(Card.of("Kd"), Card.of("9c"), Card.of("5d"));

        // a river without a turn is not part of the board
        hand.setRiver(Card.of("Jh"));
        assertThat(hand.getBoard()).hasSize(3);

        hand.setTurn(Card.of("2s"));
        assertThat(hand.getBoard()).containsExactly(
                Card.of("Kd"), Card.of("9c"), Card.of("5d"), Card.of("2s"), Card.of("Jh"));
    }

    @Test
    void replacePlayer_repointsButtonAndHero() {
        Player bob = hand.getPlayers().get(1);
        hand.setButton(bob);
        hand.setHero(bob);

        Player withCards = bob.withCombo(Combo.of("AhKh"));
        hand.replacePlayer(withCards);

        assertThat(hand.getPlayers().get(1)).isSameAs(withCards);
        assertThat(hand.getButton()).isSameAs(withCards);
        assertThat(hand.getHero()).isSameAs(withCards);
    }

    @Test
    void replacePlayer_leavesOtherSeatsAlone() {
        Player alice = hand.getPlayers().get(0);
        hand.setButton(alice);
        hand.replacePlayer(hand.getPlayers().get(1).withCombo(Combo.of("2c3c")));
        assertThat(hand.getButton()).isSameAs(alice);
    }

    @Test
    void replacePlayer_unknownSeat() {
        assertThatThrownBy(() -> hand.replacePlayer(new Player("zed", 10, 7, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptySeatPlaceholder() {
        assertThat(hand.getPlayers().get(2).isEmptySeat()).isTrue();
        assertThat(hand.getPlayers().get(2).getName()).isEqualTo("Empty Seat 3");
        assertThat(hand.findPlayer("bob")).isPresent();
        assertThat(hand.findPlayer("carol")).isEmpty();
    }

    @Test
    void streets_absentUntilRecorded() {
        assertThat(hand.getTurnActions()).isNull();
        hand.putStreet(new StreetInfo(StreetName.TURN, null, null, null));
        assertThat(hand.getTurnActions()).isEmpty();
        assertThat(hand.getStreet(StreetName.TURN).players()).isEmpty();
    }
}
