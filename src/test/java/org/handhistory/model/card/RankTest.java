package org.handhistory.model.card;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RankTest {

    @Test
    void difference_usesCanonicalOrder() {
        assertThat(Rank.difference(Rank.FIVE, Rank.EIGHT)).isEqualTo(3);
        assertThat(Rank.difference(Rank.KING, Rank.ACE)).isEqualTo(1);
        assertThat(Rank.difference(Rank.DEUCE, Rank.ACE)).isEqualTo(12);
    }

    @Test
    void difference_isSymmetricAndZeroOnSelf() {
        for (Rank a : Rank.values()) {
            assertThat(Rank.difference(a, a)).isZero();
            for (Rank b : Rank.values()) {
                assertThat(Rank.difference(a, b)).isEqualTo(Rank.difference(b, a));
            }
        }
    }

    @Test
    void difference_acceptsSymbols() {
        assertThat(Rank.difference("T", "J")).isEqualTo(1);
        assertThat(Rank.difference("a", "2")).isEqualTo(12);
        assertThat(Rank.difference(Rank.FIVE, "8")).isEqualTo(3);
        assertThat(Rank.difference("K", Rank.ACE)).isEqualTo(1);
    }

    @Test
    void of_unknownSymbol() {
        assertThatThrownBy(() -> Rank.of('X'))
                .isInstanceOf(UnknownEnumerationValueException.class)
                .hasMessageContaining("rank");
        assertThatThrownBy(() -> Rank.of("10")).isInstanceOf(UnknownEnumerationValueException.class);
    }

    @Test
    void aceOrdersHighButPrintsAsOne() {
        assertThat(Rank.ACE).isGreaterThan(Rank.KING);
        assertThat(Rank.ACE.getFaceValue()).isEqualTo(1);
    }

    @Test
    void suits_orderAndCodes() {
        assertThat(Suit.CLUBS).isLessThan(Suit.DIAMONDS);
        assertThat(Suit.HEARTS).isLessThan(Suit.SPADES);
        assertThat(Suit.of('S')).isEqualTo(Suit.SPADES);
        assertThat(Suit.of('♦')).isEqualTo(Suit.DIAMONDS);
        assertThat(Suit.HEARTS.getLabel()).isEqualTo("hearts");
        assertThatThrownBy(() -> Suit.of('x')).isInstanceOf(UnknownEnumerationValueException.class);
    }
}
