package org.handhistory.model.card;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * One of the 52 cards. Instances parsed from text come from a deck built once per JVM,
 * so {@code Card.of("As") == Card.of("As")}.
 */
public final class Card implements Comparable<Card> {

    private static final Random RND = new SecureRandom();

    // indexed by rank.ordinal() * 4 + suit.ordinal()
    private static final Card[] DECK = buildDeck();
    private static final List<Card> ALL = List.of(DECK);

    private final Rank rank;
    private final Suit suit;

    private Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    private static Card[] buildDeck() {
        List<Card> cards = new ArrayList<>(52);
        for (Rank r : Rank.values()) {
            for (Suit s : Suit.values()) cards.add(new Card(r, s));
        }
        return cards.toArray(new Card[0]);
    }

    public static Card of(Rank rank, Suit suit) {
        return DECK[rank.ordinal() * Suit.values().length + suit.ordinal()];
    }

    /**
     * Parses a two character code such as {@code "Td"}. The rank letter may be lower case.
     */
    public static Card of(String text) {
        if (text == null || text.length() != 2) throw new InvalidCardFormatException(text);
        try {
            return of(Rank.of(text.charAt(0)), Suit.of(text.charAt(1)));
        } catch (UnknownEnumerationValueException ex) {
            throw new InvalidCardFormatException(text, ex);
        }
    }

    /** Pass-through, no copy is made. */
    public static Card of(Card card) {
        return Objects.requireNonNull(card, "card");
    }

    /** Every card, ordered deuce of clubs to ace of spades. */
    public static List<Card> all() {
        return ALL;
    }

    /** Fresh instance outside the shared deck. */
    public static Card random() {
        return random(RND);
    }

    public static Card random(Random rnd) {
        return new Card(Rank.random(rnd), Suit.random(rnd));
    }

    public Rank getRank() { return rank; }
    public Suit getSuit() { return suit; }

    public boolean isFace() {
        return Rank.FACE_RANKS.contains(rank);
    }

    public boolean isBroadway() {
        return Rank.BROADWAY_RANKS.contains(rank);
    }

    @Override
    public int compareTo(Card other) {
        int byRank = rank.compareTo(other.rank);
        return byRank != 0 ? byRank : suit.compareTo(other.suit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Card)) return false;
        Card other = (Card) o;
        return rank == other.rank && suit == other.suit;
    }

    @Override
    public int hashCode() {
        return rank.hashCode() + suit.hashCode();
    }

    @Override
    public String toString() {
        return "" + rank.getSymbol() + suit.getCode();
    }
}
