package org.handhistory.model.card;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

/**
 * Card ranks in canonical order, deuce lowest and ace highest.
 * Ordering always follows this sequence, never {@link #getFaceValue()}.
 */
public enum Rank {
    DEUCE('2', 2),
    THREE('3', 3),
    FOUR('4', 4),
    FIVE('5', 5),
    SIX('6', 6),
    SEVEN('7', 7),
    EIGHT('8', 8),
    NINE('9', 9),
    TEN('T', 10),
    JACK('J', 11),
    QUEEN('Q', 12),
    KING('K', 13),
    ACE('A', 1);

    public static final Set<Rank> FACE_RANKS = Collections.unmodifiableSet(EnumSet.of(JACK, QUEEN, KING));
    public static final Set<Rank> BROADWAY_RANKS = Collections.unmodifiableSet(EnumSet.of(TEN, JACK, QUEEN, KING, ACE));

    private static final Rank[] VALUES = values();

    private final char symbol;
    private final int faceValue;

    Rank(char symbol, int faceValue) {
        this.symbol = symbol;
        this.faceValue = faceValue;
    }

    public char getSymbol() { return symbol; }

    /** Printed value of the rank; the ace counts as 1 here. */
    public int getFaceValue() { return faceValue; }

    public static Rank of(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Rank r : VALUES) {
            if (r.symbol == upper) return r;
        }
        throw new UnknownEnumerationValueException("rank", String.valueOf(symbol));
    }

    public static Rank of(String symbol) {
        if (symbol == null || symbol.length() != 1) {
            throw new UnknownEnumerationValueException("rank", String.valueOf(symbol));
        }
        return of(symbol.charAt(0));
    }

    /**
     * Distance of two ranks in the canonical sequence, e.g. 5 and 8 are 3 apart, A and 2 are 12 apart.
     */
    public static int difference(Rank first, Rank second) {
        return Math.abs(first.ordinal() - second.ordinal());
    }

    public static int difference(String first, String second) {
        return difference(of(first), of(second));
    }

    public static int difference(Rank first, String second) {
        return difference(first, of(second));
    }

    public static int difference(String first, Rank second) {
        return difference(of(first), second);
    }

    public static Rank random(Random rnd) {
        return VALUES[rnd.nextInt(VALUES.length)];
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
