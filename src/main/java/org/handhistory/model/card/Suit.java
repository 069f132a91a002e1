package org.handhistory.model.card;

import java.util.Random;

public enum Suit {
    CLUBS('♣', 'c', "clubs"),
    DIAMONDS('♦', 'd', "diamonds"),
    HEARTS('♥', 'h', "hearts"),
    SPADES('♠', 's', "spades");

    private static final Suit[] VALUES = values();

    private final char glyph;
    private final char code;
    private final String label;

    Suit(char glyph, char code, String label) {
        this.glyph = glyph;
        this.code = code;
        this.label = label;
    }

    public char getGlyph() { return glyph; }
    public char getCode() { return code; }
    public String getLabel() { return label; }

    /** Accepts the one letter code in either case, or the glyph. */
    public static Suit of(char code) {
        char lower = Character.toLowerCase(code);
        for (Suit s : VALUES) {
            if (s.code == lower || s.glyph == code) return s;
        }
        throw new UnknownEnumerationValueException("suit", String.valueOf(code));
    }

    public static Suit random(Random rnd) {
        return VALUES[rnd.nextInt(VALUES.length)];
    }

    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
