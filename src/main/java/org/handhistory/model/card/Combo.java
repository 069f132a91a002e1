package org.handhistory.model.card;

import java.util.Objects;

/**
 * Two hole cards. Unordered: the higher card is always stored first, so
 * {@code Combo.of("2cAs").equals(Combo.of("As2c"))}.
 */
public final class Combo {

    private final Card first;
    private final Card second;

    private Combo(Card first, Card second) {
        this.first = first;
        this.second = second;
    }

    public static Combo of(Card a, Card b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) throw new IllegalArgumentException("Combo needs two different cards, got " + a + " twice");
        return a.compareTo(b) > 0 ? new Combo(a, b) : new Combo(b, a);
    }

    public static Combo of(String text) {
        if (text == null || text.length() != 4) throw new InvalidCardFormatException(text);
        return of(Card.of(text.substring(0, 2)), Card.of(text.substring(2)));
    }

    public Card getFirst() { return first; }
    public Card getSecond() { return second; }

    public boolean isPair() {
        return first.getRank() == second.getRank();
    }

    public boolean isSuited() {
        return first.getSuit() == second.getSuit();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Combo)) return false;
        Combo other = (Combo) o;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first.toString() + second;
    }
}
