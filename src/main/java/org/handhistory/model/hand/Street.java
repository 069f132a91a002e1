package org.handhistory.model.hand;

import org.handhistory.model.card.Card;
import org.handhistory.model.card.Rank;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * A multi-card street (the flop) with its actions and board texture.
 * Every texture flag looks at all unordered pairs of the street's cards.
 */
public final class Street {

    private static final int MIN_CARDS = 3;

    private final List<Card> cards;
    private final List<PlayerAction> actions;
    private final BigDecimal pot;

    private Texture texture;

    public Street(List<Card> cards, List<PlayerAction> actions, BigDecimal pot) {
        Objects.requireNonNull(cards, "cards");
        if (cards.size() < MIN_CARDS) {
            throw new IllegalArgumentException("a textured street needs at least " + MIN_CARDS + " cards, got " + cards);
        }
        this.cards = List.copyOf(cards);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.pot = pot;
    }

    public List<Card> getCards() { return cards; }
    public List<PlayerAction> getActions() { return actions; }

    /** Amount won on this street, null if the hand went on. */
    public BigDecimal getPot() { return pot; }

    public boolean isRainbow() { return texture().rainbow; }
    public boolean isMonotone() { return texture().monotone; }
    public boolean isTriplet() { return texture().triplet; }
    public boolean hasPair() { return texture().pair; }
    public boolean hasFlushDraw() { return texture().flushDraw; }
    public boolean hasStraightDraw() { return texture().straightDraw; }
    public boolean hasGutshot() { return texture().gutshot; }

    /**
     * Distinct acting players in first-appearance order. Empty optional means no actions
     * were recorded, which is not the same as an empty list of players.
     */
    public Optional<List<String>> players() {
        return PlayerAction.actingPlayers(actions);
    }

    private Texture texture() {
        if (texture == null) texture = new Texture(pairs(cards));
        return texture;
    }

    static List<Card[]> pairs(List<Card> cards) {
        List<Card[]> pairs = new ArrayList<>();
        for (int i = 0; i < cards.size(); i++) {
            for (int j = i + 1; j < cards.size(); j++) pairs.add(new Card[]{cards.get(i), cards.get(j)});
        }
        return pairs;
    }

    private static final class Texture {
        final boolean rainbow;
        final boolean monotone;
        final boolean triplet;
        final boolean pair;
        final boolean flushDraw;
        final boolean straightDraw;
        final boolean gutshot;

        Texture(List<Card[]> pairs) {
            rainbow = all(pairs, (a, b) -> a.getSuit() != b.getSuit());
            monotone = all(pairs, (a, b) -> a.getSuit() == b.getSuit());
            triplet = all(pairs, (a, b) -> a.getRank() == b.getRank());
            pair = any(pairs, (a, b) -> a.getRank() == b.getRank());
            flushDraw = any(pairs, (a, b) -> a.getSuit() == b.getSuit());
            straightDraw = any(pairs, (a, b) -> between(Rank.difference(a.getRank(), b.getRank()), 1, 3));
            gutshot = any(pairs, (a, b) -> between(Rank.difference(a.getRank(), b.getRank()), 1, 4));
        }

        private static boolean between(int diff, int low, int high) {
            return diff >= low && diff <= high;
        }

        private static boolean all(List<Card[]> pairs, BiPredicate<Card, Card> test) {
            return pairs.stream().allMatch(p -> test.test(p[0], p[1]));
        }

        private static boolean any(List<Card[]> pairs, BiPredicate<Card, Card> test) {
            return pairs.stream().anyMatch(p -> test.test(p[0], p[1]));
        }
    }

    @Override
    public String toString() {
        return "Street" + cards;
    }
}
