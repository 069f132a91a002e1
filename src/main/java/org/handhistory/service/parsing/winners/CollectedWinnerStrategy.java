package org.handhistory.service.parsing.winners;

import org.handhistory.model.hand.HandHistory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hands decided without a showdown: winners are the seats that "collected" the pot.
 * The pattern must define the named groups {@code seat} and {@code name}.
 */
public class CollectedWinnerStrategy implements WinnerStrategy {

    private final Pattern collected;

    public CollectedWinnerStrategy(Pattern collected) {
        this.collected = collected;
    }

    @Override
    public Set<String> winners(List<String> summaryLines, HandHistory hand) {
        Set<String> winners = new LinkedHashSet<>();
        for (String line : summaryLines) {
            Matcher m = collected.matcher(line);
            if (!m.find()) continue;
            winners.add(WinnerStrategy.winnerName(m, hand));
        }
        return winners;
    }
}
