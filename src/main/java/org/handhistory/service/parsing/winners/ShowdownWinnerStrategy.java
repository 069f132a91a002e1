package org.handhistory.service.parsing.winners;

import org.handhistory.model.hand.HandHistory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hands that went to showdown: winners are the seats that "showed ... and won".
 * The pattern must define the named groups {@code seat} and {@code name}.
 */
public class ShowdownWinnerStrategy implements WinnerStrategy {

    private final Pattern showedAndWon;

    public ShowdownWinnerStrategy(Pattern showedAndWon) {
        this.showedAndWon = showedAndWon;
    }

    @Override
    public Set<String> winners(List<String> summaryLines, HandHistory hand) {
        Set<String> winners = new LinkedHashSet<>();
        for (String line : summaryLines) {
            Matcher m = showedAndWon.matcher(line);
            if (!m.find()) continue;
            winners.add(WinnerStrategy.winnerName(m, hand));
        }
        return winners;
    }
}
