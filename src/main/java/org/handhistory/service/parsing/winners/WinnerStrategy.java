package org.handhistory.service.parsing.winners;

import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.Player;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Reads the winners from the summary lines of a hand.
 */
public interface WinnerStrategy {

    /**
     * Lines that do not match the room's winner pattern are skipped, so player names
     * containing words like "won" or "collected" do not matter.
     */
    Set<String> winners(List<String> summaryLines, HandHistory hand);

    /**
     * Player name of a matched summary line. Seat numbers win over the printed name because rooms
     * append markers like "(button)" to it.
     */
    static String winnerName(Matcher m, HandHistory hand) {
        String seat = m.group("seat");
        if (seat != null) {
            int index = Integer.parseInt(seat) - 1;
            if (index >= 0 && index < hand.getPlayers().size()) {
                Player p = hand.getPlayers().get(index);
                if (!p.isEmptySeat()) return p.getName();
            }
        }
        return m.group("name");
    }
}
