package org.handhistory.service.parsing.room;

import org.handhistory.model.enums.Action;
import org.handhistory.model.hand.PlayerAction;
import org.handhistory.service.parsing.MalformedStageLineException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns Full Tilt action lines into {@link PlayerAction}s.
 */
class FullTiltActionParser {

    private static final String ALL_IN = "(?:, and is all in)?";

    private static final Pattern UNCALLED = Pattern.compile("^Uncalled bet of (?<amount>[\\d,.]+) returned to (?<name>.+)$");
    private static final Pattern RAISE = Pattern.compile("^(?<name>.+?) raises to (?<amount>[\\d,.]+)" + ALL_IN + "$");
    private static final Pattern WIN = Pattern.compile("^(?<name>.+?) wins the pot \\((?<amount>[\\d,.]+)\\)(?: with .*)?$");
    private static final Pattern MUCK = Pattern.compile("^(?<name>.+?) mucks$");
    private static final Pattern SHOW = Pattern.compile("^(?<name>.+?) shows \\[[^\\]]*\\].*$");
    private static final Pattern THINK = Pattern.compile("^(?<name>.+?) has \\d+ seconds left to act$");
    private static final Pattern BET_CALL = Pattern.compile("^(?<name>.+?) (?<verb>bets|calls) (?<amount>[\\d,.]+)" + ALL_IN + "$");
    private static final Pattern CHECK_FOLD = Pattern.compile("^(?<name>.+?) (?<verb>checks|folds)$");

    // table chatter and seat changes that can appear between actions
    private static final Pattern NOISE = Pattern.compile(
            "^.+?(?: is sitting out| has returned| has timed out| has requested TIME| stands up| sits down| has been disconnected| has reconnected)$|^\\S+: .*$");

    /**
     * @param firstIndex fragment index of {@code lines.get(0)}, for error reports
     */
    List<PlayerAction> parse(List<String> lines, int firstIndex) {
        List<PlayerAction> actions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || NOISE.matcher(line).matches()) continue;
            PlayerAction action = parseLine(line);
            if (action == null) {
                throw new MalformedStageLineException("unknown action line '" + line + "'", firstIndex + i);
            }
            actions.add(action);
        }
        return actions;
    }

    PlayerAction parseLine(String line) {
        Matcher m;
        if ((m = UNCALLED.matcher(line)).matches()) return action(m, Action.RETURN, true);
        if ((m = RAISE.matcher(line)).matches()) return action(m, Action.RAISE, true);
        if ((m = WIN.matcher(line)).matches()) return action(m, Action.WIN, true);
        if ((m = MUCK.matcher(line)).matches()) return action(m, Action.MUCK, false);
        if ((m = SHOW.matcher(line)).matches()) return action(m, Action.SHOW, false);
        if ((m = THINK.matcher(line)).matches()) return action(m, Action.THINK, false);
        if ((m = BET_CALL.matcher(line)).matches()) return action(m, Action.fromText(m.group("verb")), true);
        if ((m = CHECK_FOLD.matcher(line)).matches()) return action(m, Action.fromText(m.group("verb")), false);
        return null;
    }

    private static PlayerAction action(Matcher m, Action kind, boolean withAmount) {
        BigDecimal amount = withAmount ? amount(m.group("amount")) : null;
        return new PlayerAction(m.group("name"), kind, amount);
    }

    static BigDecimal amount(String text) {
        return new BigDecimal(text.replace(",", ""));
    }
}
