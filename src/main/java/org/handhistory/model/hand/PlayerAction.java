package org.handhistory.model.hand;

import lombok.Value;
import org.handhistory.model.enums.Action;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Value
public class PlayerAction {
    String name;
    Action action;
    /** null for actions without chips (check, fold, muck, think). */
    BigDecimal amount;

    /**
     * Names of the acting players in order of first appearance, or empty when there were no actions at all.
     */
    public static Optional<List<String>> actingPlayers(List<PlayerAction> actions) {
        if (actions == null || actions.isEmpty()) return Optional.empty();
        List<String> names = new ArrayList<>();
        for (PlayerAction a : actions) {
            if (!names.contains(a.getName())) names.add(a.getName());
        }
        return Optional.of(List.copyOf(names));
    }
}
