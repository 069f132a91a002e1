package org.handhistory.model.hand;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Per-street facts: the actions in document order, the pot when the street was dealt and
 * how many players saw it. Pot and player count are null when the room does not print them.
 */
@Value
public class StreetInfo {
    StreetName street;
    List<PlayerAction> actions;
    BigDecimal pot;
    Integer numPlayers;

    public StreetInfo(StreetName street, List<PlayerAction> actions, BigDecimal pot, Integer numPlayers) {
        this.street = street;
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.pot = pot;
        this.numPlayers = numPlayers;
    }

    public Optional<List<String>> players() {
        return PlayerAction.actingPlayers(actions);
    }
}
