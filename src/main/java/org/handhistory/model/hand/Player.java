package org.handhistory.model.hand;

import lombok.Value;
import lombok.With;
import org.handhistory.model.card.Combo;

/**
 * A seated player. Immutable: learning hole cards produces a new instance via {@link #withCombo(Combo)}.
 */
@Value
public class Player {
    String name;
    long stack;
    int seat;
    @With
    Combo combo;

    public static Player emptySeat(int seat) {
        return new Player("Empty Seat " + seat, 0, seat, null);
    }

    public boolean isEmptySeat() {
        return stack == 0 && combo == null && name.equals("Empty Seat " + seat);
    }
}
