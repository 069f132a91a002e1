package org.handhistory.service.parsing;

import java.util.List;

/**
 * States of a hand parse, in the order they are reached.
 */
public enum ParseStage {
    UNPARSED,
    HEADER_PARSED,
    TABLE,
    PLAYERS,
    BUTTON,
    HERO,
    PREFLOP,
    FLOP,
    TURN,
    RIVER,
    SHOWDOWN,
    POT,
    BOARD,
    WINNERS,
    EXTRA,
    PARSED;

    public static final List<ParseStage> BODY_STAGES = List.of(
            TABLE, PLAYERS, BUTTON, HERO, PREFLOP, FLOP, TURN, RIVER, SHOWDOWN, POT, BOARD, WINNERS, EXTRA);
}
