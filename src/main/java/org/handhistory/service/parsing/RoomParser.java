package org.handhistory.service.parsing;

import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.StreetName;

import java.util.regex.Pattern;

/**
 * Extraction rules of one poker room. {@link HandHistoryParser} calls the stages in a fixed order;
 * each reads the split text and fills its part of the {@link HandHistory}. A stage may rely on what
 * earlier stages stored in the hand, never on another stage's private state.
 *
 * <p>Implementations must be stateless so one instance can serve any number of hands.</p>
 */
public interface RoomParser {

    /** Room key, e.g. {@code "fulltilt"}. */
    String room();

    /** Delimiter handed to {@link SectionSplitter}. */
    Pattern splitPattern();

    /**
     * Identifier, stakes, buy-in, currency, limit/game/game type, table name and UTC date.
     * @throws MalformedHeaderException when the first line is not a header of this room
     */
    void parseHeader(SplitText text, HandHistory hand);

    void parseTable(SplitText text, HandHistory hand);

    /** Seats 1..N, with placeholder players for empty seats. */
    void parsePlayers(SplitText text, HandHistory hand);

    void parseButton(SplitText text, HandHistory hand);

    /** Hole cards of the hero; re-points the button when the hero holds it. */
    void parseHero(SplitText text, HandHistory hand);

    void parsePreflop(SplitText text, HandHistory hand);

    /** Sets {@code flop} to null when no flop was dealt. */
    void parseFlop(SplitText text, HandHistory hand);

    /** Turn or river; the street is recorded as absent when its marker is missing. */
    void parseStreet(StreetName street, SplitText text, HandHistory hand);

    void parseShowdown(SplitText text, HandHistory hand);

    void parsePot(SplitText text, HandHistory hand);

    void parseBoard(SplitText text, HandHistory hand);

    void parseWinners(SplitText text, HandHistory hand);

    /** Room facts without a typed field, stored in {@link HandHistory#getExtra()}. */
    void parseExtra(SplitText text, HandHistory hand);
}
