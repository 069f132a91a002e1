package org.handhistory.service.parsing;

import lombok.extern.slf4j.Slf4j;
import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.StreetName;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Runs the parse of one hand: split once, header on demand, then every body stage in order.
 * The split fragments are dropped once the hand is parsed.
 *
 * <p>Both {@link #parseHeader()} and {@link #parse()} may be called again; a finished step is not re-run.</p>
 */
@Slf4j
public class HandHistoryParser {

    private final RoomParser room;
    private final HandHistory hand;
    private SplitText text;
    private ParseStage stage = ParseStage.UNPARSED;

    public HandHistoryParser(RoomParser room, String raw) {
        this.room = Objects.requireNonNull(room, "room");
        this.hand = new HandHistory(room.room(), raw);
        this.text = SectionSplitter.split(hand.getRaw(), room.splitPattern());
    }

    public static HandHistoryParser fromFile(RoomParser room, Path file) throws IOException {
        return new HandHistoryParser(room, Files.readString(file, StandardCharsets.UTF_8));
    }

    public ParseStage getStage() { return stage; }

    public HandHistory getHand() { return hand; }

    public HandHistory parseHeader() {
        if (hand.isHeaderParsed()) return hand;
        if (text == null) throw new IllegalStateException("split text already released");
        run(ParseStage.HEADER_PARSED);
        hand.setHeaderParsed(true);
        return hand;
    }

    public HandHistory parse() {
        if (hand.isParsed()) {
            log.debug("{} already parsed, skipping", hand);
            return hand;
        }
        parseHeader();
        for (ParseStage s : ParseStage.BODY_STAGES) run(s);

        text = null;
        stage = ParseStage.PARSED;
        hand.setParsed(true);
        log.debug("parsed {}", hand);
        return hand;
    }

    private void run(ParseStage next) {
        try {
            dispatch(next);
        } catch (HandParseException ex) {
            throw ex.atStage(next);
        } catch (RuntimeException ex) {
            throw new MalformedStageLineException(next, ex.toString(), -1, ex);
        }
        stage = next;
    }

    private void dispatch(ParseStage s) {
        switch (s) {
            case HEADER_PARSED -> room.parseHeader(text, hand);
            case TABLE -> room.parseTable(text, hand);
            case PLAYERS -> room.parsePlayers(text, hand);
            case BUTTON -> room.parseButton(text, hand);
            case HERO -> room.parseHero(text, hand);
            case PREFLOP -> room.parsePreflop(text, hand);
            case FLOP -> room.parseFlop(text, hand);
            case TURN -> room.parseStreet(StreetName.TURN, text, hand);
            case RIVER -> room.parseStreet(StreetName.RIVER, text, hand);
            case SHOWDOWN -> room.parseShowdown(text, hand);
            case POT -> room.parsePot(text, hand);
            case BOARD -> room.parseBoard(text, hand);
            case WINNERS -> room.parseWinners(text, hand);
            case EXTRA -> room.parseExtra(text, hand);
            default -> throw new IllegalStateException("not a parse step: " + s);
        }
    }
}
