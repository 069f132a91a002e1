package org.handhistory.model.hand;

import lombok.Getter;
import lombok.Setter;
import org.handhistory.model.card.Card;
import org.handhistory.model.enums.Currency;
import org.handhistory.model.enums.Game;
import org.handhistory.model.enums.GameType;
import org.handhistory.model.enums.Limit;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structured record of one hand, filled stage by stage by the parser.
 * Not thread safe; once parsed it should only be read.
 */
@Getter
@Setter
public class HandHistory {

    private final String room;
    private final String raw;

    private boolean headerParsed;
    private boolean parsed;

    // header
    private String ident;
    private ZonedDateTime date;
    private BigDecimal sb;
    private BigDecimal bb;
    private Limit limit;
    private Game game;
    private GameType gameType;
    private Currency currency;
    private BigDecimal buyin;
    private BigDecimal rake;
    private String tournamentIdent;
    private String tableName;

    // body
    private Integer maxPlayers;
    private List<Player> players = new ArrayList<>();
    private Player button;
    private Player hero;
    private boolean showDown;
    private Street flop;
    private Card turn;
    private Card river;
    private BigDecimal totalPot;
    private Set<String> winners = new LinkedHashSet<>();

    @Setter(lombok.AccessLevel.NONE)
    private final Map<StreetName, StreetInfo> streets = new EnumMap<>(StreetName.class);
    @Setter(lombok.AccessLevel.NONE)
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public HandHistory(String room, String raw) {
        this.room = room;
        this.raw = raw == null ? "" : raw.strip().replace("\r\n", "\n");
    }

    /**
     * Community cards: the flop, then the turn if there was a flop, then the river if there was a turn.
     * Null when no flop was dealt.
     */
    public List<Card> getBoard() {
        if (flop == null) return null;
        List<Card> board = new ArrayList<>(flop.getCards());
        if (turn != null) {
            board.add(turn);
            if (river != null) board.add(river);
        }
        return Collections.unmodifiableList(board);
    }

    public void putStreet(StreetInfo info) {
        streets.put(info.getStreet(), info);
    }

    /** Null when the street was not reached. */
    public StreetInfo getStreet(StreetName street) {
        return streets.get(street);
    }

    public List<PlayerAction> getActions(StreetName street) {
        StreetInfo info = streets.get(street);
        return info == null ? null : info.getActions();
    }

    public List<PlayerAction> getPreflopActions() { return getActions(StreetName.PREFLOP); }
    public List<PlayerAction> getTurnActions() { return getActions(StreetName.TURN); }
    public List<PlayerAction> getRiverActions() { return getActions(StreetName.RIVER); }

    public Optional<Player> findPlayer(String name) {
        return players.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /**
     * Puts {@code updated} on its seat and re-points button and hero when they sit there,
     * so all three references stay the same object.
     */
    public void replacePlayer(Player updated) {
        int index = updated.getSeat() - 1;
        if (index < 0 || index >= players.size()) {
            throw new IllegalArgumentException("No seat " + updated.getSeat() + " in a " + players.size() + " seat hand");
        }
        players.set(index, updated);
        if (button != null && button.getSeat() == updated.getSeat()) button = updated;
        if (hero != null && hero.getSeat() == updated.getSeat()) hero = updated;
    }

    @Override
    public String toString() {
        return "<HandHistory " + room + ": #" + ident + ">";
    }
}
