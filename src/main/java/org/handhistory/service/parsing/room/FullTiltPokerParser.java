package org.handhistory.service.parsing.room;

import org.handhistory.model.card.Card;
import org.handhistory.model.card.Combo;
import org.handhistory.model.enums.Action;
import org.handhistory.model.enums.Currency;
import org.handhistory.model.enums.Game;
import org.handhistory.model.enums.GameType;
import org.handhistory.model.enums.Limit;
import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.Player;
import org.handhistory.model.hand.PlayerAction;
import org.handhistory.model.hand.Street;
import org.handhistory.model.hand.StreetInfo;
import org.handhistory.model.hand.StreetName;
import org.handhistory.service.parsing.DateNormalizer;
import org.handhistory.service.parsing.HeroNotFoundException;
import org.handhistory.service.parsing.MalformedHeaderException;
import org.handhistory.service.parsing.MalformedStageLineException;
import org.handhistory.service.parsing.RoomParser;
import org.handhistory.service.parsing.SectionNotFoundException;
import org.handhistory.service.parsing.SplitText;
import org.handhistory.service.parsing.winners.CollectedWinnerStrategy;
import org.handhistory.service.parsing.winners.ShowdownWinnerStrategy;
import org.handhistory.service.parsing.winners.WinnerStrategy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Full Tilt Poker tournament hand histories.
 *
 * <p>Split on {@code ***} markers and new lines, a hand looks like:</p>
 * <pre>
 *   header, seat lines, blinds, button line
 *   ""  HOLE CARDS  Dealt to ...  preflop actions
 *   ""  FLOP  [board] (Total Pot: n, k Players)  actions
 *   ... TURN, RIVER, SHOW DOWN the same way
 *   ""  SUMMARY  Total pot ...  Board: [...]  Seat lines
 * </pre>
 */
@Component
public class FullTiltPokerParser implements RoomParser {

    public static final String ROOM = "fulltilt";

    // FTP does not print the table size
    private static final int MAX_SEATS = 9;

    private static final Pattern SPLIT = Pattern.compile(" ?\\*\\*\\* ?\\n?|\\n");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("H:mm:ss 'ET' - yyyy/MM/dd");
    private static final ZoneId ROOM_ZONE = ZoneId.of("America/New_York");

    private static final Pattern HEADER = Pattern.compile(
            "^Full[ ]Tilt[ ]Poker[ ]"
            + "Game[ ]\\#(?<ident>\\d+):[ ]"
            + "(?<tournamentName>\\$?(?<buyin>\\d*).*)[ ]"
            + "\\((?<tournamentIdent>\\d+)\\),[ ]"
            + "Table[ ](?<tableName>\\d+)[ ]-[ ]"
            + "(?<limit>NL|PL|FL|No[ ]Limit|Pot[ ]Limit|Fix[ ]Limit)[ ]"
            + "(?<game>.*?)[ ]-[ ]"
            + "(?<sb>[\\d,]+)/(?<bb>[\\d,]+)[ ]-[ ].*"
            + "\\[(?<date>.*)\\]$");
    private static final Pattern SEAT = Pattern.compile("^Seat (?<seat>\\d+): (?<name>.+) \\((?<stack>[\\d,]+)\\)$");
    private static final Pattern BLIND = Pattern.compile(
            "^(?<name>.+?) posts (?:the )?(?<kind>small blind|big blind|an ante) (?:of )?(?<amount>[\\d,]+)$");
    private static final Pattern BUTTON = Pattern.compile("^The button is in seat #(?<seat>\\d+)$");
    private static final Pattern HERO = Pattern.compile("^Dealt to (?<name>.+) \\[(?<first>..) (?<second>..)\\]$");
    private static final Pattern STREET_LINE = Pattern.compile(
            "\\[(?<cards>[^\\]]*)\\] \\(Total Pot: (?<pot>[\\d,]+), (?<players>\\d+) Players?");
    private static final Pattern SHOWS = Pattern.compile("^(?<name>.+?) shows \\[(?<first>..) (?<second>..)\\]");
    private static final Pattern POT = Pattern.compile("^Total pot (?<total>[\\d.]+) .*\\| Rake (?<rake>[\\d.]+)$");
    private static final Pattern BOARD_CARD = Pattern.compile("(?<=[\\[ ])(..)(?=[\\] ])");
    private static final Pattern COLLECTED = Pattern.compile(
            "^Seat (?<seat>\\d+): (?<name>.+?) .*collected \\((?<amount>[\\d,]+)\\)");
    private static final Pattern SHOWED_AND_WON = Pattern.compile(
            "^Seat (?<seat>\\d+): (?<name>.+?) .*showed \\[.*\\] and won");

    private final FullTiltActionParser actionParser = new FullTiltActionParser();
    private final WinnerStrategy collectedWinners = new CollectedWinnerStrategy(COLLECTED);
    private final WinnerStrategy showdownWinners = new ShowdownWinnerStrategy(SHOWED_AND_WON);

    @Override
    public String room() { return ROOM; }

    @Override
    public Pattern splitPattern() { return SPLIT; }

    @Override
    public void parseHeader(SplitText text, HandHistory hand) {
        String line = text.fragment(0);
        Matcher m = HEADER.matcher(line);
        if (!m.matches()) throw new MalformedHeaderException(line);

        String tournamentName = m.group("tournamentName");
        String buyin = m.group("buyin");

        hand.setIdent(m.group("ident"));
        hand.setSb(FullTiltActionParser.amount(m.group("sb")));
        hand.setBb(FullTiltActionParser.amount(m.group("bb")));
        hand.setDate(DateNormalizer.toUtc(m.group("date"), DATE_FORMAT, ROOM_ZONE));
        hand.setGameType(tournamentName.contains("Sit & Go") ? GameType.SNG : GameType.TOUR);
        hand.setCurrency(tournamentName.contains("$") ? Currency.USD : null);
        hand.setTournamentIdent(m.group("tournamentIdent"));
        hand.setTableName(m.group("tableName"));
        hand.setLimit(Limit.fromText(m.group("limit")));
        hand.setGame(Game.fromText(m.group("game")));
        hand.setBuyin(buyin == null || buyin.isEmpty() ? null : new BigDecimal(buyin));
        hand.getExtra().put("tournament_name", tournamentName);
    }

    @Override
    public void parseTable(SplitText text, HandHistory hand) {
        // table name is part of the header line
    }

    @Override
    public void parsePlayers(SplitText text, HandHistory hand) {
        List<Player> players = new ArrayList<>();
        for (int seat = 1; seat <= MAX_SEATS; seat++) players.add(Player.emptySeat(seat));

        int maxSeat = 0;
        for (int i = 1; i < text.size(); i++) {
            Matcher m = SEAT.matcher(text.fragment(i));
            if (!m.matches()) break;
            int seat = Integer.parseInt(m.group("seat"));
            if (seat < 1 || seat > MAX_SEATS) {
                throw new MalformedStageLineException("seat " + seat + " out of range", i);
            }
            players.set(seat - 1, new Player(m.group("name"), FullTiltActionParser.amount(m.group("stack")).longValue(), seat, null));
            maxSeat = Math.max(maxSeat, seat);
        }
        if (maxSeat == 0) throw new MalformedStageLineException("no seat lines after the header", 1);

        hand.setMaxPlayers(maxSeat);
        hand.setPlayers(new ArrayList<>(players.subList(0, maxSeat)));
    }

    @Override
    public void parseButton(SplitText text, HandHistory hand) {
        int index = text.firstBoundary() - 1;
        Matcher m = BUTTON.matcher(text.fragment(index));
        if (!m.matches()) throw new MalformedStageLineException("expected the button line", index);
        int seat = Integer.parseInt(m.group("seat"));
        if (seat < 1 || seat > hand.getPlayers().size()) {
            throw new MalformedStageLineException("button on unknown seat " + seat, index);
        }
        hand.setButton(hand.getPlayers().get(seat - 1));
    }

    @Override
    public void parseHero(SplitText text, HandHistory hand) {
        int index = text.firstBoundary() + 2;
        Matcher m = HERO.matcher(text.fragment(index));
        if (!m.matches()) throw new MalformedStageLineException("expected the 'Dealt to' line", index);

        String name = m.group("name");
        Player hero = hand.findPlayer(name).orElseThrow(() -> new HeroNotFoundException(name, index));
        hand.setHero(hero);
        hand.replacePlayer(hero.withCombo(Combo.of(Card.of(m.group("first")), Card.of(m.group("second")))));
    }

    @Override
    public void parsePreflop(SplitText text, HandHistory hand) {
        int start = text.firstBoundary() + 3;
        int stop = text.nextBoundaryAfter(text.firstBoundary());
        List<PlayerAction> actions = actionParser.parse(text.slice(start, stop), start);
        hand.putStreet(new StreetInfo(StreetName.PREFLOP, actions, null, null));
    }

    @Override
    public void parseFlop(SplitText text, HandHistory hand) {
        int start;
        try {
            start = text.indexOf(StreetName.FLOP.getMarker());
        } catch (SectionNotFoundException ex) {
            hand.setFlop(null);
            return;
        }
        int lineIndex = start + 1;
        Matcher m = streetLine(text, lineIndex);
        List<Card> cards = new ArrayList<>();
        for (String code : m.group("cards").trim().split(" ")) cards.add(Card.of(code));
        if (cards.size() != 3) throw new MalformedStageLineException("flop needs 3 cards, got " + cards, lineIndex);

        List<PlayerAction> actions = actionParser.parse(text.slice(lineIndex + 1, text.nextBoundaryAfter(start)), lineIndex + 1);
        hand.setFlop(new Street(cards, actions, wonAmount(actions)));
        hand.putStreet(new StreetInfo(StreetName.FLOP, actions,
                FullTiltActionParser.amount(m.group("pot")), Integer.parseInt(m.group("players"))));
    }

    @Override
    public void parseStreet(StreetName street, SplitText text, HandHistory hand) {
        int start;
        try {
            start = text.indexOf(street.getMarker());
        } catch (SectionNotFoundException ex) {
            setStreetCard(street, hand, null);
            return;
        }
        int lineIndex = start + 1;
        Matcher m = streetLine(text, lineIndex);
        setStreetCard(street, hand, Card.of(m.group("cards").trim()));

        List<PlayerAction> actions = actionParser.parse(text.slice(lineIndex + 1, text.nextBoundaryAfter(start)), lineIndex + 1);
        hand.putStreet(new StreetInfo(street, actions,
                FullTiltActionParser.amount(m.group("pot")), Integer.parseInt(m.group("players"))));
    }

    @Override
    public void parseShowdown(SplitText text, HandHistory hand) {
        hand.setShowDown(text.contains("SHOW DOWN"));
        if (!hand.isShowDown()) return;

        int start = text.indexOf("SHOW DOWN") + 1;
        for (String line : text.slice(start, text.nextBoundaryAfter(start))) {
            Matcher m = SHOWS.matcher(line);
            if (!m.find()) continue;
            Combo shown = Combo.of(Card.of(m.group("first")), Card.of(m.group("second")));
            hand.findPlayer(m.group("name")).ifPresent(p -> hand.replacePlayer(p.withCombo(shown)));
        }
    }

    @Override
    public void parsePot(SplitText text, HandHistory hand) {
        int index = text.lastBoundary() + 2;
        String line = text.fragment(index).replace(",", "");
        Matcher m = POT.matcher(line);
        if (!m.matches()) throw new MalformedStageLineException("expected the total pot line", index);
        hand.setTotalPot(new BigDecimal(m.group("total")));
        hand.setRake(new BigDecimal(m.group("rake")));
    }

    @Override
    public void parseBoard(SplitText text, HandHistory hand) {
        int index = text.lastBoundary() + 3;
        if (index >= text.size() || !text.fragment(index).startsWith("Board")) return;

        List<Card> cards = new ArrayList<>();
        Matcher m = BOARD_CARD.matcher(text.fragment(index));
        while (m.find()) cards.add(Card.of(m.group(1)));
        hand.setTurn(cards.size() > 3 ? cards.get(3) : null);
        hand.setRiver(cards.size() > 4 ? cards.get(4) : null);
    }

    @Override
    public void parseWinners(SplitText text, HandHistory hand) {
        List<String> lines = text.slice(text.lastBoundary() + 3, text.size());
        WinnerStrategy strategy = hand.isShowDown() ? showdownWinners : collectedWinners;
        hand.setWinners(strategy.winners(lines, hand));
    }

    @Override
    public void parseExtra(SplitText text, HandHistory hand) {
        // blind and ante posts sit between the seat lines and the button line
        BigDecimal antes = BigDecimal.ZERO;
        for (String line : text.slice(seatLineCount(text) + 1, text.firstBoundary() - 1)) {
            Matcher m = BLIND.matcher(line);
            if (!m.matches()) continue;
            switch (m.group("kind")) {
                case "small blind" -> hand.getExtra().put("small_blind_player", m.group("name"));
                case "big blind" -> hand.getExtra().put("big_blind_player", m.group("name"));
                default -> antes = antes.add(FullTiltActionParser.amount(m.group("amount")));
            }
        }
        if (antes.signum() > 0) hand.getExtra().put("antes", antes);
    }

    private static int seatLineCount(SplitText text) {
        int count = 0;
        while (count + 1 < text.size() && SEAT.matcher(text.fragment(count + 1)).matches()) count++;
        return count;
    }

    private static Matcher streetLine(SplitText text, int index) {
        Matcher m = STREET_LINE.matcher(text.fragment(index));
        if (!m.find()) throw new MalformedStageLineException("expected '[cards] (Total Pot: ...)'", index);
        return m;
    }

    private static void setStreetCard(StreetName street, HandHistory hand, Card card) {
        if (street == StreetName.TURN) hand.setTurn(card);
        else if (street == StreetName.RIVER) hand.setRiver(card);
        else throw new IllegalArgumentException("not a single card street: " + street);
    }

    private static BigDecimal wonAmount(List<PlayerAction> actions) {
        return actions.stream()
                .filter(a -> a.getAction() == Action.WIN)
                .map(PlayerAction::getAmount)
                .reduce(BigDecimal::add)
                .orElse(null);
    }
}
