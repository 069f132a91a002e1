package org.handhistory.service;

import org.handhistory.dto.HandSummaryDTO;
import org.handhistory.dto.HandSummaryDTO.ActionDTO;
import org.handhistory.dto.HandSummaryDTO.PlayerDTO;
import org.handhistory.dto.HandSummaryDTO.StreetDTO;
import org.handhistory.dto.HandSummaryDTO.TextureDTO;
import org.handhistory.model.card.Card;
import org.handhistory.model.hand.HandHistory;
import org.handhistory.model.hand.Player;
import org.handhistory.model.hand.Street;
import org.handhistory.model.hand.StreetInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Maps the parse record to its JSON summary.
 */
public final class HandSummaries {
    private HandSummaries() {}

    public static HandSummaryDTO from(HandHistory h) {
        HandSummaryDTO.HandSummaryDTOBuilder b = HandSummaryDTO.builder()
                .room(h.getRoom())
                .ident(h.getIdent())
                .date(h.getDate() == null ? null : h.getDate().toInstant().toString())
                .sb(h.getSb())
                .bb(h.getBb())
                .limit(name(h.getLimit()))
                .game(name(h.getGame()))
                .gameType(name(h.getGameType()))
                .currency(name(h.getCurrency()))
                .buyin(h.getBuyin())
                .tournamentIdent(h.getTournamentIdent())
                .tableName(h.getTableName())
                .extra(new LinkedHashMap<>(h.getExtra()));

        if (!h.isParsed()) return b.build();

        List<StreetDTO> streets = new ArrayList<>();
        for (StreetInfo s : h.getStreets().values()) {
            streets.add(new StreetDTO(
                    s.getStreet().name(),
                    s.getPot(),
                    s.getNumPlayers(),
                    s.players().orElse(null),
                    s.getActions().stream()
                            .map(a -> new ActionDTO(a.getName(), a.getAction().name(), a.getAmount()))
                            .toList()));
        }

        return b.maxPlayers(h.getMaxPlayers())
                .players(h.getPlayers().stream().map(HandSummaries::player).toList())
                .button(h.getButton() == null ? null : h.getButton().getName())
                .hero(h.getHero() == null ? null : h.getHero().getName())
                .heroCombo(h.getHero() == null ? null : Objects.toString(h.getHero().getCombo(), null))
                .showDown(h.isShowDown())
                .board(h.getBoard() == null ? null : h.getBoard().stream().map(Card::toString).toList())
                .flopTexture(texture(h.getFlop()))
                .streets(streets)
                .rake(h.getRake())
                .totalPot(h.getTotalPot())
                .winners(new ArrayList<>(h.getWinners()))
                .build();
    }

    public static TextureDTO texture(Street s) {
        if (s == null) return null;
        return TextureDTO.builder()
                .rainbow(s.isRainbow())
                .monotone(s.isMonotone())
                .triplet(s.isTriplet())
                .pair(s.hasPair())
                .flushDraw(s.hasFlushDraw())
                .straightDraw(s.hasStraightDraw())
                .gutshot(s.hasGutshot())
                .build();
    }

    private static PlayerDTO player(Player p) {
        return new PlayerDTO(p.getSeat(), p.getName(), p.getStack(), Objects.toString(p.getCombo(), null));
    }

    private static String name(Enum<?> e) {
        return e == null ? null : e.name();
    }
}
