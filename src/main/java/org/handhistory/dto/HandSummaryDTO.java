package org.handhistory.dto;

import lombok.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a parsed hand, used by the REST API and for the stored summary.
 * Body fields stay null after a header-only parse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandSummaryDTO {
    private String room;
    private String ident;
    /** ISO-8601, UTC */
    private String date;
    private BigDecimal sb;
    private BigDecimal bb;
    private String limit;
    private String game;
    private String gameType;
    private String currency;
    private BigDecimal buyin;
    private BigDecimal rake;
    private String tournamentIdent;
    private String tableName;

    private Integer maxPlayers;
    private List<PlayerDTO> players;
    private String button;
    private String hero;
    private String heroCombo;
    private boolean showDown;
    private List<String> board;
    private TextureDTO flopTexture;
    private List<StreetDTO> streets;
    private BigDecimal totalPot;
    private List<String> winners;
    private Map<String, Object> extra;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlayerDTO {
        private int seat;
        private String name;
        private long stack;
        private String combo;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionDTO {
        private String name;
        private String action;
        private BigDecimal amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StreetDTO {
        private String street;
        private BigDecimal pot;
        private Integer numPlayers;
        private List<String> players;
        private List<ActionDTO> actions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TextureDTO {
        private boolean rainbow;
        private boolean monotone;
        private boolean triplet;
        private boolean pair;
        private boolean flushDraw;
        private boolean straightDraw;
        private boolean gutshot;
    }
}
