package org.handhistory.model.enums;

import java.util.List;

public enum GameType implements TextAliases {
    CASH("Cash game", "Ring"),
    TOUR("Tournament"),
    SNG("Sit & Go", "SNG");

    private final List<String> aliases;

    GameType(String... aliases) { this.aliases = List.of(aliases); }

    @Override
    public List<String> aliases() { return aliases; }

    public static GameType fromText(String text) { return TextAliases.lookup(GameType.class, text); }
}
