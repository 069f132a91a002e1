package org.handhistory.model.enums;

import java.util.List;

public enum Game implements TextAliases {
    HOLDEM("Hold'em", "Holdem", "HOLDEM"),
    OMAHA("Omaha"),
    OMAHA_HILO("Omaha H/L", "Omaha Hi/Lo", "Omaha Hi-Lo"),
    RAZZ("Razz"),
    STUD("Stud", "7 Card Stud");

    private final List<String> aliases;

    Game(String... aliases) { this.aliases = List.of(aliases); }

    @Override
    public List<String> aliases() { return aliases; }

    public static Game fromText(String text) { return TextAliases.lookup(Game.class, text); }
}
