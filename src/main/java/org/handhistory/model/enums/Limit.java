package org.handhistory.model.enums;

import java.util.List;

public enum Limit implements TextAliases {
    NL("NL", "No Limit"),
    PL("PL", "Pot Limit"),
    FL("FL", "Fix Limit", "Fixed Limit", "Limit");

    private final List<String> aliases;

    Limit(String... aliases) { this.aliases = List.of(aliases); }

    @Override
    public List<String> aliases() { return aliases; }

    public static Limit fromText(String text) { return TextAliases.lookup(Limit.class, text); }
}
