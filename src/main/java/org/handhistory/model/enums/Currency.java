package org.handhistory.model.enums;

import java.util.List;

public enum Currency implements TextAliases {
    USD("USD", "$"),
    EUR("EUR", "€"),
    GBP("GBP", "£");

    private final List<String> aliases;

    Currency(String... aliases) { this.aliases = List.of(aliases); }

    @Override
    public List<String> aliases() { return aliases; }

    public static Currency fromText(String text) { return TextAliases.lookup(Currency.class, text); }
}
