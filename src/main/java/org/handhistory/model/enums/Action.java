package org.handhistory.model.enums;

import java.util.List;

/**
 * Kind of event a player produces on a street.
 */
public enum Action implements TextAliases {
    BET("bet", "bets"),
    RAISE("raise", "raises"),
    CALL("call", "calls"),
    CHECK("check", "checks"),
    FOLD("fold", "folds"),
    MUCK("muck", "mucks", "don't show", "didn't show", "did not show"),
    SHOW("show", "shows"),
    THINK("seconds left to act"),
    RETURN("return", "returned"),
    WIN("win", "wins", "won", "collected");

    private final List<String> aliases;

    Action(String... aliases) { this.aliases = List.of(aliases); }

    @Override
    public List<String> aliases() { return aliases; }

    public static Action fromText(String text) { return TextAliases.lookup(Action.class, text); }
}
