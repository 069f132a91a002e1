package org.handhistory.model.hand;

public enum StreetName {
    PREFLOP("HOLE CARDS"),
    FLOP("FLOP"),
    TURN("TURN"),
    RIVER("RIVER");

    private final String marker;

    StreetName(String marker) { this.marker = marker; }

    /** Section title as printed between the asterisks, e.g. {@code *** TURN ***}. */
    public String getMarker() { return marker; }
}
