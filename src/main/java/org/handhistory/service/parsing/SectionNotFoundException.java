package org.handhistory.service.parsing;

/**
 * A named section marker (e.g. {@code FLOP}) is absent from the split text.
 * Stages for optional streets catch it and record the street as not dealt.
 */
public class SectionNotFoundException extends HandParseException {

    private final String marker;

    public SectionNotFoundException(String marker) {
        super("section '" + marker + "' not found", -1);
        this.marker = marker;
    }

    public String getMarker() { return marker; }
}
