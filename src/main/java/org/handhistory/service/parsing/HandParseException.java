package org.handhistory.service.parsing;

/**
 * A hand could not be parsed. Carries the stage that failed and, when known, the index of the
 * text fragment it was looking at ({@code -1} otherwise).
 */
public class HandParseException extends RuntimeException {

    private ParseStage stage;
    private final int fragmentIndex;

    public HandParseException(String message, int fragmentIndex) {
        this(null, message, fragmentIndex, null);
    }

    public HandParseException(ParseStage stage, String message, int fragmentIndex, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.fragmentIndex = fragmentIndex;
    }

    public ParseStage getStage() { return stage; }
    public int getFragmentIndex() { return fragmentIndex; }

    /** Tags the exception with the stage that was running, unless it already names one. */
    HandParseException atStage(ParseStage running) {
        if (stage == null) stage = running;
        return this;
    }

    @Override
    public String getMessage() {
        String where = (stage == null ? "" : "[" + stage + "] ")
                + (fragmentIndex >= 0 ? "fragment " + fragmentIndex + ": " : "");
        return where + super.getMessage();
    }
}
