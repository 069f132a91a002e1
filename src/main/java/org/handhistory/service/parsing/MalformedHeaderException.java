package org.handhistory.service.parsing;

public class MalformedHeaderException extends HandParseException {

    public MalformedHeaderException(String line) {
        this("header does not match the room format: '" + line + "'", null);
    }

    public MalformedHeaderException(String message, Throwable cause) {
        super(ParseStage.HEADER_PARSED, message, 0, cause);
    }
}
