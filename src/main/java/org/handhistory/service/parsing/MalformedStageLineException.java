package org.handhistory.service.parsing;

public class MalformedStageLineException extends HandParseException {

    public MalformedStageLineException(String message, int fragmentIndex) {
        super(message, fragmentIndex);
    }

    public MalformedStageLineException(ParseStage stage, String message, int fragmentIndex, Throwable cause) {
        super(stage, message, fragmentIndex, cause);
    }
}
