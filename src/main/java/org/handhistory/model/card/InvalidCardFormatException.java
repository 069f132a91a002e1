package org.handhistory.model.card;

public class InvalidCardFormatException extends IllegalArgumentException {

    public InvalidCardFormatException(String text) {
        super("Invalid card code: '" + text + "' (expected rank + suit, e.g. 'As')");
    }

    public InvalidCardFormatException(String text, Throwable cause) {
        super("Invalid card code: '" + text + "' (expected rank + suit, e.g. 'As')", cause);
    }
}
