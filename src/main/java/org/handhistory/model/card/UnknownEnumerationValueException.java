package org.handhistory.model.card;

/**
 * Raised when a rank, suit or room enumeration code is not one of the known values.
 */
public class UnknownEnumerationValueException extends IllegalArgumentException {

    private final String enumeration;
    private final String value;

    public UnknownEnumerationValueException(String enumeration, String value) {
        super("Unknown " + enumeration + " value: '" + value + "'");
        this.enumeration = enumeration;
        this.value = value;
    }

    public String getEnumeration() { return enumeration; }
    public String getValue() { return value; }
}
