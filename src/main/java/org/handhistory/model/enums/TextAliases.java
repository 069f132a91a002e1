package org.handhistory.model.enums;

import org.handhistory.model.card.UnknownEnumerationValueException;

import java.util.List;

/**
 * Room enumerations that can be spelled several ways in a hand history ("NL", "No Limit").
 */
public interface TextAliases {

    List<String> aliases();

    static <E extends Enum<E> & TextAliases> E lookup(Class<E> type, String text) {
        if (text != null) {
            String wanted = text.trim();
            for (E e : type.getEnumConstants()) {
                for (String alias : e.aliases()) {
                    if (alias.equalsIgnoreCase(wanted)) return e;
                }
            }
        }
        throw new UnknownEnumerationValueException(type.getSimpleName(), text);
    }
}
