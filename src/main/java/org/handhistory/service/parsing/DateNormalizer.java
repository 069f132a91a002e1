package org.handhistory.service.parsing;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Room timestamps are printed in the room's local zone; the hand record keeps UTC.
 */
public final class DateNormalizer {

    private DateNormalizer() {}

    public static ZonedDateTime toUtc(String text, DateTimeFormatter format, ZoneId roomZone) {
        try {
            LocalDateTime local = LocalDateTime.parse(text.trim(), format);
            return local.atZone(roomZone).withZoneSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new MalformedHeaderException("unparseable date '" + text + "'", ex);
        }
    }
}
