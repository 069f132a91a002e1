package org.handhistory.service.parsing;

import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Room adapters known to the application, by case-insensitive room key.
 */
@Service
public class RoomParserRegistry {

    private final Map<String, RoomParser> parsers = new TreeMap<>();

    public RoomParserRegistry(List<RoomParser> rooms) {
        for (RoomParser p : rooms) {
            RoomParser previous = parsers.put(key(p.room()), p);
            if (previous != null) {
                throw new IllegalStateException("Two parsers for room '" + p.room() + "': "
                        + previous.getClass().getSimpleName() + ", " + p.getClass().getSimpleName());
            }
        }
    }

    public RoomParser get(String room) {
        RoomParser p = room == null ? null : parsers.get(key(room));
        if (p == null) throw new IllegalArgumentException("Unknown room '" + room + "', known: " + parsers.keySet());
        return p;
    }

    public Collection<String> rooms() { return Collections.unmodifiableSet(parsers.keySet()); }

    private static String key(String room) {
        return room.trim().toLowerCase(Locale.ROOT);
    }
}
