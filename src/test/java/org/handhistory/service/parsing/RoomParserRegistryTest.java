package org.handhistory.service.parsing;

import org.handhistory.service.parsing.room.FullTiltPokerParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RoomParserRegistryTest {

    @Test
    void get_isCaseInsensitive() {
        FullTiltPokerParser ftp = new FullTiltPokerParser();
        RoomParserRegistry registry = new RoomParserRegistry(List.of(ftp));

        assertThat(registry.get("FullTilt")).isSameAs(ftp);
        assertThat(registry.get(" fulltilt ")).isSameAs(ftp);
        assertThat(registry.rooms()).containsExactly("fulltilt");
    }

    @Test
    void get_unknownRoom() {
        RoomParserRegistry registry = new RoomParserRegistry(List.of(new FullTiltPokerParser()));

        assertThatThrownBy(() -> registry.get("pokerstars"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pokerstars")
                .hasMessageContaining("fulltilt");
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateRoomsAreRejected() {
        assertThatThrownBy(() -> new RoomParserRegistry(List.of(new FullTiltPokerParser(), new FullTiltPokerParser())))
                .isInstanceOf(IllegalStateException.class);
    }
}
