package org.handhistory.model.enums;

import org.handhistory.model.card.UnknownEnumerationValueException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TextAliasesTest {

    @Test
    void fromText_acceptsEveryAliasIgnoringCase() {
        assertThat(Limit.fromText("No Limit")).isEqualTo(Limit.NL);
        assertThat(Limit.fromText("nl")).isEqualTo(Limit.NL);
        assertThat(Limit.fromText(" Pot Limit ")).isEqualTo(Limit.PL);
        assertThat(Game.fromText("Hold'em")).isEqualTo(Game.HOLDEM);
        assertThat(Game.fromText("omaha hi/lo")).isEqualTo(Game.OMAHA_HILO);
        assertThat(Action.fromText("folds")).isEqualTo(Action.FOLD);
        assertThat(Action.fromText("bets")).isEqualTo(Action.BET);
    }

    @Test
    void fromText_unknownValueNamesTheEnumeration() {
        assertThatThrownBy(() -> Game.fromText("Badugi"))
                .isInstanceOf(UnknownEnumerationValueException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Game")
                .hasMessageContaining("Badugi");
        assertThatThrownBy(() -> Currency.fromText(null)).isInstanceOf(UnknownEnumerationValueException.class);
    }
}
