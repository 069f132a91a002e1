package org.handhistory.model.card;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ComboTest {

    @Test
    void of_isUnordered() {
        assertThat(Combo.of("2cAs")).isEqualTo(Combo.of("As2c"));
        assertThat(Combo.of("2cAs").toString()).isEqualTo("As2c");
        assertThat(Combo.of(Card.of("9d"), Card.of("Ks")).getFirst()).isEqualTo(Card.of("Ks"));
    }

    @Test
    void pairsAndSuited() {
        assertThat(Combo.of("QhQd").isPair()).isTrue();
        assertThat(Combo.of("AhKh").isSuited()).isTrue();
        assertThat(Combo.of("AhKd").isSuited()).isFalse();
    }

    @Test
    void of_rejectsSameCardTwice() {
        assertThatThrownBy(() -> Combo.of("AsAs")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_rejectsBadText() {
        assertThatThrownBy(() -> Combo.of("AsK")).isInstanceOf(InvalidCardFormatException.class);
    }
}
