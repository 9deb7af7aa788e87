package com.aegis.records;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Rank and ContactType")
class RankTest {

    @Test
    @DisplayName("only captains and commanders lead")
    void leadership() {
        assertThat(Rank.values())
                .filteredOn(Rank::isLeadership)
                .containsExactly(Rank.CAPTAIN, Rank.COMMANDER);
    }

    @Test
    @DisplayName("tags round-trip through fromTag")
    void fromTag() {
        assertThat(Rank.fromTag("lieutenant")).contains(Rank.LIEUTENANT);
        assertThat(Rank.fromTag("Captain")).isEmpty();
        assertThat(ContactType.fromTag("telepathic")).contains(ContactType.TELEPATHIC);
        assertThat(ContactType.fromTag("psychic")).isEmpty();
    }
}
