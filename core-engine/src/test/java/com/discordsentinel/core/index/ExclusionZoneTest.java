package com.discordsentinel.core.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExclusionZone}.
 */
class ExclusionZoneTest {

    @Test
    @DisplayName("Should treat windows closer than their length as overlapping")
    void shouldDetectOverlap() {
        assertThat(ExclusionZone.overlaps(10, 10, 5)).isTrue();
        assertThat(ExclusionZone.overlaps(10, 14, 5)).isTrue();
        assertThat(ExclusionZone.overlaps(14, 10, 5)).isTrue();
        assertThat(ExclusionZone.overlaps(10, 15, 5)).isFalse();
        assertThat(ExclusionZone.overlaps(15, 10, 5)).isFalse();
    }
}
