package io.github.drompincen.taskclaw.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictTypeTest {

    @Test
    void severityIncreasesFromNoneToHard() {
        assertThat(ConflictType.HARD.isMoreSevereThan(ConflictType.IDENTICAL)).isTrue();
        assertThat(ConflictType.IDENTICAL.isMoreSevereThan(ConflictType.PARTIAL)).isTrue();
        assertThat(ConflictType.PARTIAL.isMoreSevereThan(ConflictType.NESTED)).isTrue();
        assertThat(ConflictType.NESTED.isMoreSevereThan(ConflictType.NONE)).isTrue();
        assertThat(ConflictType.NONE.isMoreSevereThan(ConflictType.NONE)).isFalse();
    }
}
