package com.drautomation.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdGenerator")
class IdGeneratorTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    private final IdGenerator idGenerator = new IdGenerator(clock);

    @Test
    @DisplayName("should build prefix, epoch millis and a base-36 suffix")
    void shouldBuildId() {
        String id = idGenerator.generate(IdGenerator.PREFIX_BACKUP);

        assertThat(id).matches("backup_1700000000000_[0-9a-z]{9}");
    }

    @Test
    @DisplayName("should generate distinct ids at the same instant")
    void shouldGenerateDistinctIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(idGenerator.generate(IdGenerator.PREFIX_JOB));
        }

        assertThat(ids).hasSize(1000);
    }

    @Test
    @DisplayName("should reject a blank prefix")
    void shouldRejectBlankPrefix() {
        assertThatThrownBy(() -> idGenerator.generate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a non-positive suffix length")
    void shouldRejectNonPositiveLength() {
        assertThatThrownBy(() -> idGenerator.randomSuffix(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
