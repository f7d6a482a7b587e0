package com.drautomation.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReadOnlyQueries")
class ReadOnlyQueriesTest {

    @Test
    @DisplayName("should accept plain selects and common table expressions")
    void shouldAcceptSelects() {
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT COUNT(*) FROM users;")).isTrue();
        assertThat(ReadOnlyQueries.isReadOnlySelect("with t as (select 1 as x) select x from t")).isTrue();
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT * FROM users WHERE note = 'delete; me'")).isTrue();
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT offset_days FROM plans -- drop later")).isTrue();
    }

    @Test
    @DisplayName("should reject writes hidden inside a select")
    void shouldRejectEmbeddedWrites() {
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT * FROM OLD TABLE (DELETE FROM users)")).isFalse();
        assertThat(ReadOnlyQueries.isReadOnlySelect(
                "WITH d AS (DELETE FROM users RETURNING *) SELECT COUNT(*) FROM d")).isFalse();
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT * INTO users_copy FROM users")).isFalse();
        assertThat(ReadOnlyQueries.isReadOnlySelect("SELECT setval('users_id_seq', 1)")).isFalse();
    }

    @Test
    @DisplayName("should reject other statements, stacked statements and empty input")
    void shouldRejectOthers() {
        assertThat(ReadOnlyQueries.isReadOnlySelect(null)).isFalse();
        assertThat(ReadOnlyQueries.isReadOnlySelect("  ")).isFalse();
        assertThat(ReadOnlyQueries.isReadOnlySelect("SHOW TABLES")).isFalse();

        assertThatThrownBy(() -> ReadOnlyQueries.requireReadOnlySelect("SELECT 1; SELECT 2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiple statements");
    }
}
