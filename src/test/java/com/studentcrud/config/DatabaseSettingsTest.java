package com.studentcrud.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseSettingsTest {

    @Test
    @DisplayName("Should fall back to defaults when nothing is set")
    void shouldUseDefaultsWhenAbsent() {
        DatabaseSettings settings = DatabaseSettings.resolve(key -> null);

        assertThat(settings.host()).isEqualTo("localhost");
        assertThat(settings.port()).isEqualTo(5432);
        assertThat(settings.database()).isEqualTo("postgres");
        assertThat(settings.user()).isEqualTo("postgres");
        assertThat(settings.password()).isEqualTo("postgres");
        assertThat(settings.jdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/postgres");
    }

    @Test
    @DisplayName("Should treat empty values as absent")
    void shouldUseDefaultsWhenEmpty() {
        DatabaseSettings settings = DatabaseSettings.resolve(key -> "");

        assertThat(settings.host()).isEqualTo("localhost");
        assertThat(settings.port()).isEqualTo(5432);
        assertThat(settings.password()).isEqualTo("postgres");
    }

    @Test
    @DisplayName("Should take every value from the lookup")
    void shouldUseProvidedValues() {
        Map<String, String> env = new HashMap<>();
        env.put("PGHOST", "db.internal");
        env.put("PGPORT", "6543");
        env.put("PGDATABASE", "school");
        env.put("PGUSER", "registrar");
        env.put("PGPASSWORD", "s3cret");

        DatabaseSettings settings = DatabaseSettings.resolve(env::get);

        assertThat(settings).isEqualTo(new DatabaseSettings("db.internal", 6543, "school", "registrar", "s3cret"));
        assertThat(settings.jdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:6543/school");
    }

    @Test
    @DisplayName("Should reject a non-numeric port instead of defaulting it")
    void shouldRejectMalformedPort() {
        assertThatThrownBy(() -> DatabaseSettings.resolve(key -> "PGPORT".equals(key) ? "fifty" : null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PGPORT")
                .hasMessageContaining("fifty");
    }

    @Test
    void toString_shouldMaskPassword() {
        DatabaseSettings settings = new DatabaseSettings("h", 1, "d", "u", "hunter2");

        assertThat(settings.toString()).doesNotContain("hunter2").contains("password=****");
    }
}
