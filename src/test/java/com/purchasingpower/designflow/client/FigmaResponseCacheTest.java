package com.purchasingpower.designflow.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Figma Response Cache Tests")
class FigmaResponseCacheTest {

    private static final Instant WRITTEN_AT = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path cacheDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should report entries younger than the TTL as fresh")
    void read_withinTtl_isFresh() {
        // Given
        cacheAt(WRITTEN_AT).write("/files/KEY", payload("Landing"));

        // When / Then
        assertThat(cacheAt(WRITTEN_AT.plus(Duration.ofMinutes(59))).read("/files/KEY"))
                .hasValueSatisfying(entry -> {
                    assertThat(entry.fresh()).isTrue();
                    assertThat(entry.cachedAt()).isEqualTo(WRITTEN_AT);
                    assertThat(entry.payload().get("name").asText()).isEqualTo("Landing");
                });
    }

    @Test
    @DisplayName("Should keep serving expired entries, marked stale")
    void read_afterTtl_isStaleButPresent() {
        // Given
        cacheAt(WRITTEN_AT).write("/files/KEY", payload("Landing"));

        // When / Then
        assertThat(cacheAt(WRITTEN_AT.plus(Duration.ofHours(1))).read("/files/KEY"))
                .hasValueSatisfying(entry -> assertThat(entry.fresh()).isFalse());
    }

    @Test
    @DisplayName("Should key entries by the full request path")
    void keyFor_distinguishesQueries() {
        assertThat(FigmaResponseCache.keyFor("/files/KEY/nodes?ids=1%3A2"))
                .hasSize(16)
                .isNotEqualTo(FigmaResponseCache.keyFor("/files/KEY/nodes?ids=1%3A3"));
    }

    @Test
    @DisplayName("Should ignore missing and corrupt entries")
    void read_missingOrCorrupt_isEmpty() throws Exception {
        // Given
        FigmaResponseCache cache = cacheAt(WRITTEN_AT);
        Files.writeString(cache.fileFor("/files/BROKEN"), "{not json");

        // When / Then
        assertThat(cache.read("/files/NONE")).isEmpty();
        assertThat(cache.read("/files/BROKEN")).isEmpty();
    }

    private FigmaResponseCache cacheAt(Instant instant) {
        return new FigmaResponseCache(cacheDir, Duration.ofHours(1), Clock.fixed(instant, ZoneOffset.UTC), objectMapper);
    }

    private ObjectNode payload(String name) {
        return objectMapper.createObjectNode().put("name", name);
    }
}
