package com.purchasingpower.designflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.purchasingpower.designflow.model.CallContext;
import com.purchasingpower.designflow.model.ServiceType;
import com.purchasingpower.designflow.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * On-disk cache of Figma API responses, one JSON file per request path.
 *
 * <p>Each file is an envelope holding the write time, the request path and the raw payload.
 * Freshness is judged from the stored write time, not from file timestamps. Entries are never
 * deleted: a stale entry is still served when the API is rate limited or unreachable.
 *
 * <p>No file locking is done. Two processes writing the same key leave one valid snapshot.
 */
@Slf4j
public class FigmaResponseCache {

    private final Path directory;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public FigmaResponseCache(Path directory, Duration ttl, Clock clock, ObjectMapper objectMapper) {
        this.directory = directory;
        this.ttl = ttl;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public Optional<CachedResponse> read(String requestPath) {
        Path file = fileFor(requestPath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            CacheEnvelope envelope = objectMapper.readValue(file.toFile(), CacheEnvelope.class);
            if (envelope.payload() == null) {
                log.warn("Ignoring cache entry without payload: {}", file);
                return Optional.empty();
            }
            Instant cachedAt = Instant.ofEpochMilli(envelope.cachedAt());
            Duration age = Duration.between(cachedAt, clock.instant());
            return Optional.of(new CachedResponse(envelope.payload(), cachedAt, age.compareTo(ttl) < 0));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(String requestPath, JsonNode payload) {
        Path file = fileFor(requestPath);
        CallContext call = ExternalCallLogger.startCall(ServiceType.CACHE, "write", log);
        try {
            Files.createDirectories(directory);
            CacheEnvelope envelope = new CacheEnvelope(clock.millis(), requestPath, payload);
            objectMapper.writeValue(file.toFile(), envelope);
            call.logResponse(file.toString());
        } catch (IOException e) {
            // a failed write only costs a future API call
            call.logDegraded("cache write failed for " + file + ": " + e.getMessage());
        }
    }

    public Path fileFor(String requestPath) {
        return directory.resolve(keyFor(requestPath) + ".json");
    }

    /**
     * First 16 hex chars of the SHA-256 of the request path.
     */
    static String keyFor(String requestPath) {
        return Hashing.sha256().hashString(requestPath, StandardCharsets.UTF_8).toString().substring(0, 16);
    }

    public record CachedResponse(JsonNode payload, Instant cachedAt, boolean fresh) {
    }

    public record CacheEnvelope(long cachedAt, String path, JsonNode payload) {
    }
}
