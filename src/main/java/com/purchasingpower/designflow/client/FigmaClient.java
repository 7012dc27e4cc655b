package com.purchasingpower.designflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.designflow.configuration.FigmaProperties;
import com.purchasingpower.designflow.exception.FigmaAccessException;
import com.purchasingpower.designflow.exception.FigmaApiException;
import com.purchasingpower.designflow.exception.FigmaAuthException;
import com.purchasingpower.designflow.exception.FigmaNotFoundException;
import com.purchasingpower.designflow.exception.FigmaRateLimitException;
import com.purchasingpower.designflow.exception.FigmaTimeoutException;
import com.purchasingpower.designflow.model.CallContext;
import com.purchasingpower.designflow.model.Enrichment;
import com.purchasingpower.designflow.model.ServiceType;
import com.purchasingpower.designflow.model.figma.DesignFile;
import com.purchasingpower.designflow.model.figma.ImageFillsResponse;
import com.purchasingpower.designflow.model.figma.ImagesResponse;
import com.purchasingpower.designflow.model.figma.NodesResponse;
import com.purchasingpower.designflow.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Figma REST API client that survives rate limits.
 *
 * <p>Every GET goes through {@link #request(String, boolean)}:
 * <ul>
 *   <li>a fresh cache entry is returned without touching the network;</li>
 *   <li>timeouts and transport failures fall back to a stale cache entry when there is one;</li>
 *   <li>on 429 any cached entry, however old, wins; without one, essential calls wait
 *       {@code min(Retry-After, max-retry-wait)} and retry once while optional calls fail at once;</li>
 *   <li>a Retry-After above the CDN-block threshold fails immediately with workarounds.</li>
 * </ul>
 *
 * <p>Once a response reveals a starter plan or a low rate-limit tier, the client flags the
 * account as low-budget and {@link #requestOptional} stops spending requests for the rest of
 * the client's life.
 */
@Slf4j
public class FigmaClient {

    static final String TOKEN_HEADER = "X-Figma-Token";
    static final String PLAN_TIER_HEADER = "x-figma-plan-tier";
    static final String RATE_LIMIT_TYPE_HEADER = "x-figma-rate-limit-type";

    private final WebClient webClient;
    private final FigmaProperties properties;
    private final FigmaResponseCache cache;
    private final BackoffSleeper sleeper;
    private final ObjectMapper objectMapper;

    private volatile boolean lowBudget;

    public FigmaClient(WebClient webClient,
                       FigmaProperties properties,
                       FigmaResponseCache cache,
                       BackoffSleeper sleeper,
                       ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.cache = cache;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
    }

    public DesignFile getFile(String fileKey) {
        return request("/files/" + fileKey, true, DesignFile.class);
    }

    public NodesResponse getNodes(String fileKey, List<String> nodeIds) {
        return request("/files/" + fileKey + "/nodes?ids=" + formatNodeIds(nodeIds), true, NodesResponse.class);
    }

    /**
     * Download URLs for every image fill in the file. Essential: images are the one enrichment
     * worth a retry.
     */
    public ImageFillsResponse getImageFills(String fileKey) {
        return request("/files/" + fileKey + "/images", true, ImageFillsResponse.class);
    }

    /**
     * Renders nodes through {@code /v1/images}. Best-effort; see {@link #requestOptional}.
     */
    public Enrichment<ImagesResponse> renderImages(String fileKey, List<String> nodeIds, String format, Integer scale) {
        String path = "/images/" + fileKey + "?ids=" + formatNodeIds(nodeIds) + "&format=" + format;
        if (scale != null) {
            path += "&scale=" + scale;
        }
        Enrichment<ImagesResponse> outcome = requestOptional(path, ImagesResponse.class);
        if (outcome.isSucceeded() && outcome.value().hasError()) {
            return Enrichment.failed("render error: " + outcome.value().getErr());
        }
        return outcome;
    }

    /**
     * Non-essential request: skipped while the account is low-budget, never retried, and any
     * failure comes back as a {@link Enrichment.Status#FAILED} outcome instead of an exception.
     */
    public <T> Enrichment<T> requestOptional(String path, Class<T> type) {
        if (lowBudget) {
            log.info("Skipping optional Figma call {} (low-budget plan detected)", stripQuery(path));
            return Enrichment.skipped("low-budget plan detected");
        }
        try {
            return Enrichment.succeeded(request(path, false, type));
        } catch (FigmaApiException e) {
            log.warn("Optional Figma call {} failed: {}", stripQuery(path), e.getMessage());
            return Enrichment.failed(e.getMessage());
        }
    }

    public <T> T request(String path, boolean essential, Class<T> type) {
        JsonNode payload = request(path, essential);
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new FigmaApiException(502, "Unexpected Figma API response for " + stripQuery(path),
                    "The response did not match the expected shape; try again or report the file key.", e);
        }
    }

    public JsonNode request(String path, boolean essential) {
        Optional<FigmaResponseCache.CachedResponse> cached = cache.read(path);
        if (cached.isPresent() && cached.get().fresh()) {
            log.info("Figma cache hit (fresh) for {}", stripQuery(path));
            return cached.get().payload();
        }
        if (!properties.hasToken()) {
            throw new FigmaAuthException("No Figma token configured");
        }

        int maxAttempts = essential ? 2 : 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            CallContext call = ExternalCallLogger.startCall(ServiceType.FIGMA, "GET " + stripQuery(path), log);
            call.logRequest(path, "essential", essential, "attempt", attempt + "/" + maxAttempts);

            RawResponse response;
            try {
                response = exchange(path);
            } catch (RuntimeException e) {
                boolean timedOut = Exceptions.unwrap(e) instanceof TimeoutException;
                if (cached.isPresent()) {
                    call.logDegraded((timedOut ? "timed out" : "unreachable") + ", using cached Figma data");
                    return cached.get().payload();
                }
                call.logError(timedOut ? "timed out" : "transport failure", e);
                if (timedOut) {
                    throw new FigmaTimeoutException(stripQuery(path), properties.getTimeout(), e);
                }
                throw new FigmaApiException(503, "Could not reach the Figma API: " + e.getMessage(),
                        "Check your network connection and try again.", e);
            }

            observeBudget(response.headers());

            if (response.status() == 429) {
                if (cached.isPresent()) {
                    call.logDegraded("rate limited, using cached Figma data");
                    return cached.get().payload();
                }
                Long retryAfter = retryAfterSeconds(response.headers());
                if (retryAfter != null && retryAfter > properties.getCdnBlockThreshold().toSeconds()) {
                    call.logError("CDN block, Retry-After " + retryAfter + "s", null);
                    throw FigmaRateLimitException.cdnBlock(retryAfter);
                }
                if (attempt < maxAttempts) {
                    Duration wait = backoffFor(retryAfter);
                    call.logDegraded("rate limited, waiting " + wait.toSeconds() + "s before retry");
                    sleeper.sleep(wait);
                    continue;
                }
                call.logError("rate limited", null);
                throw FigmaRateLimitException.transientLimit(retryAfter);
            }

            if (response.status() < 200 || response.status() >= 300) {
                call.logError("HTTP " + response.status(), null);
                throw statusException(response, stripQuery(path));
            }

            JsonNode payload = parse(response.body(), path);
            cache.write(path, payload);
            call.logResponse(ExternalCallLogger.truncate(response.body(), 200),
                    "status", response.status(), "bytes", response.body().length());
            return payload;
        }
        throw new FigmaApiException(0, "Figma API request failed after retries: " + stripQuery(path), null);
    }

    public boolean isLowBudget() {
        return lowBudget;
    }

    /**
     * Fixed pause between sequential optional calls, so a run never bursts the API.
     */
    public void pause(Duration delay) {
        sleeper.sleep(delay);
    }

    private RawResponse exchange(String path) {
        return webClient.get()
                .uri(URI.create(properties.getBaseUrl() + path))
                .header(TOKEN_HEADER, properties.getToken())
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new RawResponse(
                                response.statusCode().value(), response.headers().asHttpHeaders(), body)))
                .timeout(properties.getTimeout())
                .block();
    }

    private void observeBudget(HttpHeaders headers) {
        String planTier = headers.getFirst(PLAN_TIER_HEADER);
        String limitType = headers.getFirst(RATE_LIMIT_TYPE_HEADER);
        if ("starter".equalsIgnoreCase(planTier) || "low".equalsIgnoreCase(limitType)) {
            if (!lowBudget) {
                log.warn("Low-budget Figma plan detected (plan={}, limit-type={}); optional calls are disabled",
                        planTier, limitType);
            }
            lowBudget = true;
        }
    }

    Duration backoffFor(Long retryAfterSeconds) {
        Duration requested = retryAfterSeconds != null && retryAfterSeconds > 0
                ? Duration.ofSeconds(retryAfterSeconds)
                : properties.getDefaultRetryWait();
        return requested.compareTo(properties.getMaxRetryWait()) < 0 ? requested : properties.getMaxRetryWait();
    }

    private static Long retryAfterSeconds(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After '{}'", value);
            return null;
        }
    }

    private FigmaApiException statusException(RawResponse response, String path) {
        return switch (response.status()) {
            case 401 -> new FigmaAuthException("Invalid Figma token");
            case 403 -> new FigmaAccessException(path);
            case 404 -> new FigmaNotFoundException(path);
            default -> new FigmaApiException(response.status(),
                    "Figma API error: " + response.status() + " - " + errorMessage(response.body()),
                    "Try again later; if the error persists check https://status.figma.com.");
        };
    }

    private String errorMessage(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.hasNonNull("message")) {
                return node.get("message").asText();
            }
            if (node != null && node.hasNonNull("err")) {
                return node.get("err").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", ExternalCallLogger.truncate(body, 200));
        }
        return ExternalCallLogger.truncate(body, 200);
    }

    private JsonNode parse(String body, String path) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FigmaApiException(502, "Figma API returned invalid JSON for " + stripQuery(path),
                    "Try again later.", e);
        }
    }

    /**
     * Comma-joined, URL-encoded node ids ({@code 1:2} becomes {@code 1%3A2}).
     */
    public static String formatNodeIds(List<String> nodeIds) {
        return nodeIds.stream()
                .map(id -> URLEncoder.encode(id, StandardCharsets.UTF_8))
                .collect(Collectors.joining(","));
    }

    static String stripQuery(String path) {
        int query = path.indexOf('?');
        return query < 0 ? path : path.substring(0, query);
    }

    record RawResponse(int status, HttpHeaders headers, String body) {
    }
}
