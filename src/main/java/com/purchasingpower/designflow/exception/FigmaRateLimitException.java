package com.purchasingpower.designflow.exception;

import lombok.Getter;

/**
 * HTTP 429. {@code cdnBlock} is set when the Retry-After is long enough that waiting is pointless.
 */
@Getter
public class FigmaRateLimitException extends FigmaApiException {

    private final Long retryAfterSeconds;
    private final boolean cdnBlock;

    private FigmaRateLimitException(String message, String remediation, Long retryAfterSeconds, boolean cdnBlock) {
        super(429, message, remediation);
        this.retryAfterSeconds = retryAfterSeconds;
        this.cdnBlock = cdnBlock;
    }

    public static FigmaRateLimitException transientLimit(Long retryAfterSeconds) {
        String wait = retryAfterSeconds != null ? " (Retry-After: " + retryAfterSeconds + "s)" : "";
        return new FigmaRateLimitException(
                "Figma API rate limit exceeded" + wait,
                "Wait 1-2 minutes before trying again. Cached responses are reused automatically.",
                retryAfterSeconds,
                false);
    }

    public static FigmaRateLimitException cdnBlock(long retryAfterSeconds) {
        long days = (retryAfterSeconds + 86_399) / 86_400;
        return new FigmaRateLimitException(
                "Figma API blocked for ~" + days + " day(s) (CDN-level throttle, Retry-After: "
                        + retryAfterSeconds + "s). Community files use the file owner's plan limits.",
                """
                        Workarounds:
                          1. Duplicate the file to your own Figma workspace (fixes owner-plan limits).
                          2. Use a VPN or a different network to get a fresh IP.
                          3. Upgrade to a paid Figma plan with a Dev seat.""",
                retryAfterSeconds,
                true);
    }
}
