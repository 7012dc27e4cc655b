package com.purchasingpower.designflow.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class FigmaProperties {

    /**
     * Personal access token sent as {@code X-Figma-Token}. Checked lazily, on the first request.
     */
    private String token;

    @NotBlank
    private String baseUrl = "https://api.figma.com/v1";

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    @NotBlank
    private String cacheDir = System.getProperty("user.home") + "/.designflow/figma-cache";

    @NotNull
    private Duration cacheTtl = Duration.ofHours(1);

    @NotNull
    private Duration maxRetryWait = Duration.ofSeconds(60);

    @NotNull
    private Duration defaultRetryWait = Duration.ofSeconds(30);

    /**
     * A Retry-After longer than this is a CDN block rather than a rate limit.
     */
    @NotNull
    private Duration cdnBlockThreshold = Duration.ofHours(1);

    @NotNull
    private Duration interCallDelay = Duration.ofMillis(1000);

    @NotNull
    private Duration screenshotDelay = Duration.ofMillis(1500);

    @Min(0)
    private int iconLimit = 30;

    @Min(0)
    private int screenshotLimit = 3;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
