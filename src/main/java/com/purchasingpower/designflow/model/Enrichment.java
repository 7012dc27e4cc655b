package com.purchasingpower.designflow.model;

import java.util.Optional;

/**
 * Outcome of a best-effort enrichment call (icon export, screenshots, composite renders).
 *
 * <p>Lets callers tell "skipped to save quota" apart from "tried and failed" and from
 * "succeeded with an empty answer".
 *
 * @param <T> payload type
 */
public record Enrichment<T>(Status status, T value, String reason) {

    public enum Status {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    public static <T> Enrichment<T> succeeded(T value) {
        return new Enrichment<>(Status.SUCCEEDED, value, null);
    }

    public static <T> Enrichment<T> skipped(String reason) {
        return new Enrichment<>(Status.SKIPPED, null, reason);
    }

    public static <T> Enrichment<T> failed(String reason) {
        return new Enrichment<>(Status.FAILED, null, reason);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public Optional<T> valueIfPresent() {
        return Optional.ofNullable(value);
    }

    /**
     * One-line description for logs and result metadata.
     */
    public String describe() {
        return reason == null ? status.name() : status.name() + ": " + reason;
    }
}
