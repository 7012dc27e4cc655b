package com.purchasingpower.designflow.util;

import com.purchasingpower.designflow.model.CallContext;
import com.purchasingpower.designflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for logging calls that leave the compiler.
 *
 * <p>{@link ServiceType#FIGMA} calls log one INFO line per REST request and response
 * ({@code GET /files/...} with call id and elapsed ms), WARN when a stale cache entry or a retry
 * stands in for the response, and the status and body excerpt at DEBUG.
 * {@link ServiceType#CACHE} calls only show up when a cache write fails.
 */
public final class ExternalCallLogger {

    private static final String ELLIPSIS = "... [+%d chars]";

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens Figma response and error bodies; a file payload can run to megabytes.
     */
    public static String truncate(String body, int maxLength) {
        if (body == null) {
            return "(empty body)";
        }
        if (body.length() <= maxLength) {
            return body;
        }
        return body.substring(0, maxLength) + String.format(ELLIPSIS, body.length() - maxLength);
    }
}
