package com.purchasingpower.designflow.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * @see com.purchasingpower.designflow.util.ExternalCallLogger
 */
public enum ServiceType {
    FIGMA("🟣", "Figma"),
    CACHE("📦", "FigmaCache");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
