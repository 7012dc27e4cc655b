package com.purchasingpower.designflow.model.content;

import java.util.List;

/**
 * A container of the content tree with the texts found directly in it.
 *
 * @param semanticGroup hero, navigation, features, ... or {@code null}
 */
public record ContentSection(
        String id,
        String name,
        String type,
        List<ContentSection> children,
        List<ExtractedText> textItems,
        String semanticGroup
) {
}
