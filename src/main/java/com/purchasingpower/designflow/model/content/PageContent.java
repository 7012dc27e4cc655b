package com.purchasingpower.designflow.model.content;

import java.util.List;

public record PageContent(
        String name,
        String id,
        List<ContentSection> sections,
        List<ExtractedText> allText,
        Navigation navigation
) {

    public record Navigation(List<String> primary, List<String> secondary, List<String> footer) {
    }
}
