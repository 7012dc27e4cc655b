package com.purchasingpower.designflow.model.content;

import java.util.List;
import java.util.Map;

/**
 * Text content and information architecture of a whole file.
 *
 * @param pages  page name to page content, in document order
 * @param byRole every text grouped by role, all roles present
 */
public record ExtractedContent(
        String fileName,
        Map<String, PageContent> pages,
        Map<SemanticRole, List<ExtractedText>> byRole,
        GlobalNavigation navigation,
        Stats stats
) {

    public record GlobalNavigation(List<String> primary, List<String> footer) {
    }

    public record Stats(int totalTextItems, int totalPages, int totalSections, Map<SemanticRole, Integer> roleBreakdown) {
    }
}
