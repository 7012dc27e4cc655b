package com.purchasingpower.designflow.service.format;

import com.purchasingpower.designflow.model.content.ContentSection;
import com.purchasingpower.designflow.model.content.ExtractedContent;
import com.purchasingpower.designflow.model.content.ExtractedContent.GlobalNavigation;
import com.purchasingpower.designflow.model.content.ExtractedContent.Stats;
import com.purchasingpower.designflow.model.content.ExtractedText;
import com.purchasingpower.designflow.model.content.ExtractedText.ParentFrame;
import com.purchasingpower.designflow.model.content.ExtractedText.TextStyle;
import com.purchasingpower.designflow.model.content.PageContent;
import com.purchasingpower.designflow.model.content.PageContent.Navigation;
import com.purchasingpower.designflow.model.content.SemanticRole;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import com.purchasingpower.designflow.service.classification.TextRoleClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pulls the text content of a design into a page / section tree, tagging every text with its
 * {@link SemanticRole} and collecting the navigation labels.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentExtractor {

    private static final Map<String, List<String>> SECTION_GROUPS = new LinkedHashMap<>();

    static {
        SECTION_GROUPS.put("hero", List.of("hero", "banner", "jumbotron", "splash"));
        SECTION_GROUPS.put("navigation", List.of("nav", "navigation", "menu", "header"));
        SECTION_GROUPS.put("features", List.of("features", "benefits", "highlights", "capabilities"));
        SECTION_GROUPS.put("testimonials", List.of("testimonials", "reviews", "quotes", "social-proof"));
        SECTION_GROUPS.put("pricing", List.of("pricing", "plans", "packages", "tiers"));
        SECTION_GROUPS.put("cta", List.of("cta", "call-to-action", "signup", "get-started"));
        SECTION_GROUPS.put("footer", List.of("footer", "bottom"));
        SECTION_GROUPS.put("about", List.of("about", "story", "mission"));
        SECTION_GROUPS.put("contact", List.of("contact", "reach", "get-in-touch"));
        SECTION_GROUPS.put("faq", List.of("faq", "questions", "help"));
    }

    private final TextRoleClassifier textRoleClassifier;

    public ExtractedContent extract(List<DesignNode> nodes, String fileName) {
        Map<String, PageContent> pages = new LinkedHashMap<>();
        List<ExtractedText> allTexts = new ArrayList<>();
        Map<SemanticRole, List<ExtractedText>> byRole = new EnumMap<>(SemanticRole.class);
        for (SemanticRole role : SemanticRole.values()) {
            byRole.put(role, new ArrayList<>());
        }

        for (DesignNode node : nodes) {
            if (!node.isVisible()) {
                continue;
            }
            PageContent page = node.getType() == NodeType.CANVAS ? pageOf(node) : standalonePageOf(node);
            pages.put(node.displayName(), page);
            for (ExtractedText text : page.allText()) {
                allTexts.add(text);
                byRole.get(text.role()).add(text);
            }
        }

        Map<SemanticRole, Integer> breakdown = new EnumMap<>(SemanticRole.class);
        byRole.forEach((role, texts) -> breakdown.put(role, texts.size()));
        Stats stats = new Stats(allTexts.size(), pages.size(), countSections(pages), breakdown);
        log.debug("Extracted {} text item(s) from {} page(s) of '{}'", stats.totalTextItems(), stats.totalPages(), fileName);

        return new ExtractedContent(fileName, pages, byRole, globalNavigation(allTexts, pages), stats);
    }

    private PageContent pageOf(DesignNode canvas) {
        List<ContentSection> sections = new ArrayList<>();
        for (DesignNode child : canvas.visibleChildren()) {
            sections.add(sectionOf(child, List.of(canvas.displayName())));
        }
        List<ExtractedText> allText = new ArrayList<>();
        sections.forEach(section -> collectTexts(section, allText));
        return new PageContent(canvas.displayName(), canvas.getId(), sections, allText, navigationOf(sections));
    }

    private PageContent standalonePageOf(DesignNode node) {
        ContentSection section = sectionOf(node, List.of());
        List<ExtractedText> allText = new ArrayList<>();
        collectTexts(section, allText);
        return new PageContent(node.displayName(), node.getId(), List.of(section), allText,
                navigationOf(section.children()));
    }

    ContentSection sectionOf(DesignNode node, List<String> parentPath) {
        List<String> framePath = new ArrayList<>(parentPath);
        framePath.add(node.displayName());
        List<ExtractedText> textItems = new ArrayList<>();
        List<ContentSection> children = new ArrayList<>();

        if (isText(node)) {
            textItems.add(textOf(node, framePath, null));
        }
        for (DesignNode child : node.visibleChildren()) {
            if (isText(child)) {
                textItems.add(textOf(child, framePath, node));
            } else if (child.getType() != null && child.getType().isContainer()) {
                children.add(sectionOf(child, framePath));
            } else if (child.hasChildren()) {
                nestedTexts(child, framePath, node, textItems);
            }
        }
        return new ContentSection(node.getId(), node.displayName(), typeName(node), children, textItems,
                semanticGroup(node.displayName()));
    }

    private void nestedTexts(DesignNode node, List<String> framePath, DesignNode parentFrame,
                             List<ExtractedText> into) {
        if (isText(node)) {
            into.add(textOf(node, framePath, parentFrame));
        }
        for (DesignNode child : node.visibleChildren()) {
            nestedTexts(child, framePath, parentFrame, into);
        }
    }

    private ExtractedText textOf(DesignNode node, List<String> framePath, DesignNode parentFrame) {
        TypeStyle style = node.getStyle();
        TextStyle textStyle = style == null ? null : new TextStyle(
                style.getFontFamily(),
                style.getFontSize(),
                style.getFontWeight(),
                style.getLineHeightPx(),
                style.getLetterSpacing(),
                style.getTextAlignHorizontal() != null ? style.getTextAlignHorizontal().toLowerCase(Locale.ROOT) : null);
        SemanticRole role = textRoleClassifier.classify(node, framePath, parentFrame);
        return new ExtractedText(
                node.getId(),
                node.getCharacters() != null ? node.getCharacters() : "",
                role,
                node.displayName(),
                List.copyOf(framePath),
                textStyle,
                node.getAbsoluteBoundingBox(),
                parentFrame != null
                        ? new ParentFrame(parentFrame.getId(), parentFrame.displayName(), typeName(parentFrame))
                        : null);
    }

    private static boolean isText(DesignNode node) {
        return node.getType() == NodeType.TEXT && node.getCharacters() != null && !node.getCharacters().isEmpty();
    }

    private static String typeName(DesignNode node) {
        return node.getType() != null ? node.getType().name() : NodeType.OTHER.name();
    }

    static String semanticGroup(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> group : SECTION_GROUPS.entrySet()) {
            if (group.getValue().stream().anyMatch(lower::contains)) {
                return group.getKey();
            }
        }
        return null;
    }

    private static void collectTexts(ContentSection section, List<ExtractedText> into) {
        into.addAll(section.textItems());
        section.children().forEach(child -> collectTexts(child, into));
    }

    private static Navigation navigationOf(List<ContentSection> sections) {
        List<String> primary = new ArrayList<>();
        List<String> footer = new ArrayList<>();
        sections.forEach(section -> collectNavigation(section, false, primary, footer));
        return new Navigation(primary, new ArrayList<>(), footer);
    }

    private static void collectNavigation(ContentSection section, boolean insideFooter,
                                          List<String> primary, List<String> footer) {
        String name = section.name().toLowerCase(Locale.ROOT);
        boolean nav = "navigation".equals(section.semanticGroup()) || name.contains("nav") || name.contains("menu");
        boolean footerSection = insideFooter || "footer".equals(section.semanticGroup()) || name.contains("footer");

        for (ExtractedText text : section.textItems()) {
            if (text.role() == SemanticRole.NAVIGATION || nav) {
                (footerSection ? footer : primary).add(text.text());
            } else if (text.role() == SemanticRole.FOOTER) {
                footer.add(text.text());
            }
        }
        for (ContentSection child : section.children()) {
            collectNavigation(child, footerSection, primary, footer);
        }
    }

    private static GlobalNavigation globalNavigation(List<ExtractedText> allTexts, Map<String, PageContent> pages) {
        Set<String> primary = new LinkedHashSet<>();
        Set<String> footer = new LinkedHashSet<>();
        for (ExtractedText text : allTexts) {
            if (text.role() == SemanticRole.NAVIGATION) {
                primary.add(text.text());
            } else if (text.role() == SemanticRole.FOOTER) {
                footer.add(text.text());
            }
        }
        for (PageContent page : pages.values()) {
            primary.addAll(page.navigation().primary());
            footer.addAll(page.navigation().footer());
        }
        return new GlobalNavigation(List.copyOf(primary), List.copyOf(footer));
    }

    private static int countSections(Map<String, PageContent> pages) {
        int count = 0;
        for (PageContent page : pages.values()) {
            for (ContentSection section : page.sections()) {
                count += countSections(section);
            }
        }
        return count;
    }

    private static int countSections(ContentSection section) {
        int count = 1;
        for (ContentSection child : section.children()) {
            count += countSections(child);
        }
        return count;
    }
}
