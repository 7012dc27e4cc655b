package com.purchasingpower.designflow.service.format;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.designflow.model.design.NotableComponent;
import com.purchasingpower.designflow.model.design.PlanTask;
import com.purchasingpower.designflow.model.design.SectionSummary;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionImage;
import com.purchasingpower.designflow.model.design.SectionSummary.SectionLayout;
import com.purchasingpower.designflow.model.design.SectionSummary.TypographyUsage;
import com.purchasingpower.designflow.service.classification.ImageImportanceClassifier;
import com.purchasingpower.designflow.util.CssValues;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns section summaries into a checkbox-style IMPLEMENTATION_PLAN.md.
 *
 * <p>Tasks are computed here; the document frame (universal rules, task layout) lives in
 * {@code templates/implementation-plan.mustache}.
 *
 * <pre>
 * String plan = planFormatter.render(summaries, PlanOptions.builder()
 *         .fileName("Landing Page")
 *         .projectStack("Next.js + Tailwind")
 *         .hasDesignTokens(true)
 *         .build());
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImplementationPlanFormatter {

    static final String TEMPLATE = "templates/implementation-plan.mustache";
    private static final double FULL_WIDTH_RATIO = 0.8;
    private static final long HERO_MIN_HEIGHT = 400;

    private final ImageImportanceClassifier imageImportanceClassifier;
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private Mustache template;

    @Value
    @Builder
    public static class PlanOptions {
        String fileName;
        String projectStack;
        boolean hasDesignTokens;
        @Builder.Default
        List<String> fontNames = List.of();
        boolean imagesDownloaded;
        int iconCount;
    }

    @PostConstruct
    public void loadTemplate() {
        try {
            template = mustacheFactory.compile(TEMPLATE);
            log.info("Loaded plan template: {}", TEMPLATE);
        } catch (Exception e) {
            log.error("Failed to load plan template {}", TEMPLATE, e);
            throw new IllegalStateException("Plan template initialization failed", e);
        }
    }

    public String render(List<SectionSummary> sections, PlanOptions options) {
        List<PlanTask> tasks = new ArrayList<>();
        int taskNumber = 1;
        tasks.add(setupTask(taskNumber, sections, options));
        for (SectionSummary section : sections) {
            tasks.add(sectionTask(++taskNumber, section));
        }

        Map<String, Object> scope = new HashMap<>();
        scope.put("fileName", options.getFileName());
        scope.put("tasks", tasks);
        scope.put("alternatingLayout", hasAlternatingLayout(sections));
        scope.put("polish", polishTask(taskNumber + 1, sections.size()));

        StringWriter writer = new StringWriter();
        template.execute(writer, scope);
        log.debug("Rendered implementation plan with {} section tasks", sections.size());
        return writer.toString();
    }

    private static PlanTask setupTask(int number, List<SectionSummary> sections, PlanOptions options) {
        PlanTask.Builder task = PlanTask.builder(number, "Project setup and design tokens");
        task.item(options.getProjectStack() != null
                ? "Verify " + options.getProjectStack() + " project structure"
                : "Initialize project structure");
        task.item(options.isHasDesignTokens()
                ? "Configure design tokens in @theme (colors, fonts, spacing from spec)"
                : "Extract colors, fonts, and spacing from spec into CSS variables/@theme");
        task.item(!options.getFontNames().isEmpty()
                ? "Import Google Fonts: " + String.join(", ", options.getFontNames())
                : "Import fonts referenced in the spec via Google Fonts");

        if (options.isImagesDownloaded()) {
            int totalImages = sections.stream().mapToInt(section -> section.getImages().size()).sum();
            List<String> assets = new ArrayList<>();
            if (totalImages > 0) {
                assets.add(totalImages + " image(s) in public/images/");
            }
            if (options.getIconCount() > 0) {
                assets.add(options.getIconCount() + " icon(s) in public/images/icons/");
            }
            if (!assets.isEmpty()) {
                task.item("Verify downloaded assets: " + String.join(", ", assets));
            }
        }
        return task.build();
    }

    private PlanTask sectionTask(int number, SectionSummary section) {
        String dimensions = section.getDimensions() != null
                ? " (" + section.getDimensions().width() + " x " + section.getDimensions().height() + "px)"
                : "";
        PlanTask.Builder task = PlanTask.builder(number, "Implement " + section.getName() + dimensions);

        task.item(section.getLayout() != null
                ? "Build layout: " + layout(section.getLayout())
                : "Build " + section.getName() + " layout structure");
        if (section.getBackground() != null) {
            task.item("Background: " + section.getBackground());
        }

        if (section.getCompositeImage() != null) {
            addComposite(task, section);
        } else if (!section.getImages().isEmpty()) {
            addImages(task, section);
        }

        List<String> icons = section.getIcons();
        if (!icons.isEmpty()) {
            task.item(icons.size() <= 3
                    ? "Add icons: " + String.join(", ", icons)
                    : "Add " + icons.size() + " icons from public/images/icons/");
        }

        section.getNotableComponents().forEach(component -> addNotableComponent(task, component));

        if (section.getTypography().isEmpty()) {
            task.item("Apply typography and text content from spec");
        } else {
            section.getTypography().forEach(usage -> task.item(typography(usage)));
        }

        if (section.getBorder() != null) {
            task.item("Border: " + section.getBorder());
        }
        if (section.getBorderRadius() != null) {
            task.item("Border radius: " + section.getBorderRadius());
        }
        section.getEffects().forEach(effect -> task.item("Effect: " + effect));
        if (section.getScrollBehavior() != null) {
            String behavior = section.getScrollBehavior();
            task.item("Scroll behavior: " + behavior + " (position: " + behavior
                    + ("sticky".equals(behavior) ? "; top: 0" : "") + ")");
        }

        boolean hasPersonImage = section.getImages().stream()
                .anyMatch(image -> imageImportanceClassifier.looksLikePerson(image.path()));
        task.item(hasPersonImage
                ? "Add responsive breakpoints — ensure person images remain visible at all sizes "
                + "(never display:none; use object-position: top center for cropping)"
                : "Add responsive breakpoints");
        return task.build();
    }

    static String layout(SectionLayout layout) {
        List<String> parts = new ArrayList<>();
        parts.add("flex " + (layout.direction() != null ? layout.direction() : "column"));
        if (layout.gap() != null) {
            parts.add("gap " + CssValues.number(layout.gap()) + "px");
        }
        if (layout.rowGap() != null) {
            parts.add("row-gap " + CssValues.number(layout.rowGap()) + "px");
        }
        if (layout.padding() != null) {
            parts.add("padding " + layout.padding());
        }
        if (layout.wrap()) {
            parts.add("flex-wrap");
        }
        if (layout.mainAlign() != null) {
            parts.add("main-axis " + layout.mainAlign());
        }
        if (layout.crossAlign() != null) {
            parts.add("cross-axis " + layout.crossAlign());
        }
        return String.join(", ", parts);
    }

    private static void addComposite(PlanTask.Builder task, SectionSummary section) {
        SectionSummary.CompositeImage composite = section.getCompositeImage();
        boolean hero = section.getDimensions() != null && section.getDimensions().height() >= HERO_MIN_HEIGHT;
        String minHeight = hero ? ", min-height " + section.getDimensions().height() + "px" : "";

        if (composite.hasTextOverlays()) {
            task.item("Add parallax hero background: " + composite.path() + " (" + composite.dimensions()
                    + "), full-bleed cover" + minHeight);
            task.item("Layer ALL text content over hero background with z-index stacking "
                    + "(text is NOT in the composite image)");
            if (hero) {
                task.item("Ensure visual layers create depth effect with text overlaid on top");
            }
        } else {
            task.item("Add composite background: " + composite.path() + " (" + composite.dimensions() + "), cover"
                    + minHeight);
            task.item("Position content over background with z-index layering");
        }
    }

    private void addImages(PlanTask.Builder task, SectionSummary section) {
        List<SectionImage> fullWidth = section.getDimensions() == null ? List.of()
                : section.getImages().stream()
                .filter(image -> width(image.dimensions()) >= section.getDimensions().width() * FULL_WIDTH_RATIO)
                .toList();

        // a single full-width image is an ordinary image, two or more form a layered stack
        if (fullWidth.size() > 1) {
            task.item("Layer " + fullWidth.size() + " overlapping images to create depth/parallax effect");
            task.note("Stack images using absolute positioning with ascending z-index");
            task.note("Later images in the list are on top (higher z-index)");
            for (SectionImage image : fullWidth) {
                String ratio = aspectRatio(image.dimensions());
                task.note(image.path() + " (" + image.dimensions() + ")"
                        + (ratio != null ? " (aspect-ratio: " + ratio + ")" : "") + ", " + scaleMode(image));
            }
        }

        for (SectionImage image : section.getImages()) {
            if (fullWidth.size() > 1 && fullWidth.contains(image)) {
                continue;
            }
            if (image.hero()) {
                task.item("Add hero background: " + image.path() + " (" + image.dimensions()
                        + "), cover, min-height from spec");
                task.item("Position content over background with z-index layering");
            } else {
                String ratio = aspectRatio(image.dimensions());
                task.item("Add image: " + image.path() + " (" + image.dimensions()
                        + (ratio != null ? ", aspect-ratio: " + ratio : "") + "), " + scaleMode(image));
            }
            if (imageImportanceClassifier.looksLikePerson(image.path())) {
                task.note("**CRITICAL**: Person image — must remain visible at ALL breakpoints (see Universal Rules above)");
            }
        }
    }

    private static void addNotableComponent(PlanTask.Builder task, NotableComponent component) {
        List<String> notes = new ArrayList<>();
        notes.add("Size " + component.dimensions() + " at (" + component.x() + ", " + component.y()
                + ") relative to the section");
        if (component.positionHint() != null) {
            notes.add("Position: `" + component.positionHint() + "`");
        }
        if (component.overlapping()) {
            notes.add("Overlaps sibling content: use `position: absolute` and a z-index above the content it covers");
        }
        if (component.scrollBehavior() != null) {
            notes.add("Scroll behavior: " + component.scrollBehavior());
        }
        if (!component.textContent().isEmpty()) {
            notes.add("Text: " + String.join(" / ", component.textContent()));
        }
        task.item("Add " + component.category().label() + " \"" + component.name() + "\"", notes);
    }

    static String typography(TypographyUsage usage) {
        List<String> parts = new ArrayList<>();
        parts.add(usage.font() + " " + CssValues.number(usage.size()) + "px");
        if (usage.lineHeight() != null && usage.lineHeight() != 0) {
            parts.add("/" + usage.lineHeight() + "px");
        }
        parts.add("weight " + CssValues.number(usage.weight()));
        if (usage.color() != null) {
            parts.add("color " + usage.color());
        }
        return usage.usage() + ": " + String.join(" ", parts);
    }

    private static boolean hasAlternatingLayout(List<SectionSummary> sections) {
        if (sections.size() < 3) {
            return false;
        }
        long withImages = sections.stream()
                .filter(section -> !section.getImages().isEmpty() && section.getCompositeImage() == null)
                .count();
        return withImages >= 2;
    }

    private static PlanTask polishTask(int number, int sectionCount) {
        if (sectionCount > 1) {
            return PlanTask.builder(number, "Polish and cross-section integration")
                    .item("Compare implementation against frame screenshots in public/images/screenshots/")
                    .item("Verify consistent spacing and alignment between sections")
                    .item("Test responsive behavior across mobile/tablet/desktop")
                    .item("Fix any visual discrepancies")
                    .build();
        }
        if (sectionCount == 1) {
            return PlanTask.builder(number, "Polish and verification")
                    .item("Compare against frame screenshots in public/images/screenshots/")
                    .item("Test responsive behavior")
                    .build();
        }
        return null;
    }

    private static String scaleMode(SectionImage image) {
        return image.scaleMode() != null ? image.scaleMode().toLowerCase(Locale.ROOT) : "fill";
    }

    private static double width(String dimensions) {
        long[] size = parseDimensions(dimensions);
        return size != null ? size[0] : 0;
    }

    static String aspectRatio(String dimensions) {
        long[] size = parseDimensions(dimensions);
        if (size == null || size[0] == 0 || size[1] == 0) {
            return null;
        }
        return CssValues.fixed2((double) size[0] / size[1]);
    }

    private static long[] parseDimensions(String dimensions) {
        if (dimensions == null) {
            return null;
        }
        String[] parts = dimensions.split("x");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new long[]{Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim())};
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed image dimensions '{}'", dimensions);
            return null;
        }
    }
}
