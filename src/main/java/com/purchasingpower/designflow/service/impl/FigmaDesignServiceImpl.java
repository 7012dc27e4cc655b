package com.purchasingpower.designflow.service.impl;

import com.purchasingpower.designflow.client.FigmaClient;
import com.purchasingpower.designflow.configuration.AppProperties;
import com.purchasingpower.designflow.configuration.FigmaProperties;
import com.purchasingpower.designflow.exception.FigmaApiException;
import com.purchasingpower.designflow.model.Enrichment;
import com.purchasingpower.designflow.model.content.ExtractedContent;
import com.purchasingpower.designflow.model.design.CompositeGroup;
import com.purchasingpower.designflow.model.design.FontCheckResult;
import com.purchasingpower.designflow.model.design.IconInfo;
import com.purchasingpower.designflow.model.design.ImageRefInfo;
import com.purchasingpower.designflow.model.design.ResolvedAssets;
import com.purchasingpower.designflow.model.design.SectionSummary;
import com.purchasingpower.designflow.model.document.DesignDocument;
import com.purchasingpower.designflow.model.document.FetchMode;
import com.purchasingpower.designflow.model.document.FetchOptions;
import com.purchasingpower.designflow.model.figma.DesignFile;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.FigmaFileReference;
import com.purchasingpower.designflow.model.figma.ImageFillsResponse;
import com.purchasingpower.designflow.model.figma.ImagesResponse;
import com.purchasingpower.designflow.model.figma.NodeType;
import com.purchasingpower.designflow.model.figma.NodesResponse;
import com.purchasingpower.designflow.model.tokens.DesignTokens;
import com.purchasingpower.designflow.model.tokens.TokenFormat;
import com.purchasingpower.designflow.service.FigmaDesignService;
import com.purchasingpower.designflow.service.analysis.CompositeGroupDetector;
import com.purchasingpower.designflow.service.analysis.PrimaryFrameSelector;
import com.purchasingpower.designflow.service.analysis.SectionSummaryExtractor;
import com.purchasingpower.designflow.service.assets.FontChecker;
import com.purchasingpower.designflow.service.assets.IconCollector;
import com.purchasingpower.designflow.service.assets.ImageRefCollector;
import com.purchasingpower.designflow.service.figma.FigmaUrlParser;
import com.purchasingpower.designflow.service.format.ContentExtractor;
import com.purchasingpower.designflow.service.format.ContentFormatter;
import com.purchasingpower.designflow.service.format.DesignSpecFormatter;
import com.purchasingpower.designflow.service.format.DesignTokenExtractor;
import com.purchasingpower.designflow.service.format.DesignTokenFormatter;
import com.purchasingpower.designflow.service.format.ImplementationPlanFormatter;
import com.purchasingpower.designflow.service.format.ImplementationPlanFormatter.PlanOptions;
import com.purchasingpower.designflow.util.CssValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link FigmaDesignService}.
 *
 * <p>Spec mode spends as few API requests as possible: one essential file (or nodes) fetch, one
 * image-fill lookup when the design has images, then at most three best-effort renders (icon SVGs,
 * frame screenshots, composite layers) separated by fixed pauses. The renders are skipped entirely
 * once the client has flagged the account as low-budget. Every best-effort outcome is recorded in
 * the document metadata under {@code enrichments}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FigmaDesignServiceImpl implements FigmaDesignService {

    private final FigmaClient figmaClient;
    private final FigmaUrlParser urlParser;
    private final AppProperties appProperties;
    private final FontChecker fontChecker;
    private final ImageRefCollector imageRefCollector;
    private final IconCollector iconCollector;
    private final CompositeGroupDetector compositeGroupDetector;
    private final PrimaryFrameSelector primaryFrameSelector;
    private final DesignSpecFormatter specFormatter;
    private final SectionSummaryExtractor sectionSummaryExtractor;
    private final DesignTokenExtractor tokenExtractor;
    private final DesignTokenFormatter tokenFormatter;
    private final ContentExtractor contentExtractor;
    private final ContentFormatter contentFormatter;
    private final ImplementationPlanFormatter planFormatter;

    @Override
    public DesignDocument fetch(String identifier, FetchOptions options) {
        FetchOptions effective = options != null ? options : FetchOptions.defaults();
        FigmaFileReference reference = urlParser.parse(identifier, effective.getNodeIds());
        FetchMode mode = effective.getMode() != null ? effective.getMode() : FetchMode.SPEC;
        log.info("Fetching Figma file {} (mode: {}, nodes: {})", reference.getFileKey(), mode.value(),
                reference.getNodeIds());

        return switch (mode) {
            case SPEC -> buildSpec(reference).document();
            case TOKENS -> fetchTokens(reference, effective.getTokenFormat());
            case CONTENT -> fetchContent(reference);
            case PLAN -> fetchPlan(reference, effective.getProjectStack());
        };
    }

    private SpecBuild buildSpec(FigmaFileReference reference) {
        String fileKey = reference.getFileKey();
        FigmaProperties figma = appProperties.getFigma();
        Map<String, String> enrichments = new LinkedHashMap<>();

        // page ids do not narrow the scope and a full-file fetch also yields the tokens
        List<String> specificIds = FigmaUrlParser.specificNodeIds(reference.getNodeIds());
        DesignFile file = null;
        List<DesignNode> nodes;
        String fileName;
        if (!specificIds.isEmpty()) {
            NodesResponse response = figmaClient.getNodes(fileKey, specificIds);
            fileName = response.getName();
            nodes = response.documents();
        } else {
            file = figmaClient.getFile(fileKey);
            fileName = file.getName();
            nodes = file.pages();
        }

        List<FontCheckResult> fontChecks = fontChecker.check(fontChecker.collectFontFamilies(nodes));
        Map<String, String> fontSubstitutions = FontChecker.substitutionMap(fontChecks);

        List<ImageRefInfo> imageRefs = imageRefCollector.collect(nodes);
        Map<String, String> imageFillUrls = Map.of();
        if (!imageRefs.isEmpty()) {
            Enrichment<ImageFillsResponse> fills = resolveImageFills(fileKey);
            enrichments.put("imageFills", fills.describe());
            imageFillUrls = fills.valueIfPresent().map(response -> nonNullUrls(response.imageUrls())).orElse(Map.of());
        }

        List<IconInfo> icons = iconCollector.collect(nodes, figma.getIconLimit());
        List<CompositeGroup> composites = compositeGroupDetector.detect(nodes);

        Map<String, String> exportedIcons = new LinkedHashMap<>();
        Map<String, String> iconSvgUrls = new LinkedHashMap<>();
        Map<String, String> frameScreenshots = new LinkedHashMap<>();
        Map<String, String> compositeImages = new LinkedHashMap<>();
        Set<String> compositeTextOverlays = new LinkedHashSet<>();
        Map<String, String> compositeRenderUrls = new LinkedHashMap<>();
        Map<String, List<String>> compositeLayers = new LinkedHashMap<>();

        if (figmaClient.isLowBudget()) {
            log.info("Low-budget plan detected, skipping icon, screenshot and composite renders for {}", fileKey);
            enrichments.put("renders", Enrichment.skipped("low-budget plan detected").describe());
        } else {
            Set<String> compositeIds = new HashSet<>();
            composites.forEach(group -> compositeIds.add(group.nodeId()));
            List<String> screenshotIds = topLevelFrameIds(nodes, figma.getScreenshotLimit()).stream()
                    .filter(id -> !compositeIds.contains(id))
                    .toList();
            List<String> iconIds = icons.stream().map(IconInfo::nodeId).toList();

            if (!iconIds.isEmpty() || !screenshotIds.isEmpty()) {
                figmaClient.pause(figma.getInterCallDelay());

                if (!iconIds.isEmpty()) {
                    Enrichment<ImagesResponse> svg = figmaClient.renderImages(fileKey, iconIds, "svg", null);
                    enrichments.put("iconSvgs", svg.describe());
                    svg.valueIfPresent().ifPresent(response -> {
                        for (IconInfo icon : icons) {
                            if (response.hasImage(icon.nodeId())) {
                                iconSvgUrls.put(icon.nodeId(), response.getImages().get(icon.nodeId()));
                                exportedIcons.put(icon.nodeId(), icon.filename());
                            }
                        }
                    });
                }

                if (!screenshotIds.isEmpty()) {
                    if (!iconIds.isEmpty()) {
                        figmaClient.pause(figma.getScreenshotDelay());
                    }
                    Enrichment<ImagesResponse> screenshots = figmaClient.renderImages(fileKey, screenshotIds, "png", 2);
                    enrichments.put("screenshots", screenshots.describe());
                    screenshots.valueIfPresent().ifPresent(response -> frameScreenshots.putAll(nonNullUrls(response.getImages())));
                }
            }

            if (!composites.isEmpty()) {
                figmaClient.pause(figma.getInterCallDelay());
                Enrichment<ImagesResponse> renders =
                        figmaClient.renderImages(fileKey, compositeRenderIds(composites), "png", 2);
                enrichments.put("composites", renders.describe());
                renders.valueIfPresent().ifPresent(response -> {
                    compositeRenderUrls.putAll(nonNullUrls(response.getImages()));
                    for (CompositeGroup group : composites) {
                        List<String> layerIds = layerIds(group);
                        if (!layerIds.stream().allMatch(response::hasImage)) {
                            continue;
                        }
                        compositeImages.put(group.nodeId(), "/images/composite-" + CssValues.slug(group.name()) + ".png");
                        if (group.hasTextOverlays()) {
                            compositeTextOverlays.add(group.nodeId());
                            compositeLayers.put(group.nodeId(), layerIds.stream()
                                    .map(id -> response.getImages().get(id))
                                    .toList());
                        }
                    }
                });
            }
        }

        ResolvedAssets assets = new ResolvedAssets(imageFillUrls, exportedIcons, compositeImages,
                compositeTextOverlays, fontSubstitutions);

        String content = specFormatter.format(nodes, fileName, assets);
        String fontTable = fontChecker.substitutionMarkdown(fontChecks);
        if (!fontTable.isEmpty()) {
            content = content + "\n" + fontTable;
        }
        List<SectionSummary> sections = sectionSummaryExtractor.extract(nodes, assets);

        String tokensContent = null;
        if (file != null) {
            DesignTokens tokens = tokenExtractor.extract(file);
            if (tokens.totalCount() > 0) {
                tokensContent = tokenFormatter.cssSummary(fileName, tokens);
            }
        }

        String contentMarkdown = contentFormatter.toMarkdown(contentExtractor.extract(nodes, fileName));
        String contentStructure = contentFormatter.compactSummary(contentMarkdown);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "figma");
        metadata.put("mode", FetchMode.SPEC.value());
        metadata.put("fileKey", fileKey);
        metadata.put("nodeCount", nodes.size());
        metadata.put("fontChecks", fontChecks);
        metadata.put("fontSubstitutions", fontTable.isEmpty() ? null : fontTable);
        metadata.put("imageRefs", imageRefs);
        metadata.put("imageFillUrls", imageFillUrls);
        metadata.put("imageCount", imageRefs.size());
        metadata.put("frameScreenshots", frameScreenshots);
        metadata.put("iconNodes", icons);
        metadata.put("iconSvgUrls", iconSvgUrls);
        metadata.put("tokensContent", tokensContent);
        metadata.put("contentStructure", contentStructure == null || contentStructure.isEmpty() ? null : contentStructure);
        metadata.put("compositeNodes", composites.isEmpty() ? null : composites);
        metadata.put("compositeRenderUrls", compositeRenderUrls.isEmpty() ? null : compositeRenderUrls);
        metadata.put("compositeImages", compositeImages.isEmpty() ? null : compositeImages);
        metadata.put("compositeTextOverlays", compositeTextOverlays.isEmpty() ? null : List.copyOf(compositeTextOverlays));
        metadata.put("compositeLayers", compositeLayers.isEmpty() ? null : compositeLayers);
        metadata.put("sectionSummaries", sections.isEmpty() ? null : sections);
        metadata.put("enrichments", enrichments);
        metadata.values().removeIf(value -> value == null);

        log.info("Compiled design spec for {} ({} nodes, {} icons, {} composites, low-budget: {})",
                fileName, nodes.size(), exportedIcons.size(), compositeImages.size(), figmaClient.isLowBudget());

        DesignDocument document = DesignDocument.builder()
                .content(content)
                .source("figma:" + fileKey)
                .title(fileName)
                .metadata(metadata)
                .build();
        return new SpecBuild(document, fileName, sections, fontChecks, tokensContent != null,
                !imageFillUrls.isEmpty(), exportedIcons.size());
    }

    private Enrichment<ImageFillsResponse> resolveImageFills(String fileKey) {
        try {
            return Enrichment.succeeded(figmaClient.getImageFills(fileKey));
        } catch (FigmaApiException e) {
            log.warn("Image fill lookup failed for {}, continuing without image downloads: {}", fileKey, e.getMessage());
            return Enrichment.failed(e.getMessage());
        }
    }

    private DesignDocument fetchTokens(FigmaFileReference reference, TokenFormat requested) {
        TokenFormat format = requested != null ? requested : TokenFormat.CSS;
        DesignFile file = figmaClient.getFile(reference.getFileKey());
        DesignTokens tokens = tokenExtractor.extract(file);

        Map<String, Integer> tokenCounts = new LinkedHashMap<>();
        tokenCounts.put("colors", tokens.getColors().size());
        tokenCounts.put("typography", tokens.getTypography().size());
        tokenCounts.put("shadows", tokens.getShadows().size());
        tokenCounts.put("radii", tokens.getRadii().size());
        tokenCounts.put("spacing", tokens.getSpacing().size());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "figma");
        metadata.put("mode", FetchMode.TOKENS.value());
        metadata.put("format", format.value());
        metadata.put("fileKey", reference.getFileKey());
        metadata.put("tokenCounts", tokenCounts);

        log.info("Extracted {} design tokens from {} as {}", tokens.totalCount(), file.getName(), format.value());
        return DesignDocument.builder()
                .content(tokenFormatter.document(file.getName(), tokens, format))
                .source("figma:" + reference.getFileKey() + ":tokens")
                .title(file.getName() + " - Design Tokens")
                .metadata(metadata)
                .build();
    }

    private DesignDocument fetchContent(FigmaFileReference reference) {
        String fileKey = reference.getFileKey();
        List<DesignNode> nodes;
        String fileName;
        if (!reference.getNodeIds().isEmpty()) {
            NodesResponse response = figmaClient.getNodes(fileKey, reference.getNodeIds());
            fileName = response.getName();
            nodes = response.documents();
        } else {
            DesignFile file = figmaClient.getFile(fileKey);
            fileName = file.getName();
            nodes = file.pages();
        }

        ExtractedContent extracted = contentExtractor.extract(nodes, fileName);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", "figma");
        metadata.put("mode", FetchMode.CONTENT.value());
        metadata.put("fileKey", fileKey);
        metadata.put("stats", extracted.stats());
        metadata.put("navigation", extracted.navigation());
        metadata.put("extractedContent", extracted);

        return DesignDocument.builder()
                .content(contentFormatter.toMarkdown(extracted))
                .source("figma:" + fileKey + ":content")
                .title(fileName + " - Content Extraction")
                .metadata(metadata)
                .build();
    }

    private DesignDocument fetchPlan(FigmaFileReference reference, String projectStack) {
        SpecBuild spec = buildSpec(reference);

        PlanOptions options = PlanOptions.builder()
                .fileName(spec.fileName())
                .projectStack(projectStack)
                .hasDesignTokens(spec.hasTokens())
                .fontNames(fontNames(spec.fontChecks()))
                .imagesDownloaded(spec.imagesResolved() || spec.iconCount() > 0)
                .iconCount(spec.iconCount())
                .build();
        String plan = planFormatter.render(spec.sections(), options);

        Map<String, Object> metadata = new LinkedHashMap<>(spec.document().getMetadata());
        metadata.put("mode", FetchMode.PLAN.value());
        metadata.put("spec", spec.document().getContent());
        metadata.put("taskCount", spec.sections().size() + (spec.sections().isEmpty() ? 1 : 2));

        return DesignDocument.builder()
                .content(plan)
                .source(spec.document().getSource() + ":plan")
                .title(spec.fileName() + " - Implementation Plan")
                .metadata(metadata)
                .build();
    }

    /**
     * Fonts to import: Google fonts as used, substitutes for the rest.
     */
    static List<String> fontNames(List<FontCheckResult> checks) {
        Set<String> names = new LinkedHashSet<>();
        for (FontCheckResult check : checks) {
            if (check.googleFont()) {
                names.add(check.fontFamily());
            } else if (check.suggestedAlternative() != null) {
                names.add(check.suggestedAlternative());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Primary frames of each page, or requested nodes that are frames themselves.
     */
    List<String> topLevelFrameIds(List<DesignNode> nodes, int limit) {
        List<String> frameIds = new ArrayList<>();
        for (DesignNode node : nodes) {
            if (frameIds.size() >= limit) {
                break;
            }
            if (!node.isVisible()) {
                continue;
            }
            if (node.getType() == NodeType.CANVAS && node.getChildren() != null) {
                for (DesignNode child : primaryFrameSelector.select(node.getChildren())) {
                    if (child.getType() == NodeType.FRAME && child.isVisible() && frameIds.size() < limit) {
                        frameIds.add(child.getId());
                    }
                }
            } else if (node.getType() == NodeType.FRAME) {
                frameIds.add(node.getId());
            }
        }
        return frameIds;
    }

    /**
     * A pure composite renders as a whole; one with text overlays renders its visual layers only,
     * since the render endpoint would bake the text into the bitmap.
     */
    private static List<String> layerIds(CompositeGroup group) {
        return group.hasTextOverlays() && group.visualChildIds() != null ? group.visualChildIds() : List.of(group.nodeId());
    }

    private static List<String> compositeRenderIds(List<CompositeGroup> composites) {
        Set<String> ids = new LinkedHashSet<>();
        composites.forEach(group -> ids.addAll(layerIds(group)));
        return new ArrayList<>(ids);
    }

    /**
     * Render and fill endpoints map ids they could not resolve to {@code null}.
     */
    private static Map<String, String> nonNullUrls(Map<String, String> images) {
        Map<String, String> urls = new LinkedHashMap<>();
        if (images != null) {
            images.forEach((id, url) -> {
                if (url != null) {
                    urls.put(id, url);
                }
            });
        }
        return urls;
    }

    private record SpecBuild(
            DesignDocument document,
            String fileName,
            List<SectionSummary> sections,
            List<FontCheckResult> fontChecks,
            boolean hasTokens,
            boolean imagesResolved,
            int iconCount
    ) {
    }
}
