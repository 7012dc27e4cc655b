package com.purchasingpower.designflow.model.design;

import java.util.Map;
import java.util.Set;

/**
 * Assets resolved earlier in a run that rendered documents point at.
 *
 * @param imageFillUrls         image ref to download URL
 * @param exportedIcons         icon node id to SVG file name
 * @param compositeImages       composite node id to {@code /images/composite-<slug>.png}
 * @param compositeTextOverlays ids of composites whose text is laid on top of the image
 * @param fontSubstitutions     commercial family to Google Fonts substitute
 */
public record ResolvedAssets(
        Map<String, String> imageFillUrls,
        Map<String, String> exportedIcons,
        Map<String, String> compositeImages,
        Set<String> compositeTextOverlays,
        Map<String, String> fontSubstitutions
) {

    public ResolvedAssets {
        imageFillUrls = imageFillUrls != null ? Map.copyOf(imageFillUrls) : Map.of();
        exportedIcons = exportedIcons != null ? Map.copyOf(exportedIcons) : Map.of();
        compositeImages = compositeImages != null ? Map.copyOf(compositeImages) : Map.of();
        compositeTextOverlays = compositeTextOverlays != null ? Set.copyOf(compositeTextOverlays) : Set.of();
        fontSubstitutions = fontSubstitutions != null ? Map.copyOf(fontSubstitutions) : Map.of();
    }

    public static ResolvedAssets none() {
        return new ResolvedAssets(Map.of(), Map.of(), Map.of(), Set.of(), Map.of());
    }

    public boolean hasImageDownload(String imageRef) {
        return imageRef != null && imageFillUrls.containsKey(imageRef);
    }
}
