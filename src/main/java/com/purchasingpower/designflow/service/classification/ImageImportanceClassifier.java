package com.purchasingpower.designflow.service.classification;

import com.purchasingpower.designflow.model.design.ImageImportance;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ranks how important an image is for responsive layouts.
 *
 * <p>Pictures of people are the key visual of almost any page and must never disappear at a
 * breakpoint; images that dominate their section or show the product come next.
 */
@Component
public class ImageImportanceClassifier {

    static final Pattern PERSON = Pattern.compile(
            "\\b(person|people|portrait|photo|avatar|team|founder|headshot|profile|model|woman|man|face|selfie"
                    + "|human|client|testimonial)\\b");
    static final Pattern HERO_IMAGE = Pattern.compile("\\b(hero.*(image|photo|pic|img))\\b");
    static final Pattern KEY_CONTENT = Pattern.compile(
            "\\b(product|feature|showcase|main|key|primary|highlight|mockup|screenshot|demo)\\b");

    private static final Pattern PERSON_ASSET = Pattern.compile(
            "person|people|portrait|photo|avatar|team|founder|headshot|model|woman|man|face");

    static final String PERSON_HINT = "Contains a person/people — this is the KEY visual element. "
            + "MUST remain visible at ALL viewport sizes. Use `object-position: top center` to keep the "
            + "face/upper body visible when cropping. NEVER use `display: none` or `visibility: hidden` on "
            + "this image at any breakpoint.";
    static final String LARGE_HINT = "Large primary image — keep visible at all breakpoints. "
            + "On smaller screens, scale proportionally rather than hiding.";
    static final String KEY_CONTENT_HINT = "Key content image — must remain visible and prominent at all breakpoints.";

    private static final double DOMINANT_AREA_RATIO = 0.3;

    /**
     * @param box     the image node's box, may be null
     * @param section the enclosing section's box, may be null
     */
    public Optional<ImageImportance> classify(String nodeName, BoundingBox box, BoundingBox section) {
        String lower = nodeName == null ? "" : nodeName.toLowerCase(Locale.ROOT);

        if (PERSON.matcher(lower).find() || HERO_IMAGE.matcher(lower).find()) {
            return Optional.of(new ImageImportance(ImageImportance.Priority.CRITICAL, PERSON_HINT));
        }
        if (box != null && section != null && section.area() > 0
                && box.area() / section.area() > DOMINANT_AREA_RATIO) {
            return Optional.of(new ImageImportance(ImageImportance.Priority.HIGH, LARGE_HINT));
        }
        if (KEY_CONTENT.matcher(lower).find()) {
            return Optional.of(new ImageImportance(ImageImportance.Priority.HIGH, KEY_CONTENT_HINT));
        }
        return Optional.empty();
    }

    /**
     * Whether an asset path or name points at a picture of a person.
     */
    public boolean looksLikePerson(String pathOrName) {
        return pathOrName != null && PERSON_ASSET.matcher(pathOrName.toLowerCase(Locale.ROOT)).find();
    }
}
