package com.purchasingpower.designflow.model.content;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.designflow.model.figma.BoundingBox;

import java.util.List;

/**
 * One TEXT node with its classified role and where it sits in the frame hierarchy.
 *
 * @param framePath   names of the enclosing page and frames, outermost first
 * @param parentFrame the container the text was found in, {@code null} for a top-level text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedText(
        String id,
        String text,
        SemanticRole role,
        String nodeName,
        List<String> framePath,
        TextStyle style,
        BoundingBox bounds,
        ParentFrame parentFrame
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TextStyle(
            String fontFamily,
            Double fontSize,
            Double fontWeight,
            Double lineHeight,
            Double letterSpacing,
            String textAlign
    ) {
    }

    public record ParentFrame(String id, String name, String type) {
    }
}
