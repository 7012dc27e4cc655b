package com.purchasingpower.designflow.model.figma;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Parsed Figma identifier.
 *
 * @see com.purchasingpower.designflow.service.figma.FigmaUrlParser
 */
@Data
@AllArgsConstructor
public class FigmaFileReference {

    /**
     * File key, the path segment after /file/ or /design/.
     */
    private String fileKey;

    /**
     * Node ids in API (colon) form, empty when the identifier selects the whole file.
     */
    private List<String> nodeIds;

    /**
     * File name decoded from the URL slug, null for bare keys.
     */
    private String fileName;
}
