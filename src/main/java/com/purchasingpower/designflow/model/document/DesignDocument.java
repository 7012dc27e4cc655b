package com.purchasingpower.designflow.model.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A compiled design artifact.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesignDocument {

    private String content;

    /**
     * {@code figma:<fileKey>} with a {@code :tokens}, {@code :content} or {@code :plan} suffix
     * for the non-spec modes.
     */
    private String source;

    private String title;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
