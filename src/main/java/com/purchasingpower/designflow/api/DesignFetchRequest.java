package com.purchasingpower.designflow.api;

import com.purchasingpower.designflow.model.document.FetchMode;
import com.purchasingpower.designflow.model.tokens.TokenFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Design fetch request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesignFetchRequest {

    /**
     * Figma URL or bare file key.
     */
    private String identifier;
    private FetchMode mode;
    private TokenFormat tokenFormat;
    private String nodeIds;
    private String projectStack;
}
