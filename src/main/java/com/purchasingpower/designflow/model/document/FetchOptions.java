package com.purchasingpower.designflow.model.document;

import com.purchasingpower.designflow.model.tokens.TokenFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options of a design fetch.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchOptions {

    @Builder.Default
    private FetchMode mode = FetchMode.SPEC;

    /**
     * Output format of {@link FetchMode#TOKENS}.
     */
    @Builder.Default
    private TokenFormat tokenFormat = TokenFormat.CSS;

    /**
     * Comma-separated node ids merged with the ones in the URL.
     */
    private String nodeIds;

    /**
     * Target stack named in the plan's setup task, e.g. "Next.js + Tailwind".
     */
    private String projectStack;

    public static FetchOptions defaults() {
        return FetchOptions.builder().build();
    }
}
