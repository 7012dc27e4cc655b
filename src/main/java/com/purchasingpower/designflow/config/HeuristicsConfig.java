package com.purchasingpower.designflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable thresholds of the geometric heuristics.
 *
 * <p>The values were chosen empirically and are exposed so they can be calibrated against real
 * files. Properties are loaded from the {@code app.heuristics} namespace in application.yml:
 * <pre>
 * app:
 *   heuristics:
 *     overlap-threshold: 0.30
 *     min-composite-size: 200
 *     row-tolerance-px: 20
 *     row-tolerance-ratio: 0.05
 *     justify-tolerance-px: 20
 *     justify-substantial-px: 40
 *     equal-gap-variance-px: 10
 * </pre>
 *
 * <p>Unit tests use {@link #defaults()} instead of a Spring context.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.heuristics")
@Data
public class HeuristicsConfig {

    /**
     * Minimum intersection area, as a fraction of the smaller box, for two layers to count as
     * overlapping. Default: 0.30
     */
    private double overlapThreshold = 0.30;

    /**
     * Minimum width and height of a composite candidate container. Default: 200
     */
    private double minCompositeSize = 200;

    /**
     * Upper bound of the edge-alignment tolerance used to detect rows and columns. Default: 20
     */
    private double rowTolerancePx = 20;

    /**
     * Edge-alignment tolerance as a fraction of the parent's cross-axis size; the smaller of this
     * and {@link #rowTolerancePx} wins. Default: 0.05
     */
    private double rowToleranceRatio = 0.05;

    /**
     * Leading/trailing space below this is "near zero" when inferring justification. Default: 20
     */
    private double justifyTolerancePx = 20;

    /**
     * Leading/trailing space above this is "substantial" when inferring justification. Default: 40
     */
    private double justifySubstantialPx = 40;

    /**
     * Maximum spread between the largest and smallest gap for gaps to count as equal. Default: 10
     */
    private double equalGapVariancePx = 10;

    public static HeuristicsConfig defaults() {
        return new HeuristicsConfig();
    }

    public double edgeTolerance(double crossAxisSize) {
        return Math.min(rowTolerancePx, crossAxisSize * rowToleranceRatio);
    }
}
