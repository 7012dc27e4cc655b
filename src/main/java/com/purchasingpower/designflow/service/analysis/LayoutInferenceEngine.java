package com.purchasingpower.designflow.service.analysis;

import com.purchasingpower.designflow.config.HeuristicsConfig;
import com.purchasingpower.designflow.model.design.InferredLayout;
import com.purchasingpower.designflow.model.figma.BoundingBox;
import com.purchasingpower.designflow.model.figma.DesignNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives a flex layout from raw child coordinates when a container has no auto-layout.
 *
 * <p>Community files are often drawn without auto-layout. Children whose top edges line up form
 * a row, children whose left edges line up form a column, anything else stays absolute. The
 * result is a hint for the reader, not an exact translation.
 */
@Component
@RequiredArgsConstructor
public class LayoutInferenceEngine {

    private final HeuristicsConfig heuristics;

    /**
     * Empty when the parent has auto-layout, no bounding box, or fewer than two visible
     * positioned children.
     */
    public Optional<InferredLayout> infer(DesignNode parent) {
        if (parent.hasAutoLayout() || parent.getAbsoluteBoundingBox() == null) {
            return Optional.empty();
        }
        BoundingBox parentBox = parent.getAbsoluteBoundingBox();
        List<Placed> children = parent.visibleChildren().stream()
                .filter(child -> child.getAbsoluteBoundingBox() != null)
                .map(child -> Placed.of(child.getAbsoluteBoundingBox(), parentBox))
                .toList();
        if (children.size() < 2) {
            return Optional.empty();
        }

        double yRange = range(children.stream().map(Placed::y).toList());
        double xRange = range(children.stream().map(Placed::x).toList());

        if (yRange < heuristics.edgeTolerance(parentBox.height())) {
            return Optional.of(row(children, parentBox));
        }
        if (xRange < heuristics.edgeTolerance(parentBox.width())) {
            return Optional.of(column(children, parentBox));
        }
        return Optional.of(InferredLayout.absolute());
    }

    private InferredLayout row(List<Placed> children, BoundingBox parentBox) {
        List<Placed> sorted = children.stream().sorted(Comparator.comparingDouble(Placed::x)).toList();
        List<Double> starts = sorted.stream().map(Placed::x).toList();
        List<Double> sizes = sorted.stream().map(Placed::width).toList();

        Placed last = sorted.get(sorted.size() - 1);
        long top = Math.round(Math.max(0, sorted.stream().mapToDouble(Placed::y).min().orElse(0)));
        long left = Math.round(Math.max(0, sorted.get(0).x()));
        long right = Math.round(Math.max(0, parentBox.width() - (last.x() + last.width())));

        InferredLayout.Padding padding = top > 0 || left > 0 || right > 0
                ? new InferredLayout.Padding(top, right, 0, left)
                : null;
        return new InferredLayout(InferredLayout.Kind.FLEX_ROW, averageGap(starts, sizes), padding,
                justification(starts, sizes, parentBox.width()));
    }

    private InferredLayout column(List<Placed> children, BoundingBox parentBox) {
        List<Placed> sorted = children.stream().sorted(Comparator.comparingDouble(Placed::y)).toList();
        List<Double> starts = sorted.stream().map(Placed::y).toList();
        List<Double> sizes = sorted.stream().map(Placed::height).toList();

        long top = Math.round(Math.max(0, sorted.get(0).y()));
        long left = Math.round(Math.max(0, sorted.stream().mapToDouble(Placed::x).min().orElse(0)));

        InferredLayout.Padding padding = top > 0 || left > 0
                ? new InferredLayout.Padding(top, 0, 0, left)
                : null;
        return new InferredLayout(InferredLayout.Kind.FLEX_COLUMN, averageGap(starts, sizes), padding,
                justification(starts, sizes, parentBox.height()));
    }

    /**
     * Rounded mean of the gaps between neighbours; {@code null} unless positive.
     */
    private static Integer averageGap(List<Double> starts, List<Double> sizes) {
        List<Double> gaps = gaps(starts, sizes);
        if (gaps.isEmpty()) {
            return null;
        }
        double sum = gaps.stream().mapToDouble(gap -> Math.round(gap)).sum();
        long average = Math.round(sum / gaps.size());
        return average > 0 ? (int) average : null;
    }

    /**
     * Justification along the main axis, or {@code null} when the spacing is ambiguous.
     *
     * <p>Two children count as space-between when both outer spaces are under half the gap
     * between them; three or more also need near-equal gaps.
     */
    String justification(List<Double> starts, List<Double> sizes, double parentSize) {
        if (starts.size() < 2) {
            return null;
        }
        double tolerance = heuristics.getJustifyTolerancePx();
        double substantial = heuristics.getJustifySubstantialPx();
        int lastIndex = starts.size() - 1;
        double leading = starts.get(0);
        double trailing = parentSize - (starts.get(lastIndex) + sizes.get(lastIndex));

        if (Math.abs(leading - trailing) < tolerance && leading > tolerance) {
            return "center";
        }
        if (leading < tolerance && trailing > substantial) {
            return "flex-start";
        }
        if (trailing < tolerance && leading > substantial) {
            return "flex-end";
        }

        List<Double> gaps = gaps(starts, sizes);
        double firstGap = gaps.get(0);
        if (gaps.size() >= 2) {
            double spread = gaps.stream().mapToDouble(Double::doubleValue).max().orElse(0)
                    - gaps.stream().mapToDouble(Double::doubleValue).min().orElse(0);
            if (spread < heuristics.getEqualGapVariancePx() && leading < firstGap * 0.5) {
                return "space-between";
            }
        } else if (firstGap > 0 && leading < firstGap * 0.5 && trailing < firstGap * 0.5) {
            return "space-between";
        }
        return null;
    }

    private static List<Double> gaps(List<Double> starts, List<Double> sizes) {
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < starts.size(); i++) {
            gaps.add(starts.get(i) - (starts.get(i - 1) + sizes.get(i - 1)));
        }
        return gaps;
    }

    private static double range(List<Double> values) {
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        return max - min;
    }

    /**
     * Child box relative to the parent's top-left corner.
     */
    private record Placed(double x, double y, double width, double height) {

        static Placed of(BoundingBox box, BoundingBox parent) {
            return new Placed(box.x() - parent.x(), box.y() - parent.y(), box.width(), box.height());
        }
    }
}
