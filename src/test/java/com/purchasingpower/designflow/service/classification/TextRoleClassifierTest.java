package com.purchasingpower.designflow.service.classification;

import com.purchasingpower.designflow.model.content.SemanticRole;
import com.purchasingpower.designflow.model.figma.DesignNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Text Role Classifier Tests")
class TextRoleClassifierTest {

    private final TextRoleClassifier classifier = new TextRoleClassifier();

    @Test
    @DisplayName("Should trust explicit layer names first")
    void classify_namedLayer_usesName() {
        // Given
        DesignNode title = text("1:1", "Hero Title", "Build faster", 0, 0, 400, 60, 16, 400);

        // When / Then
        assertThat(classifier.classify(title, List.of("Landing"), null)).isEqualTo(SemanticRole.HEADING);
    }

    @Test
    @DisplayName("Should classify text inside a navigation frame as navigation")
    void classify_insideNavFrame_returnsNavigation() {
        // Given
        DesignNode nav = frame("1:1", "Main Nav", 0, 0, 1440, 80);
        DesignNode item = text("1:2", "Pricing", 0, 0, 80, 20);

        // When / Then
        assertThat(classifier.classify(item, List.of("Landing", "Main Nav"), nav)).isEqualTo(SemanticRole.NAVIGATION);
    }

    @Test
    @DisplayName("Should classify text anywhere below a footer as footer")
    void classify_footerAncestor_returnsFooter() {
        // Given
        DesignNode column = frame("1:3", "Column", 0, 0, 200, 200);
        DesignNode item = text("1:4", "Privacy", 0, 0, 80, 20);

        // When / Then
        assertThat(classifier.classify(item, List.of("Landing", "Footer", "Column"), column))
                .isEqualTo(SemanticRole.FOOTER);
    }

    @Test
    @DisplayName("Should fall back to typography")
    void classify_byTypography() {
        // Given
        DesignNode headline = text("1:1", "Welcome", "Welcome aboard", 0, 0, 600, 60, 48, 700);
        DesignNode sectionTitle = text("1:2", "Intro", "Why teams switch", 0, 0, 600, 40, 24, 500);
        DesignNode fine = text("1:3", "Copyright", "© 2026 Acme", 0, 0, 200, 16, 12, 400);

        // When / Then
        assertThat(classifier.classify(headline, List.of(), null)).isEqualTo(SemanticRole.HEADING);
        assertThat(classifier.classify(sectionTitle, List.of(), null)).isEqualTo(SemanticRole.SUBHEADING);
        assertThat(classifier.classify(fine, List.of(), null)).isEqualTo(SemanticRole.CAPTION);
    }

    @Test
    @DisplayName("Should fall back to the text itself")
    void classify_byContent() {
        // Given
        DesignNode cta = text("1:1", "Get started", 0, 0, 120, 20);
        DesignNode label = text("1:2", "Email", 0, 0, 60, 20);
        DesignNode body = text("1:3", "Frame 9", "x".repeat(120), 0, 0, 600, 120, 16, 400);

        // When / Then
        assertThat(classifier.classify(cta, List.of(), null)).isEqualTo(SemanticRole.CTA);
        assertThat(classifier.classify(label, List.of(), null)).isEqualTo(SemanticRole.LABEL);
        assertThat(classifier.classify(body, List.of(), null)).isEqualTo(SemanticRole.BODY);
    }
}
