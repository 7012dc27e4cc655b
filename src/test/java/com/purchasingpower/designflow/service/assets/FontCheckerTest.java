package com.purchasingpower.designflow.service.assets;

import com.purchasingpower.designflow.model.design.FontCheckResult;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.designflow.TestNodes.frame;
import static com.purchasingpower.designflow.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Font Checker Tests")
class FontCheckerTest {

    private FontChecker fontChecker;

    @BeforeEach
    void setUp() {
        fontChecker = new FontChecker();
        fontChecker.loadCatalog();
    }

    @Test
    @DisplayName("Should collect families from styles and overrides of visible text")
    void collectFontFamilies_includesOverrides() {
        // Given
        DesignNode mixed = text("1:2", "Mixed", 0, 0, 100, 20).toBuilder()
                .styleOverrideTable(Map.of("1", TypeStyle.builder().fontFamily("Gotham").build()))
                .build();
        DesignNode hidden = text("1:3", "Hidden", 0, 0, 100, 20).toBuilder()
                .visible(false)
                .style(TypeStyle.builder().fontFamily("Comic Sans MS").build())
                .build();

        // When
        Set<String> families = fontChecker.collectFontFamilies(List.of(frame("1:1", "Page", 0, 0, 800, 600, mixed, hidden)));

        // Then
        assertThat(families).containsExactly("Inter", "Gotham");
    }

    @Test
    @DisplayName("Should suggest look-alikes for commercial fonts, including weight-suffixed names")
    void check_commercialFonts_getSubstitutes() {
        // Given
        Set<String> families = new LinkedHashSet<>(List.of("Inter", "Helvetica Neue", "Gotham Bold", "Acme Sans"));

        // When
        List<FontCheckResult> checks = fontChecker.check(families);

        // Then
        assertThat(checks).containsExactly(
                new FontCheckResult("Inter", true, null),
                new FontCheckResult("Helvetica Neue", false, "Inter"),
                new FontCheckResult("Gotham Bold", false, "Montserrat"),
                new FontCheckResult("Acme Sans", false, null));
        assertThat(FontChecker.substitutionMap(checks))
                .containsOnlyKeys("Helvetica Neue", "Gotham Bold");
    }

    @Test
    @DisplayName("Should render a substitution table only when needed")
    void substitutionMarkdown_listsNonGoogleFonts() {
        List<FontCheckResult> checks = fontChecker.check(new LinkedHashSet<>(List.of("Inter", "SF Pro", "Acme Sans")));

        String markdown = fontChecker.substitutionMarkdown(checks);

        assertThat(markdown)
                .startsWith("## Font Substitutions")
                .contains("| SF Pro | Inter |")
                .contains("| Acme Sans | *(pick a similar Google Font)* |");
        assertThat(fontChecker.substitutionMarkdown(fontChecker.check(Set.of("Inter")))).isEmpty();
    }
}
