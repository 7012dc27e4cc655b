package com.purchasingpower.designflow.service.classification;

import com.purchasingpower.designflow.model.content.SemanticRole;
import com.purchasingpower.designflow.model.figma.DesignNode;
import com.purchasingpower.designflow.model.figma.TypeStyle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Guesses the {@link SemanticRole} of a TEXT node.
 *
 * <p>Signals are tried from most to least reliable: the layer name, the parent's name, the
 * frame path, the typography, the wording, and finally the text length.
 */
@Component
public class TextRoleClassifier {

    public SemanticRole classify(DesignNode node, List<String> framePath, DesignNode parentFrame) {
        String nodeName = lower(node.getName());
        String text = lower(node.getCharacters());
        String parentName = parentFrame != null ? lower(parentFrame.getName()) : "";
        String path = lower(String.join("/", framePath));
        TypeStyle style = node.getStyle();
        double fontSize = style != null ? style.fontSizeOrZero() : 0;
        double fontWeight = style != null ? style.fontWeightOrZero() : 0;

        SemanticRole byName = fromNodeName(nodeName, text, fontSize);
        if (byName != null) {
            return byName;
        }

        if (matches(parentName, "nav", "navigation", "menu", "header")) {
            return SemanticRole.NAVIGATION;
        }
        if (matches(parentName, "footer")) {
            return SemanticRole.FOOTER;
        }
        if (matches(parentName, "button", "btn", "cta")) {
            return SemanticRole.BUTTON;
        }
        if (matches(parentName, "hero")) {
            if (fontSize >= 32) {
                return SemanticRole.HEADING;
            }
            if (fontSize >= 20) {
                return SemanticRole.SUBHEADING;
            }
        }

        if (matches(path, "nav", "navigation", "menu", "header")) {
            return SemanticRole.NAVIGATION;
        }
        if (matches(path, "footer")) {
            return SemanticRole.FOOTER;
        }

        if (fontSize > 0) {
            if (fontSize >= 32 && fontWeight >= 600) {
                return SemanticRole.HEADING;
            }
            if (fontSize >= 24 && fontWeight >= 500) {
                return SemanticRole.SUBHEADING;
            }
            if (fontSize <= 12) {
                return SemanticRole.CAPTION;
            }
        }

        if (text.length() < 30 && matches(text, "get started", "sign up", "learn more", "try", "start", "subscribe")) {
            return SemanticRole.CTA;
        }
        if (text.length() > 100) {
            return SemanticRole.BODY;
        }
        return text.length() < 50 ? SemanticRole.LABEL : SemanticRole.BODY;
    }

    private static SemanticRole fromNodeName(String nodeName, String text, double fontSize) {
        if (matches(nodeName, "heading", "title", "headline", "h1", "h2", "h3")) {
            return SemanticRole.HEADING;
        }
        if (matches(nodeName, "subheading", "subtitle", "tagline", "sub-heading")) {
            return SemanticRole.SUBHEADING;
        }
        if (matches(nodeName, "button", "btn", "cta")) {
            if (matches(nodeName, "cta") || matches(text, "get started", "sign up", "try", "start")) {
                return SemanticRole.CTA;
            }
            return SemanticRole.BUTTON;
        }
        if (matches(nodeName, "label", "field-label", "input-label", "form-label")) {
            return SemanticRole.LABEL;
        }
        if (matches(nodeName, "link", "anchor", "href")) {
            return SemanticRole.LINK;
        }
        if (matches(nodeName, "caption", "hint", "helper")) {
            return SemanticRole.CAPTION;
        }
        if (matches(nodeName, "placeholder", "input-placeholder")) {
            return SemanticRole.PLACEHOLDER;
        }
        if (matches(nodeName, "nav", "navigation", "menu-item", "nav-item", "nav-link")) {
            return SemanticRole.NAVIGATION;
        }
        if (matches(nodeName, "footer", "footer-link", "footer-text")) {
            return SemanticRole.FOOTER;
        }
        if (matches(nodeName, "description", "desc", "body", "paragraph", "text", "content")) {
            return fontSize >= 18 ? SemanticRole.BODY : SemanticRole.DESCRIPTION;
        }
        return null;
    }

    private static boolean matches(String value, String... keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
