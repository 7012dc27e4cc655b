package com.purchasingpower.designflow.model.design;

/**
 * Availability of a font family on Google Fonts, with a look-alike when it is not.
 */
public record FontCheckResult(String fontFamily, boolean googleFont, String suggestedAlternative) {
}
