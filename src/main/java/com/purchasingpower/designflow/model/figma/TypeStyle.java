package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Typography of a TEXT node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TypeStyle {

    private String fontFamily;
    private Double fontSize;
    private Double fontWeight;
    private Boolean italic;
    private String fontStyle;
    private Double lineHeightPx;
    private Double letterSpacing;
    private String textAlignHorizontal;
    private String textCase;
    private String textDecoration;
    private String textAutoResize;
    private String textTruncation;
    private Integer maxLines;
    private Hyperlink hyperlink;
    private List<Paint> fills;

    public double fontSizeOrZero() {
        return fontSize != null ? fontSize : 0;
    }

    public double fontWeightOrZero() {
        return fontWeight != null ? fontWeight : 0;
    }
}
