package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of {@code GET /v1/files/{key}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignFile {

    private String name;
    private String lastModified;
    private String version;
    private DesignNode document;

    @Builder.Default
    private Map<String, StyleMetadata> styles = new LinkedHashMap<>();

    /**
     * Pages of the file, the usual roots for every formatter.
     */
    public List<DesignNode> pages() {
        return document != null ? document.getChildren() : List.of();
    }
}
