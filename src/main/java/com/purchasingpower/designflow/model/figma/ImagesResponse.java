package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of {@code GET /v1/images/{key}}. Nodes that failed to render map to {@code null}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImagesResponse {

    private String err;
    private Map<String, String> images = new LinkedHashMap<>();

    public boolean hasError() {
        return err != null && !err.isBlank();
    }

    public boolean hasImage(String nodeId) {
        return images != null && images.get(nodeId) != null;
    }
}
