package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of {@code GET /v1/files/{key}/images}: download URLs per image fill ref.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageFillsResponse {

    private Meta meta = new Meta();

    public Map<String, String> imageUrls() {
        return meta != null && meta.getImages() != null ? meta.getImages() : Map.of();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private Map<String, String> images = new LinkedHashMap<>();
    }
}
