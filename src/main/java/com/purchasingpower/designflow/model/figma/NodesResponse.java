package com.purchasingpower.designflow.model.figma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Response of {@code GET /v1/files/{key}/nodes?ids=...}. Unknown ids map to {@code null}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodesResponse {

    private String name;
    private Map<String, NodeEntry> nodes = new LinkedHashMap<>();

    public List<DesignNode> documents() {
        if (nodes == null) {
            return List.of();
        }
        return nodes.values().stream()
                .filter(Objects::nonNull)
                .map(NodeEntry::getDocument)
                .filter(Objects::nonNull)
                .toList();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeEntry {
        private DesignNode document;
    }
}
