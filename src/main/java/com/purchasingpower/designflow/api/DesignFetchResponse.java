package com.purchasingpower.designflow.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.designflow.model.document.DesignDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Design fetch response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DesignFetchResponse {

    private boolean success;
    private DesignDocument document;
    private long durationMs;
    private String error;
    private String remediation;

    public static DesignFetchResponse success(DesignDocument document, long durationMs) {
        return DesignFetchResponse.builder()
            .success(true)
            .document(document)
            .durationMs(durationMs)
            .build();
    }

    public static DesignFetchResponse error(String error, String remediation) {
        return DesignFetchResponse.builder()
            .success(false)
            .error(error)
            .remediation(remediation)
            .build();
    }
}
