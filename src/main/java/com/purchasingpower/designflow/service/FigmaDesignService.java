package com.purchasingpower.designflow.service;

import com.purchasingpower.designflow.model.document.DesignDocument;
import com.purchasingpower.designflow.model.document.FetchOptions;

/**
 * Compiles a Figma file, or a selection of its nodes, into an artifact for a coding agent.
 *
 * @since 1.0.0
 */
public interface FigmaDesignService {

    /**
     * @param identifier Figma URL or bare file key
     * @throws com.purchasingpower.designflow.exception.MalformedIdentifierException if the identifier
     *         names no file
     * @throws com.purchasingpower.designflow.exception.FigmaApiException if the essential fetch fails
     */
    DesignDocument fetch(String identifier, FetchOptions options);
}
