package com.purchasingpower.designflow.api;

import com.purchasingpower.designflow.exception.FigmaApiException;
import com.purchasingpower.designflow.exception.MalformedIdentifierException;
import com.purchasingpower.designflow.model.document.DesignDocument;
import com.purchasingpower.designflow.model.document.FetchOptions;
import com.purchasingpower.designflow.service.FigmaDesignService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller compiling Figma designs into agent-ready documents.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/designs")
@RequiredArgsConstructor
public class DesignController {

    private final FigmaDesignService designService;

    /**
     * Fetch and compile a design.
     *
     * POST /api/v1/designs/fetch
     */
    @PostMapping("/fetch")
    public ResponseEntity<DesignFetchResponse> fetch(@RequestBody DesignFetchRequest request) {
        if (request.getIdentifier() == null || request.getIdentifier().isBlank()) {
            return ResponseEntity.badRequest()
                .body(DesignFetchResponse.error("Figma URL or file key is required", null));
        }

        long start = System.currentTimeMillis();
        try {
            FetchOptions options = FetchOptions.builder()
                .mode(request.getMode() != null ? request.getMode() : FetchOptions.defaults().getMode())
                .tokenFormat(request.getTokenFormat() != null
                    ? request.getTokenFormat() : FetchOptions.defaults().getTokenFormat())
                .nodeIds(request.getNodeIds())
                .projectStack(request.getProjectStack())
                .build();

            DesignDocument document = designService.fetch(request.getIdentifier(), options);
            return ResponseEntity.ok(DesignFetchResponse.success(document, System.currentTimeMillis() - start));

        } catch (MalformedIdentifierException e) {
            log.warn("Rejected Figma identifier: {}", e.getIdentifier());
            return ResponseEntity.badRequest()
                .body(DesignFetchResponse.error(e.getMessage(), null));

        } catch (FigmaApiException e) {
            log.error("Figma fetch failed for {}: {}", request.getIdentifier(), e.getMessage());
            return ResponseEntity.status(statusOf(e))
                .body(DesignFetchResponse.error(e.getMessage(), e.getRemediation()));

        } catch (Exception e) {
            log.error("Design fetch failed", e);
            return ResponseEntity.internalServerError()
                .body(DesignFetchResponse.error("Design fetch failed: " + e.getMessage(), null));
        }
    }

    /**
     * Figma's own status when it is an HTTP error, 502 when the failure had no status.
     */
    static HttpStatus statusOf(FigmaApiException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatus());
        return status != null && status.isError() ? status : HttpStatus.BAD_GATEWAY;
    }
}
