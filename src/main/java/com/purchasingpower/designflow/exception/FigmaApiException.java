package com.purchasingpower.designflow.exception;

import lombok.Getter;

/**
 * Fatal failure talking to the Figma API. {@code remediation} tells the user what to do next.
 */
@Getter
public class FigmaApiException extends RuntimeException {

    private final int status;
    private final String remediation;

    public FigmaApiException(int status, String message, String remediation) {
        super(message);
        this.status = status;
        this.remediation = remediation;
    }

    public FigmaApiException(int status, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.remediation = remediation;
    }

    /**
     * Message followed by the remediation, as shown to users.
     */
    public String describe() {
        if (remediation == null || remediation.isBlank()) {
            return getMessage();
        }
        return getMessage() + "\n\n" + remediation;
    }
}
