package com.purchasingpower.designflow.exception;

public class FigmaAuthException extends FigmaApiException {

    private static final String REMEDIATION = """
            Create a personal access token at https://www.figma.com/developers/api#access-tokens
            and export it as FIGMA_TOKEN (or set app.figma.token).""";

    public FigmaAuthException(String message) {
        super(401, message, REMEDIATION);
    }
}
