package com.purchasingpower.designflow.exception;

public class FigmaAccessException extends FigmaApiException {

    public FigmaAccessException(String path) {
        super(403, "Access denied to Figma resource " + path,
                "Make sure the token's account can open this file, or ask the owner to share it.");
    }
}
