package com.purchasingpower.designflow.exception;

public class FigmaNotFoundException extends FigmaApiException {

    public FigmaNotFoundException(String path) {
        super(404, "Figma file or node not found: " + path,
                "Check the file key and node ids in the URL.");
    }
}
