package com.purchasingpower.designflow.exception;

import java.time.Duration;

public class FigmaTimeoutException extends FigmaApiException {

    public FigmaTimeoutException(String path, Duration timeout, Throwable cause) {
        super(504, "Figma API request timed out after " + timeout.toSeconds() + "s: " + path,
                "Check your network connection and try again. Large files can take a while to render.",
                cause);
    }
}
