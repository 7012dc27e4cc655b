package com.purchasingpower.designflow.exception;

import lombok.Getter;

/**
 * Input matched none of the accepted Figma URL or file-key shapes.
 */
@Getter
public class MalformedIdentifierException extends RuntimeException {

    private final String identifier;

    public MalformedIdentifierException(String identifier) {
        super("""
                Invalid Figma identifier: %s

                Accepted formats:
                  - https://www.figma.com/file/ABC123xyz/My-Design
                  - https://www.figma.com/design/ABC123xyz/My-Design?node-id=0-1
                  - ABC123xyz (file key only)""".formatted(identifier));
        this.identifier = identifier;
    }
}
