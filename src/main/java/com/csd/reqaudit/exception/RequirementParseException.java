package com.csd.reqaudit.exception;

/**
 * A manifest line does not describe a package. Line-local: callers skip the line.
 */
public class RequirementParseException extends RuntimeException {

    private final String line;

    public RequirementParseException(String line, String message) {
        super(message);
        this.line = line;
    }

    public RequirementParseException(String line, String message, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
