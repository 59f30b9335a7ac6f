package com.csd.reqaudit.exception;

/**
 * A catalogue spec string cannot be turned into a bounded range.
 * Only the advisory carrying it is dropped.
 */
public class CatalogueFormatException extends RuntimeException {

    private final String spec;

    public CatalogueFormatException(String spec, String message) {
        super(message);
        this.spec = spec;
    }

    public CatalogueFormatException(String spec, String message, Throwable cause) {
        super(message, cause);
        this.spec = spec;
    }

    public String getSpec() {
        return spec;
    }
}
