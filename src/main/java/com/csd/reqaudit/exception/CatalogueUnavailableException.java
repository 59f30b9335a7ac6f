package com.csd.reqaudit.exception;

public class CatalogueUnavailableException extends RuntimeException {

    public CatalogueUnavailableException(String message) {
        super(message);
    }
}
