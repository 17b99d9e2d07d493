package com.delta.linktools.check.http;

/**
 * A page could not be fetched: network failure, timeout or a non-2xx response after redirects.
 */
public class PageFetchException extends Exception {
    private final String errorCode;

    public PageFetchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
