package com.metrocrawler.exception;

/**
 * Base class of everything the crawl core throws.
 */
public abstract class CrawlException extends RuntimeException {

    protected CrawlException(String message) {
        super(message);
    }

    protected CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Name of the failure category, used in diagnostics and error responses.
     */
    public abstract String getReason();
}
