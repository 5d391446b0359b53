package com.spiderstream.crawl.error;

/**
 * Base type for everything a crawl session reports on its error stream.
 */
public class CrawlException extends RuntimeException {
    public CrawlException(String message) {
        super(message);
    }

    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Fatal errors end the session; everything else is reported and the session continues.
     */
    public boolean isFatal() {
        return false;
    }
}
