package com.spiderstream.crawl.error;

/**
 * Failure of a single page fetch. Status 404, 429 and 5xx are expected noise during a crawl and are
 * classified as {@link SuppressedTransportException}; anything else is a {@link ReportedTransportException}.
 */
public abstract class TransportException extends CrawlException {
    private final String url;
    private final int statusCode;

    protected TransportException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP status of the failed response, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public static TransportException classify(String url, int statusCode, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        String message = statusCode > 0
            ? "request to " + url + " failed with status " + statusCode + detail
            : "request to " + url + " failed" + detail;
        if (isSuppressedStatus(statusCode)) {
            return new SuppressedTransportException(url, statusCode, message, cause);
        }
        return new ReportedTransportException(url, statusCode, message, cause);
    }

    public static boolean isSuppressedStatus(int statusCode) {
        return statusCode == 404 || statusCode == 429 || (statusCode >= 500 && statusCode < 600);
    }
}
