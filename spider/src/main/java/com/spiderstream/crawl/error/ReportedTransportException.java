package com.spiderstream.crawl.error;

public class ReportedTransportException extends TransportException {
    ReportedTransportException(String url, int statusCode, String message, Throwable cause) {
        super(url, statusCode, message, cause);
    }
}
