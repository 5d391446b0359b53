package com.spiderstream.crawl.error;

public class SuppressedTransportException extends TransportException {
    SuppressedTransportException(String url, int statusCode, String message, Throwable cause) {
        super(url, statusCode, message, cause);
    }
}
