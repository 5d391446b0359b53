package com.spiderstream.crawl.model;

import java.nio.charset.StandardCharsets;

/**
 * Outcome of a collaborator GET. Either a response was read ({@code errorCode} is null)
 * or the fetch failed before one was available and {@code statusCode} is 0.
 */
public record HttpFetchResult(
    String url,
    int statusCode,
    byte[] bodyBytes,
    String contentEncoding,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult response(String url, int statusCode, byte[] bodyBytes, String contentEncoding) {
        return new HttpFetchResult(url, statusCode, bodyBytes, contentEncoding, null, null);
    }

    public static HttpFetchResult failure(String url, String errorCode, String errorMessage) {
        return new HttpFetchResult(url, 0, null, null, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }
}
