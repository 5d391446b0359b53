package com.spiderstream.crawl.engine;

import java.net.URI;
import java.util.Locale;

/**
 * Outcome of one fetch. {@code uri} is the address after redirects; {@code statusCode} is 0 when no response
 * was received at all.
 */
public record FetchResponse(FetchRequest request, URI uri, int statusCode, String body, String contentType) {

    public static FetchResponse transportFailure(FetchRequest request) {
        return new FetchResponse(request, request.uri(), 0, null, null);
    }

    public String url() {
        return uri.toString();
    }

    public boolean isHtml() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("html");
    }
}
