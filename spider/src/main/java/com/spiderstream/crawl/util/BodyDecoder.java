package com.spiderstream.crawl.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class BodyDecoder {
    private static final Pattern ESCAPED_SLASH = Pattern.compile("(?i)\\\\u002f");
    private static final Pattern ESCAPED_AMPERSAND = Pattern.compile("(?i)\\\\u0026");

    private BodyDecoder() {
    }

    /**
     * Undoes URL encoding and JSON escaping of '/' and '&amp;' so that hosts and URLs embedded in scripts
     * become visible to the text scanners. Bodies that are not valid URL-encoded text are kept as they are.
     */
    public static String decodeChars(String body) {
        if (body == null || body.isEmpty()) {
            return body;
        }
        String decoded;
        try {
            decoded = URLDecoder.decode(body, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            decoded = body;
        }
        decoded = ESCAPED_SLASH.matcher(decoded).replaceAll("/");
        return ESCAPED_AMPERSAND.matcher(decoded).replaceAll(Matcher.quoteReplacement("&"));
    }
}
