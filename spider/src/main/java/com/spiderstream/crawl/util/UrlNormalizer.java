package com.spiderstream.crawl.util;

import com.spiderstream.crawl.model.ReportType;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw references found on a page into absolute, canonical http(s) URLs.
 * Every method returns the empty string when the reference must be dropped.
 */
public final class UrlNormalizer {
    private static final List<String> DROPPED_SCHEMES = List.of("javascript:", "mailto:", "tel:");
    private static final Pattern CONTROL_WHITESPACE = Pattern.compile("[\\t\\r\\n]");

    private UrlNormalizer() {
    }

    public static String resolve(URI origin, String raw) {
        if (raw == null) {
            return "";
        }
        String candidate = CONTROL_WHITESPACE.matcher(raw).replaceAll("").trim();
        if (candidate.isEmpty() || candidate.startsWith("#")) {
            return "";
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (String scheme : DROPPED_SCHEMES) {
            if (lower.startsWith(scheme)) {
                return "";
            }
        }

        URI reference = safeUri(candidate.replace(" ", "%20"));
        if (reference == null) {
            return "";
        }
        URI resolved = reference.isAbsolute() ? reference : resolveRelative(origin, reference);
        if (resolved == null) {
            return "";
        }
        return canonical(resolved.normalize());
    }

    /**
     * Normalizes a record output according to its type: URL-bearing records resolve against their page,
     * domain and bucket identifiers are only trimmed and lower-cased.
     */
    public static String normalize(ReportType type, URI origin, String output) {
        if (output == null) {
            return "";
        }
        if (type.isUrlBearing()) {
            return resolve(origin, output);
        }
        return output.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * File extension of the URL path including the leading dot, lower-cased; empty when there is none.
     */
    public static String extensionOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return "";
        }
        String path = uri.getPath();
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return lastSegment.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static URI resolveRelative(URI origin, URI reference) {
        if (origin == null || !origin.isAbsolute() || origin.isOpaque()) {
            return null;
        }
        String originPath = origin.getRawPath();
        String root = origin.getScheme() + "://" + origin.getRawAuthority();
        try {
            String rawReference = reference.toString();
            // java.net.URI follows RFC 2396 for query-only references and drops the last path segment
            if (rawReference.startsWith("?")) {
                String path = originPath == null || originPath.isEmpty() ? "/" : originPath;
                return new URI(root + path + rawReference);
            }
            URI base = originPath == null || originPath.isEmpty() ? new URI(root + "/") : origin;
            return base.resolve(reference);
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    private static String canonical(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            return "";
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return "";
        }
        String authority = authority(uri);
        if (authority.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(scheme).append("://").append(authority);
        if (uri.getRawPath() != null) {
            out.append(uri.getRawPath());
        }
        if (uri.getRawQuery() != null) {
            out.append('?').append(uri.getRawQuery());
        }
        return out.toString();
    }

    private static String authority(URI uri) {
        if (uri.getHost() == null) {
            String raw = uri.getRawAuthority();
            return raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        }
        StringBuilder authority = new StringBuilder();
        if (uri.getRawUserInfo() != null) {
            authority.append(uri.getRawUserInfo()).append('@');
        }
        authority.append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            authority.append(':').append(uri.getPort());
        }
        return authority.toString();
    }
}
