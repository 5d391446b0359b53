package com.spiderstream.crawl.engine;

import com.spiderstream.crawl.error.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a raw HTTP/1.x request as saved by an intercepting proxy and keeps its headers and cookie, so a crawl
 * can reuse an authenticated browser session.
 */
public final class RawRequestImporter {
    private static final Pattern REQUEST_LINE = Pattern.compile("^[A-Z]+\\s+\\S+\\s+HTTP/\\d(?:\\.\\d)?$");

    private RawRequestImporter() {
    }

    public record RawRequest(Map<String, String> headers, String cookie) {
        public RawRequest {
            headers = Map.copyOf(headers);
        }
    }

    public static RawRequest importFile(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("failed to open raw request file " + file, e);
        }
        return parse(lines, file.toString());
    }

    static RawRequest parse(List<String> lines, String name) {
        if (lines.isEmpty() || !REQUEST_LINE.matcher(lines.get(0).trim()).matches()) {
            throw new ConfigurationException("failed to parse raw request in " + name + ": missing request line");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        String cookie = null;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new ConfigurationException("failed to parse raw request in " + name + ": bad header line " + i);
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if ("cookie".equalsIgnoreCase(key)) {
                cookie = cookie == null ? value : cookie + "; " + value;
            } else {
                headers.putIfAbsent(key, value);
            }
        }
        return new RawRequest(headers, cookie);
    }
}
