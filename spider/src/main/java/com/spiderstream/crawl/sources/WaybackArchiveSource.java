package com.spiderstream.crawl.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.http.PoliteHttpClient;
import com.spiderstream.crawl.model.HttpFetchResult;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Wayback Machine CDX index. The JSON answer is an array of rows whose first row is the column header.
 */
@Component
public class WaybackArchiveSource implements HistoricalUrlSource {
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SpiderProperties properties;

    public WaybackArchiveSource(PoliteHttpClient httpClient, ObjectMapper objectMapper, SpiderProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "wayback";
    }

    @Override
    public List<String> fetch(String host, boolean includeSubdomains) {
        String pattern = (includeSubdomains ? "*." : "") + host + "/*";
        String url = properties.getSources().getWaybackBaseUrl()
            + "/cdx/search/cdx?url=" + URLEncoder.encode(pattern, StandardCharsets.UTF_8)
            + "&output=json&fl=original&collapse=urlkey";
        HttpFetchResult fetch = httpClient.get(url, "application/json");
        if (!fetch.isSuccessful()) {
            throw new CrawlException(
                "wayback lookup failed for " + host + ": status=" + fetch.statusCode() + " error=" + fetch.errorCode()
            );
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            throw new CrawlException("wayback answer for " + host + " is not JSON", e);
        }
        List<String> urls = new ArrayList<>();
        if (!root.isArray()) {
            return urls;
        }
        for (int i = 1; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (row.isArray() && row.size() > 0) {
                urls.add(row.get(0).asText());
            }
        }
        return urls;
    }
}
