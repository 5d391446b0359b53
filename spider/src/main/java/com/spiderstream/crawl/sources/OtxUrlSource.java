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
 * AlienVault OTX url_list for a hostname or a whole domain, read page by page.
 */
@Component
public class OtxUrlSource implements HistoricalUrlSource {
    private static final int PAGE_SIZE = 200;

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SpiderProperties properties;

    public OtxUrlSource(PoliteHttpClient httpClient, ObjectMapper objectMapper, SpiderProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "otx";
    }

    @Override
    public List<String> fetch(String host, boolean includeSubdomains) {
        String section = includeSubdomains ? "domain" : "hostname";
        String encodedHost = URLEncoder.encode(host, StandardCharsets.UTF_8);
        List<String> urls = new ArrayList<>();
        int maxPages = properties.getSources().getOtxMaxPages();
        for (int page = 1; page <= maxPages; page++) {
            String url = properties.getSources().getOtxBaseUrl()
                + "/api/v1/indicators/" + section + "/" + encodedHost
                + "/url_list?limit=" + PAGE_SIZE + "&page=" + page;
            JsonNode root = read(url, host);
            for (JsonNode entry : root.path("url_list")) {
                String value = entry.path("url").asText("");
                if (!value.isEmpty()) {
                    urls.add(value);
                }
            }
            if (!root.path("has_next").asBoolean(false)) {
                break;
            }
        }
        return urls;
    }

    private JsonNode read(String url, String host) {
        HttpFetchResult fetch = httpClient.get(url, "application/json");
        if (!fetch.isSuccessful()) {
            throw new CrawlException(
                "otx lookup failed for " + host + ": status=" + fetch.statusCode() + " error=" + fetch.errorCode()
            );
        }
        try {
            return objectMapper.readTree(fetch.body() == null ? "{}" : fetch.body());
        } catch (JsonProcessingException e) {
            throw new CrawlException("otx answer for " + host + " is not JSON", e);
        }
    }
}
