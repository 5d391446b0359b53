package com.spiderstream.crawl.sitemap;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.http.PoliteHttpClient;
import com.spiderstream.crawl.model.HttpFetchResult;
import com.spiderstream.crawl.model.SpiderReport;
import com.spiderstream.crawl.robots.RobotsTxtService;
import com.spiderstream.crawl.sources.SupplementarySource;
import com.spiderstream.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Collects page URLs from the sitemaps of a site: the well-known sitemap locations plus the {@code Sitemap:}
 * hints of its robots.txt, following sitemap indexes.
 */
@Service
public class SitemapService implements SupplementarySource {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 2_000_000;
    private static final int MAX_SITEMAPS = 64;

    static final List<String> WELL_KNOWN_PATHS = List.of(
        "/sitemap.xml",
        "/sitemap_news.xml",
        "/sitemap_index.xml",
        "/sitemap-index.xml",
        "/sitemapindex.xml",
        "/sitemap-news.xml",
        "/post-sitemap.xml",
        "/page-sitemap.xml",
        "/portfolio-sitemap.xml",
        "/home_slider-sitemap.xml",
        "/category-sitemap.xml",
        "/author-sitemap.xml"
    );

    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;
    private final SpiderProperties properties;

    public SitemapService(PoliteHttpClient httpClient, RobotsTxtService robotsTxtService, SpiderProperties properties) {
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
        this.properties = properties;
    }

    @Override
    public String sourceTag() {
        return SpiderReport.SOURCE_SITEMAP;
    }

    @Override
    public List<String> discover(URI site) {
        if (site == null || site.getScheme() == null || site.getRawAuthority() == null) {
            return List.of();
        }
        String root = site.getScheme().toLowerCase(Locale.ROOT) + "://" + site.getRawAuthority();
        List<String> seeds = new ArrayList<>();
        for (String path : WELL_KNOWN_PATHS) {
            seeds.add(root + path);
        }
        seeds.addAll(robotsTxtService.getRules(site).getSitemapUrls());
        return discover(
            seeds,
            properties.getSources().getSitemapMaxDepth(),
            MAX_SITEMAPS,
            properties.getSources().getSitemapMaxUrls()
        );
    }

    public List<String> discover(List<String> seedSitemaps, int maxDepth, int maxSitemaps, int maxUrls) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> visitedSitemaps = new LinkedHashSet<>();
        LinkedHashSet<String> discoveredUrls = new LinkedHashSet<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        while (!queue.isEmpty() && visitedSitemaps.size() < maxSitemaps) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || visitedSitemaps.contains(current.url())) {
                continue;
            }
            visitedSitemaps.add(current.url());

            HttpFetchResult fetch = httpClient.get(
                current.url(),
                "application/xml,text/xml;q=0.9,*/*;q=0.1",
                MAX_SITEMAP_BYTES
            );
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(fetch);
            } catch (IOException e) {
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());

            List<Element> childSitemaps = xml.select("sitemap > loc");
            if (!childSitemaps.isEmpty() && current.depth() < maxDepth) {
                for (Element loc : childSitemaps) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child != null && !visitedSitemaps.contains(child) && visitedSitemaps.size() + queue.size() < maxSitemaps) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }

            for (Element locElement : xml.select("url > loc")) {
                String loc = UrlNormalizer.resolve(UrlNormalizer.safeUri(current.url()), locElement.text());
                if (!loc.isEmpty() && discoveredUrls.size() < maxUrls) {
                    discoveredUrls.add(loc);
                }
            }
            if (discoveredUrls.size() >= maxUrls) {
                break;
            }
        }

        if (!errors.isEmpty()) {
            log.debug("sitemap fetch problems sitemaps={} errors={}", visitedSitemaps.size(), errors);
        }
        return new ArrayList<>(discoveredUrls);
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    // the http client does not decompress, so a .xml.gz file and a gzip transfer encoding look the same
    private boolean isGzipPayload(HttpFetchResult fetch, byte[] bodyBytes) {
        if (bodyBytes.length >= 2 && (bodyBytes[0] & 0xFF) == 0x1f && (bodyBytes[1] & 0xFF) == 0x8b) {
            return true;
        }
        String encoding = fetch.contentEncoding();
        return encoding != null && encoding.toLowerCase(Locale.ROOT).contains("gzip");
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
