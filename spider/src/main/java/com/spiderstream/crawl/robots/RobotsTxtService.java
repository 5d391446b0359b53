package com.spiderstream.crawl.robots;

import com.spiderstream.crawl.http.PoliteHttpClient;
import com.spiderstream.crawl.model.HttpFetchResult;
import com.spiderstream.crawl.model.SpiderReport;
import com.spiderstream.crawl.sources.SupplementarySource;
import com.spiderstream.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads {@code /robots.txt} of a site and reports every Allow/Disallow target as a URL.
 */
@Service
public class RobotsTxtService implements SupplementarySource {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final PoliteHttpClient httpClient;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String sourceTag() {
        return SpiderReport.SOURCE_ROBOTS;
    }

    @Override
    public List<String> discover(URI site) {
        URI root = siteRoot(site);
        if (root == null) {
            return List.of();
        }
        RobotsRules rules = getRules(root);
        List<String> urls = new ArrayList<>();
        for (String path : rules.getDirectivePaths()) {
            String resolved = UrlNormalizer.resolve(root, path);
            if (!resolved.isEmpty() && !urls.contains(resolved)) {
                urls.add(resolved);
            }
        }
        log.debug("robots host={} directives={} urls={}", root.getHost(), rules.getDirectives().size(), urls.size());
        return urls;
    }

    /**
     * Parsed robots.txt of the site, fetched once per scheme and authority. A missing or unreadable file
     * yields empty rules.
     */
    public RobotsRules getRules(URI site) {
        URI root = siteRoot(site);
        if (root == null) {
            return RobotsRules.empty();
        }
        return cache.computeIfAbsent(root.toString(), this::loadRules);
    }

    private RobotsRules loadRules(String root) {
        String robotsUrl = root + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1");
        if (!fetch.isSuccessful()) {
            log.debug(
                "robots fetch failed url={} status={} errorCode={} errorMessage={}",
                robotsUrl,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage()
            );
            return RobotsRules.empty();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body());
        log.debug("Loaded robots for {} with {} sitemap hints", root, rules.getSitemapUrls().size());
        return rules;
    }

    private static URI siteRoot(URI site) {
        if (site == null || site.getScheme() == null || site.getRawAuthority() == null) {
            return null;
        }
        return UrlNormalizer.safeUri(site.getScheme().toLowerCase(Locale.ROOT) + "://" + site.getRawAuthority());
    }
}
