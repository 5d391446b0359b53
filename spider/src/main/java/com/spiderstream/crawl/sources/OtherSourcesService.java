package com.spiderstream.crawl.sources;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.model.SpiderReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the URL lists of every configured {@link HistoricalUrlSource} for the host of a site.
 */
@Service
public class OtherSourcesService implements SupplementarySource {
    private static final Logger log = LoggerFactory.getLogger(OtherSourcesService.class);

    private final List<HistoricalUrlSource> sources;
    private final SpiderProperties properties;

    public OtherSourcesService(List<HistoricalUrlSource> sources, SpiderProperties properties) {
        this.sources = List.copyOf(sources);
        this.properties = properties;
    }

    @Override
    public String sourceTag() {
        return SpiderReport.SOURCE_OTHER;
    }

    @Override
    public List<String> discover(URI site) {
        if (site == null || site.getHost() == null || site.getHost().isBlank()) {
            return List.of();
        }
        String host = site.getHost();
        boolean includeSubdomains = properties.getSources().isIncludeSubdomains();
        Set<String> urls = new LinkedHashSet<>();
        for (HistoricalUrlSource source : sources) {
            List<String> fetched;
            try {
                fetched = source.fetch(host, includeSubdomains);
            } catch (CrawlException e) {
                log.warn("other source {} failed for host={}: {}", source.name(), host, e.getMessage());
                continue;
            }
            for (String url : fetched) {
                String trimmed = url == null ? "" : url.trim();
                if (!trimmed.isEmpty()) {
                    urls.add(trimmed);
                }
            }
        }
        log.debug("other sources host={} urls={}", host, urls.size());
        return new ArrayList<>(urls);
    }
}
