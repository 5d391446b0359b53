package com.spiderstream.crawl.sources;

import java.util.List;

/**
 * A third-party archive that remembers URLs seen for a host.
 */
public interface HistoricalUrlSource {

    String name();

    /**
     * @throws com.spiderstream.crawl.error.CrawlException when the archive cannot be queried or answers with
     *     something unreadable
     */
    List<String> fetch(String host, boolean includeSubdomains);
}
