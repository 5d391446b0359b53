package com.spiderstream.crawl.sources;

import java.net.URI;
import java.util.List;

/**
 * Produces extra URLs for a site outside of page traversal. Implementations report problems through logs and
 * return what they found; an empty list is a valid answer.
 */
public interface SupplementarySource {

    /**
     * Value carried in the {@code source} field of records built from this source.
     */
    String sourceTag();

    List<String> discover(URI site);
}
