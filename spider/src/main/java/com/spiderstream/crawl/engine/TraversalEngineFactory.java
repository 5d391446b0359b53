package com.spiderstream.crawl.engine;

import com.spiderstream.config.SpiderProperties;
import org.springframework.stereotype.Component;

/**
 * Hands out one unconfigured engine per crawl session.
 */
@Component
public class TraversalEngineFactory {
    private final SpiderProperties properties;

    public TraversalEngineFactory(SpiderProperties properties) {
        this.properties = properties;
    }

    public TraversalEngine create() {
        return new HttpTraversalEngine(properties.getHttp().getMaxBodyBytes());
    }
}
