package com.spiderstream.crawl.engine;

import com.spiderstream.crawl.error.ConfigurationException;

/**
 * One provisioning step applied to a fresh engine. A failing step aborts the whole session.
 */
@FunctionalInterface
public interface EngineConfigurer {
    void configure(TraversalEngine engine) throws ConfigurationException;
}
