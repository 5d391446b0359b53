package com.spiderstream.crawl.engine;

import com.spiderstream.crawl.error.MalformedSeedUrlException;

import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Fetches pages and reports what it finds through hooks. Hooks fire on worker threads, concurrently.
 * Configuration methods must be called before the first {@link #visit(String)}.
 */
public interface TraversalEngine extends AutoCloseable {

    /**
     * Receives the raw attribute value of an element found on an HTML page.
     */
    @FunctionalInterface
    interface DiscoveryHook {
        void onDiscovery(FetchResponse page, String value);
    }

    /**
     * Receives responses with a status of 400 or more, and transport failures (status 0, {@code cause} set).
     */
    @FunctionalInterface
    interface ErrorHook {
        void onError(FetchResponse response, Throwable cause);
    }

    void onAnchor(DiscoveryHook hook);

    void onForm(DiscoveryHook hook);

    void onUploadForm(DiscoveryHook hook);

    void onEmbeddedResource(DiscoveryHook hook);

    void onResponse(Consumer<FetchResponse> hook);

    void onError(ErrorHook hook);

    void onRequest(Consumer<FetchRequest> hook);

    void allowUrl(Pattern pattern);

    void disallowUrl(Pattern pattern);

    void limit(int parallelism, Duration delay, Duration randomDelay);

    /**
     * 0 means unlimited.
     */
    void maxDepth(int maxDepth);

    void userAgent(Supplier<String> userAgent);

    void proxy(URI proxy);

    void timeout(Duration timeout);

    /**
     * When set, a redirect is only followed if its target contains the host of the page that issued it.
     */
    void sameHostRedirectsOnly(boolean sameHostOnly);

    /**
     * Queues a seed URL. URLs already visited, filtered out or too deep are ignored.
     *
     * @throws MalformedSeedUrlException when the URL is not an absolute http(s) URL
     */
    void visit(String url);

    /**
     * Queues a URL discovered while handling {@code parent}; invalid URLs are ignored.
     */
    void visit(String url, FetchRequest parent);

    /**
     * Blocks until no fetch is queued or running, hooks included.
     */
    void awaitIdle() throws InterruptedException;

    @Override
    void close();
}
