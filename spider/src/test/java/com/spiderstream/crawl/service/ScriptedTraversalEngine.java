package com.spiderstream.crawl.service;

import com.spiderstream.crawl.engine.FetchRequest;
import com.spiderstream.crawl.engine.FetchResponse;
import com.spiderstream.crawl.engine.TraversalEngine;
import com.spiderstream.crawl.error.MalformedSeedUrlException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * In-memory engine serving scripted pages. Fetches run on the thread that calls {@link #awaitIdle()}, one at a
 * time, in submission order.
 */
class ScriptedTraversalEngine implements TraversalEngine {
    record Page(int status, String body, List<String> anchors, List<String> resources, List<String> forms) {
        static Page html(String body, List<String> anchors, List<String> resources) {
            return new Page(200, body, anchors, resources, List.of());
        }

        static Page status(int status, String body) {
            return new Page(status, body, List.of(), List.of(), List.of());
        }
    }

    private final Map<String, Page> pages = new HashMap<>();
    private final Deque<FetchRequest> queue = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private final List<DiscoveryHook> anchorHooks = new ArrayList<>();
    private final List<DiscoveryHook> formHooks = new ArrayList<>();
    private final List<DiscoveryHook> embeddedHooks = new ArrayList<>();
    private final List<Consumer<FetchResponse>> responseHooks = new ArrayList<>();
    private final List<ErrorHook> errorHooks = new ArrayList<>();
    private final List<Consumer<FetchRequest>> requestHooks = new ArrayList<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final CountDownLatch gate = new CountDownLatch(1);
    private volatile Consumer<String> afterFetch = url -> {
    };
    private volatile boolean closed;
    private volatile int maxDepth;

    ScriptedTraversalEngine page(String url, Page page) {
        pages.put(url, page);
        return this;
    }

    /**
     * Fetching starts once this was called.
     */
    void open() {
        gate.countDown();
    }

    void afterFetch(Consumer<String> listener) {
        this.afterFetch = listener;
    }

    List<String> sent() {
        return sent;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void onAnchor(DiscoveryHook hook) {
        anchorHooks.add(hook);
    }

    @Override
    public void onForm(DiscoveryHook hook) {
        formHooks.add(hook);
    }

    @Override
    public void onUploadForm(DiscoveryHook hook) {
    }

    @Override
    public void onEmbeddedResource(DiscoveryHook hook) {
        embeddedHooks.add(hook);
    }

    @Override
    public void onResponse(Consumer<FetchResponse> hook) {
        responseHooks.add(hook);
    }

    @Override
    public void onError(ErrorHook hook) {
        errorHooks.add(hook);
    }

    @Override
    public void onRequest(Consumer<FetchRequest> hook) {
        requestHooks.add(hook);
    }

    @Override
    public void allowUrl(Pattern pattern) {
    }

    @Override
    public void disallowUrl(Pattern pattern) {
    }

    @Override
    public void limit(int parallelism, Duration delay, Duration randomDelay) {
    }

    @Override
    public void maxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public void userAgent(Supplier<String> userAgent) {
    }

    @Override
    public void proxy(URI proxy) {
    }

    @Override
    public void timeout(Duration timeout) {
    }

    @Override
    public void sameHostRedirectsOnly(boolean sameHostOnly) {
    }

    @Override
    public void visit(String url) {
        if (url == null || !url.startsWith("http")) {
            throw new MalformedSeedUrlException(url, "not an http url");
        }
        visit(url, null);
    }

    @Override
    public synchronized void visit(String url, FetchRequest parent) {
        int depth = parent == null ? 1 : parent.depth() + 1;
        if (maxDepth > 0 && depth > maxDepth) {
            return;
        }
        if (visited.add(url)) {
            queue.addLast(new FetchRequest(URI.create(url), depth));
        }
    }

    @Override
    public void awaitIdle() throws InterruptedException {
        gate.await();
        FetchRequest request;
        while ((request = next()) != null) {
            fetch(request);
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private synchronized FetchRequest next() {
        return queue.pollFirst();
    }

    private void fetch(FetchRequest request) {
        requestHooks.forEach(hook -> hook.accept(request));
        if (request.isAborted()) {
            return;
        }
        sent.add(request.url());
        Page page = pages.getOrDefault(request.url(), Page.status(404, null));
        FetchResponse response = new FetchResponse(request, request.uri(), page.status(), page.body(), "text/html");
        if (page.status() >= 400) {
            errorHooks.forEach(hook -> hook.onError(response, null));
        } else {
            responseHooks.forEach(hook -> hook.accept(response));
            page.anchors().forEach(href -> anchorHooks.forEach(hook -> hook.onDiscovery(response, href)));
            page.forms().forEach(action -> formHooks.forEach(hook -> hook.onDiscovery(response, action)));
            page.resources().forEach(src -> embeddedHooks.forEach(hook -> hook.onDiscovery(response, src)));
        }
        afterFetch.accept(request.url());
    }
}
