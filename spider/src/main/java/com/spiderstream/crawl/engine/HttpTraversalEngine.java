package com.spiderstream.crawl.engine;

import com.spiderstream.crawl.error.MalformedSeedUrlException;
import com.spiderstream.crawl.util.IdleTracker;
import com.spiderstream.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link TraversalEngine} on top of {@link HttpClient} and jsoup. Every URL is fetched at most once per engine.
 * Links are not followed automatically: hooks decide what gets visited next.
 */
public class HttpTraversalEngine implements TraversalEngine {
    private static final Logger log = LoggerFactory.getLogger(HttpTraversalEngine.class);
    private static final int MAX_REDIRECTS = 10;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");
    private static final AtomicInteger ENGINE_IDS = new AtomicInteger();

    private final int maxBodyBytes;
    private final List<DiscoveryHook> anchorHooks = new CopyOnWriteArrayList<>();
    private final List<DiscoveryHook> formHooks = new CopyOnWriteArrayList<>();
    private final List<DiscoveryHook> uploadFormHooks = new CopyOnWriteArrayList<>();
    private final List<DiscoveryHook> embeddedResourceHooks = new CopyOnWriteArrayList<>();
    private final List<Consumer<FetchResponse>> responseHooks = new CopyOnWriteArrayList<>();
    private final List<ErrorHook> errorHooks = new CopyOnWriteArrayList<>();
    private final List<Consumer<FetchRequest>> requestHooks = new CopyOnWriteArrayList<>();
    private final List<Pattern> allowedUrls = new CopyOnWriteArrayList<>();
    private final List<Pattern> disallowedUrls = new CopyOnWriteArrayList<>();
    private final Set<String> visited = ConcurrentHashMap.newKeySet();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();
    private final IdleTracker idleTracker = new IdleTracker();

    private volatile int parallelism = 1;
    private volatile Duration delay = Duration.ZERO;
    private volatile Duration randomDelay = Duration.ZERO;
    private volatile int maxDepth;
    private volatile Supplier<String> userAgent = () -> UserAgents.resolve(UserAgents.WEB);
    private volatile URI proxy;
    private volatile Duration timeout = DEFAULT_TIMEOUT;
    private volatile boolean sameHostRedirectsOnly;

    private HttpClient client;
    private ExecutorService workers;
    private volatile boolean closed;

    public HttpTraversalEngine(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1, maxBodyBytes);
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
        uploadFormHooks.add(hook);
    }

    @Override
    public void onEmbeddedResource(DiscoveryHook hook) {
        embeddedResourceHooks.add(hook);
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
        allowedUrls.add(pattern);
    }

    @Override
    public void disallowUrl(Pattern pattern) {
        disallowedUrls.add(pattern);
    }

    @Override
    public void limit(int parallelism, Duration delay, Duration randomDelay) {
        this.parallelism = Math.max(1, parallelism);
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        this.randomDelay = randomDelay == null || randomDelay.isNegative() ? Duration.ZERO : randomDelay;
    }

    @Override
    public void maxDepth(int maxDepth) {
        this.maxDepth = Math.max(0, maxDepth);
    }

    @Override
    public void userAgent(Supplier<String> userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public void proxy(URI proxy) {
        this.proxy = proxy;
    }

    @Override
    public void timeout(Duration timeout) {
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    @Override
    public void sameHostRedirectsOnly(boolean sameHostOnly) {
        this.sameHostRedirectsOnly = sameHostOnly;
    }

    @Override
    public void visit(String url) {
        URI uri = UrlNormalizer.safeUri(url == null ? null : url.trim());
        if (uri == null) {
            throw new MalformedSeedUrlException(url, "not a valid URI");
        }
        if (!isHttpUrl(uri)) {
            throw new MalformedSeedUrlException(url, "expected an absolute http(s) URL with a host");
        }
        submit(uri, 1);
    }

    @Override
    public void visit(String url, FetchRequest parent) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || !isHttpUrl(uri)) {
            log.debug("ignoring invalid follow-up url {}", url);
            return;
        }
        submit(uri, parent == null ? 1 : parent.depth() + 1);
    }

    @Override
    public void awaitIdle() throws InterruptedException {
        idleTracker.waitUntilIdle();
    }

    @Override
    public void close() {
        closed = true;
        ExecutorService pool;
        synchronized (this) {
            pool = workers;
        }
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private void submit(URI uri, int depth) {
        if (closed) {
            return;
        }
        int depthLimit = maxDepth;
        if (depthLimit > 0 && depth > depthLimit) {
            return;
        }
        String key = uri.toString();
        if (!isUrlAllowed(key) || !visited.add(key)) {
            return;
        }
        ExecutorService pool = ensureStarted();
        idleTracker.started();
        try {
            pool.execute(() -> {
                try {
                    fetch(new FetchRequest(uri, depth));
                } finally {
                    idleTracker.finished();
                }
            });
        } catch (RejectedExecutionException e) {
            idleTracker.finished();
            log.debug("engine closed, dropping {}", key);
        }
    }

    boolean isUrlAllowed(String url) {
        for (Pattern pattern : disallowedUrls) {
            if (pattern.matcher(url).find()) {
                return false;
            }
        }
        if (allowedUrls.isEmpty()) {
            return true;
        }
        for (Pattern pattern : allowedUrls) {
            if (pattern.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }

    private void fetch(FetchRequest request) {
        try {
            awaitHostSlot(request.uri().getHost());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        request.setHeader("User-Agent", userAgent.get());
        for (Consumer<FetchRequest> hook : requestHooks) {
            runHook(() -> hook.accept(request));
        }
        if (request.isAborted() || closed) {
            log.debug("request aborted before sending {}", request.url());
            return;
        }

        FetchResponse response;
        try {
            response = execute(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (IOException | IllegalArgumentException e) {
            FetchResponse failure = FetchResponse.transportFailure(request);
            for (ErrorHook hook : errorHooks) {
                runHook(() -> hook.onError(failure, e));
            }
            return;
        }

        if (response.statusCode() >= 400) {
            for (ErrorHook hook : errorHooks) {
                runHook(() -> hook.onError(response, null));
            }
            return;
        }
        for (Consumer<FetchResponse> hook : responseHooks) {
            runHook(() -> hook.accept(response));
        }
        if (response.isHtml() && response.body() != null) {
            dispatchHtml(response);
        }
    }

    private FetchResponse execute(FetchRequest request) throws IOException, InterruptedException {
        HttpClient httpClient = ensureClient();
        URI current = request.uri();
        for (int hop = 0; ; hop++) {
            HttpRequest.Builder builder = HttpRequest.newBuilder(current).timeout(timeout).GET();
            request.headers().forEach((name, values) -> {
                if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    values.forEach(value -> builder.header(name, value));
                }
            });
            HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());

            Optional<String> location = response.headers().firstValue("Location");
            if (isRedirect(response.statusCode()) && location.isPresent() && hop < MAX_REDIRECTS) {
                String target = UrlNormalizer.resolve(current, location.get());
                if (!target.isEmpty() && shouldFollow(current, target)) {
                    response.body().close();
                    log.debug("redirect {} -> {}", current, target);
                    current = URI.create(target);
                    continue;
                }
            }

            byte[] bytes;
            try (InputStream in = response.body()) {
                bytes = in.readNBytes(maxBodyBytes);
            }
            return new FetchResponse(
                request,
                current,
                response.statusCode(),
                new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null)
            );
        }
    }

    private boolean shouldFollow(URI current, String target) {
        if (!sameHostRedirectsOnly) {
            return true;
        }
        // only the host is compared, so http -> https upgrades on the same host are followed
        String targetHost = URI.create(target).getHost();
        return current.getHost() != null && current.getHost().equalsIgnoreCase(targetHost);
    }

    private void dispatchHtml(FetchResponse page) {
        Document document = Jsoup.parse(page.body(), page.url());
        for (Element element : document.select("[href]")) {
            fire(anchorHooks, page, element.attr("href"));
        }
        for (Element element : document.select("form[action]")) {
            fire(formHooks, page, element.attr("action"));
        }
        for (Element element : document.select("input[type=file]")) {
            fire(uploadFormHooks, page, element.attr("name"));
        }
        for (Element element : document.select("[src]")) {
            fire(embeddedResourceHooks, page, element.attr("src"));
        }
    }

    private void fire(List<DiscoveryHook> hooks, FetchResponse page, String value) {
        for (DiscoveryHook hook : hooks) {
            runHook(() -> hook.onDiscovery(page, value));
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("hook failed: {}", e.getMessage(), e);
        }
    }

    private void awaitHostSlot(String host) throws InterruptedException {
        Duration fixed = delay;
        Duration jitter = randomDelay;
        if (host == null || (fixed.isZero() && jitter.isZero())) {
            return;
        }
        String key = host.toLowerCase(Locale.ROOT);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(key, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            long jitterMs = jitter.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitter.toMillis() + 1);
            hostNextAllowed.put(key, Instant.now().plus(fixed).plusMillis(jitterMs));
        }
    }

    private synchronized ExecutorService ensureStarted() {
        if (workers == null) {
            int engineId = ENGINE_IDS.incrementAndGet();
            AtomicInteger threadIds = new AtomicInteger();
            workers = Executors.newFixedThreadPool(parallelism, runnable -> {
                Thread thread = new Thread(runnable, "spider-" + engineId + "-worker-" + threadIds.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
        return workers;
    }

    private synchronized HttpClient ensureClient() {
        if (client == null) {
            HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1);
            if (proxy != null && proxy.getHost() != null) {
                int port = proxy.getPort() == -1 ? 8080 : proxy.getPort();
                builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), port)));
            }
            client = builder.build();
        }
        return client;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static boolean isHttpUrl(URI uri) {
        String scheme = uri.getScheme();
        return scheme != null
            && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
            && uri.getHost() != null;
    }
}
