package com.spiderstream.crawl.service;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.derive.DerivationEngine;
import com.spiderstream.crawl.derive.DerivationResult;
import com.spiderstream.crawl.engine.EngineConfigurer;
import com.spiderstream.crawl.engine.EngineConfigurers;
import com.spiderstream.crawl.engine.FetchRequest;
import com.spiderstream.crawl.engine.FetchResponse;
import com.spiderstream.crawl.engine.TraversalEngine;
import com.spiderstream.crawl.engine.TraversalEngineFactory;
import com.spiderstream.crawl.error.ConfigurationException;
import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.error.MalformedSeedUrlException;
import com.spiderstream.crawl.error.SuppressedTransportException;
import com.spiderstream.crawl.error.TransportException;
import com.spiderstream.crawl.model.ReportType;
import com.spiderstream.crawl.model.SpiderReport;
import com.spiderstream.crawl.sources.SupplementarySource;
import com.spiderstream.crawl.stream.CrawlSession;
import com.spiderstream.crawl.stream.ReportChannel;
import com.spiderstream.crawl.util.BodyDecoder;
import com.spiderstream.crawl.util.DuplicateFilter;
import com.spiderstream.crawl.util.IdleTracker;
import com.spiderstream.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs crawl sessions. Each session gets its own engine and its own dedup state; records flow
 * hook -> normalize -> dedup -> emit -> follow-ups -> engine, and fetched bodies are additionally scanned for
 * subdomains and buckets.
 */
@Service
public class CrawlStreamService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStreamService.class);
    private static final Duration INPUT_POLL = Duration.ofMillis(100);

    private final SpiderProperties properties;
    private final TraversalEngineFactory engineFactory;
    private final DerivationEngine derivationEngine;
    private final List<SupplementarySource> supplementarySources;
    private final ExecutorService sessionExecutor;
    private final AtomicLong sessionIds = new AtomicLong();

    public CrawlStreamService(
        SpiderProperties properties,
        TraversalEngineFactory engineFactory,
        DerivationEngine derivationEngine,
        List<SupplementarySource> supplementarySources,
        @Qualifier("sessionExecutor") ExecutorService sessionExecutor
    ) {
        this.properties = properties;
        this.engineFactory = engineFactory;
        this.derivationEngine = derivationEngine;
        this.supplementarySources = List.copyOf(supplementarySources);
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Crawls a fixed list of sites. The session drains once every site was seeded and the engine went idle.
     */
    public CrawlSession start(List<String> sites) {
        Iterator<String> remaining = List.copyOf(sites).iterator();
        return launch(session -> remaining.hasNext() ? remaining.next() : null);
    }

    /**
     * Crawls sites as they arrive on {@code siteInput}; the caller closes the channel to end the input.
     */
    public CrawlSession stream(ReportChannel<String> siteInput) {
        return launch(session -> {
            while (!session.isCancelled()) {
                String site = siteInput.poll(INPUT_POLL);
                if (site != null) {
                    return site;
                }
                if (siteInput.isDrained()) {
                    return null;
                }
            }
            return null;
        });
    }

    private CrawlSession launch(SeedFeed feed) {
        CrawlSession session = new CrawlSession(
            "crawl-" + sessionIds.incrementAndGet(),
            properties.getStream().getReportCapacity(),
            properties.getStream().getErrorCapacity()
        );
        try {
            sessionExecutor.submit(() -> run(session, feed));
        } catch (RejectedExecutionException e) {
            log.warn("Crawl session {} could not be scheduled", session.id(), e);
            sendQuietly(session, new CrawlException("crawl session could not be scheduled", e));
            session.close();
        }
        return session;
    }

    private void run(CrawlSession session, SeedFeed feed) {
        Instant startedAt = Instant.now();
        TraversalEngine engine = null;
        SessionPipeline pipeline = null;
        try {
            engine = provision(session);
            if (engine == null) {
                return;
            }
            pipeline = new SessionPipeline(session, engine);
            pipeline.register();
            session.markRunning();
            log.info("Crawl session {} running", session.id());

            String site;
            while (!session.isCancelled() && (site = feed.next(session)) != null) {
                pipeline.seed(site);
            }

            session.markDraining();
            engine.awaitIdle();
            pipeline.awaitDerivations();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.cancel();
            log.info("Crawl session {} interrupted", session.id());
        } catch (RuntimeException e) {
            log.warn("Crawl session {} failed", session.id(), e);
            sendQuietly(session, new CrawlException("crawl session failed: " + e.getMessage(), e));
        } finally {
            if (engine != null) {
                engine.close();
            }
            session.close();
            log.info(
                "Crawl session {} closed state={} emitted={} duration={}",
                session.id(),
                session.state(),
                pipeline == null ? 0 : pipeline.emittedCount(),
                Duration.between(startedAt, Instant.now())
            );
        }
    }

    /**
     * @return the configured engine, or null when a provisioning step failed and the fatal error was reported
     */
    private TraversalEngine provision(CrawlSession session) {
        TraversalEngine engine = engineFactory.create();
        try {
            for (EngineConfigurer configurer : EngineConfigurers.fromProperties(properties)) {
                configurer.configure(engine);
            }
            return engine;
        } catch (ConfigurationException e) {
            engine.close();
            log.warn("Crawl session {} provisioning failed: {}", session.id(), e.getMessage());
            sendQuietly(session, new ConfigurationException("failed to provision traversal engine: " + e.getMessage(), e));
            return null;
        }
    }

    private List<SupplementarySource> enabledSources() {
        SpiderProperties.Sources sources = properties.getSources();
        return supplementarySources.stream()
            .filter(source -> switch (source.sourceTag()) {
                case SpiderReport.SOURCE_SITEMAP -> sources.isSitemap();
                case SpiderReport.SOURCE_ROBOTS -> sources.isRobots();
                case SpiderReport.SOURCE_OTHER -> sources.isOtherSources();
                default -> false;
            })
            .toList();
    }

    private static void sendQuietly(CrawlSession session, CrawlException error) {
        try {
            session.errors().send(error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dropped error for session {}: {}", session.id(), error.getMessage());
        }
    }

    @FunctionalInterface
    private interface SeedFeed {
        /**
         * @return next site, or null when the input is exhausted
         */
        String next(CrawlSession session) throws InterruptedException;
    }

    /**
     * Hook wiring and dedup state of one session.
     */
    private final class SessionPipeline {
        private final CrawlSession session;
        private final TraversalEngine engine;
        private final DuplicateFilter emitted = new DuplicateFilter();
        private final DuplicateFilter submitted = new DuplicateFilter();
        private final IdleTracker derivations = new IdleTracker();
        private final Set<Integer> filteredLengths;
        private final List<SupplementarySource> sources;
        private final boolean deriveEnabled;

        SessionPipeline(CrawlSession session, TraversalEngine engine) {
            this.session = session;
            this.engine = engine;
            this.filteredLengths = Set.copyOf(properties.getFilterLength());
            this.sources = enabledSources();
            this.deriveEnabled = properties.getDerivation().isEnabled();
        }

        void register() {
            engine.onAnchor((page, href) ->
                handle(SpiderReport.discovered(ReportType.REF, href, page.uri()), page.request()));
            engine.onEmbeddedResource((page, src) ->
                handle(SpiderReport.discovered(ReportType.SRC, src, page.uri()), page.request()));
            // forms are reported by the page that contains them
            engine.onForm((page, action) ->
                handle(SpiderReport.discovered(ReportType.FORM, page.url(), page.uri()), page.request()));
            engine.onUploadForm((page, field) ->
                handle(SpiderReport.discovered(ReportType.UPLOAD_FORM, page.url(), page.uri()), page.request()));
            engine.onResponse(this::handleResponse);
            engine.onError(this::handleFailure);
            engine.onRequest(request -> {
                if (session.isCancelled()) {
                    request.abort();
                }
            });
        }

        void seed(String site) {
            try {
                engine.visit(site);
            } catch (MalformedSeedUrlException e) {
                log.debug("Skipping malformed seed {}", site);
                send(e);
                return;
            }
            URI siteUri = UrlNormalizer.safeUri(site.trim());
            for (SupplementarySource source : sources) {
                if (session.isCancelled()) {
                    return;
                }
                List<String> urls;
                try {
                    urls = source.discover(siteUri);
                } catch (RuntimeException e) {
                    log.warn("Supplementary source {} failed for {}", source.sourceTag(), site, e);
                    send(new CrawlException(source.sourceTag() + " discovery failed for " + site + ": " + e.getMessage(), e));
                    continue;
                }
                log.debug("Supplementary source {} found {} urls for {}", source.sourceTag(), urls.size(), site);
                for (String url : urls) {
                    handle(SpiderReport.supplementary(source.sourceTag(), url, siteUri), null);
                }
            }
        }

        void awaitDerivations() throws InterruptedException {
            derivations.waitUntilIdle();
        }

        int emittedCount() {
            return emitted.size();
        }

        private void handleResponse(FetchResponse response) {
            if (session.isCancelled()) {
                return;
            }
            String body = BodyDecoder.decodeChars(response.body());
            if (isFilteredLength(body)) {
                return;
            }
            SpiderReport page = SpiderReport.fetched(response.url(), response.statusCode(), body, response.uri(), null);
            handle(page, response.request());
            derive(page);
        }

        private void handleFailure(FetchResponse response, Throwable cause) {
            if (session.isCancelled()) {
                return;
            }
            TransportException error = TransportException.classify(response.url(), response.statusCode(), cause);
            if (error instanceof SuppressedTransportException) {
                log.debug("Suppressed {}", error.getMessage());
                return;
            }
            if (response.statusCode() > 0 && response.body() != null) {
                String body = BodyDecoder.decodeChars(response.body());
                if (!isFilteredLength(body)) {
                    SpiderReport page = SpiderReport.fetched(response.url(), response.statusCode(), body, response.uri(), error);
                    handle(page, response.request());
                    derive(page);
                }
            }
            send(error);
        }

        private boolean isFilteredLength(String body) {
            return !filteredLengths.isEmpty() && filteredLengths.contains(body == null ? 0 : body.length());
        }

        /**
         * Normalizes, deduplicates and emits one record, then queues its follow-ups.
         */
        private void handle(SpiderReport report, FetchRequest parent) {
            if (session.isCancelled()) {
                return;
            }
            String normalized = UrlNormalizer.normalize(report.type(), report.origin(), report.output());
            if (normalized.isEmpty() || emitted.testAndInsert(normalized)) {
                return;
            }
            SpiderReport record = report.withOutput(normalized);
            try {
                if (!session.reports().send(record)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (String next : FollowUpPolicy.followUps(record.type(), normalized)) {
                if (!submitted.testAndInsert(next)) {
                    engine.visit(next, parent);
                }
            }
        }

        private void derive(SpiderReport page) {
            if (!deriveEnabled || !page.hasBody()) {
                return;
            }
            derivations.started();
            CompletableFuture<DerivationResult> future;
            try {
                future = derivationEngine.deriveAsync(page);
            } catch (RejectedExecutionException e) {
                derivations.finished();
                log.debug("Derivation rejected for {}", page.output());
                return;
            }
            future.whenComplete((result, failure) -> {
                try {
                    if (failure != null) {
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause()
                            : failure;
                        send(cause instanceof CrawlException crawlException
                            ? crawlException
                            : new CrawlException("derivation failed for " + page.output(), cause));
                        return;
                    }
                    for (SpiderReport derived : result.reports()) {
                        handle(derived, null);
                    }
                    result.failure().ifPresent(this::send);
                } finally {
                    derivations.finished();
                }
            });
        }

        private void send(CrawlException error) {
            if (session.isCancelled()) {
                return;
            }
            sendQuietly(session, error);
        }
    }
}
