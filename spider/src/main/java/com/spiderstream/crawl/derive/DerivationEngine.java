package com.spiderstream.crawl.derive;

import com.spiderstream.crawl.error.DomainResolutionException;
import com.spiderstream.crawl.model.ReportType;
import com.spiderstream.crawl.model.SpiderReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Produces subdomain and cloud-bucket records from the body of a fetched page.
 */
@Service
public class DerivationEngine {
    private static final Logger log = LoggerFactory.getLogger(DerivationEngine.class);

    private final BaseDomainResolver baseDomainResolver;
    private final SubdomainExtractor subdomainExtractor;
    private final BucketExtractor bucketExtractor;
    private final ExecutorService derivationExecutor;

    public DerivationEngine(
        BaseDomainResolver baseDomainResolver,
        SubdomainExtractor subdomainExtractor,
        BucketExtractor bucketExtractor,
        @Qualifier("derivationExecutor") ExecutorService derivationExecutor
    ) {
        this.baseDomainResolver = baseDomainResolver;
        this.subdomainExtractor = subdomainExtractor;
        this.bucketExtractor = bucketExtractor;
        this.derivationExecutor = derivationExecutor;
    }

    /**
     * @throws DomainResolutionException when the page host has no registrable domain
     */
    public List<SpiderReport> deriveSubdomains(SpiderReport parent) {
        if (!parent.hasBody()) {
            return List.of();
        }
        String host = parent.origin() == null ? null : parent.origin().getHost();
        String baseDomain = baseDomainResolver.registrableDomain(host);
        List<SpiderReport> derived = new ArrayList<>();
        for (String fqdn : subdomainExtractor.extract(parent.body(), baseDomain)) {
            derived.add(parent.deriveAs(ReportType.DOMAIN, fqdn));
        }
        return derived;
    }

    public List<SpiderReport> deriveBuckets(SpiderReport parent) {
        if (!parent.hasBody()) {
            return List.of();
        }
        List<SpiderReport> derived = new ArrayList<>();
        for (String bucket : bucketExtractor.extract(parent.body())) {
            derived.add(parent.deriveAs(ReportType.AWS_S3, bucket));
        }
        return derived;
    }

    /**
     * Runs both derivations. A subdomain failure does not stop bucket derivation; the failure is returned
     * next to whatever was found.
     */
    public DerivationResult derive(SpiderReport parent) {
        List<SpiderReport> reports = new ArrayList<>();
        DomainResolutionException failure = null;
        try {
            reports.addAll(deriveSubdomains(parent));
        } catch (DomainResolutionException e) {
            log.debug("subdomain derivation failed for {}: {}", parent.output(), e.getMessage());
            failure = e;
        }
        reports.addAll(deriveBuckets(parent));
        return new DerivationResult(reports, failure);
    }

    /**
     * Same as {@link #derive(SpiderReport)} on the derivation pool, so page fetching is never blocked.
     */
    public CompletableFuture<DerivationResult> deriveAsync(SpiderReport parent) {
        return CompletableFuture.supplyAsync(() -> derive(parent), derivationExecutor);
    }
}
