package com.spiderstream.crawl.derive;

import com.spiderstream.crawl.error.DomainResolutionException;
import com.spiderstream.crawl.model.SpiderReport;

import java.util.List;
import java.util.Optional;

/**
 * Records derived from one page together with the subdomain failure, if any. The reports are valid
 * even when an error is present.
 */
public record DerivationResult(List<SpiderReport> reports, DomainResolutionException error) {
    public DerivationResult {
        reports = reports == null ? List.of() : List.copyOf(reports);
    }

    public static DerivationResult empty() {
        return new DerivationResult(List.of(), null);
    }

    public Optional<DomainResolutionException> failure() {
        return Optional.ofNullable(error);
    }
}
