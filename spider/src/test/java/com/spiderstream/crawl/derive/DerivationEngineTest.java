package com.spiderstream.crawl.derive;

import com.spiderstream.crawl.model.ReportType;
import com.spiderstream.crawl.model.SpiderReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DerivationEngineTest {
    private ExecutorService executor;
    private DerivationEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        engine = new DerivationEngine(new BaseDomainResolver(), new SubdomainExtractor(), new BucketExtractor(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void derivesSubdomainsAndBucketsFromPageBody() throws Exception {
        URI origin = URI.create("https://www.example.com/");
        SpiderReport page = SpiderReport.fetched(
            "https://www.example.com/", 200, "see backup.s3.amazonaws.com and old.example.com", origin, null
        );

        DerivationResult result = engine.deriveAsync(page).get(5, TimeUnit.SECONDS);

        assertThat(result.failure()).isEmpty();
        assertThat(result.reports())
            .extracting(SpiderReport::type, SpiderReport::output, SpiderReport::statusCode, SpiderReport::source)
            .containsExactly(
                tuple(ReportType.DOMAIN, "old.example.com", 200, SpiderReport.SOURCE_BODY),
                tuple(ReportType.AWS_S3, "backup.s3.amazonaws.com", 200, SpiderReport.SOURCE_BODY)
            );
        assertThat(result.reports()).allSatisfy(report -> assertThat(report.origin()).isEqualTo(origin));
    }

    @Test
    void bucketsSurviveSubdomainFailureOnIpOrigin() {
        SpiderReport page = SpiderReport.fetched(
            "http://10.0.0.5/", 200, "files at media.s3.amazonaws.com", URI.create("http://10.0.0.5/"), null
        );

        DerivationResult result = engine.derive(page);

        assertThat(result.failure()).hasValueSatisfying(e -> assertThat(e.getHost()).isEqualTo("10.0.0.5"));
        assertThat(result.reports())
            .extracting(SpiderReport::type, SpiderReport::output)
            .containsExactly(tuple(ReportType.AWS_S3, "media.s3.amazonaws.com"));
    }

    @Test
    void pagesWithoutBodyDeriveNothing() {
        SpiderReport page = SpiderReport.fetched("https://www.example.com/", 204, "", URI.create("https://www.example.com/"), null);

        DerivationResult result = engine.derive(page);

        assertThat(result.reports()).isEmpty();
        assertThat(result.failure()).isEmpty();
    }
}
