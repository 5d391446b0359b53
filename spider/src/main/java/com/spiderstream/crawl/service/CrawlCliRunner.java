package com.spiderstream.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.model.SpiderReport;
import com.spiderstream.crawl.stream.CrawlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final SpiderProperties properties;
    private final CrawlStreamService crawlStreamService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;
    private final PrintStream out;

    @Autowired
    public CrawlCliRunner(
        SpiderProperties properties,
        CrawlStreamService crawlStreamService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this(properties, crawlStreamService, objectMapper, applicationContext, System.out);
    }

    CrawlCliRunner(
        SpiderProperties properties,
        CrawlStreamService crawlStreamService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext,
        PrintStream out
    ) {
        this.properties = properties;
        this.crawlStreamService = crawlStreamService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> sites = properties.getCli().getSites().stream()
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        if (sites.isEmpty()) {
            log.warn("spider.cli.run is set but spider.cli.sites is empty");
        }

        CrawlSession session = crawlStreamService.start(sites);
        ScheduledExecutorService deadline = Executors.newSingleThreadScheduledExecutor();
        int maxDurationSeconds = properties.getCli().getMaxDurationSeconds();
        if (maxDurationSeconds > 0) {
            deadline.schedule(
                () -> {
                    log.info("Crawl session {} reached max duration of {}s, cancelling", session.id(), maxDurationSeconds);
                    session.cancel();
                },
                maxDurationSeconds,
                TimeUnit.SECONDS
            );
        }

        AtomicInteger records = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        try {
            session.drain(
                report -> {
                    records.incrementAndGet();
                    print(report);
                },
                error -> {
                    errors.incrementAndGet();
                    logError(error);
                }
            );
        } finally {
            deadline.shutdownNow();
        }
        log.info("Crawl session {} finished: state={} records={} errors={}", session.id(), session.state(), records.get(), errors.get());

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private void print(SpiderReport report) {
        if (!properties.getCli().isJson()) {
            out.println("[" + report.type() + "] - [code-" + report.statusCode() + "] - " + report.output());
            return;
        }
        try {
            out.println(objectMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize record {}", report.output(), e);
        }
    }

    private void logError(CrawlException error) {
        if (error.isFatal()) {
            log.error("{}", error.getMessage(), error);
        } else {
            log.warn("{}", error.getMessage());
        }
    }
}
