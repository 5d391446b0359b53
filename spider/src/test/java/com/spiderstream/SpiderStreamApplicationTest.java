package com.spiderstream;

import com.spiderstream.crawl.service.CrawlStreamService;
import com.spiderstream.crawl.sources.HistoricalUrlSource;
import com.spiderstream.crawl.sources.SupplementarySource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class SpiderStreamApplicationTest {
    @Autowired
    private CrawlStreamService crawlStreamService;

    @Autowired
    private List<SupplementarySource> supplementarySources;

    @Autowired
    private List<HistoricalUrlSource> historicalUrlSources;

    @Test
    void wiresStreamServiceWithAllSources() {
        assertThat(crawlStreamService).isNotNull();
        assertThat(supplementarySources)
            .extracting(SupplementarySource::sourceTag)
            .containsExactlyInAnyOrder("sitemap", "robots", "other-sources");
        assertThat(historicalUrlSources)
            .extracting(HistoricalUrlSource::name)
            .containsExactlyInAnyOrder("wayback", "otx");
    }
}
