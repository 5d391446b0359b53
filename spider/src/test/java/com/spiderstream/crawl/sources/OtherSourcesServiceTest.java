package com.spiderstream.crawl.sources;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.CrawlException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OtherSourcesServiceTest {

    @Test
    void mergesSourcesAndToleratesFailingOne() {
        HistoricalUrlSource failing = mock(HistoricalUrlSource.class);
        when(failing.name()).thenReturn("wayback");
        when(failing.fetch("example.com", true)).thenThrow(new CrawlException("wayback down"));
        HistoricalUrlSource working = mock(HistoricalUrlSource.class);
        when(working.fetch("example.com", true))
            .thenReturn(List.of(" https://example.com/a ", "", "https://example.com/a", "https://example.com/b"));

        OtherSourcesService service = new OtherSourcesService(List.of(failing, working), new SpiderProperties());

        assertThat(service.discover(URI.create("https://example.com/start")))
            .containsExactly("https://example.com/a", "https://example.com/b");
        assertThat(service.sourceTag()).isEqualTo("other-sources");
    }

    @Test
    void siteWithoutHostIsSkipped() {
        HistoricalUrlSource source = mock(HistoricalUrlSource.class);
        OtherSourcesService service = new OtherSourcesService(List.of(source), new SpiderProperties());

        assertThat(service.discover(URI.create("file:///tmp/x"))).isEmpty();
        verify(source, never()).fetch("", true);
    }
}
