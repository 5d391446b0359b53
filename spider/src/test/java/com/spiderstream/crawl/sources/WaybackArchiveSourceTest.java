package com.spiderstream.crawl.sources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaybackArchiveSourceTest {
    private MockWebServer server;
    private ExecutorService executor;
    private WaybackArchiveSource source;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        SpiderProperties properties = new SpiderProperties();
        properties.getHttp().setPerHostDelayMs(1);
        properties.getHttp().setRequestMaxRetries(0);
        String base = server.url("/").toString();
        properties.getSources().setWaybackBaseUrl(base.substring(0, base.length() - 1));
        executor = Executors.newFixedThreadPool(1);
        source = new WaybackArchiveSource(new PoliteHttpClient(properties, executor), new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void skipsHeaderRowAndReturnsOriginalUrls() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("[[\"original\"],[\"http://example.com/old\"],[\"https://api.example.com/v1/users\"]]"));

        assertThat(source.fetch("example.com", true))
            .containsExactly("http://example.com/old", "https://api.example.com/v1/users");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/cdx/search/cdx");
        assertThat(request.getRequestUrl().queryParameter("url")).isEqualTo("*.example.com/*");
        assertThat(request.getRequestUrl().queryParameter("fl")).isEqualTo("original");
    }

    @Test
    void hostOnlyLookupHasNoWildcard() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        assertThat(source.fetch("www.example.com", false)).isEmpty();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("url")).isEqualTo("www.example.com/*");
    }

    @Test
    void failedLookupRaisesCrawlException() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("denied"));

        assertThatThrownBy(() -> source.fetch("example.com", true))
            .isInstanceOf(CrawlException.class)
            .hasMessageContaining("status=403");
    }

    @Test
    void malformedAnswerRaisesCrawlException() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> source.fetch("example.com", true))
            .isInstanceOf(CrawlException.class)
            .hasMessageContaining("not JSON");
    }
}
