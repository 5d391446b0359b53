package com.spiderstream.crawl.engine;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EngineConfigurersTest {
    private final TraversalEngine engine = mock(TraversalEngine.class);

    @Test
    void whitelistDomainAllowsBothSchemes() {
        EngineConfigurers.whitelistDomain("example\\.com").configure(engine);

        ArgumentCaptor<Pattern> captor = ArgumentCaptor.forClass(Pattern.class);
        verify(engine).allowUrl(captor.capture());
        assertThat(captor.getValue().matcher("http://example.com/a").find()).isTrue();
        assertThat(captor.getValue().matcher("https://example.com/a").find()).isTrue();
        assertThat(captor.getValue().matcher("https://other.test/").find()).isFalse();
    }

    @Test
    void invalidRegexFailsProvisioning() {
        assertThatThrownBy(() -> EngineConfigurers.scope("([").configure(engine))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("scope");
        assertThatThrownBy(() -> EngineConfigurers.disallow("*oops").configure(engine))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void defaultDisallowRejectsMediaAndStylesheets() {
        Pattern pattern = Pattern.compile(EngineConfigurers.DEFAULT_DISALLOWED_REGEX);

        assertThat(pattern.matcher("https://x.test/logo.PNG").find()).isTrue();
        assertThat(pattern.matcher("https://x.test/site.css?v=1").find()).isTrue();
        assertThat(pattern.matcher("https://x.test/app.js").find()).isFalse();
        assertThat(pattern.matcher("https://x.test/page.html").find()).isFalse();
    }

    @Test
    void limitValidatesArguments() {
        EngineConfigurers.limit(3, 1, 2).configure(engine);
        verify(engine).limit(3, Duration.ofSeconds(1), Duration.ofSeconds(2));

        assertThatThrownBy(() -> EngineConfigurers.limit(0, 0, 0).configure(engine))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void zeroTimeoutFallsBackToTenSeconds() {
        EngineConfigurers.timeout(0).configure(engine);

        verify(engine).timeout(Duration.ofSeconds(10));
    }

    @Test
    void headerIsSetOnEveryRequest() {
        FetchRequest request = new FetchRequest(URI.create("https://x.test/"), 1);

        applyRequestHooks(List.of(EngineConfigurers.header("X-Api-Key: abc:def")), request);

        assertThat(request.header("x-api-key")).isEqualTo("abc:def");
    }

    @Test
    void malformedHeaderFailsProvisioning() {
        assertThatThrownBy(() -> EngineConfigurers.header("NoColonHere").configure(engine))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> EngineConfigurers.header(": value").configure(engine))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void proxyNeedsAHost() {
        EngineConfigurers.proxy("http://127.0.0.1:8080").configure(engine);
        verify(engine).proxy(URI.create("http://127.0.0.1:8080"));

        assertThatThrownBy(() -> EngineConfigurers.proxy("not a proxy").configure(engine))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rawRequestReplaysHeadersAndCookie(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("request.txt");
        Files.writeString(file, "GET /account HTTP/1.1\nHost: example.com\nAuthorization: Bearer t0k\nCookie: session=1\n\n");
        FetchRequest request = new FetchRequest(URI.create("https://example.com/"), 1);

        applyRequestHooks(List.of(EngineConfigurers.rawRequest(file)), request);

        assertThat(request.header("Authorization")).isEqualTo("Bearer t0k");
        assertThat(request.header("Cookie")).isEqualTo("session=1");
    }

    @Test
    void missingRawRequestFileFailsProvisioning(@TempDir Path dir) {
        assertThatThrownBy(() -> EngineConfigurers.rawRequest(dir.resolve("absent.txt")).configure(engine))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fromPropertiesAppliesDefaults() {
        SpiderProperties properties = new SpiderProperties();

        for (EngineConfigurer configurer : EngineConfigurers.fromProperties(properties)) {
            configurer.configure(engine);
        }

        verify(engine).maxDepth(3);
        verify(engine).disallowUrl(any(Pattern.class));
        verify(engine, never()).allowUrl(any(Pattern.class));
        verify(engine).limit(5, Duration.ZERO, Duration.ZERO);
        verify(engine).timeout(Duration.ofSeconds(10));
        verify(engine, never()).sameHostRedirectsOnly(true);
        verify(engine).userAgent(any());
    }

    @Test
    void fromPropertiesFailsOnBadWhitelist() {
        SpiderProperties properties = new SpiderProperties();
        properties.getScope().setWhitelist(List.of("(["));

        assertThatThrownBy(() -> EngineConfigurers.fromProperties(properties).forEach(c -> c.configure(engine)))
            .isInstanceOf(ConfigurationException.class);
    }

    @SuppressWarnings("unchecked")
    private void applyRequestHooks(List<EngineConfigurer> configurers, FetchRequest request) {
        configurers.forEach(c -> c.configure(engine));
        ArgumentCaptor<Consumer<FetchRequest>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(engine, atLeastOnce()).onRequest(captor.capture());
        captor.getAllValues().forEach(hook -> hook.accept(request));
    }
}
