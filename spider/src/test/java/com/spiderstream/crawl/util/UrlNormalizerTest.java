package com.spiderstream.crawl.util;

import com.spiderstream.crawl.model.ReportType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {
    private static final URI PAGE = URI.create("https://www.example.com/docs/guide/index.html?lang=en");

    @Test
    void resolvesRelativeAndRootRelativePaths() {
        assertThat(UrlNormalizer.resolve(PAGE, "intro.html")).isEqualTo("https://www.example.com/docs/guide/intro.html");
        assertThat(UrlNormalizer.resolve(PAGE, "../api/")).isEqualTo("https://www.example.com/docs/api/");
        assertThat(UrlNormalizer.resolve(PAGE, "/login")).isEqualTo("https://www.example.com/login");
    }

    @Test
    void resolvesProtocolRelativeReferencesWithThePageScheme() {
        assertThat(UrlNormalizer.resolve(PAGE, "//cdn.example.net/app.js")).isEqualTo("https://cdn.example.net/app.js");
    }

    @Test
    void resolvesQueryOnlyReferenceAgainstTheFullPagePath() {
        assertThat(UrlNormalizer.resolve(PAGE, "?page=2")).isEqualTo("https://www.example.com/docs/guide/index.html?page=2");
    }

    @Test
    void resolvesAgainstOriginWithoutPath() {
        assertThat(UrlNormalizer.resolve(URI.create("https://example.com"), "about")).isEqualTo("https://example.com/about");
    }

    @Test
    void keepsAbsoluteUrlsButCanonicalizesSchemeAndHost() {
        assertThat(UrlNormalizer.resolve(PAGE, "HTTPS://Shop.Example.COM/Cart?Item=A#top"))
            .isEqualTo("https://shop.example.com/Cart?Item=A");
    }

    @Test
    void stripsWhitespaceAndEncodesSpaces() {
        assertThat(UrlNormalizer.resolve(PAGE, "  /a b\n/c\t ")).isEqualTo("https://www.example.com/a%20b/c");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "#section",
        "javascript:void(0)",
        "JavaScript:alert(1)",
        "mailto:someone@example.com",
        "tel:+1555123",
        "ftp://files.example.com/x",
        "http://[broken",
        ""
    })
    void dropsReferencesThatAreNotCrawlable(String raw) {
        assertThat(UrlNormalizer.resolve(PAGE, raw)).isEmpty();
    }

    @Test
    void dropsRelativeReferenceWithoutOrigin() {
        assertThat(UrlNormalizer.resolve(null, "/relative")).isEmpty();
        assertThat(UrlNormalizer.resolve(PAGE, null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "intro.html",
        "../../up/../x",
        "//cdn.example.net/a/./b.js",
        "HTTP://EXAMPLE.com:8080/p?q=1#f",
        "?only=query",
        "/with space/x",
        "mailto:x@example.com"
    })
    void resolveIsIdempotent(String raw) {
        String once = UrlNormalizer.resolve(PAGE, raw);
        String twice = UrlNormalizer.resolve(PAGE, once);
        assertThat(twice).isIn(once, "");
        if (!once.isEmpty()) {
            assertThat(twice).isEqualTo(once);
        }
    }

    @Test
    void normalizesDomainAndBucketOutputsWithoutResolvingThem() {
        assertThat(UrlNormalizer.normalize(ReportType.DOMAIN, PAGE, " Old.Example.com ")).isEqualTo("old.example.com");
        assertThat(UrlNormalizer.normalize(ReportType.AWS_S3, PAGE, "Backup.s3.amazonaws.com"))
            .isEqualTo("backup.s3.amazonaws.com");
        assertThat(UrlNormalizer.normalize(ReportType.SRC, PAGE, "/static/app.js"))
            .isEqualTo("https://www.example.com/static/app.js");
    }

    @Test
    void extensionIgnoresQueryAndFragment() {
        assertThat(UrlNormalizer.extensionOf("https://x.test/app.min.js?v=3")).isEqualTo(".js");
        assertThat(UrlNormalizer.extensionOf("https://x.test/data.JSON")).isEqualTo(".json");
        assertThat(UrlNormalizer.extensionOf("https://x.test/dir.v2/")).isEmpty();
        assertThat(UrlNormalizer.extensionOf("https://x.test/page")).isEmpty();
    }
}
