package com.spiderstream.crawl.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFetchResultTest {
    @Test
    void failureHasNoStatusOrBody() {
        HttpFetchResult result = HttpFetchResult.failure("https://example.com/robots.txt", "timeout", "read timed out");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isZero();
        assertThat(result.body()).isNull();
        assertThat(result.errorCode()).isEqualTo("timeout");
    }

    @Test
    void onlyTwoHundredsAreSuccessful() {
        byte[] bytes = "User-agent: *".getBytes(StandardCharsets.UTF_8);

        assertThat(HttpFetchResult.response("https://example.com/", 200, bytes, null).isSuccessful()).isTrue();
        assertThat(HttpFetchResult.response("https://example.com/", 304, bytes, null).isSuccessful()).isFalse();
        assertThat(HttpFetchResult.response("https://example.com/", 503, bytes, null).isSuccessful()).isFalse();
        assertThat(HttpFetchResult.response("https://example.com/", 200, bytes, null).body()).isEqualTo("User-agent: *");
    }
}
