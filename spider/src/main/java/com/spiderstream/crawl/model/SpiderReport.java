package com.spiderstream.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.net.URI;
import java.util.Objects;

/**
 * One discovered artifact with its category and provenance.
 * <p>
 * {@code body} and {@code err} are transient: they feed derivation and diagnostics but are never serialized.
 */
@JsonPropertyOrder({"source", "type", "status", "output", "length", "input"})
public record SpiderReport(
    @JsonProperty("output") String output,
    @JsonProperty("type") ReportType type,
    @JsonProperty("status") int statusCode,
    @JsonProperty("source") String source,
    @JsonIgnore String body,
    @JsonIgnore URI origin,
    @JsonIgnore Throwable err,
    @JsonProperty("length") int length
) {
    public static final String SOURCE_BODY = "body";
    public static final String SOURCE_SITEMAP = "sitemap";
    public static final String SOURCE_ROBOTS = "robots";
    public static final String SOURCE_OTHER = "other-sources";

    public SpiderReport {
        Objects.requireNonNull(type, "type");
        output = output == null ? "" : output;
        source = source == null ? SOURCE_BODY : source;
    }

    /**
     * Record for an element found while parsing a page.
     */
    public static SpiderReport discovered(ReportType type, String output, URI origin) {
        return new SpiderReport(output, type, 0, SOURCE_BODY, null, origin, null, 0);
    }

    /**
     * Record for a fetched page, successful or not.
     */
    public static SpiderReport fetched(String url, int statusCode, String body, URI origin, Throwable err) {
        int length = body == null ? 0 : body.length();
        return new SpiderReport(url, ReportType.URL, statusCode, SOURCE_BODY, body, origin, err, length);
    }

    /**
     * Record wrapping a bare URL produced by a supplementary source.
     */
    public static SpiderReport supplementary(String sourceTag, String url, URI origin) {
        return new SpiderReport(url, ReportType.REF, 0, sourceTag, null, origin, null, 0);
    }

    /**
     * Derived copy: keeps source, body, status and origin, replaces output and type.
     */
    public SpiderReport deriveAs(ReportType derivedType, String derivedOutput) {
        return new SpiderReport(derivedOutput, derivedType, statusCode, source, body, origin, null, 0);
    }

    public SpiderReport withOutput(String normalizedOutput) {
        return new SpiderReport(normalizedOutput, type, statusCode, source, body, origin, err, length);
    }

    @JsonProperty("input")
    public String input() {
        return origin == null ? null : origin.toString();
    }

    @JsonIgnore
    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
