package com.spiderstream.crawl.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpiderReportTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesWithoutBodyOrError() throws Exception {
        SpiderReport page = SpiderReport.fetched(
            "https://www.example.com/", 403, "<html>secret</html>", URI.create("https://www.example.com/"),
            new IllegalStateException("boom")
        );

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(page));

        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("source", "type", "status", "output", "length", "input");
        assertThat(json.get("type").asText()).isEqualTo("url");
        assertThat(json.get("status").asInt()).isEqualTo(403);
        assertThat(json.get("length").asInt()).isEqualTo(19);
        assertThat(json.get("input").asText()).isEqualTo("https://www.example.com/");
    }

    @Test
    void derivedRecordKeepsProvenance() throws Exception {
        SpiderReport page = SpiderReport.fetched("https://www.example.com/", 200, "body", URI.create("https://www.example.com/"), null);

        SpiderReport bucket = page.deriveAs(ReportType.AWS_S3, "backup.s3.amazonaws.com");

        assertThat(bucket.statusCode()).isEqualTo(200);
        assertThat(bucket.source()).isEqualTo(SpiderReport.SOURCE_BODY);
        assertThat(bucket.err()).isNull();
        assertThat(objectMapper.readTree(objectMapper.writeValueAsString(bucket)).get("type").asText()).isEqualTo("aws-s3");
    }

    @Test
    void supplementaryRecordIsTaggedWithItsSource() {
        SpiderReport report = SpiderReport.supplementary(SpiderReport.SOURCE_SITEMAP, "https://x.test/a", URI.create("https://x.test"));

        assertThat(report.type()).isEqualTo(ReportType.REF);
        assertThat(report.source()).isEqualTo("sitemap");
        assertThat(report.hasBody()).isFalse();
    }

    @Test
    void parsesWireValues() {
        assertThat(ReportType.fromValue(" Upload-Form ")).isEqualTo(ReportType.UPLOAD_FORM);
        assertThat(ReportType.AWS_S3.isUrlBearing()).isFalse();
        assertThat(ReportType.FORM.isUrlBearing()).isTrue();
    }
}
