package com.spiderstream.crawl.derive;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds object-storage bucket references (S3 and Google Cloud Storage) in free text.
 */
@Component
public class BucketExtractor {
    private static final Pattern BUCKET = Pattern.compile(
        "(?i)"
            + "[a-z0-9.-]+\\.s3\\.amazonaws\\.com"
            + "|[a-z0-9.-]+\\.s3-website[.-][a-z0-9-]+\\.amazonaws\\.com"
            + "|[a-z0-9.-]+\\.s3[.-][a-z0-9-]+\\.amazonaws\\.com"
            + "|//s3\\.amazonaws\\.com/[a-z0-9._-]+"
            + "|//s3[.-][a-z0-9-]+\\.amazonaws\\.com/[a-z0-9._-]+"
            + "|s3://[a-z0-9._-]+"
            + "|[a-z0-9._-]+\\.storage\\.googleapis\\.com"
            + "|//storage\\.googleapis\\.com/[a-z0-9._-]+"
            + "|gs://[a-z0-9._-]+"
    );

    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        Matcher matcher = BUCKET.matcher(text);
        while (matcher.find()) {
            String cleaned = clean(matcher.group());
            if (!cleaned.isEmpty()) {
                unique.add(cleaned);
            }
        }
        return new ArrayList<>(unique);
    }

    private String clean(String match) {
        String value = match.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("//")) {
            value = value.substring(2);
        }
        while (value.startsWith(".") || value.startsWith("-")) {
            value = value.substring(1);
        }
        return value;
    }
}
