package com.spiderstream.crawl.service;

import com.spiderstream.crawl.model.ReportType;
import com.spiderstream.crawl.util.UrlNormalizer;

import java.util.List;
import java.util.Set;

/**
 * Decides which URLs an emitted record pushes back into the frontier. Pure: the caller deduplicates.
 */
public final class FollowUpPolicy {
    private static final Set<String> CRAWLABLE_ASSET_EXTENSIONS = Set.of(".js", ".xml", ".json");
    private static final String MINIFIED_JS = ".min.js";

    private FollowUpPolicy() {
    }

    public static List<String> followUps(ReportType type, String output) {
        if (output == null || output.isEmpty()) {
            return List.of();
        }
        return switch (type) {
            case REF -> List.of(output);
            case SRC -> assetFollowUps(output);
            case UPLOAD_FORM, FORM, URL, AWS_S3, DOMAIN -> List.of();
        };
    }

    private static List<String> assetFollowUps(String output) {
        if (!CRAWLABLE_ASSET_EXTENSIONS.contains(UrlNormalizer.extensionOf(output))) {
            return List.of();
        }
        if (output.contains(MINIFIED_JS)) {
            // the un-minified source is speculative, a 404 on it is expected
            return List.of(output, output.replace(MINIFIED_JS, ".js"));
        }
        return List.of(output);
    }
}
