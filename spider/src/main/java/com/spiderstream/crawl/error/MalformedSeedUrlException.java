package com.spiderstream.crawl.error;

public class MalformedSeedUrlException extends CrawlException {
    private final String seed;

    public MalformedSeedUrlException(String seed, String reason) {
        super("malformed seed url " + seed + ": " + reason);
        this.seed = seed;
    }

    public String getSeed() {
        return seed;
    }
}
