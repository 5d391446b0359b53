package com.spiderstream.crawl.error;

public class DomainResolutionException extends CrawlException {
    private final String host;

    public DomainResolutionException(String host, String reason) {
        super("cannot derive registrable domain for host " + host + ": " + reason);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
