package com.spiderstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "spider")
public class SpiderProperties {
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;

    private int maxDepth = 3;
    private List<Integer> filterLength = new ArrayList<>();
    private Scope scope = new Scope();
    private Limit limit = new Limit();
    private Http http = new Http();
    private Sources sources = new Sources();
    private Derivation derivation = new Derivation();
    private Stream stream = new Stream();
    private Cli cli = new Cli();

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = Math.max(0, maxDepth);
    }

    public List<Integer> getFilterLength() {
        return filterLength;
    }

    public void setFilterLength(List<Integer> filterLength) {
        this.filterLength = filterLength == null ? new ArrayList<>() : filterLength;
    }

    public Scope getScope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public Limit getLimit() {
        return limit;
    }

    public void setLimit(Limit limit) {
        this.limit = limit;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Derivation getDerivation() {
        return derivation;
    }

    public void setDerivation(Derivation derivation) {
        this.derivation = derivation;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Scope {
        private List<String> whitelist = new ArrayList<>();
        private String whitelistDomain;
        private List<String> blacklist = new ArrayList<>();
        private boolean defaultBlacklist = true;

        public List<String> getWhitelist() {
            return whitelist;
        }

        public void setWhitelist(List<String> whitelist) {
            this.whitelist = whitelist == null ? new ArrayList<>() : whitelist;
        }

        public String getWhitelistDomain() {
            return whitelistDomain;
        }

        public void setWhitelistDomain(String whitelistDomain) {
            this.whitelistDomain = whitelistDomain;
        }

        public List<String> getBlacklist() {
            return blacklist;
        }

        public void setBlacklist(List<String> blacklist) {
            this.blacklist = blacklist == null ? new ArrayList<>() : blacklist;
        }

        public boolean isDefaultBlacklist() {
            return defaultBlacklist;
        }

        public void setDefaultBlacklist(boolean defaultBlacklist) {
            this.defaultBlacklist = defaultBlacklist;
        }
    }

    public static class Limit {
        private int parallelism = 5;
        private int delaySeconds = 0;
        private int randomDelaySeconds = 0;

        public int getParallelism() {
            return Math.max(1, parallelism);
        }

        public void setParallelism(int parallelism) {
            this.parallelism = Math.max(1, parallelism);
        }

        public int getDelaySeconds() {
            return delaySeconds;
        }

        public void setDelaySeconds(int delaySeconds) {
            this.delaySeconds = Math.max(0, delaySeconds);
        }

        public int getRandomDelaySeconds() {
            return randomDelaySeconds;
        }

        public void setRandomDelaySeconds(int randomDelaySeconds) {
            this.randomDelaySeconds = Math.max(0, randomDelaySeconds);
        }
    }

    public static class Http {
        private String proxy;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private boolean noRedirect;
        private String userAgent = "web";
        private List<String> headers = new ArrayList<>();
        private String cookie;
        private String rawRequestFile;
        private int maxBodyBytes = 5_000_000;
        private int perHostDelayMs = 250;
        private int globalConcurrency = 4;
        private int requestMaxRetries = 1;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 4000;

        public String getProxy() {
            return proxy;
        }

        public void setProxy(String proxy) {
            this.proxy = proxy;
        }

        /**
         * A zero timeout means "not configured" and falls back to the default.
         */
        public int getTimeoutSeconds() {
            return timeoutSeconds <= 0 ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isNoRedirect() {
            return noRedirect;
        }

        public void setNoRedirect(boolean noRedirect) {
            this.noRedirect = noRedirect;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public List<String> getHeaders() {
            return headers;
        }

        public void setHeaders(List<String> headers) {
            this.headers = headers == null ? new ArrayList<>() : headers;
        }

        public String getCookie() {
            return cookie;
        }

        public void setCookie(String cookie) {
            this.cookie = cookie;
        }

        public String getRawRequestFile() {
            return rawRequestFile;
        }

        public void setRawRequestFile(String rawRequestFile) {
            this.rawRequestFile = rawRequestFile;
        }

        public int getMaxBodyBytes() {
            return Math.max(1, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1, maxBodyBytes);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return requestRetryBaseDelayMs;
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
        }

        public int getRequestRetryMaxDelayMs() {
            return requestRetryMaxDelayMs;
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
        }
    }

    public static class Sources {
        private boolean sitemap;
        private boolean robots;
        private boolean otherSources;
        private boolean includeSubdomains = true;
        private int sitemapMaxDepth = 2;
        private int sitemapMaxUrls = 500;
        private String waybackBaseUrl = "https://web.archive.org";
        private String otxBaseUrl = "https://otx.alienvault.com";
        private int otxMaxPages = 5;

        public boolean isSitemap() {
            return sitemap;
        }

        public void setSitemap(boolean sitemap) {
            this.sitemap = sitemap;
        }

        public boolean isRobots() {
            return robots;
        }

        public void setRobots(boolean robots) {
            this.robots = robots;
        }

        public boolean isOtherSources() {
            return otherSources;
        }

        public void setOtherSources(boolean otherSources) {
            this.otherSources = otherSources;
        }

        public boolean isIncludeSubdomains() {
            return includeSubdomains;
        }

        public void setIncludeSubdomains(boolean includeSubdomains) {
            this.includeSubdomains = includeSubdomains;
        }

        public int getSitemapMaxDepth() {
            return sitemapMaxDepth;
        }

        public void setSitemapMaxDepth(int sitemapMaxDepth) {
            this.sitemapMaxDepth = Math.max(0, sitemapMaxDepth);
        }

        public int getSitemapMaxUrls() {
            return sitemapMaxUrls;
        }

        public void setSitemapMaxUrls(int sitemapMaxUrls) {
            this.sitemapMaxUrls = Math.max(1, sitemapMaxUrls);
        }

        public String getWaybackBaseUrl() {
            return waybackBaseUrl;
        }

        public void setWaybackBaseUrl(String waybackBaseUrl) {
            this.waybackBaseUrl = waybackBaseUrl;
        }

        public String getOtxBaseUrl() {
            return otxBaseUrl;
        }

        public void setOtxBaseUrl(String otxBaseUrl) {
            this.otxBaseUrl = otxBaseUrl;
        }

        public int getOtxMaxPages() {
            return otxMaxPages;
        }

        public void setOtxMaxPages(int otxMaxPages) {
            this.otxMaxPages = Math.max(1, otxMaxPages);
        }
    }

    public static class Derivation {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Stream {
        private int reportCapacity = 1024;
        private int errorCapacity = 256;

        public int getReportCapacity() {
            return reportCapacity;
        }

        public void setReportCapacity(int reportCapacity) {
            this.reportCapacity = Math.max(1, reportCapacity);
        }

        public int getErrorCapacity() {
            return errorCapacity;
        }

        public void setErrorCapacity(int errorCapacity) {
            this.errorCapacity = Math.max(1, errorCapacity);
        }
    }

    public static class Cli {
        private boolean run;
        private List<String> sites = new ArrayList<>();
        private boolean json;
        private int maxDurationSeconds = 0;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public List<String> getSites() {
            return sites;
        }

        public void setSites(List<String> sites) {
            this.sites = sites == null ? new ArrayList<>() : sites;
        }

        public boolean isJson() {
            return json;
        }

        public void setJson(boolean json) {
            this.json = json;
        }

        public int getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
