package com.spiderstream.crawl.engine;

import com.spiderstream.config.SpiderProperties;
import com.spiderstream.crawl.error.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Factories for the provisioning steps of a crawl session.
 */
public final class EngineConfigurers {
    /**
     * Images, audio, video, fonts and stylesheets.
     */
    public static final String DEFAULT_DISALLOWED_REGEX =
        "(?i)\\.(png|apng|bmp|gif|ico|cur|jpg|jpeg|jfif|pjp|pjpeg|svg|tif|tiff|webp|xbm|3gp|aac|flac|mpg|mpeg|mp3|mp4"
            + "|m4a|m4v|m4p|oga|ogg|ogv|mov|wav|webm|eot|woff|woff2|ttf|otf|css)(?:\\?|#|$)";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;

    private EngineConfigurers() {
    }

    /**
     * Only URLs matching {@code regex} are fetched. Several scopes widen each other.
     */
    public static EngineConfigurer scope(String regex) {
        return engine -> engine.allowUrl(compile(regex, "scope"));
    }

    public static EngineConfigurer whitelistDomain(String domain) {
        return scope("http(s)?://" + domain);
    }

    public static EngineConfigurer disallow(String regex) {
        return engine -> engine.disallowUrl(compile(regex, "disallowed"));
    }

    public static EngineConfigurer defaultDisallow() {
        return disallow(DEFAULT_DISALLOWED_REGEX);
    }

    public static EngineConfigurer limit(int parallelism, int delaySeconds, int randomDelaySeconds) {
        return engine -> {
            if (parallelism < 1 || delaySeconds < 0 || randomDelaySeconds < 0) {
                throw new ConfigurationException(
                    "invalid limit parallelism=" + parallelism + " delay=" + delaySeconds + " randomDelay=" + randomDelaySeconds
                );
            }
            engine.limit(parallelism, Duration.ofSeconds(delaySeconds), Duration.ofSeconds(randomDelaySeconds));
        };
    }

    public static EngineConfigurer maxDepth(int maxDepth) {
        return engine -> engine.maxDepth(maxDepth);
    }

    /**
     * @param header {@code "Name: value"}
     */
    public static EngineConfigurer header(String header) {
        return engine -> {
            int colon = header == null ? -1 : header.indexOf(':');
            if (colon <= 0) {
                throw new ConfigurationException("invalid header '" + header + "', expected 'Name: value'");
            }
            String name = header.substring(0, colon).trim();
            String value = header.substring(colon + 1).trim();
            engine.onRequest(request -> request.setHeader(name, value));
        };
    }

    public static EngineConfigurer cookie(String cookie) {
        return engine -> engine.onRequest(request -> request.addHeader("Cookie", cookie));
    }

    public static EngineConfigurer userAgent(String mode) {
        return engine -> engine.userAgent(UserAgents.supplier(mode));
    }

    /**
     * Replays the headers and cookie of a raw request file on every request.
     */
    public static EngineConfigurer rawRequest(Path file) {
        return engine -> {
            RawRequestImporter.RawRequest raw = RawRequestImporter.importFile(file);
            if (raw.cookie() != null) {
                engine.onRequest(request -> request.addHeader("Cookie", raw.cookie()));
            }
            engine.onRequest(request -> raw.headers().forEach(request::setHeader));
        };
    }

    public static EngineConfigurer proxy(String proxy) {
        return engine -> {
            if (proxy == null) {
                throw new ConfigurationException("proxy url missing");
            }
            URI uri;
            try {
                uri = new URI(proxy.trim());
            } catch (URISyntaxException e) {
                throw new ConfigurationException("invalid proxy url " + proxy, e);
            }
            if (uri.getHost() == null) {
                throw new ConfigurationException("invalid proxy url " + proxy + ": missing host");
            }
            engine.proxy(uri);
        };
    }

    /**
     * A timeout of 0 falls back to 10 seconds.
     */
    public static EngineConfigurer timeout(int seconds) {
        int effective = seconds <= 0 ? DEFAULT_TIMEOUT_SECONDS : seconds;
        return engine -> engine.timeout(Duration.ofSeconds(effective));
    }

    public static EngineConfigurer noRedirect() {
        return engine -> engine.sameHostRedirectsOnly(true);
    }

    /**
     * Provisioning steps for the given settings, in application order.
     */
    public static List<EngineConfigurer> fromProperties(SpiderProperties properties) {
        List<EngineConfigurer> configurers = new ArrayList<>();
        configurers.add(maxDepth(properties.getMaxDepth()));

        SpiderProperties.Scope scope = properties.getScope();
        for (String regex : scope.getWhitelist()) {
            configurers.add(scope(regex));
        }
        if (scope.getWhitelistDomain() != null && !scope.getWhitelistDomain().isBlank()) {
            configurers.add(whitelistDomain(scope.getWhitelistDomain().trim()));
        }
        for (String regex : scope.getBlacklist()) {
            configurers.add(disallow(regex));
        }
        if (scope.isDefaultBlacklist()) {
            configurers.add(defaultDisallow());
        }

        SpiderProperties.Limit limit = properties.getLimit();
        configurers.add(limit(limit.getParallelism(), limit.getDelaySeconds(), limit.getRandomDelaySeconds()));

        SpiderProperties.Http http = properties.getHttp();
        configurers.add(timeout(http.getTimeoutSeconds()));
        if (http.getProxy() != null && !http.getProxy().isBlank()) {
            configurers.add(proxy(http.getProxy()));
        }
        if (http.isNoRedirect()) {
            configurers.add(noRedirect());
        }
        configurers.add(userAgent(http.getUserAgent()));
        if (http.getRawRequestFile() != null && !http.getRawRequestFile().isBlank()) {
            configurers.add(rawRequest(Path.of(http.getRawRequestFile().trim())));
        }
        if (http.getCookie() != null && !http.getCookie().isBlank()) {
            configurers.add(cookie(http.getCookie()));
        }
        for (String header : http.getHeaders()) {
            configurers.add(header(header));
        }
        return configurers;
    }

    private static Pattern compile(String regex, String kind) {
        if (regex == null) {
            throw new ConfigurationException(kind + " filter missing");
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("failed to compile " + kind + " filter " + regex, e);
        }
    }
}
