package com.spiderstream.crawl.engine;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * User-agent rotation. {@code web} and {@code mobi} pick a random browser string per request, anything else is
 * sent as given.
 */
public final class UserAgents {
    public static final String WEB = "web";
    public static final String MOBILE = "mobi";

    private static final List<String> WEB_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:123.0) Gecko/20100101 Firefox/123.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.3 Safari/605.1.15",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:122.0) Gecko/20100101 Firefox/122.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36 Edg/122.0.0.0"
    );

    private static final List<String> MOBILE_AGENTS = List.of(
        "Mozilla/5.0 (iPhone; CPU iPhone OS 17_3 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.3 Mobile/15E148 Safari/604.1",
        "Mozilla/5.0 (iPad; CPU OS 17_3 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.3 Mobile/15E148 Safari/604.1",
        "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Mobile Safari/537.36",
        "Mozilla/5.0 (Linux; Android 13; SM-S911B) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Mobile Safari/537.36",
        "Mozilla/5.0 (Android 14; Mobile; rv:123.0) Gecko/123.0 Firefox/123.0"
    );

    private UserAgents() {
    }

    public static String resolve(String mode) {
        if (mode == null || mode.isBlank()) {
            return pick(WEB_AGENTS);
        }
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        if (WEB.equals(normalized)) {
            return pick(WEB_AGENTS);
        }
        if (MOBILE.equals(normalized)) {
            return pick(MOBILE_AGENTS);
        }
        return mode.trim();
    }

    public static Supplier<String> supplier(String mode) {
        return () -> resolve(mode);
    }

    static List<String> webAgents() {
        return WEB_AGENTS;
    }

    static List<String> mobileAgents() {
        return MOBILE_AGENTS;
    }

    private static String pick(List<String> agents) {
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }
}
