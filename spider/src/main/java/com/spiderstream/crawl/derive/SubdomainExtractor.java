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
 * Finds fully-qualified subdomains of a base domain anywhere in free text.
 */
@Component
public class SubdomainExtractor {
    private static final String LABEL = "[a-z0-9](?:[a-z0-9_-]{0,61}[a-z0-9])?";
    // residue of \\u002f and \\x2f escapes glued to the front of a host token
    private static final Pattern ESCAPE_RESIDUE = Pattern.compile("^(?:u00[0-9a-f]{2}|x[0-9a-f]{2})");

    public List<String> extract(String text, String baseDomain) {
        if (text == null || text.isEmpty() || baseDomain == null || baseDomain.isBlank()) {
            return List.of();
        }
        Pattern pattern = Pattern.compile(
            "(?i)(?<![a-z0-9-])(?:" + LABEL + "\\.)+" + Pattern.quote(baseDomain.toLowerCase(Locale.ROOT))
                + "(?![a-z0-9-]|\\.[a-z0-9-])"
        );
        Set<String> unique = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String cleaned = clean(matcher.group(), baseDomain);
            if (cleaned != null) {
                unique.add(cleaned);
            }
        }
        return new ArrayList<>(unique);
    }

    private String clean(String match, String baseDomain) {
        String name = match.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith("*.")) {
            name = name.substring(2);
        }
        Matcher residue = ESCAPE_RESIDUE.matcher(name);
        while (residue.find()) {
            String stripped = name.substring(residue.end());
            if (!stripped.endsWith("." + baseDomain.toLowerCase(Locale.ROOT)) || stripped.startsWith(".")) {
                break;
            }
            name = stripped;
            residue = ESCAPE_RESIDUE.matcher(name);
        }
        while (name.startsWith("-") || name.startsWith(".")) {
            name = name.substring(1);
        }
        return name.endsWith("." + baseDomain.toLowerCase(Locale.ROOT)) ? name : null;
    }
}
