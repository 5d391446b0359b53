package com.spiderstream.crawl.derive;

import com.spiderstream.crawl.error.DomainResolutionException;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixList;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixListFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Computes the registrable domain (public suffix plus one label) of a host.
 */
@Component
public class BaseDomainResolver {
    private static final PublicSuffixList publicSuffixList = new PublicSuffixListFactory().build();
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(?:\\.\\d{1,3}){3}$");

    public String registrableDomain(String host) {
        if (host == null || host.isBlank()) {
            throw new DomainResolutionException(String.valueOf(host), "empty host");
        }
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.startsWith("[") || normalized.contains(":") || IPV4.matcher(normalized).matches()) {
            throw new DomainResolutionException(host, "ip literal has no registrable domain");
        }
        if (!normalized.contains(".")) {
            throw new DomainResolutionException(host, "host has no public suffix");
        }
        String domain = publicSuffixList.getRegistrableDomain(normalized);
        if (domain == null || domain.isBlank()) {
            throw new DomainResolutionException(host, "host is a public suffix or has an unknown suffix");
        }
        return domain;
    }
}
