package com.spiderstream.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Directives of one robots.txt file. Every Allow/Disallow target is kept regardless of the user-agent group it
 * belongs to, since the targets are treated as discovered paths rather than crawl rules.
 */
public class RobotsRules {
  private final List<Directive> directives;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Directive> directives, List<String> sitemapUrls) {
    this.directives = List.copyOf(directives);
    this.sitemapUrls = List.copyOf(sitemapUrls);
  }

  public static RobotsRules empty() {
    return new RobotsRules(List.of(), List.of());
  }

  public List<Directive> getDirectives() {
    return directives;
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  /**
   * Distinct directive targets in file order.
   */
  public List<String> getDirectivePaths() {
    List<String> paths = new ArrayList<>();
    for (Directive directive : directives) {
      if (!paths.contains(directive.path())) {
        paths.add(directive.path());
      }
    }
    return paths;
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return empty();
    }

    List<String> sitemaps = new ArrayList<>();
    List<Directive> parsed = new ArrayList<>();

    List<String> currentAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        currentAgents.clear();
        lastDirectiveWasUserAgent = false;
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        parsed.add(new Directive(value, "allow".equals(key), List.copyOf(currentAgents)));
      }
    }

    return new RobotsRules(parsed, sitemaps);
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Directive(String path, boolean allow, List<String> userAgents) {
  }
}
