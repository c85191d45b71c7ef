package com.delta.siteaudit.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow/disallow rules from one robots.txt for a single user-agent token. A group naming the
 * token wins over the wildcard group; within the chosen rules the longest match decides and an
 * allow beats a disallow of equal length.
 */
public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of());
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  /** True when the site root itself is disallowed, which blocks the whole crawl. */
  public boolean blocksEntireSite() {
    return !isAllowed("/");
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    Rule bestMatch = null;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      if (bestMatch == null
          || rule.path().length() > bestMatch.path().length()
          || (rule.path().length() == bestMatch.path().length() && rule.allow() && !bestMatch.allow())) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText) {
    return parse(robotsText, null);
  }

  public static RobotsRules parse(String robotsText, String agentToken) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String token = agentToken == null ? null : agentToken.toLowerCase(Locale.ROOT);

    List<String> sitemaps = new ArrayList<>();
    List<Rule> wildcardRules = new ArrayList<>();
    List<Rule> agentRules = new ArrayList<>();
    boolean agentGroupSeen = false;

    List<String> groupAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
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
          groupAgents.clear();
        }
        groupAgents.add(value.toLowerCase(Locale.ROOT));
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
      if (!"allow".equals(key) && !"disallow".equals(key)) {
        continue;
      }
      boolean forAgent = token != null && groupAgents.stream().anyMatch(agent -> !agent.equals("*") && token.contains(agent));
      boolean forWildcard = groupAgents.contains("*");
      if (forAgent) {
        agentGroupSeen = true;
      }
      // an empty Disallow means allow everything, which is the default anyway
      if (value.isBlank()) {
        continue;
      }
      Rule rule = new Rule(value, "allow".equals(key));
      if (forAgent) {
        agentRules.add(rule);
      } else if (forWildcard) {
        wildcardRules.add(rule);
      }
    }
    return new RobotsRules(agentGroupSeen ? agentRules : wildcardRules, sitemaps);
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (char c : normalizedPath.toCharArray()) {
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append('$');
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
