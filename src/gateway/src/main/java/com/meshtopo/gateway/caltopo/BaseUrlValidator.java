package com.meshtopo.gateway.caltopo;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a CalTopo base URL may be called.
 *
 * <p>With an explicit allowlist (test and development setups) the URL must match one of the
 * patterns, where {@code *} matches any run of characters. Without one, the URL must be http(s) on
 * {@code caltopo.com} or one of its subdomains.
 */
public final class BaseUrlValidator {
  private static final String PRODUCTION_DOMAIN = "caltopo.com";

  private final List<String> patterns;
  private final List<Pattern> compiled;

  public BaseUrlValidator(List<String> allowedUrlPatterns) {
    List<String> raw = new ArrayList<>();
    List<Pattern> regexes = new ArrayList<>();
    if (allowedUrlPatterns != null) {
      for (String pattern : allowedUrlPatterns) {
        if (pattern != null && !pattern.isBlank()) {
          raw.add(pattern.trim());
          regexes.add(toRegex(pattern.trim()));
        }
      }
    }
    this.patterns = List.copyOf(raw);
    this.compiled = List.copyOf(regexes);
  }

  public boolean isAllowed(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    if (!compiled.isEmpty()) {
      return compiled.stream().anyMatch(pattern -> pattern.matcher(url).matches());
    }
    return isProductionHost(url);
  }

  public boolean usesExplicitAllowlist() {
    return !compiled.isEmpty();
  }

  public List<String> patterns() {
    return patterns;
  }

  static Pattern toRegex(String wildcard) {
    StringBuilder regex = new StringBuilder("^");
    int start = 0;
    int star;
    while ((star = wildcard.indexOf('*', start)) >= 0) {
      regex.append(Pattern.quote(wildcard.substring(start, star))).append(".*");
      start = star + 1;
    }
    regex.append(Pattern.quote(wildcard.substring(start))).append('$');
    return Pattern.compile(regex.toString());
  }

  private static boolean isProductionHost(String url) {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException ex) {
      return false;
    }
    String scheme = uri.getScheme();
    String host = uri.getHost();
    if (scheme == null || host == null || uri.getUserInfo() != null) {
      return false;
    }
    String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
    if (!normalizedScheme.equals("https") && !normalizedScheme.equals("http")) {
      return false;
    }
    String normalizedHost = host.toLowerCase(Locale.ROOT);
    return normalizedHost.equals(PRODUCTION_DOMAIN) || normalizedHost.endsWith("." + PRODUCTION_DOMAIN);
  }
}
