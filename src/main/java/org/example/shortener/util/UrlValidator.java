package org.example.shortener.util;

import java.net.URI;

/**
 * Syntactic checks for URLs handed to the shortener, plus the small amount of string handling
 * needed to build and take apart short URLs.
 *
 * <p>Validation happens in the caller (the service), never in the stores: a store persists
 * whatever it is given.
 */
public final class UrlValidator {
  private UrlValidator() {}

  /**
   * Checks whether the given string is a syntactically valid HTTP/HTTPS URL.
   *
   * <p>The input is trimmed first; it must then be non-empty, at most {@code maxLen} characters
   * long, parse as a {@link URI}, use the {@code http} or {@code https} scheme and name a host.
   * Reachability is not checked.
   *
   * @param url the candidate URL string
   * @param maxLen maximum allowed length after trimming
   * @return {@code true} if the input passes every rule above
   */
  public static boolean isValidHttpUrl(String url, int maxLen) {
    if (url == null) return false;
    url = url.trim();
    if (url.isEmpty() || url.length() > maxLen) return false;
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (scheme == null) return false;
      if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return false;
      String host = uri.getHost();
      return host != null && !host.isBlank();
    } catch (java.net.URISyntaxException e) {
      return false;
    }
  }

  /**
   * Appends {@code /} unless already present. Empty input is returned unchanged.
   *
   * @param baseUrl prefix of short URLs
   * @return {@code baseUrl} ending in {@code /}
   */
  public static String ensureTrailingSlash(String baseUrl) {
    if (baseUrl == null || baseUrl.isEmpty()) return baseUrl == null ? "" : baseUrl;
    return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
  }

  /**
   * @param baseUrl prefix, with or without trailing slash
   * @param code short code
   * @return the fully-qualified short URL
   */
  public static String shortUrl(String baseUrl, String code) {
    return ensureTrailingSlash(baseUrl) + code;
  }

  /**
   * Accepts either a bare code or a full short URL and returns the code.
   *
   * @param baseUrl prefix used when the short URL was issued
   * @param input code or {@code baseUrl + code}
   * @return the trimmed code
   */
  public static String extractCode(String baseUrl, String input) {
    String s = input == null ? "" : input.trim();
    String prefix = ensureTrailingSlash(baseUrl);
    if (!prefix.isEmpty() && s.startsWith(prefix)) {
      return s.substring(prefix.length());
    }
    return s;
  }
}
