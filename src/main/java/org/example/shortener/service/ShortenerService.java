package org.example.shortener.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.example.shortener.exception.LinkGoneException;
import org.example.shortener.exception.LinkNotFoundException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UrlRecord;
import org.example.shortener.model.UserUrl;
import org.example.shortener.storage.UrlStore;
import org.example.shortener.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-side facade over a {@link UrlStore}: the layer an HTTP or console front end talks to.
 *
 * <ul>
 *   <li>Validates submitted URLs (http/https with a host, bounded length) before they reach the
 *       store.
 *   <li>Binds the configured base URL so front ends never format short URLs themselves.
 *   <li>Turns the store's {@code loadFull} outcome into a target URL or a typed {@link
 *       LinkNotFoundException} / {@link LinkGoneException}.
 *   <li>Accepts codes either bare or as full short URLs.
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> stateless apart from immutable settings; safe to share when
 * the underlying store is.
 */
public class ShortenerService {

  private static final Logger LOG = LoggerFactory.getLogger(ShortenerService.class);

  private final UrlStore store;
  private final String baseUrl;
  private final int maxUrlLength;

  /**
   * @param store backend chosen at startup
   * @param baseUrl prefix of short URLs
   * @param maxUrlLength longest URL accepted by {@link #shorten}
   */
  public ShortenerService(UrlStore store, String baseUrl, int maxUrlLength) {
    this.store = Objects.requireNonNull(store, "store");
    this.baseUrl = UrlValidator.ensureTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
    this.maxUrlLength = maxUrlLength;
  }

  // ---------- Create ----------

  /**
   * Shortens one URL for {@code ownerId}.
   *
   * @param ownerId owner identifier, may be empty for anonymous use
   * @param longUrl URL to shorten
   * @return the short URL; {@link SaveResult#isConflict()} if it had been shortened before
   * @throws IllegalArgumentException if the URL is not a valid http/https URL
   */
  public SaveResult shorten(String ownerId, String longUrl) {
    String url = validated(longUrl);
    SaveResult r = store.save(ownerId, url, baseUrl);
    LOG.debug("{} for owner {}: {}", r.isConflict() ? "Existing" : "Created", ownerId, r);
    return r;
  }

  /**
   * Shortens several URLs at once; all of them are validated before anything is stored.
   *
   * @param ownerId owner identifier
   * @param longUrls URLs to shorten
   * @return results in input order
   * @throws IllegalArgumentException if any URL is invalid; nothing is stored then
   */
  public List<SaveResult> shortenAll(String ownerId, List<String> longUrls) {
    List<String> urls = new ArrayList<>(longUrls.size());
    for (String u : longUrls) urls.add(validated(u));
    return store.saveBatch(ownerId, urls, baseUrl);
  }

  // ---------- Resolve ----------

  /**
   * Resolves a code (or full short URL) to its original URL.
   *
   * @param codeOrShortUrl bare code or {@code baseUrl + code}
   * @return the original URL
   * @throws LinkNotFoundException if the code was never allocated
   * @throws LinkGoneException if the owner deleted it
   */
  public String resolve(String codeOrShortUrl) {
    String code = UrlValidator.extractCode(baseUrl, codeOrShortUrl);
    Optional<UrlRecord> found = code.isEmpty() ? Optional.empty() : store.loadFull(code);
    if (found.isEmpty()) throw new LinkNotFoundException(code);
    UrlRecord r = found.get();
    if (r.deleted) throw new LinkGoneException(code);
    return r.originalUrl;
  }

  // ---------- Owner queries ----------

  /**
   * @param ownerId owner identifier
   * @return the owner's live short URLs, oldest first
   */
  public List<UserUrl> listMine(String ownerId) {
    return store.loadUserUrls(ownerId, baseUrl);
  }

  /**
   * Deletes the owner's codes. Codes of other owners and unknown codes are ignored.
   *
   * @param ownerId owner identifier
   * @param codesOrShortUrls bare codes or full short URLs
   * @return number of codes actually deleted
   */
  public int deleteMine(String ownerId, List<String> codesOrShortUrls) {
    List<String> codes = new ArrayList<>(codesOrShortUrls.size());
    for (String c : codesOrShortUrls) {
      String code = UrlValidator.extractCode(baseUrl, c);
      if (!code.isEmpty()) codes.add(code);
    }
    int n = store.deleteBatch(ownerId, codes);
    LOG.debug("Owner {} deleted {} of {} codes", ownerId, n, codes.size());
    return n;
  }

  /** @throws org.example.shortener.exception.BackendUnavailableException if the store is down */
  public void checkHealth() {
    store.ping();
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  private String validated(String longUrl) {
    if (!UrlValidator.isValidHttpUrl(longUrl, maxUrlLength)) {
      throw new IllegalArgumentException("Invalid URL. Only http/https with host are allowed.");
    }
    return longUrl.trim();
  }
}
