package org.example.shortener.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.example.shortener.exception.BackendUnavailableException;
import org.example.shortener.exception.LinkGoneException;
import org.example.shortener.exception.LinkNotFoundException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UserUrl;
import org.example.shortener.storage.MemoryUrlStore;
import org.example.shortener.storage.UrlStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ShortenerService} over the in-memory store. */
public class ShortenerServiceTest {

  private static final String OWNER = "11111111-1111-1111-1111-111111111111";

  private UrlStore store;
  private ShortenerService svc;

  @BeforeEach
  void setUp() {
    store = new MemoryUrlStore();
    svc = new ShortenerService(store, "http://x", 100);
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  // ---------- helpers ----------

  private String codeOf(SaveResult r) {
    return r.getShortUrl().substring(svc.getBaseUrl().length());
  }

  // ---------- tests ----------

  @Test
  @DisplayName("Shorten, resolve by code and by full short URL")
  void shorten_andResolve() {
    SaveResult r = svc.shorten(OWNER, "  https://example.com/page  ");

    assertEquals("http://x/", svc.getBaseUrl());
    assertTrue(r.getShortUrl().startsWith("http://x/"));
    assertEquals("https://example.com/page", svc.resolve(codeOf(r)), "URL is stored trimmed");
    assertEquals("https://example.com/page", svc.resolve(r.getShortUrl()));
  }

  @Test
  @DisplayName("Invalid URLs are rejected before reaching the store")
  void shorten_rejectsInvalid() {
    assertThrows(IllegalArgumentException.class, () -> svc.shorten(OWNER, "ftp://example.com"));
    assertThrows(IllegalArgumentException.class, () -> svc.shorten(OWNER, ""));
    assertThrows(
        IllegalArgumentException.class,
        () -> svc.shorten(OWNER, "https://example.com/" + "a".repeat(100)));
    assertTrue(svc.listMine(OWNER).isEmpty());
  }

  @Test
  @DisplayName("One invalid URL rejects the whole batch")
  void shortenAll_validatesFirst() {
    assertThrows(
        IllegalArgumentException.class,
        () -> svc.shortenAll(OWNER, List.of("https://a.example", "not a url")));
    assertTrue(svc.listMine(OWNER).isEmpty());

    List<SaveResult> ok = svc.shortenAll(OWNER, List.of("https://a.example", "https://b.example"));
    assertEquals(2, ok.size());
    assertEquals(2, svc.listMine(OWNER).size());
  }

  @Test
  @DisplayName("Unknown code is NotFound, deleted code is Gone")
  void resolve_notFoundAndGone() {
    LinkNotFoundException nf =
        assertThrows(LinkNotFoundException.class, () -> svc.resolve("missing1"));
    assertEquals("missing1", nf.getCode());
    assertThrows(LinkNotFoundException.class, () -> svc.resolve("   "));

    SaveResult r = svc.shorten(OWNER, "https://example.com");
    assertEquals(1, svc.deleteMine(OWNER, List.of(r.getShortUrl())));

    LinkGoneException gone = assertThrows(LinkGoneException.class, () -> svc.resolve(codeOf(r)));
    assertEquals(codeOf(r), gone.getCode());
  }

  @Test
  @DisplayName("Owners only see and delete their own links")
  void ownership() {
    SaveResult mine = svc.shorten(OWNER, "https://mine.example");
    SaveResult theirs = svc.shorten("someone-else", "https://theirs.example");

    assertEquals(
        List.of(new UserUrl(mine.getShortUrl(), "https://mine.example")), svc.listMine(OWNER));
    assertEquals(0, svc.deleteMine(OWNER, List.of(codeOf(theirs), "", " ")));
    assertEquals("https://theirs.example", svc.resolve(codeOf(theirs)));
  }

  @Test
  @DisplayName("Health check delegates to the store")
  void checkHealth() {
    assertDoesNotThrow(svc::checkHealth);

    UrlStore down =
        new MemoryUrlStore() {
          @Override
          public void ping() {
            throw new BackendUnavailableException("down");
          }
        };
    ShortenerService broken = new ShortenerService(down, "http://x/", 100);
    assertThrows(BackendUnavailableException.class, broken::checkHealth);
  }
}
