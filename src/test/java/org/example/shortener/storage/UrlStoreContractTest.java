package org.example.shortener.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.example.shortener.exception.AllocationExhaustedException;
import org.example.shortener.exception.CodeGenerationException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UrlRecord;
import org.example.shortener.model.UserUrl;
import org.example.shortener.util.CodeGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link UrlStore} must share, run once per backend by the concrete subclasses.
 *
 * <p>Subclasses only say how to build a fresh, empty and bootstrapped store around a given {@link
 * CodeGenerator}; stores opened through {@link #open(CodeGenerator)} are closed after each test.
 */
public abstract class UrlStoreContractTest {

  protected static final String BASE = "http://x/";

  private final List<UrlStore> opened = new ArrayList<>();

  /**
   * @param generator source of candidate codes
   * @return an empty store, ready for use
   */
  protected abstract UrlStore newStore(CodeGenerator generator) throws Exception;

  // ---------- helpers ----------

  protected UrlStore open(CodeGenerator generator) throws Exception {
    UrlStore s = newStore(generator);
    opened.add(s);
    return s;
  }

  protected UrlStore open() throws Exception {
    return open(CodeGenerator.secure());
  }

  protected static String code(SaveResult r) {
    assertTrue(r.getShortUrl().startsWith(BASE), "Unexpected short URL " + r.getShortUrl());
    return r.getShortUrl().substring(BASE.length());
  }

  @AfterEach
  void closeStores() {
    for (UrlStore s : opened) s.close();
    opened.clear();
  }

  // ---------- save / load ----------

  @Test
  @DisplayName("Saved URL loads back live with its owner")
  void save_thenLoadFull() throws Exception {
    UrlStore store = open();

    SaveResult r = store.save("u1", "https://example.com/a", BASE);

    assertFalse(r.isConflict());
    Optional<UrlRecord> loaded = store.loadFull(code(r));
    assertTrue(loaded.isPresent());
    assertEquals("https://example.com/a", loaded.get().originalUrl);
    assertEquals("u1", loaded.get().ownerId);
    assertFalse(loaded.get().deleted);
    assertNotNull(loaded.get().createdAt);
    assertNull(loaded.get().deletedAt);
  }

  @Test
  @DisplayName("Second save of the same URL by another owner returns the same short URL as conflict")
  void save_sameUrlTwice_conflict() throws Exception {
    UrlStore store = open();

    SaveResult first = store.save("u1", "https://example.com", BASE);
    SaveResult second = store.save("u2", "https://example.com", BASE);

    assertTrue(first.getShortUrl().matches("http://x/[a-zA-Z0-9]{8}"), first.getShortUrl());
    assertFalse(first.isConflict());
    assertTrue(second.isConflict());
    assertEquals(first.getShortUrl(), second.getShortUrl());
    assertEquals("u1", store.loadFull(code(first)).get().ownerId, "Owner must not change");
  }

  @Test
  @DisplayName("A code that was never allocated is not found")
  void loadFull_unknown() throws Exception {
    UrlStore store = open();
    store.save("u1", "https://example.com", BASE);
    assertTrue(store.loadFull("nope1234").isEmpty());
  }

  @Test
  @DisplayName("loadFull hands out copies")
  void loadFull_returnsCopy() throws Exception {
    UrlStore store = open();
    String c = code(store.save("u1", "https://example.com", BASE));

    UrlRecord r = store.loadFull(c).get();
    r.originalUrl = "https://evil.example";
    r.deleted = true;

    UrlRecord again = store.loadFull(c).get();
    assertEquals("https://example.com", again.originalUrl);
    assertFalse(again.deleted);
  }

  @Test
  @DisplayName("Code collision is retried with the next candidate")
  void save_collisionRetried() throws Exception {
    UrlStore store = open(new ScriptedCodeGenerator("AAAAAAAA", "AAAAAAAA", "BBBBBBBB"));

    SaveResult a = store.save("u1", "https://a.example", BASE);
    SaveResult b = store.save("u1", "https://b.example", BASE);

    assertEquals(BASE + "AAAAAAAA", a.getShortUrl());
    assertEquals(BASE + "BBBBBBBB", b.getShortUrl());
    assertFalse(b.isConflict());
    assertEquals("https://b.example", store.loadFull("BBBBBBBB").get().originalUrl);
  }

  @Test
  @DisplayName("Allocation gives up after the retry budget and stores nothing")
  void save_exhausted() throws Exception {
    UrlStore store = open(ScriptedCodeGenerator.constant("AAAAAAAA"));
    store.save("u1", "https://a.example", BASE);

    AllocationExhaustedException ex =
        assertThrows(
            AllocationExhaustedException.class,
            () -> store.save("u1", "https://b.example", BASE));

    assertEquals(5, ex.getAttempts());
    assertEquals(1, store.loadUserUrls("u1", BASE).size());
    assertEquals("https://a.example", store.loadFull("AAAAAAAA").get().originalUrl);
  }

  @Test
  @DisplayName("Generator failure aborts save and batch without storing anything")
  void generatorFailure_storesNothing() throws Exception {
    UrlStore store =
        open(
            length -> {
              throw new CodeGenerationException("entropy gone", new IllegalStateException());
            });

    assertThrows(
        CodeGenerationException.class, () -> store.save("u1", "https://a.example", BASE));
    assertThrows(
        CodeGenerationException.class,
        () -> store.saveBatch("u1", List.of("https://b.example"), BASE));

    assertTrue(store.loadUserUrls("u1", BASE).isEmpty());
  }

  // ---------- batch ----------

  @Test
  @DisplayName("Batch returns one result per URL in input order")
  void saveBatch_order() throws Exception {
    UrlStore store = open();
    List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example");

    List<SaveResult> results = store.saveBatch("u1", urls, BASE);

    assertEquals(3, results.size());
    for (int i = 0; i < urls.size(); i++) {
      assertFalse(results.get(i).isConflict());
      assertEquals(urls.get(i), store.loadFull(code(results.get(i))).get().originalUrl);
    }
    List<UserUrl> mine = store.loadUserUrls("u1", BASE);
    assertEquals(3, mine.size());
    assertEquals("https://a.example", mine.get(0).getOriginalUrl());
  }

  @Test
  @DisplayName("Batch deduplicates against stored URLs and within itself")
  void saveBatch_dedup() throws Exception {
    UrlStore store = open();
    SaveResult stored = store.save("u2", "https://a.example", BASE);

    List<SaveResult> results =
        store.saveBatch(
            "u1", List.of("https://a.example", "https://b.example", "https://b.example"), BASE);

    assertEquals(SaveResult.conflict(stored.getShortUrl()), results.get(0));
    assertFalse(results.get(1).isConflict());
    assertTrue(results.get(2).isConflict());
    assertEquals(results.get(1).getShortUrl(), results.get(2).getShortUrl());
    assertEquals(1, store.loadUserUrls("u1", BASE).size(), "Only b belongs to u1");
  }

  @Test
  @DisplayName("Empty batch yields an empty list")
  void saveBatch_empty() throws Exception {
    UrlStore store = open();
    assertTrue(store.saveBatch("u1", List.of(), BASE).isEmpty());
  }

  @Test
  @DisplayName("Batch exhausted mid-way stores none of its URLs")
  void saveBatch_allOrNothing() throws Exception {
    UrlStore store = open(ScriptedCodeGenerator.constant("AAAAAAAA"));

    assertThrows(
        AllocationExhaustedException.class,
        () -> store.saveBatch("u1", List.of("https://a.example", "https://b.example"), BASE));

    assertTrue(store.loadFull("AAAAAAAA").isEmpty(), "First URL of the batch must be rolled back");
    assertTrue(store.loadUserUrls("u1", BASE).isEmpty());

    SaveResult later = store.save("u1", "https://a.example", BASE);
    assertFalse(later.isConflict(), "Rolled back URL must not count as stored");
  }

  // ---------- list / delete ----------

  @Test
  @DisplayName("Listing shows only the owner's live URLs, oldest first")
  void loadUserUrls_scopedAndOrdered() throws Exception {
    UrlStore store = open();
    SaveResult a = store.save("u1", "https://a.example", BASE);
    store.save("u2", "https://other.example", BASE);
    SaveResult b = store.save("u1", "https://b.example", BASE);

    List<UserUrl> mine = store.loadUserUrls("u1", BASE);

    assertEquals(
        List.of(
            new UserUrl(a.getShortUrl(), "https://a.example"),
            new UserUrl(b.getShortUrl(), "https://b.example")),
        mine);
    assertTrue(store.loadUserUrls("nobody", BASE).isEmpty());
  }

  @Test
  @DisplayName("Deleted code is Gone and disappears from the owner's listing")
  void deleteBatch_tombstones() throws Exception {
    UrlStore store = open();
    String a = code(store.save("u1", "https://a.example", BASE));
    String b = code(store.save("u1", "https://b.example", BASE));

    assertEquals(1, store.deleteBatch("u1", List.of(a)));

    UrlRecord gone = store.loadFull(a).get();
    assertTrue(gone.deleted);
    assertNotNull(gone.deletedAt);
    assertEquals("https://a.example", gone.originalUrl);
    List<UserUrl> mine = store.loadUserUrls("u1", BASE);
    assertEquals(1, mine.size());
    assertEquals(BASE + b, mine.get(0).getShortUrl());

    assertEquals(0, store.deleteBatch("u1", List.of(a)), "Already deleted codes are not counted");
  }

  @Test
  @DisplayName("Codes of other owners and unknown codes are skipped silently")
  void deleteBatch_foreignCodesUntouched() throws Exception {
    UrlStore store = open();
    String ofB = code(store.save("userB", "https://b.example", BASE));
    String ofA = code(store.save("userA", "https://a.example", BASE));

    int n = store.deleteBatch("userA", List.of(ofB, "missing1", ofA, ofA));

    assertEquals(1, n);
    assertFalse(store.loadFull(ofB).get().deleted);
    assertTrue(store.loadFull(ofA).get().deleted);
    assertEquals(1, store.loadUserUrls("userB", BASE).size());
  }

  @Test
  @DisplayName("Empty owner neither lists nor deletes anything")
  void emptyOwner_matchesNothing() throws Exception {
    UrlStore store = open();
    String anon = code(store.save("", "https://anon.example", BASE));

    assertTrue(store.loadUserUrls("", BASE).isEmpty());
    assertEquals(0, store.deleteBatch("", List.of(anon)));
    assertFalse(store.loadFull(anon).get().deleted);
    assertEquals(0, store.deleteBatch("u1", List.of()));
  }

  @Test
  @DisplayName("Resubmitting a deleted URL returns its deleted code as conflict")
  void save_afterDelete_returnsTombstonedCode() throws Exception {
    UrlStore store = open();
    SaveResult first = store.save("u1", "https://a.example", BASE);
    store.deleteBatch("u1", List.of(code(first)));

    SaveResult again = store.save("u1", "https://a.example", BASE);

    assertTrue(again.isConflict());
    assertEquals(first.getShortUrl(), again.getShortUrl());
    assertTrue(store.loadFull(code(again)).get().deleted, "Deletion is never undone");
  }

  @Test
  @DisplayName("Healthy store answers ping")
  void ping_ok() throws Exception {
    UrlStore store = open();
    assertDoesNotThrow(store::ping);
  }
}
