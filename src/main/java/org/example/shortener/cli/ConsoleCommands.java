package org.example.shortener.cli;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.example.shortener.exception.AllocationExhaustedException;
import org.example.shortener.exception.BackendUnavailableException;
import org.example.shortener.exception.LinkGoneException;
import org.example.shortener.exception.LinkNotFoundException;
import org.example.shortener.exception.StoreException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UserUrl;
import org.example.shortener.service.ShortenerService;

/**
 * One-shot console front end.
 *
 * <p>Each invocation runs exactly one command against the {@link ShortenerService} and prints the
 * outcome. The commands are:
 *
 * <ul>
 *   <li>{@code shorten <url>} – prints {@code CREATED <shortUrl>} or {@code CONFLICT <shortUrl>}
 *   <li>{@code batch <url> [<url> ...]} – same, one line per URL in input order
 *   <li>{@code open <code|shortUrl>} – prints the original URL, or why it cannot be opened
 *   <li>{@code list} – prints the current owner's live links, oldest first
 *   <li>{@code delete <code|shortUrl> [...]} – prints how many links were deleted
 *   <li>{@code ping} – checks that the store is reachable
 *   <li>{@code help} – prints usage
 * </ul>
 *
 * <h2>Exit codes</h2>
 *
 * <ul>
 *   <li>{@link #EXIT_OK} – command succeeded (a conflict is a success)
 *   <li>{@link #EXIT_USAGE} – unknown command, missing argument or invalid URL
 *   <li>{@link #EXIT_NOT_FOUND} – {@code open} of an unknown or deleted link
 *   <li>{@link #EXIT_FAILURE} – the store failed
 * </ul>
 *
 * <p>Store failures are reported on the error stream and not rethrown; the store itself has already
 * logged the cause.
 */
public class ConsoleCommands {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;
  public static final int EXIT_NOT_FOUND = 3;

  private final ShortenerService service;
  private final String ownerId;
  private final PrintStream out;
  private final PrintStream err;

  /**
   * @param service shortener service bound to the open store
   * @param ownerId owner id of the current user
   * @param out stream for results
   * @param err stream for usage and error messages
   */
  public ConsoleCommands(
      ShortenerService service, String ownerId, PrintStream out, PrintStream err) {
    this.service = Objects.requireNonNull(service, "service");
    this.ownerId = ownerId == null ? "" : ownerId;
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
  }

  /**
   * Runs one command.
   *
   * @param args command name followed by its arguments
   * @return process exit code
   */
  public int run(List<String> args) {
    if (args.isEmpty()) {
      printUsage(err);
      return EXIT_USAGE;
    }
    String command = args.get(0).toLowerCase(Locale.ROOT);
    List<String> rest = args.subList(1, args.size());
    try {
      return switch (command) {
        case "shorten" -> shorten(rest);
        case "batch" -> batch(rest);
        case "open" -> open(rest);
        case "list" -> list();
        case "delete" -> delete(rest);
        case "ping" -> ping();
        case "help", "-h", "--help" -> {
          printUsage(out);
          yield EXIT_OK;
        }
        default -> {
          err.println("Unknown command: " + args.get(0));
          printUsage(err);
          yield EXIT_USAGE;
        }
      };
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return EXIT_USAGE;
    } catch (AllocationExhaustedException e) {
      err.println(e.getMessage() + ". Try again.");
      return EXIT_FAILURE;
    } catch (BackendUnavailableException e) {
      err.println("Storage is unavailable: " + e.getMessage());
      return EXIT_FAILURE;
    } catch (StoreException e) {
      err.println("Storage error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  // =========================
  // Commands
  // =========================

  private int shorten(List<String> rest) {
    if (rest.size() != 1) return usage("shorten <url>");
    print(service.shorten(ownerId, rest.get(0)));
    return EXIT_OK;
  }

  private int batch(List<String> rest) {
    if (rest.isEmpty()) return usage("batch <url> [<url> ...]");
    for (SaveResult r : service.shortenAll(ownerId, rest)) print(r);
    return EXIT_OK;
  }

  private int open(List<String> rest) {
    if (rest.size() != 1) return usage("open <code|shortUrl>");
    try {
      out.println(service.resolve(rest.get(0)));
      return EXIT_OK;
    } catch (LinkNotFoundException e) {
      err.println("Not found: " + e.getCode());
      return EXIT_NOT_FOUND;
    } catch (LinkGoneException e) {
      err.println("Gone (deleted by its owner): " + e.getCode());
      return EXIT_NOT_FOUND;
    }
  }

  private int list() {
    List<UserUrl> mine = service.listMine(ownerId);
    if (mine.isEmpty()) {
      out.println("No links yet.");
      return EXIT_OK;
    }
    for (UserUrl u : mine) out.println(u);
    return EXIT_OK;
  }

  private int delete(List<String> rest) {
    if (rest.isEmpty()) return usage("delete <code|shortUrl> [...]");
    int n = service.deleteMine(ownerId, rest);
    out.println("Deleted " + n + " of " + rest.size());
    return EXIT_OK;
  }

  private int ping() {
    service.checkHealth();
    out.println("OK");
    return EXIT_OK;
  }

  // =========================
  // Output helpers
  // =========================

  private void print(SaveResult r) {
    out.println((r.isConflict() ? "CONFLICT " : "CREATED ") + r.getShortUrl());
  }

  private int usage(String synopsis) {
    err.println("Usage: " + synopsis);
    return EXIT_USAGE;
  }

  private static void printUsage(PrintStream ps) {
    ps.println("Usage: shortener [-b baseUrl] [-f journalPath] [-d dsn] <command> [args]");
    ps.println("Commands:");
    ps.println("  shorten <url>                 shorten one URL");
    ps.println("  batch <url> [<url> ...]       shorten several URLs at once");
    ps.println("  open <code|shortUrl>          print the original URL");
    ps.println("  list                          list your links");
    ps.println("  delete <code|shortUrl> [...]  delete your links");
    ps.println("  ping                          check the storage backend");
  }
}
