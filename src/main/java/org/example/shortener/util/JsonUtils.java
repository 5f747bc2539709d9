package org.example.shortener.util;

import com.google.gson.*;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON utilities for the application.
 *
 * <p>Two shared {@link Gson} flavours are offered:
 *
 * <ul>
 *   <li>{@link #gson()} – pretty printed, for human-edited files such as {@code config.json};
 *   <li>{@link #compactGson()} – single-line output, for the newline-delimited URL journal where
 *       each record must occupy exactly one line.
 * </ul>
 *
 * <p>Both register (de)serializers for {@link Instant} using its ISO-8601 form (e.g. {@code
 * 2025-11-10T12:34:56.789Z}) and disable HTML escaping, so URLs containing {@code &} or {@code =}
 * are written verbatim. {@link Gson} instances are thread-safe after construction.
 */
public final class JsonUtils {
  private JsonUtils() {}

  private static final JsonSerializer<Instant> INSTANT_SER =
      (src, t, ctx) -> new JsonPrimitive(src.toString());

  private static final JsonDeserializer<Instant> INSTANT_DES =
      (json, t, ctx) -> {
        if (!json.isJsonPrimitive()) throw new JsonParseException("Bad instant: " + json);
        try {
          return Instant.parse(json.getAsString());
        } catch (DateTimeParseException e) {
          throw new JsonParseException("Bad instant: " + json, e);
        }
      };

  /** @return pretty-printing {@link Gson} for configuration files */
  public static Gson gson() {
    return builder().setPrettyPrinting().create();
  }

  /** @return single-line {@link Gson} for journal records */
  public static Gson compactGson() {
    return builder().create();
  }

  private static GsonBuilder builder() {
    return new GsonBuilder()
        .disableHtmlEscaping()
        .registerTypeAdapter(Instant.class, INSTANT_SER)
        .registerTypeAdapter(Instant.class, INSTANT_DES);
  }
}
