package org.example.pomodorobot.util;

import com.google.gson.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * JSON utilities for the application.
 *
 * <p>Provides {@link Gson} instances configured with pretty printing and {@link LocalDateTime}
 * adapters using {@link DateTimeFormatter#ISO_LOCAL_DATE_TIME}. Used for {@code config.json} and
 * for exporting the event journal.
 *
 * <p><b>Thread safety:</b> {@link Gson} instances are immutable and thread-safe once built.
 */
public final class JsonUtils {
  private JsonUtils() {}

  private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private static final JsonSerializer<LocalDateTime> LDT_SER =
      (src, t, ctx) -> new JsonPrimitive(ISO.format(src));

  private static final JsonDeserializer<LocalDateTime> LDT_DES =
      (json, t, ctx) -> LocalDateTime.parse(json.getAsString(), ISO);

  private static final Gson GSON =
      new GsonBuilder()
          .setPrettyPrinting()
          .registerTypeAdapter(LocalDateTime.class, LDT_SER)
          .registerTypeAdapter(LocalDateTime.class, LDT_DES)
          .create();

  /** @return the shared, pretty-printing {@link Gson} with date-time adapters */
  public static Gson gson() {
    return GSON;
  }

  /**
   * Serializes a value with {@link #gson()}.
   *
   * @param value value to serialize; {@code null} yields {@code "null"}
   * @return pretty-printed JSON
   */
  public static String toJson(Object value) {
    return GSON.toJson(value);
  }
}
