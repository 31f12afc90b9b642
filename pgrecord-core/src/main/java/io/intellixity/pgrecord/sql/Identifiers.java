package io.intellixity.pgrecord.sql;

import java.util.Objects;

/** Double-quoted PostgreSQL identifiers. */
public final class Identifiers {
  private Identifiers() {}

  public static String quote(String ident) {
    Objects.requireNonNull(ident, "ident");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** Quotes each dot-separated segment: {@code audit.events} becomes {@code "audit"."events"}. */
  public static String quoteQualified(String name) {
    Objects.requireNonNull(name, "name");
    String[] parts = name.split("\\.", -1);
    StringBuilder sb = new StringBuilder(name.length() + 2 * parts.length);
    for (int i = 0; i < parts.length; i++) {
      if (parts[i].isBlank()) throw new IllegalArgumentException("Empty segment in qualified name: " + name);
      if (i > 0) sb.append('.');
      sb.append(quote(parts[i]));
    }
    return sb.toString();
  }
}
