package io.intellixity.pgrecord.client;

/** A statement prepared on one {@link SqlClient}; only valid on that client. */
public interface PreparedSql extends AutoCloseable {
  /** SQL text as it was prepared, with {@code $n} placeholders. */
  String sql();

  @Override
  void close();
}
