package io.intellixity.pgrecord.client;

/** One result row as handed back by a {@link SqlClient}; values are driver representations. */
public interface SqlRow {
  int columnCount();

  boolean contains(String column);

  /** Value of a named column; fails with {@link IllegalArgumentException} for an unknown column. */
  Object get(String column);

  /** Value by 0-based position. */
  Object get(int index);
}
