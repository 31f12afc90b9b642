package io.intellixity.pgrecord.jdbc;

import io.intellixity.pgrecord.client.SqlRow;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/** A materialized result row; valid after the {@link ResultSet} it came from is closed. */
public final class JdbcRow implements SqlRow {
  private final Map<String, Integer> colIndex;
  private final Object[] values;

  JdbcRow(Map<String, Integer> colIndex, Object[] values) {
    this.colIndex = colIndex;
    this.values = values;
  }

  /**
   * Label to 0-based index for the current result set. When a label repeats (e.g. the joined side of
   * {@code UPDATE ... FROM}) the first occurrence wins.
   */
  static Map<String, Integer> labels(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Integer> out = new HashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      out.putIfAbsent(md.getColumnLabel(i), i - 1);
    }
    return out;
  }

  @Override public int columnCount() { return values.length; }
  @Override public boolean contains(String column) { return colIndex.containsKey(column); }

  @Override
  public Object get(String column) {
    Integer i = colIndex.get(column);
    if (i == null) throw new IllegalArgumentException("Unknown column label: " + column);
    return values[i];
  }

  @Override
  public Object get(int index) {
    if (index < 0 || index >= values.length) {
      throw new IndexOutOfBoundsException("Column index " + index + " out of range [0, " + values.length + ")");
    }
    return values[index];
  }
}
