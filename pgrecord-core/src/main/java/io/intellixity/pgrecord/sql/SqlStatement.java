package io.intellixity.pgrecord.sql;

import java.util.List;
import java.util.Objects;

/** SQL text with {@code $n} placeholders plus the values they refer to ({@code $n} is {@code binds.get(n - 1)}). */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Rows are returned and all of them are decoded. */
    QUERY,
    /** Exactly one row is expected back (single-row RETURNING). */
    QUERY_ONE,
    /** Only the affected row count is of interest. */
    UPDATE
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
