package io.intellixity.pgrecord.client;

import io.intellixity.pgrecord.errors.NotFoundException;
import io.intellixity.pgrecord.errors.StatementException;
import io.intellixity.pgrecord.sql.Bind;

import java.util.List;

/**
 * Wire-protocol client consumed by {@link io.intellixity.pgrecord.exec.PgConnection}.
 *
 * <p>Not thread-safe: callers serialize access through {@link ClientGuard}. Failures surface as
 * {@link io.intellixity.pgrecord.errors.PgRecordException} subtypes.</p>
 */
public interface SqlClient extends AutoCloseable {
  PreparedSql prepare(String sql);

  /** Runs a statement and returns the affected row count. */
  long execute(PreparedSql stmt, List<Bind> binds);

  List<SqlRow> query(PreparedSql stmt, List<Bind> binds);

  default SqlRow queryOne(PreparedSql stmt, List<Bind> binds) {
    List<SqlRow> rows = query(stmt, binds);
    if (rows.isEmpty()) throw new NotFoundException("No row returned by: " + stmt.sql());
    if (rows.size() > 1) {
      throw new StatementException("Expected one row but got " + rows.size() + " from: " + stmt.sql(), null);
    }
    return rows.get(0);
  }

  /** Runs a multi-statement script without parameters; stops at the first failing statement. */
  void batchExecute(String script);

  boolean isClosed();

  @Override
  void close();
}
