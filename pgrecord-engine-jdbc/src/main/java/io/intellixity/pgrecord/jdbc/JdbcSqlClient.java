package io.intellixity.pgrecord.jdbc;

import io.intellixity.pgrecord.client.PreparedSql;
import io.intellixity.pgrecord.client.SqlClient;
import io.intellixity.pgrecord.client.SqlRow;
import io.intellixity.pgrecord.errors.ConnectionException;
import io.intellixity.pgrecord.errors.PgRecordException;
import io.intellixity.pgrecord.errors.StatementException;
import io.intellixity.pgrecord.jdbc.bind.DiscoveredBinderRegistry;
import io.intellixity.pgrecord.jdbc.bind.JdbcBindContext;
import io.intellixity.pgrecord.sql.Bind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * {@link SqlClient} over one JDBC {@link Connection}.
 *
 * <p>{@code $n} placeholders are compiled to JDBC markers by {@link PlaceholderSqlCompiler} and values are
 * applied through the discovered binders. {@link SQLException}s are translated: SQLSTATE class 08 to
 * {@link ConnectionException}, anything else to {@link StatementException}.</p>
 */
public class JdbcSqlClient implements SqlClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcSqlClient.class);

  private final Connection conn;
  private final DiscoveredBinderRegistry binders;

  public JdbcSqlClient(Connection conn, DiscoveredBinderRegistry binders) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  public JdbcSqlClient(Connection conn, String dialectId) {
    this(conn, new DiscoveredBinderRegistry(dialectId));
  }

  public Connection connection() { return conn; }

  @Override
  public PreparedSql prepare(String sql) {
    PlaceholderSqlCompiler.CompiledSql compiled = PlaceholderSqlCompiler.compile(sql);
    try {
      return new JdbcPreparedSql(this, compiled, conn.prepareStatement(compiled.jdbcSql()));
    } catch (SQLException e) {
      throw translate("prepare", e);
    }
  }

  @Override
  public long execute(PreparedSql stmt, List<Bind> binds) {
    JdbcPreparedSql p = own(stmt);
    List<Bind> ordered = p.compiled().orderBinds(binds);
    long start = System.nanoTime();
    debugSql("EXECUTE", p, ordered);
    try {
      PreparedStatement ps = p.statement();
      bindAll(ps, ordered);
      long n;
      if (ps.execute()) {
        n = 0;
        try (ResultSet rs = ps.getResultSet()) {
          while (rs.next()) n++;
        }
      } else {
        n = ps.getLargeUpdateCount();
      }
      debugDone("EXECUTE", n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw translate("execute", e);
    }
  }

  @Override
  public List<SqlRow> query(PreparedSql stmt, List<Bind> binds) {
    JdbcPreparedSql p = own(stmt);
    List<Bind> ordered = p.compiled().orderBinds(binds);
    long start = System.nanoTime();
    debugSql("QUERY", p, ordered);
    try {
      PreparedStatement ps = p.statement();
      bindAll(ps, ordered);
      try (ResultSet rs = ps.executeQuery()) {
        Map<String, Integer> labels = JdbcRow.labels(rs);
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        Class<?>[] targets = new Class<?>[cols];
        for (int i = 0; i < cols; i++) targets[i] = columnTarget(md, i + 1);
        List<SqlRow> out = new ArrayList<>();
        while (rs.next()) {
          Object[] values = new Object[cols];
          for (int i = 0; i < cols; i++) values[i] = readColumn(rs, i + 1, targets[i]);
          out.add(new JdbcRow(labels, values));
        }
        debugDone("QUERY", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw translate("query", e);
    }
  }

  @Override
  public void batchExecute(String script) {
    Objects.requireNonNull(script, "script");
    long start = System.nanoTime();
    if (log.isDebugEnabled()) log.debug("pgrecord.jdbc op=BATCH dialect={} scriptLen={}", binders.dialectId(), script.length());
    try (Statement st = conn.createStatement()) {
      st.execute(script);
      debugDone("BATCH", "ok", System.nanoTime() - start);
    } catch (SQLException e) {
      throw translate("batchExecute", e);
    }
  }

  @Override
  public boolean isClosed() {
    try {
      return conn.isClosed();
    } catch (SQLException e) {
      throw translate("isClosed", e);
    }
  }

  @Override
  public void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      throw translate("close", e);
    }
  }

  /**
   * Java type a column is read as, or null for the driver's default mapping. Temporal columns are read
   * as {@code java.time} values so sub-second precision and wall-clock times survive.
   */
  protected Class<?> columnTarget(ResultSetMetaData md, int index1Based) throws SQLException {
    return switch (md.getColumnType(index1Based)) {
      case Types.DATE -> LocalDate.class;
      case Types.TIME -> LocalTime.class;
      case Types.TIMESTAMP -> LocalDateTime.class;
      case Types.TIMESTAMP_WITH_TIMEZONE -> OffsetDateTime.class;
      default -> null;
    };
  }

  /** Reads one column of the current row; dialects override to unwrap driver-specific holder types. */
  protected Object readColumn(ResultSet rs, int index1Based, Class<?> target) throws SQLException {
    return target == null ? rs.getObject(index1Based) : rs.getObject(index1Based, target);
  }

  public static PgRecordException translate(String op, SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith("08")) {
      return new ConnectionException("Connection failure during " + op + ": " + e.getMessage(), e);
    }
    return new StatementException(e.getMessage(), state, e);
  }

  private JdbcPreparedSql own(PreparedSql stmt) {
    if (!(stmt instanceof JdbcPreparedSql p) || p.owner() != this) {
      throw new IllegalArgumentException("Statement was not prepared by this client: "
          + (stmt == null ? "null" : stmt.sql()));
    }
    return p;
  }

  private void bindAll(PreparedStatement ps, List<Bind> ordered) throws SQLException {
    for (int i = 0; i < ordered.size(); i++) {
      binders.bind(ps, new JdbcBindContext(i + 1), ordered.get(i));
    }
  }

  private void debugSql(String op, JdbcPreparedSql p, List<Bind> ordered) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgrecord.jdbc op={} dialect={} bindCount={} sql={}",
        op, binders.dialectId(), ordered.size(), p.jdbcSql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && !ordered.isEmpty()) {
      int idx = 1;
      for (Bind b : ordered) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("pgrecord.jdbc bind index={} wireType={} valueType={} valueLen={}",
            idx++, b.wireType(), vType, vLen);
      }
    }
  }

  private void debugDone(String op, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgrecord.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
