package io.intellixity.pgrecord.jdbc.postgres;

import io.intellixity.pgrecord.jdbc.JdbcSqlClient;
import io.intellixity.pgrecord.jdbc.bind.DiscoveredBinderRegistry;
import org.postgresql.util.PGobject;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.OffsetDateTime;

/** JDBC client for PostgreSQL; {@link PGobject} column values (json, macaddr, ...) are read as text. */
public final class PostgresSqlClient extends JdbcSqlClient {
  public PostgresSqlClient(Connection conn) {
    super(conn, PostgresBinderProvider.DIALECT_ID);
  }

  public PostgresSqlClient(Connection conn, DiscoveredBinderRegistry binders) {
    super(conn, binders);
  }

  /** pgjdbc reports timestamptz and timetz with the zone-less JDBC types, so the server type name decides. */
  @Override
  protected Class<?> columnTarget(ResultSetMetaData md, int index1Based) throws SQLException {
    String typeName = md.getColumnTypeName(index1Based);
    if ("timestamptz".equals(typeName)) return OffsetDateTime.class;
    if ("timetz".equals(typeName)) return null;
    return super.columnTarget(md, index1Based);
  }

  @Override
  protected Object readColumn(ResultSet rs, int index1Based, Class<?> target) throws SQLException {
    Object v = super.readColumn(rs, index1Based, target);
    if (v instanceof PGobject pg) return pg.getValue();
    return v;
  }
}
