package io.intellixity.pgrecord.jdbc;

import io.intellixity.pgrecord.client.PreparedSql;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** A JDBC {@link PreparedStatement} plus the placeholder layout it was compiled with. */
public final class JdbcPreparedSql implements PreparedSql {
  private final JdbcSqlClient owner;
  private final PlaceholderSqlCompiler.CompiledSql compiled;
  private final PreparedStatement ps;

  JdbcPreparedSql(JdbcSqlClient owner, PlaceholderSqlCompiler.CompiledSql compiled, PreparedStatement ps) {
    this.owner = owner;
    this.compiled = compiled;
    this.ps = ps;
  }

  @Override public String sql() { return compiled.sql(); }

  public String jdbcSql() { return compiled.jdbcSql(); }

  PlaceholderSqlCompiler.CompiledSql compiled() { return compiled; }
  PreparedStatement statement() { return ps; }
  JdbcSqlClient owner() { return owner; }

  @Override
  public void close() {
    try {
      ps.close();
    } catch (SQLException e) {
      throw JdbcSqlClient.translate("close", e);
    }
  }
}
