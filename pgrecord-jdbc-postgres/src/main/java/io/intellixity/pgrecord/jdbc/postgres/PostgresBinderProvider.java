package io.intellixity.pgrecord.jdbc.postgres;

import io.intellixity.pgrecord.jdbc.bind.Binder;
import io.intellixity.pgrecord.jdbc.bind.JdbcBindContext;
import io.intellixity.pgrecord.jdbc.bind.JdbcBinderProvider;
import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.types.WireType;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

/** Postgres-specific JDBC binders (dialectId="postgres"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  public static final String DIALECT_ID = "postgres";

  @Override
  public String dialectId() {
    return DIALECT_ID;
  }

  @Override
  protected Collection<Binder<?>> dialectBinders() {
    return List.of(
        new PgObjectBinder(WireType.JSON, "json"),
        new PgObjectBinder(WireType.MACADDR, "macaddr"),
        new PostgresCharBinder());
  }

  /** Sends the value's text form as a typed {@link PGobject} so the server does not see varchar. */
  static final class PgObjectBinder implements Binder<Object> {
    private final WireType wireType;
    private final String pgType;

    PgObjectBinder(WireType wireType, String pgType) {
      this.wireType = wireType;
      this.pgType = pgType;
    }

    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(JdbcBindContext ctx, Bind bind, Object value) {
      return bind.wireType() == wireType;
    }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Object value) throws SQLException {
      int pos = ctx.position1Based();
      if (value == null) {
        ps.setNull(pos, Types.OTHER);
        return;
      }
      PGobject obj = new PGobject();
      obj.setType(pgType);
      obj.setValue(String.valueOf(value));
      ps.setObject(pos, obj);
    }
  }

  /** Single-byte {@code "char"}: bound with the exact type so no int2/text coercion is needed. */
  static final class PostgresCharBinder implements Binder<Byte> {
    @Override public Class<Byte> valueType() { return Byte.class; }

    @Override
    public boolean supports(JdbcBindContext ctx, Bind bind, Byte value) {
      return bind.wireType() == WireType.CHAR;
    }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Byte value) throws SQLException {
      int pos = ctx.position1Based();
      if (value == null) {
        ps.setNull(pos, Types.CHAR);
        return;
      }
      PGobject obj = new PGobject();
      obj.setType("char");
      obj.setValue(String.valueOf((char) (value & 0xFF)));
      ps.setObject(pos, obj);
    }
  }
}
