package io.intellixity.pgrecord.jdbc.bind;

import io.intellixity.pgrecord.jdbc.JdbcTypes;
import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.types.WireType;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-family binder base.
 *
 * Dialect providers extend this and add dialect binders, which are evaluated before the base ones.
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?>> binders() {
    List<Binder<?>> out = new ArrayList<>();
    out.addAll(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<Binder<?>> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<Binder<?>> jdbcBinders() {
    return List.of(
        new JdbcNullBinder(),
        new JdbcCharBinder(),
        new JdbcTextRenderedBinder(),
        new JdbcSetObjectBinder()
    );
  }

  /** SQL NULL typed from the bind's wire type ({@link java.sql.Types#NULL} when unknown). */
  static final class JdbcNullBinder implements Binder<Object> {
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(JdbcBindContext ctx, Bind bind, Object value) { return value == null; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Object value) throws SQLException {
      ps.setNull(ctx.position1Based(), JdbcTypes.sqlType(bind.wireType()));
    }
  }

  /** Single-byte {@code "char"} sent as a one-character string. */
  static final class JdbcCharBinder implements Binder<Byte> {
    @Override public Class<Byte> valueType() { return Byte.class; }
    @Override public boolean supports(JdbcBindContext ctx, Bind bind, Byte value) { return bind.wireType() == WireType.CHAR; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Byte value) throws SQLException {
      ps.setString(ctx.position1Based(), String.valueOf((char) (value & 0xFF)));
    }
  }

  /** JSON and MACADDR values sent as their text form for drivers without a native type. */
  static final class JdbcTextRenderedBinder implements Binder<Object> {
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(JdbcBindContext ctx, Bind bind, Object value) {
      return bind.wireType() == WireType.JSON || bind.wireType() == WireType.MACADDR;
    }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Object value) throws SQLException {
      ps.setString(ctx.position1Based(), String.valueOf(value));
    }
  }

  static final class JdbcSetObjectBinder implements Binder<Object> {
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(JdbcBindContext ctx, Bind bind, Object value) { return true; }

    @Override
    public void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, Object value) throws SQLException {
      ps.setObject(ctx.position1Based(), value);
    }
  }
}
