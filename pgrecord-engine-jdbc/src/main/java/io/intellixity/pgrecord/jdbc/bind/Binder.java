package io.intellixity.pgrecord.jdbc.bind;

import io.intellixity.pgrecord.sql.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Applies one encoded value to a JDBC parameter.
 *
 * The value is already encoded by the column's codec; a binder adapts it for driver specifics.
 * {@code value} may be null, in which case {@link #supports} decides from the bind's wire type.
 */
public interface Binder<TValue> {
  Class<TValue> valueType();

  boolean supports(JdbcBindContext ctx, Bind bind, TValue value);

  void bind(PreparedStatement ps, JdbcBindContext ctx, Bind bind, TValue value) throws SQLException;
}
