package io.intellixity.pgrecord.jdbc;

import io.intellixity.pgrecord.types.WireType;

import java.sql.Types;

/** {@link java.sql.Types} code per wire type, used for typed NULLs. */
public final class JdbcTypes {
  private JdbcTypes() {}

  public static int sqlType(WireType wireType) {
    if (wireType == null) return Types.NULL;
    return switch (wireType) {
      case BOOL -> Types.BOOLEAN;
      case CHAR -> Types.CHAR;
      case SMALLINT -> Types.SMALLINT;
      case INT -> Types.INTEGER;
      case OID, BIGINT -> Types.BIGINT;
      case REAL -> Types.REAL;
      case DOUBLE -> Types.DOUBLE;
      case VARCHAR -> Types.VARCHAR;
      case BYTEA -> Types.BINARY;
      case DATE -> Types.DATE;
      case TIME -> Types.TIME;
      case TIMESTAMP -> Types.TIMESTAMP;
      case TIMESTAMPTZ -> Types.TIMESTAMP_WITH_TIMEZONE;
      case UUID, JSON, MACADDR -> Types.OTHER;
    };
  }
}
