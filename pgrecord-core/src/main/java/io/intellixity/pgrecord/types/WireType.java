package io.intellixity.pgrecord.types;

/** Scalar categories a column value is sent as. {@link #sqlName()} is the cast target in typed placeholders. */
public enum WireType {
  BOOL("BOOL"),
  CHAR("\"char\""),
  SMALLINT("SMALLINT"),
  INT("INT"),
  OID("OID"),
  BIGINT("BIGINT"),
  REAL("REAL"),
  DOUBLE("DOUBLE PRECISION"),
  VARCHAR("VARCHAR"),
  BYTEA("BYTEA"),
  DATE("DATE"),
  TIME("TIME"),
  TIMESTAMP("TIMESTAMP"),
  TIMESTAMPTZ("TIMESTAMPTZ"),
  UUID("UUID"),
  JSON("JSON"),
  MACADDR("MACADDR");

  private final String sqlName;

  WireType(String sqlName) {
    this.sqlName = sqlName;
  }

  public String sqlName() { return sqlName; }
}
