package io.intellixity.pgrecord.errors;

/**
 * A statement was malformed or rejected by the server.
 * <p>
 * {@link #getMessage()} carries the server diagnostic verbatim.
 */
public final class StatementException extends PgRecordException {
  private final String sqlState;

  public StatementException(String message, String sqlState) {
    super(message);
    this.sqlState = sqlState;
  }

  public StatementException(String message, String sqlState, Throwable cause) {
    super(message, cause);
    this.sqlState = sqlState;
  }

  /** SQLSTATE reported by the server, or null when the failure was detected client-side. */
  public String sqlState() { return sqlState; }
}
