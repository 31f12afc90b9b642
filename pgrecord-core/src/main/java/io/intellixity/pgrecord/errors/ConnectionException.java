package io.intellixity.pgrecord.errors;

/** The client handle could not be established, was lost, or was already closed. */
public final class ConnectionException extends PgRecordException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
