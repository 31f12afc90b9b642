package io.intellixity.pgrecord.errors;

/** Base type of every failure raised by pgrecord. */
public abstract class PgRecordException extends RuntimeException {
  protected PgRecordException(String message) {
    super(message);
  }

  protected PgRecordException(String message, Throwable cause) {
    super(message, cause);
  }
}
