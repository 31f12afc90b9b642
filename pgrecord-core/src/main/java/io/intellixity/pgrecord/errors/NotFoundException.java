package io.intellixity.pgrecord.errors;

/** A single-row operation returned no row. */
public final class NotFoundException extends PgRecordException {
  public NotFoundException(String message) {
    super(message);
  }
}
