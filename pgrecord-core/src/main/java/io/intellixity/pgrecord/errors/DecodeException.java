package io.intellixity.pgrecord.errors;

/** A returned row could not be converted into the target record. */
public final class DecodeException extends PgRecordException {
  private final Class<?> recordType;
  private final String column;

  public DecodeException(Class<?> recordType, String column, String message) {
    super(message);
    this.recordType = recordType;
    this.column = column;
  }

  public DecodeException(Class<?> recordType, String column, String message, Throwable cause) {
    super(message, cause);
    this.recordType = recordType;
    this.column = column;
  }

  public Class<?> recordType() { return recordType; }
  public String column() { return column; }
}
