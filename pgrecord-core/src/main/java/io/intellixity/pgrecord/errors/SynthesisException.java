package io.intellixity.pgrecord.errors;

import java.util.Objects;

/**
 * Raised when a record type cannot be turned into a descriptor.
 * <p>
 * Always raised before any statement for the type is sent; never retried.
 */
public final class SynthesisException extends PgRecordException {
  public enum Kind {
    MISSING_PRIMARY_KEY,
    AMBIGUOUS_PRIMARY_KEY,
    UNSUPPORTED_TYPE,
    UNSUPPORTED_SHAPE,
    DUPLICATE_COLUMN_NAME
  }

  private final Kind kind;
  private final Class<?> recordType;
  private final String component;

  public SynthesisException(Kind kind, Class<?> recordType, String component, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.recordType = recordType;
    this.component = component;
  }

  public Kind kind() { return kind; }
  public Class<?> recordType() { return recordType; }

  /** Offending record component, or null when the failure concerns the whole type. */
  public String component() { return component; }

  public static SynthesisException missingPrimaryKey(Class<?> type) {
    return new SynthesisException(Kind.MISSING_PRIMARY_KEY, type, null,
        "No primary key for " + type.getName() + ": annotate one component with @PrimaryKey");
  }

  public static SynthesisException ambiguousPrimaryKey(Class<?> type, String first, String second) {
    return new SynthesisException(Kind.AMBIGUOUS_PRIMARY_KEY, type, second,
        "More than one @PrimaryKey on " + type.getName() + ": '" + first + "' and '" + second + "'");
  }

  public static SynthesisException unsupportedType(Class<?> type, String component, String hostType) {
    return new SynthesisException(Kind.UNSUPPORTED_TYPE, type, component,
        "Unsupported type " + hostType + " for component '" + component + "' of " + type.getName());
  }

  public static SynthesisException unsupportedShape(Class<?> type, String reason) {
    return new SynthesisException(Kind.UNSUPPORTED_SHAPE, type, null,
        "Unsupported shape " + type.getName() + ": " + reason);
  }

  public static SynthesisException duplicateColumn(Class<?> type, String component, String sqlName) {
    return new SynthesisException(Kind.DUPLICATE_COLUMN_NAME, type, component,
        "Duplicate column name '" + sqlName + "' (component '" + component + "') in " + type.getName());
  }
}
