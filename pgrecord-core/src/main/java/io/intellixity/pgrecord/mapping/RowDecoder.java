package io.intellixity.pgrecord.mapping;

import io.intellixity.pgrecord.client.SqlRow;
import io.intellixity.pgrecord.descriptor.ColumnRef;
import io.intellixity.pgrecord.errors.DecodeException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds record values from result rows, matching columns by name.
 *
 * <p>Extra columns in the row are ignored. A missing column, a value that cannot be converted, or SQL
 * NULL for a primitive component fails the row with {@link DecodeException}.</p>
 */
public final class RowDecoder<T> {
  private final Class<T> recordType;
  private final List<ColumnRef> components;
  private final Constructor<T> constructor;

  public RowDecoder(Class<T> recordType, List<ColumnRef> components, Constructor<T> constructor) {
    this.recordType = Objects.requireNonNull(recordType, "recordType");
    this.components = List.copyOf(components);
    this.constructor = Objects.requireNonNull(constructor, "constructor");
    if (constructor.getParameterCount() != this.components.size()) {
      throw new IllegalArgumentException("Constructor arity " + constructor.getParameterCount()
          + " does not match " + this.components.size() + " components of " + recordType.getName());
    }
  }

  public Class<T> recordType() { return recordType; }

  public T decode(SqlRow row) {
    Objects.requireNonNull(row, "row");
    Object[] args = new Object[components.size()];
    for (int i = 0; i < args.length; i++) args[i] = value(row, components.get(i));
    try {
      return constructor.newInstance(args);
    } catch (InvocationTargetException e) {
      throw new DecodeException(recordType, null,
          "Constructor of " + recordType.getName() + " rejected row: " + e.getCause(), e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new DecodeException(recordType, null, "Cannot instantiate " + recordType.getName(), e);
    }
  }

  public List<T> decodeAll(List<? extends SqlRow> rows) {
    List<T> out = new ArrayList<>(rows.size());
    for (SqlRow r : rows) out.add(decode(r));
    return out;
  }

  private Object value(SqlRow row, ColumnRef c) {
    String col = c.sqlName();
    if (!row.contains(col)) {
      throw new DecodeException(recordType, col, "Column '" + col + "' missing from result row");
    }
    Object raw = row.get(col);
    if (raw == null) {
      if (!c.nullable()) {
        throw new DecodeException(recordType, col,
            "NULL in column '" + col + "' for primitive component '" + c.sourceName() + "'");
      }
      return c.optional() ? Optional.empty() : null;
    }
    Object v;
    try {
      v = c.codec().decode(raw);
    } catch (IllegalArgumentException | ArithmeticException | java.time.DateTimeException e) {
      throw new DecodeException(recordType, col,
          "Column '" + col + "' (" + c.wireType() + "): " + e.getMessage(), e);
    }
    return c.optional() ? Optional.ofNullable(v) : v;
  }
}
