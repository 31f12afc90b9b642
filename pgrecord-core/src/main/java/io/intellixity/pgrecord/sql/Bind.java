package io.intellixity.pgrecord.sql;

import io.intellixity.pgrecord.types.WireType;

/**
 * One bound parameter: the encoded value and the wire type it is sent as.
 * <p>
 * {@code wireType} is null for a free-form argument whose type could not be inferred; the client then
 * lets the server infer it.
 */
public record Bind(Object value, WireType wireType) {
  public static Bind untyped(Object value) {
    return new Bind(value, null);
  }
}
