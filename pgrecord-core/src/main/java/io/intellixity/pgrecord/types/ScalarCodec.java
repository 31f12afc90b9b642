package io.intellixity.pgrecord.types;

/**
 * Converts between a host scalar type and the values exchanged with the client.
 *
 * <p>{@link #decode(Object)} accepts whatever the client hands back for the column (driver-specific
 * representations included) and throws {@link IllegalArgumentException} when it cannot convert.</p>
 */
public interface ScalarCodec<T> {
  WireType wireType();

  Class<T> hostType();

  T decode(Object raw);

  Object encode(T value);
}
