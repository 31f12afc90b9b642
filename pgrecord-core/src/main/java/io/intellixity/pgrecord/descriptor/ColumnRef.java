package io.intellixity.pgrecord.descriptor;

import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.sql.Identifiers;
import io.intellixity.pgrecord.types.ScalarCodec;
import io.intellixity.pgrecord.types.WireType;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.Optional;

/**
 * One persisted record component.
 *
 * @param sourceName record component name
 * @param sqlName    unquoted database column name
 * @param hostType   component type, or the element type for {@code Optional<X>}
 * @param nullable   false only for primitive components
 * @param optional   true when the component is declared as {@code Optional<X>}
 */
public record ColumnRef(String sourceName,
                        String sqlName,
                        WireType wireType,
                        Class<?> hostType,
                        boolean nullable,
                        boolean optional,
                        ScalarCodec<?> codec,
                        Method accessor) {
  public ColumnRef {
    Objects.requireNonNull(sourceName, "sourceName");
    Objects.requireNonNull(sqlName, "sqlName");
    Objects.requireNonNull(wireType, "wireType");
    Objects.requireNonNull(hostType, "hostType");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(accessor, "accessor");
  }

  public String quotedName() {
    return Identifiers.quote(sqlName);
  }

  /** Reads this component from {@code record} and encodes it for the wire. */
  public Bind read(Object record) {
    Object v;
    try {
      v = accessor.invoke(record);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot read component '" + sourceName + "'", e);
    } catch (InvocationTargetException e) {
      throw new IllegalStateException("Accessor of component '" + sourceName + "' failed", e.getCause());
    }
    if (optional) v = (v == null) ? null : ((Optional<?>) v).orElse(null);
    @SuppressWarnings("unchecked")
    ScalarCodec<Object> c = (ScalarCodec<Object>) codec;
    return new Bind(v == null ? null : c.encode(v), wireType);
  }
}
