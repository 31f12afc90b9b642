package io.intellixity.pgrecord.descriptor;

import io.intellixity.pgrecord.annotation.Column;
import io.intellixity.pgrecord.annotation.PrimaryKey;
import io.intellixity.pgrecord.annotation.Table;
import io.intellixity.pgrecord.annotation.Unsigned;
import io.intellixity.pgrecord.errors.SynthesisException;
import io.intellixity.pgrecord.mapping.RowDecoder;
import io.intellixity.pgrecord.sql.Identifiers;
import io.intellixity.pgrecord.types.ScalarCodec;
import io.intellixity.pgrecord.types.ScalarCodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a {@link TypeDescriptor} (and the reverse {@link RowDecoder}) from a record type.
 *
 * Rules:
 * - table = {@code @Table} value, else the simple class name; dotted names are quoted per segment
 * - column = {@code @Column(name)} when non-blank, else the component name
 * - primary key = the {@code @PrimaryKey} component, else the first component whose name contains "id"
 * - {@code Optional<X>} maps as X and is nullable
 *
 * Pure apart from one WARN line when the primary-key fallback is used.
 */
public final class DescriptorSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(DescriptorSynthesizer.class);

  private DescriptorSynthesizer() {}

  public static <T> TypeDescriptor<T> synthesize(Class<T> type) {
    RecordShape<T> shape = inspect(type);
    List<ColumnRef> comps = shape.components();

    int pk = -1;
    for (int i = 0; i < comps.size(); i++) {
      if (!shape.primaryKeyMarks().get(i)) continue;
      if (pk >= 0) {
        throw SynthesisException.ambiguousPrimaryKey(type, comps.get(pk).sourceName(), comps.get(i).sourceName());
      }
      pk = i;
    }
    if (pk < 0) {
      for (int i = 0; i < comps.size(); i++) {
        if (comps.get(i).sourceName().contains("id")) {
          pk = i;
          break;
        }
      }
      if (pk < 0) throw SynthesisException.missingPrimaryKey(type);
      log.warn("pgrecord.synth no @PrimaryKey on {}; using component '{}' as primary key",
          type.getName(), comps.get(pk).sourceName());
    }

    List<ColumnRef> columns = new ArrayList<>(comps.size() - 1);
    for (int i = 0; i < comps.size(); i++) {
      if (i != pk) columns.add(comps.get(i));
    }

    TypeDescriptor<T> d = new TypeDescriptor<>(type, tableName(type), comps.get(pk), columns, decoderOf(shape));
    if (log.isDebugEnabled()) log.debug("pgrecord.synth {}", d);
    return d;
  }

  /** Reverse mapping only; does not require a primary key. */
  public static <T> RowDecoder<T> synthesizeDecoder(Class<T> type) {
    return decoderOf(inspect(type));
  }

  private static <T> RowDecoder<T> decoderOf(RecordShape<T> shape) {
    return new RowDecoder<>(shape.type(), shape.components(), shape.canonicalConstructor());
  }

  static String tableName(Class<?> type) {
    Table t = type.getAnnotation(Table.class);
    if (t != null && !t.value().isBlank()) return Identifiers.quoteQualified(t.value().trim());
    return Identifiers.quote(type.getSimpleName());
  }

  static <T> RecordShape<T> inspect(Class<T> type) {
    if (type == null) throw new IllegalArgumentException("type is required");
    if (!type.isRecord()) throw SynthesisException.unsupportedShape(type, "not a record");
    RecordComponent[] rcs = type.getRecordComponents();
    if (rcs.length == 0) throw SynthesisException.unsupportedShape(type, "record has no components");

    List<ColumnRef> comps = new ArrayList<>(rcs.length);
    List<Boolean> pkMarks = new ArrayList<>(rcs.length);
    Map<String, String> seen = new HashMap<>();
    Class<?>[] ctorTypes = new Class<?>[rcs.length];

    for (int i = 0; i < rcs.length; i++) {
      RecordComponent rc = rcs[i];
      ctorTypes[i] = rc.getType();
      ColumnRef c = column(type, rc);
      String prev = seen.putIfAbsent(c.sqlName(), c.sourceName());
      if (prev != null) throw SynthesisException.duplicateColumn(type, c.sourceName(), c.sqlName());
      comps.add(c);
      pkMarks.add(rc.isAnnotationPresent(PrimaryKey.class));
    }

    Constructor<T> ctor;
    try {
      ctor = type.getDeclaredConstructor(ctorTypes);
      ctor.setAccessible(true);
    } catch (NoSuchMethodException | RuntimeException e) {
      throw SynthesisException.unsupportedShape(type, "canonical constructor not accessible: " + e.getMessage());
    }
    return new RecordShape<>(type, List.copyOf(comps), List.copyOf(pkMarks), ctor);
  }

  private static ColumnRef column(Class<?> type, RecordComponent rc) {
    String name = rc.getName();
    Column col = rc.getAnnotation(Column.class);
    String sqlName = (col != null && !col.name().isBlank()) ? col.name().trim() : name;

    Class<?> raw = rc.getType();
    boolean optional = raw == Optional.class;
    Class<?> host = raw;
    if (optional) {
      Type g = rc.getGenericType();
      if (!(g instanceof ParameterizedType pt) || !(pt.getActualTypeArguments()[0] instanceof Class<?> inner)
          || inner == Optional.class) {
        throw SynthesisException.unsupportedType(type, name, g.getTypeName());
      }
      host = inner;
    }

    boolean unsigned = rc.isAnnotationPresent(Unsigned.class);
    Optional<ScalarCodec<?>> codec = unsigned ? ScalarCodecs.lookupUnsigned(host) : ScalarCodecs.lookup(host);
    if (codec.isEmpty()) {
      throw SynthesisException.unsupportedType(type, name, (unsigned ? "@Unsigned " : "") + rc.getGenericType().getTypeName());
    }

    Method accessor = rc.getAccessor();
    try {
      accessor.setAccessible(true);
    } catch (RuntimeException e) {
      throw SynthesisException.unsupportedShape(type, "accessor of '" + name + "' not accessible: " + e.getMessage());
    }

    boolean nullable = optional || !host.isPrimitive();
    return new ColumnRef(name, sqlName, codec.get().wireType(), host, nullable, optional,
        codec.get(), accessor);
  }
}
