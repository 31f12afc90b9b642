package io.intellixity.pgrecord.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Fixed host type → wire type table.
 *
 * <p>Lookup is total over the supported set and returns empty for anything else. Primitive and boxed
 * variants share one codec.</p>
 */
public final class ScalarCodecs {
  private static final ObjectMapper JSON = new ObjectMapper();

  public static final ScalarCodec<Boolean> BOOL = codec(WireType.BOOL, Boolean.class, ScalarCodecs::toBool);
  public static final ScalarCodec<Byte> CHAR = codec(WireType.CHAR, Byte.class, ScalarCodecs::toByte);
  public static final ScalarCodec<Short> SMALLINT = codec(WireType.SMALLINT, Short.class,
      raw -> (short) exactLong(raw, Short.MIN_VALUE, Short.MAX_VALUE));
  public static final ScalarCodec<Integer> INT = codec(WireType.INT, Integer.class,
      raw -> (int) exactLong(raw, Integer.MIN_VALUE, Integer.MAX_VALUE));
  public static final ScalarCodec<Long> BIGINT = codec(WireType.BIGINT, Long.class,
      raw -> exactLong(raw, Long.MIN_VALUE, Long.MAX_VALUE));
  public static final ScalarCodec<Float> REAL = codec(WireType.REAL, Float.class,
      raw -> requireNumber(raw).floatValue());
  public static final ScalarCodec<Double> DOUBLE = codec(WireType.DOUBLE, Double.class,
      raw -> requireNumber(raw).doubleValue());
  public static final ScalarCodec<String> VARCHAR = codec(WireType.VARCHAR, String.class, ScalarCodecs::toText);
  public static final ScalarCodec<byte[]> BYTEA = codec(WireType.BYTEA, byte[].class, raw -> {
    if (raw instanceof byte[] b) return b;
    throw mismatch(raw, byte[].class);
  });
  public static final ScalarCodec<LocalDate> DATE = codec(WireType.DATE, LocalDate.class, raw -> {
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof String s) return LocalDate.parse(s);
    throw mismatch(raw, LocalDate.class);
  });
  public static final ScalarCodec<LocalTime> TIME = codec(WireType.TIME, LocalTime.class, raw -> {
    if (raw instanceof LocalTime t) return t;
    if (raw instanceof Time t) return t.toLocalTime().withNano((int) Math.floorMod(t.getTime(), 1000L) * 1_000_000);
    if (raw instanceof String s) return LocalTime.parse(s);
    throw mismatch(raw, LocalTime.class);
  });
  public static final ScalarCodec<LocalDateTime> TIMESTAMP = codec(WireType.TIMESTAMP, LocalDateTime.class, raw -> {
    if (raw instanceof LocalDateTime t) return t;
    if (raw instanceof Timestamp t) return t.toLocalDateTime();
    throw mismatch(raw, LocalDateTime.class);
  });
  public static final ScalarCodec<OffsetDateTime> TIMESTAMPTZ = codec(WireType.TIMESTAMPTZ, OffsetDateTime.class, raw -> {
    if (raw instanceof OffsetDateTime t) return t;
    if (raw instanceof Timestamp t) return t.toInstant().atOffset(ZoneOffset.UTC);
    throw mismatch(raw, OffsetDateTime.class);
  });
  public static final ScalarCodec<UUID> UUID_TYPE = codec(WireType.UUID, UUID.class, raw -> {
    if (raw instanceof UUID u) return u;
    if (raw instanceof String s) return UUID.fromString(s.trim());
    throw mismatch(raw, UUID.class);
  });
  public static final ScalarCodec<JsonNode> JSON_TYPE = codec(WireType.JSON, JsonNode.class, raw -> {
    if (raw instanceof JsonNode n) return n;
    if (raw instanceof String s) {
      try {
        return JSON.readTree(s);
      } catch (Exception e) {
        throw new IllegalArgumentException("Invalid JSON value", e);
      }
    }
    throw mismatch(raw, JsonNode.class);
  });
  public static final ScalarCodec<MacAddress> MACADDR = codec(WireType.MACADDR, MacAddress.class, raw -> {
    if (raw instanceof MacAddress m) return m;
    if (raw instanceof String s) return MacAddress.parse(s);
    throw mismatch(raw, MacAddress.class);
  });

  /** OID read into an {@code int}: the 32 bits are kept, sign included. */
  public static final ScalarCodec<Integer> OID_INT = new SimpleCodec<>(WireType.OID, Integer.class,
      raw -> (int) exactLong(raw, 0, 0xFFFF_FFFFL),
      v -> v == null ? null : Integer.toUnsignedLong(v));
  public static final ScalarCodec<Long> OID_LONG = new SimpleCodec<>(WireType.OID, Long.class,
      raw -> exactLong(raw, 0, 0xFFFF_FFFFL),
      v -> {
        if (v != null && (v < 0 || v > 0xFFFF_FFFFL)) throw new IllegalArgumentException("OID out of range: " + v);
        return v;
      });

  private static final Map<Class<?>, ScalarCodec<?>> BY_HOST_TYPE = new HashMap<>();

  static {
    register(BOOL, boolean.class);
    register(CHAR, byte.class);
    register(SMALLINT, short.class);
    register(INT, int.class);
    register(BIGINT, long.class);
    register(REAL, float.class);
    register(DOUBLE, double.class);
    register(VARCHAR, null);
    register(BYTEA, null);
    register(DATE, null);
    register(TIME, null);
    register(TIMESTAMP, null);
    register(TIMESTAMPTZ, null);
    register(UUID_TYPE, null);
    register(JSON_TYPE, null);
    register(MACADDR, null);
  }

  private ScalarCodecs() {}

  /** Codec for a host type, or empty when the type is not supported. */
  public static Optional<ScalarCodec<?>> lookup(Class<?> hostType) {
    if (hostType == null) return Optional.empty();
    ScalarCodec<?> c = BY_HOST_TYPE.get(hostType);
    if (c == null && JsonNode.class.isAssignableFrom(hostType)) c = JSON_TYPE;
    return Optional.ofNullable(c);
  }

  /** Codec for an {@link io.intellixity.pgrecord.annotation.Unsigned} component. */
  public static Optional<ScalarCodec<?>> lookupUnsigned(Class<?> hostType) {
    if (hostType == int.class || hostType == Integer.class) return Optional.of(OID_INT);
    if (hostType == long.class || hostType == Long.class) return Optional.of(OID_LONG);
    return Optional.empty();
  }

  /** Wire type of a runtime value passed as a free-form query argument; null when unknown. */
  public static WireType infer(Object value) {
    if (value == null) return null;
    return lookup(value.getClass()).map(ScalarCodec::wireType).orElse(null);
  }

  private static void register(ScalarCodec<?> codec, Class<?> primitive) {
    BY_HOST_TYPE.put(codec.hostType(), codec);
    if (primitive != null) BY_HOST_TYPE.put(primitive, codec);
  }

  private static <T> ScalarCodec<T> codec(WireType wire, Class<T> host, Function<Object, T> decoder) {
    return new SimpleCodec<>(wire, host, decoder, v -> v);
  }

  private static Boolean toBool(Object raw) {
    if (raw instanceof Boolean b) return b;
    if (raw instanceof String s) {
      String t = s.trim().toLowerCase(java.util.Locale.ROOT);
      if (t.equals("t") || t.equals("true")) return Boolean.TRUE;
      if (t.equals("f") || t.equals("false")) return Boolean.FALSE;
    }
    throw mismatch(raw, Boolean.class);
  }

  private static Byte toByte(Object raw) {
    if (raw instanceof Byte b) return b;
    if (raw instanceof Character c) return (byte) c.charValue();
    if (raw instanceof String s && s.length() == 1) return (byte) s.charAt(0);
    if (raw instanceof Number) return (byte) exactLong(raw, Byte.MIN_VALUE, Byte.MAX_VALUE);
    throw mismatch(raw, Byte.class);
  }

  private static String toText(Object raw) {
    if (raw instanceof String s) return s;
    if (raw instanceof CharSequence cs) return cs.toString();
    throw mismatch(raw, String.class);
  }

  private static Number requireNumber(Object raw) {
    if (raw instanceof Number n) return n;
    throw mismatch(raw, Number.class);
  }

  private static long exactLong(Object raw, long min, long max) {
    long v;
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      v = ((Number) raw).longValue();
    } else if (raw instanceof BigInteger bi) {
      v = bi.longValueExact();
    } else if (raw instanceof BigDecimal bd) {
      v = bd.longValueExact();
    } else {
      throw mismatch(raw, Long.class);
    }
    if (v < min || v > max) throw new IllegalArgumentException("Value " + v + " out of range [" + min + ", " + max + "]");
    return v;
  }

  private static IllegalArgumentException mismatch(Object raw, Class<?> expected) {
    return new IllegalArgumentException("Cannot convert " + raw.getClass().getName() + " to " + expected.getName());
  }

  record SimpleCodec<T>(WireType wireType, Class<T> hostType,
                        Function<Object, T> decoder, Function<T, Object> encoder) implements ScalarCodec<T> {
    @Override
    public T decode(Object raw) {
      if (raw == null) return null;
      return decoder.apply(raw);
    }

    @Override
    public Object encode(T value) {
      return encoder.apply(value);
    }
  }
}
