package io.intellixity.pgrecord.descriptor;

import io.intellixity.pgrecord.mapping.RowDecoder;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Memoizes descriptors and decoders per record type.
 *
 * <p>A failed synthesis is not cached; the next call raises the same error again.</p>
 */
public final class DescriptorRegistry {
  private static final DescriptorRegistry GLOBAL = new DescriptorRegistry();

  private final ConcurrentMap<Class<?>, TypeDescriptor<?>> descriptors = new ConcurrentHashMap<>();
  private final ConcurrentMap<Class<?>, RowDecoder<?>> decoders = new ConcurrentHashMap<>();

  /** Process-wide registry. */
  public static DescriptorRegistry global() {
    return GLOBAL;
  }

  @SuppressWarnings("unchecked")
  public <T> TypeDescriptor<T> descriptor(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return (TypeDescriptor<T>) descriptors.computeIfAbsent(type, DescriptorSynthesizer::synthesize);
  }

  /** Decoder for {@code type}; reuses the descriptor's decoder when one was already built. */
  @SuppressWarnings("unchecked")
  public <T> RowDecoder<T> decoder(Class<T> type) {
    Objects.requireNonNull(type, "type");
    TypeDescriptor<?> d = descriptors.get(type);
    if (d != null) return (RowDecoder<T>) d.decoder();
    return (RowDecoder<T>) decoders.computeIfAbsent(type, DescriptorSynthesizer::synthesizeDecoder);
  }

  /** Synthesizes eagerly so that mapping errors surface at startup. */
  public void register(Class<?>... types) {
    for (Class<?> t : types) descriptor(t);
  }

  public boolean isRegistered(Class<?> type) {
    return descriptors.containsKey(type);
  }
}
