package io.intellixity.pgrecord.types;

import java.util.Locale;

/** 48-bit MAC address, the host type of {@link WireType#MACADDR} columns. */
public record MacAddress(long value) {
  private static final long MASK = 0xFFFF_FFFF_FFFFL;

  public MacAddress {
    if ((value & ~MASK) != 0) throw new IllegalArgumentException("MAC address exceeds 48 bits: " + value);
  }

  /** Parses {@code 08:00:2b:01:02:03}, {@code 08-00-2b-01-02-03} or {@code 08002b010203}. */
  public static MacAddress parse(String text) {
    if (text == null) throw new IllegalArgumentException("MAC address text is required");
    String hex = text.trim().replace(":", "").replace("-", "").replace(".", "");
    if (hex.length() != 12) throw new IllegalArgumentException("Invalid MAC address: " + text);
    try {
      return new MacAddress(Long.parseUnsignedLong(hex, 16));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid MAC address: " + text, e);
    }
  }

  public byte[] octets() {
    byte[] out = new byte[6];
    for (int i = 0; i < 6; i++) out[i] = (byte) (value >>> (40 - 8 * i));
    return out;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(17);
    for (byte b : octets()) {
      if (sb.length() > 0) sb.append(':');
      sb.append(String.format(Locale.ROOT, "%02x", b & 0xFF));
    }
    return sb.toString();
  }
}
