package com.github.simbo1905.lts;

/// Bob Jenkins' lookup2 hash over 16-bit code units, the primary key of every locale entry.
/// See <a href="https://burtleburtle.net/bob/c/lookup2.c">lookup2.c</a>.
///
/// The result is an unsigned 32-bit value carried in an `int`. Use
/// [Integer#toUnsignedString(int)] or [Integer#toUnsignedLong(int)] to print or widen it.
/// Any change to the arithmetic below breaks compatibility with every existing locale file.
public final class MixHash {

  static final int GOLDEN_RATIO = 0x9e3779b9;

  private MixHash() {}

  /// Hashes a variable-length key into a 32-bit value. The empty key hashes to zero.
  ///
  /// @param key the key to hash
  /// @return the unsigned 32-bit hash
  public static int hash(CharSequence key) {
    if (key.length() == 0) {
      return 0;
    }
    return hash(key.toString().toCharArray(), key.length());
  }

  /// Hashes the first `length` chars of a buffer. This is the allocation free path used by
  /// [IdResolver] when it scans the identifier space with one reused buffer.
  ///
  /// @param key buffer holding the key
  /// @param length number of chars of the buffer that make up the key
  /// @return the unsigned 32-bit hash
  public static int hash(char[] key, int length) {
    if (length < 0 || length > key.length) {
      throw new IllegalArgumentException(
          String.format("length %d out of range for buffer of %d chars", length, key.length));
    }
    if (length == 0) {
      return 0;
    }
    int a = GOLDEN_RATIO;
    int b = GOLDEN_RATIO;
    int c = 0;
    int len = length;
    int p = 0;

    while (len >= 12) {
      a += key[p] + (key[p + 1] << 8) + (key[p + 2] << 16) + (key[p + 3] << 24);
      b += key[p + 4] + (key[p + 5] << 8) + (key[p + 6] << 16) + (key[p + 7] << 24);
      c += key[p + 8] + (key[p + 9] << 8) + (key[p + 10] << 16) + (key[p + 11] << 24);

      a -= b; a -= c; a ^= (c >>> 13);
      b -= c; b -= a; b ^= (a << 8);
      c -= a; c -= b; c ^= (b >>> 13);
      a -= b; a -= c; a ^= (c >>> 12);
      b -= c; b -= a; b ^= (a << 16);
      c -= a; c -= b; c ^= (b >>> 5);
      a -= b; a -= c; a ^= (c >>> 3);
      b -= c; b -= a; b ^= (a << 10);
      c -= a; c -= b; c ^= (b >>> 15);

      p += 12;
      len -= 12;
    }

    c += length;

    // the low byte of c is reserved for the length
    if (len >= 11) c += key[p + 10] << 24;
    if (len >= 10) c += key[p + 9] << 16;
    if (len >= 9) c += key[p + 8] << 8;
    if (len >= 8) b += key[p + 7] << 24;
    if (len >= 7) b += key[p + 6] << 16;
    if (len >= 6) b += key[p + 5] << 8;
    if (len >= 5) b += key[p + 4];
    if (len >= 4) a += key[p + 3] << 24;
    if (len >= 3) a += key[p + 2] << 16;
    if (len >= 2) a += key[p + 1] << 8;
    if (len >= 1) a += key[p];

    a -= b; a -= c; a ^= (c >>> 13);
    b -= c; b -= a; b ^= (a << 8);
    c -= a; c -= b; c ^= (b >>> 13);
    a -= b; a -= c; a ^= (c >>> 12);
    b -= c; b -= a; b ^= (a << 16);
    c -= a; c -= b; c ^= (b >>> 5);
    a -= b; a -= c; a ^= (c >>> 3);
    b -= c; b -= a; b ^= (a << 10);
    c -= a; c -= b; c ^= (b >>> 15);

    return c;
  }
}
