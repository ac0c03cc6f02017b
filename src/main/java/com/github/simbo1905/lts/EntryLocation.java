package com.github.simbo1905.lts;

/// Where an entry lives in the .dat file, as listed in the .dir file: `<hash>\t<offset>\t<size>\td`.
///
/// For bucket tags the size stops short of the trailing id or key suffix, which readers recover
/// by scanning on to the end of the line.
///
/// @param hash the unsigned 32-bit hash of the entry
/// @param offset byte offset of the entry in the .dat file
/// @param size declared number of bytes of the entry
public record EntryLocation(int hash, long offset, int size) {

  /// The fixed last field of every location line.
  static final String DATA_FLAG = "d";

  public EntryLocation {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be non-negative, got " + offset);
    }
    if (size < 0) {
      throw new IllegalArgumentException("size must be non-negative, got " + size);
    }
  }

  /// Formats this location as a .dir line without a line terminator.
  public String toLine() {
    return Integer.toUnsignedString(hash) + '\t' + offset + '\t' + size + '\t' + DATA_FLAG;
  }

  /// Parses a .dir location line.
  ///
  /// @throws LocaleFormatException if the line is not a location
  public static EntryLocation parse(String line) {
    final String[] components = line.split("\t", -1);
    if (components.length != 4 || !components[3].equals(DATA_FLAG)) {
      throw new LocaleFormatException("Invalid locale entry location: " + line);
    }
    final long hash = LocaleEntry.parseUnsignedDigits(components[0], 0, components[0].length());
    if (hash < 0) {
      throw new LocaleFormatException("Invalid locale entry location: " + line);
    }
    try {
      final long offset = Long.parseLong(components[1]);
      final int size = Integer.parseInt(components[2]);
      return new EntryLocation((int) hash, offset, size);
    } catch (IllegalArgumentException e) {
      throw new LocaleFormatException("Invalid locale entry location: " + line, e);
    }
  }
}
