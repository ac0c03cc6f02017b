package com.github.simbo1905.lts;

import java.util.Objects;

/// One record of a locale .dat file: `<hash>\t<tag>\t<text>`.
///
/// Equality covers the hash, tag and text only. Identifiers are not part of an entry; the store
/// keeps them in a separate index.
///
/// @param hash the unsigned 32-bit hash
/// @param tag the tag
/// @param text the text, which may contain line breaks and, for bucket tags, ends with the suffix
public record LocaleEntry(int hash, Tag tag, String text) {

  /// Number of chars between the end of the hash and the start of the text: tab, tag, tab.
  static final int SKIP_TAG_CHARS = Tag.LENGTH + 2;

  public LocaleEntry {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(text, "text");
  }

  /// Returns a copy of this entry with different text.
  public LocaleEntry withText(String newText) {
    return new LocaleEntry(hash, tag, newText);
  }

  /// Returns a copy of this entry with a different hash.
  public LocaleEntry withHash(int newHash) {
    return new LocaleEntry(newHash, tag, text);
  }

  /// The hash as it appears in the files.
  public String hashString() {
    return Integer.toUnsignedString(hash);
  }

  /// Formats this entry as a .dat line without a line terminator.
  public String toLine() {
    return hashString() + '\t' + tag.literal() + '\t' + text;
  }

  /// Parses a .dat line into an entry.
  ///
  /// @param line a line of the form `<hash>\t<tag>\t<text>`
  /// @return the parsed entry
  /// @throws LocaleFormatException if the line is not an entry
  public static LocaleEntry parse(String line) {
    final LocaleEntry entry = tryParse(line);
    if (entry == null) {
      throw new LocaleFormatException("Invalid locale entry: " + line);
    }
    return entry;
  }

  /// Parses a .dat line, returning null when the line is not an entry. The streaming reader uses
  /// this to tell a new entry from a continuation line of a multi-line entry.
  static LocaleEntry tryParse(String line) {
    if (line == null) {
      return null;
    }
    final int hashIndex = line.indexOf('\t');
    if (hashIndex <= 0 || hashIndex + SKIP_TAG_CHARS > line.length()) {
      return null;
    }
    final long hash = parseUnsignedDigits(line, 0, hashIndex);
    if (hash < 0) {
      return null;
    }
    final Tag tag = Tag.tryParse(line.subSequence(hashIndex + 1, hashIndex + 1 + Tag.LENGTH));
    if (tag == null || line.charAt(hashIndex + SKIP_TAG_CHARS - 1) != '\t') {
      return null;
    }
    return new LocaleEntry((int) hash, tag, line.substring(hashIndex + SKIP_TAG_CHARS));
  }

  /// Parses a run of ASCII digits as an unsigned 32-bit value.
  ///
  /// @return the value, or -1 if the run is empty, holds a non digit, or overflows 32 bits
  static long parseUnsignedDigits(CharSequence s, int from, int to) {
    if (to <= from || to - from > 10) {
      return -1;
    }
    long value = 0;
    for (int i = from; i < to; i++) {
      final char ch = s.charAt(i);
      if (ch < '0' || ch > '9') {
        return -1;
      }
      value = value * 10 + (ch - '0');
    }
    return value > 0xFFFFFFFFL ? -1 : value;
  }
}
