package com.github.simbo1905.lts;

import java.nio.charset.StandardCharsets;

/// The three line terminator conventions found in locale files.
public enum LineEnding {
  /// `\r\n` (Windows)
  CRLF("\r\n"),
  /// `\n` (Unix)
  LF("\n"),
  /// `\r` (classic Mac)
  CR("\r");

  private final String separator;

  LineEnding(String separator) {
    this.separator = separator;
  }

  public String separator() {
    return separator;
  }

  /// Returns the number of bytes the terminator takes in UTF-8.
  public int byteLength() {
    return separator.getBytes(StandardCharsets.UTF_8).length;
  }

  /// Returns the convention whose separator equals the given string.
  ///
  /// @throws IllegalArgumentException if the string is not one of `\r\n`, `\n` or `\r`
  public static LineEnding of(String separator) {
    for (LineEnding ending : values()) {
      if (ending.separator.equals(separator)) {
        return ending;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported line separator: " + separator.chars().mapToObj(c -> String.format("0x%02X", c)).toList());
  }
}
