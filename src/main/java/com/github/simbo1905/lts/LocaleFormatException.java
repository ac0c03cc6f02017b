package com.github.simbo1905.lts;

/// Thrown when a single line or value from a locale file does not have the expected format: a
/// record line, a location line, a metadata value or an unknown tag literal.
public class LocaleFormatException extends IllegalArgumentException {

  public LocaleFormatException(String message) {
    super(message);
  }

  public LocaleFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
