package com.github.simbo1905.lts;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/// Syntax rules for metadata values that are kept as strings: dates, the database URI and the
/// MD5 checksum.
final class MetadataValidator {

  /// Dates look like `Thu Mar 13 10:10:13 PDT 2014`.
  static final int DATE_LENGTH = 28;
  static final int ZONE_START = 20;
  static final int ZONE_END = 23;
  static final int CHECKSUM_LENGTH = 32;

  private MetadataValidator() {}

  /// Returns the formatter for a locale date with the given literal time zone abbreviation.
  static DateTimeFormatter dateFormat(String zone) {
    return DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss '" + zone + "' yyyy", Locale.ENGLISH);
  }

  /// Returns the three letter zone of a locale date.
  static String timeZoneOf(String date) {
    if (date.length() != DATE_LENGTH) {
      throw new LocaleFormatException("Invalid metadata date: " + date);
    }
    return date.substring(ZONE_START, ZONE_END);
  }

  /// Parses a locale date, checking the day of week agrees with the date.
  ///
  /// @throws LocaleFormatException if the value is not a locale date
  static LocalDateTime parseDate(String value) {
    final String zone = timeZoneOf(value);
    for (int i = 0; i < zone.length(); i++) {
      if (!Character.isUpperCase(zone.charAt(i))) {
        throw new LocaleFormatException("Invalid metadata date zone '" + zone + "': " + value);
      }
    }
    try {
      return LocalDateTime.parse(value, dateFormat(zone));
    } catch (DateTimeParseException e) {
      throw new LocaleFormatException("Invalid metadata date: " + value, e);
    }
  }

  static String validateDate(String value) {
    parseDate(value);
    return value;
  }

  static String validateDatabase(String value) {
    try {
      if (new URI(value).isAbsolute()) {
        return value;
      }
    } catch (URISyntaxException e) {
      throw new LocaleFormatException("Invalid metadata database URI: " + value, e);
    }
    throw new LocaleFormatException("Metadata database URI is not absolute: " + value);
  }

  static String validateChecksum(String value) {
    if (value.length() != CHECKSUM_LENGTH) {
      throw new LocaleFormatException("Invalid metadata checksum: " + value);
    }
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (!(c >= '0' && c <= '9' || c >= 'A' && c <= 'F')) {
        throw new LocaleFormatException("Invalid metadata checksum: " + value);
      }
    }
    return value;
  }
}
