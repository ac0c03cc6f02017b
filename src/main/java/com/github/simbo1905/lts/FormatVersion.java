package com.github.simbo1905.lts;

import java.util.Arrays;
import java.util.stream.Collectors;

/// A dotted version number with two to four non-negative components such as `1.2.345`, as used
/// by the T4Version, Version and Extraction version metadata fields. It prints back with the
/// same number of components it was parsed with.
///
/// @param components the components, major first
public record FormatVersion(int[] components) {

  public FormatVersion {
    if (components.length < 2 || components.length > 4) {
      throw new IllegalArgumentException(
          "a version has two to four components, got " + components.length);
    }
    for (int component : components) {
      if (component < 0) {
        throw new IllegalArgumentException("version components must be non-negative");
      }
    }
    components = components.clone();
  }

  public int major() {
    return components[0];
  }

  public int minor() {
    return components[1];
  }

  /// The build number, or -1 when absent.
  public int build() {
    return components.length > 2 ? components[2] : -1;
  }

  /// The revision number, or -1 when absent.
  public int revision() {
    return components.length > 3 ? components[3] : -1;
  }

  @Override
  public int[] components() {
    return components.clone();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FormatVersion that && Arrays.equals(components, that.components);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(components);
  }

  @Override
  public String toString() {
    return Arrays.stream(components).mapToObj(Integer::toString).collect(Collectors.joining("."));
  }

  /// Parses a dotted version.
  ///
  /// @throws LocaleFormatException if the text is not a version
  public static FormatVersion parse(String text) {
    final String[] parts = text.split("\\.", -1);
    if (parts.length < 2 || parts.length > 4) {
      throw new LocaleFormatException("Invalid version: '" + text + "'");
    }
    final int[] components = new int[parts.length];
    for (int i = 0; i < parts.length; i++) {
      final long value = LocaleEntry.parseUnsignedDigits(parts[i], 0, parts[i].length());
      if (value < 0 || value > Integer.MAX_VALUE) {
        throw new LocaleFormatException("Invalid version: '" + text + "'");
      }
      components[i] = (int) value;
    }
    return new FormatVersion(components);
  }
}
