package com.github.simbo1905.lts;

import java.io.IOException;
import java.nio.file.Path;
import lombok.Getter;

/// Thrown when a locale .dat or .dir file cannot be read because its content is malformed.
/// The message names the file and enough context (the raw line, or the hash, offset and size of
/// a location) to find the offending input.
public class InvalidLocaleDataException extends IOException {

  /// The file that failed to parse, or null when reading from a bare stream.
  @Getter private final Path path;

  public InvalidLocaleDataException(Path path, String message) {
    super(message + (path == null ? "" : " in file '" + path + "'"));
    this.path = path;
  }

  public InvalidLocaleDataException(Path path, String message, Throwable cause) {
    super(message + (path == null ? "" : " in file '" + path + "'"), cause);
    this.path = path;
  }
}
