package com.github.simbo1905.lts;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for opening a [LocaleRecordStore] from a locale file pair.
///
/// Example usage:
/// <pre>
/// LocaleRecordStore store = new LocaleRecordStoreBuilder()
///     .datPath("/path/to/en_us_data.dat")
///     .dirPath("/path/to/en_us_data.dir")
///     .parseMode(ParseMode.LENIENT)
///     .lineSeparator(LineEnding.CRLF)
///     .open();
/// </pre>
///
/// Without a .dir path the .dat file is streamed on its own, metadata is derived from the
/// entries, and [LocaleRecordStore#write()] writes the .dir file next to the .dat file.
public class LocaleRecordStoreBuilder {

  private static final Logger logger = Logger.getLogger(LocaleRecordStoreBuilder.class.getName());

  static final String DIR_EXTENSION = ".dir";

  private Path datPath;
  private Path dirPath;
  private ParseMode parseMode;
  private String lineSeparator;
  private int readBufferSize = LineReader.DEFAULT_BUFFER_SIZE;

  /// Sets the .dat file to open. Required.
  ///
  /// @param path the path to the .dat file
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder datPath(Path path) {
    this.datPath = Objects.requireNonNull(path, "path");
    return this;
  }

  /// Sets the .dat file to open using a string, which is converted to a normalized path.
  ///
  /// @param path the path string to the .dat file
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder datPath(String path) {
    return datPath(Paths.get(path).normalize());
  }

  /// Sets the .dir file to read locations and metadata from.
  ///
  /// @param path the path to the .dir file
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder dirPath(Path path) {
    this.dirPath = Objects.requireNonNull(path, "path");
    return this;
  }

  /// Sets the .dir file using a string, which is converted to a normalized path.
  ///
  /// @param path the path string to the .dir file
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder dirPath(String path) {
    return dirPath(Paths.get(path).normalize());
  }

  /// Sets how the pair is opened. Defaults to the `PARSE_MODE` setting, else [ParseMode#NORMAL].
  ///
  /// @param parseMode the parse mode
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder parseMode(ParseMode parseMode) {
    this.parseMode = Objects.requireNonNull(parseMode, "parseMode");
    return this;
  }

  /// Sets the terminator written after every line. Defaults to the `LINE_SEPARATOR_STYLE`
  /// setting, else the platform line separator.
  ///
  /// @param lineEnding the line terminator to write
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder lineSeparator(LineEnding lineEnding) {
    this.lineSeparator = Objects.requireNonNull(lineEnding, "lineEnding").separator();
    return this;
  }

  /// Sets the number of bytes read from a file at a time.
  ///
  /// @param bytes the buffer size, at least 8
  /// @return this builder for chaining
  public LocaleRecordStoreBuilder readBufferSize(int bytes) {
    if (bytes < LineReader.MIN_BUFFER_SIZE) {
      throw new IllegalArgumentException(
          String.format(
              "readBufferSize must be at least %d, got %d", LineReader.MIN_BUFFER_SIZE, bytes));
    }
    this.readBufferSize = bytes;
    return this;
  }

  /// Opens the store, reading every entry into memory.
  ///
  /// @return a new LocaleRecordStore instance
  /// @throws InvalidLocaleDataException if the files are malformed and the parse mode does not
  /// recover
  /// @throws IOException if the files cannot be read
  public LocaleRecordStore open() throws IOException {
    if (datPath == null) {
      throw new IllegalStateException("datPath must be specified");
    }
    final ParseMode mode = parseMode != null ? parseMode : LocaleRecordStore.getParseModeOrDefault();
    final String separator =
        lineSeparator != null ? lineSeparator : LocaleRecordStore.getLineSeparatorOrDefault();
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "opening dat=%s dir=%s mode=%s separator=%s",
                datPath, dirPath, mode, LineEnding.of(separator)));

    final byte[] preamble = LocaleFiles.readPreamble(datPath);
    if (dirPath == null) {
      final List<LocaleEntry> entries = stream();
      final Metadata metadata = Metadata.create(datPath, entries);
      return create(siblingDir(datPath), preamble, metadata, List.of(), entries, separator);
    }

    final LocaleFiles.Directory directory;
    try {
      directory = LocaleFiles.readDirectory(dirPath, true);
    } catch (IOException | RuntimeException e) {
      if (mode != ParseMode.LENIENT) {
        throw e;
      }
      logger.log(
          Level.WARNING,
          String.format("Failed to read %s, streaming %s without it", dirPath, datPath),
          e);
      final List<LocaleEntry> entries = stream();
      return create(
          dirPath, preamble, Metadata.create(datPath, entries), List.of(), entries, separator);
    }

    final Metadata metadata = directory.metadata();
    final List<EntryLocation> locations = directory.locations();
    if (mode == ParseMode.NORMAL
        && metadata.isForeignIdScheme()
        && metadata.getLocale() == LocaleCode.ZH_CN) {
      logger.log(Level.FINE, () -> "streaming simplified chinese foreign scheme file " + datPath);
      return create(dirPath, preamble, metadata, locations, stream(), separator);
    }
    try {
      return create(
          dirPath,
          preamble,
          metadata,
          locations,
          LocaleFiles.readEntries(datPath, locations, readBufferSize),
          separator);
    } catch (IOException | RuntimeException e) {
      if (mode != ParseMode.LENIENT) {
        throw e;
      }
      logger.log(
          Level.WARNING,
          String.format("Failed to read %s at the locations in %s, streaming it", datPath, dirPath),
          e);
      return create(dirPath, preamble, metadata, locations, stream(), separator);
    }
  }

  private List<LocaleEntry> stream() throws IOException {
    try (LocaleReader reader = new LocaleReader(datPath, readBufferSize)) {
      return reader.readToEnd();
    }
  }

  private LocaleRecordStore create(
      Path dir,
      byte[] preamble,
      Metadata metadata,
      List<EntryLocation> locations,
      List<LocaleEntry> entries,
      String separator)
      throws InvalidLocaleDataException {
    try {
      return new LocaleRecordStore(
          datPath, dir, preamble, metadata, locations, entries, separator);
    } catch (LocaleFormatException e) {
      throw new InvalidLocaleDataException(datPath, e.getMessage(), e);
    }
  }

  /// The .dat path with its extension changed to `.dir`.
  static Path siblingDir(Path dat) {
    final String name = dat.getFileName().toString();
    final int dot = name.lastIndexOf('.');
    final String stem = dot > 0 ? name.substring(0, dot) : name;
    return dat.resolveSibling(stem + DIR_EXTENSION);
  }
}
