package com.github.simbo1905.lts;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.SneakyThrows;

/// Reads and writes locale file pairs: a .dat file of entries and a .dir file holding the
/// metadata header and the location of every entry in the .dat file.
///
/// Every method opens and closes its own files.
public final class LocaleFiles {

  private static final Logger logger = Logger.getLogger(LocaleFiles.class.getName());

  /// The UTF-8 byte order mark.
  static final byte[] UTF8_PREAMBLE = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  /// The UTF-8 byte order mark encoded to UTF-8 a second time, found at the start of some files.
  static final byte[] DOUBLE_ENCODED_PREAMBLE = {
    (byte) 0xC3, (byte) 0xAF, (byte) 0xC2, (byte) 0xBB, (byte) 0xC2, (byte) 0xBF
  };

  static final int MAX_PREAMBLE_SIZE = DOUBLE_ENCODED_PREAMBLE.length;

  /// Bytes between the end of a bucket entry's text and the last tab: `\t0017` or `\t0006`.
  static final int BUCKET_PRE_KEY_BYTES = 5;

  private static final Pattern METADATA_LINE = Pattern.compile("^## (.*?):\t(.*)$");

  private LocaleFiles() {}

  /// The metadata and entry locations of a .dir file.
  record Directory(Metadata metadata, List<EntryLocation> locations) {}

  /// Reads every entry of a .dat file front to back without a .dir file.
  public static List<LocaleEntry> readEntries(Path dat) throws IOException {
    try (LocaleReader reader = new LocaleReader(dat)) {
      return reader.readToEnd();
    }
  }

  /// Reads the entries listed in a .dir file from its .dat file, in .dir order.
  public static List<LocaleEntry> readEntries(Path dat, Path dir) throws IOException {
    return readEntries(dat, readEntryLocations(dir));
  }

  /// Reads the entries at the given locations of a .dat file, in the given order.
  ///
  /// @throws InvalidLocaleDataException if an entry cannot be read at its location
  public static List<LocaleEntry> readEntries(Path dat, List<EntryLocation> locations)
      throws IOException {
    return readEntries(dat, locations, LineReader.DEFAULT_BUFFER_SIZE);
  }

  static List<LocaleEntry> readEntries(Path dat, List<EntryLocation> locations, int bufferSize)
      throws IOException {
    final List<LocaleEntry> entries = new ArrayList<>(locations.size());
    try (LineReader reader =
        new LineReader(FileChannel.open(dat, StandardOpenOption.READ), UTF_8, bufferSize)) {
      for (EntryLocation location : locations) {
        entries.add(readEntry(reader, dat, location));
      }
    }
    logger.log(
        Level.FINE, () -> String.format("read %d located entries from %s", entries.size(), dat));
    return entries;
  }

  private static LocaleEntry readEntry(LineReader reader, Path dat, EntryLocation location)
      throws InvalidLocaleDataException {
    try {
      if (location.size() > reader.size() - location.offset()) {
        throw new LocaleFormatException(
            String.format("Location runs past the end of the %d byte file", reader.size()));
      }
      reader.seek(location.offset());
      final String head = reader.readBytes(location.size());
      final String prefix = Integer.toUnsignedString(location.hash()) + '\t';
      final int textStart = prefix.length() + Tag.LENGTH + 1;
      if (!head.startsWith(prefix) || head.length() < textStart) {
        throw new LocaleFormatException("Location does not start an entry: " + head);
      }
      final Tag tag = Tag.parse(head.subSequence(prefix.length(), prefix.length() + Tag.LENGTH));
      if (head.charAt(textStart - 1) != '\t') {
        throw new LocaleFormatException("Missing tab after tag: " + head);
      }
      String text = head.substring(textStart);
      if (tag.isBucket()) {
        // the declared size stops short of the suffix
        text = text + reader.readRawLine();
      }
      logger.log(Level.FINEST, () -> String.format("read %s at %d", prefix.trim(), location.offset()));
      return new LocaleEntry(location.hash(), tag, text);
    } catch (IOException | LocaleFormatException e) {
      throw new InvalidLocaleDataException(
          dat,
          String.format(
              "Failed to read locale entry at {hash=%s, offset=%d, size=%d}",
              Integer.toUnsignedString(location.hash()), location.offset(), location.size()),
          e);
    }
  }

  /// Reads the preamble at the start of a .dat file.
  ///
  /// @return a copy of the 3 or 6 preamble bytes
  /// @throws InvalidLocaleDataException if the file does not start with a known preamble
  public static byte[] readPreamble(Path dat) throws IOException {
    try (FileChannel channel = FileChannel.open(dat, StandardOpenOption.READ)) {
      return readPreamble(channel, dat);
    }
  }

  /// Reads the preamble and leaves the channel positioned just after it.
  static byte[] readPreamble(SeekableByteChannel channel, Path path) throws IOException {
    final ByteBuffer buffer = ByteBuffer.allocate(MAX_PREAMBLE_SIZE);
    int read = 0;
    while (buffer.hasRemaining() && read >= 0) {
      read = channel.read(buffer);
    }
    final byte[] head = Arrays.copyOf(buffer.array(), buffer.position());
    final byte[] preamble;
    if (startsWith(head, UTF8_PREAMBLE)) {
      preamble = UTF8_PREAMBLE;
    } else if (startsWith(head, DOUBLE_ENCODED_PREAMBLE)) {
      preamble = DOUBLE_ENCODED_PREAMBLE;
    } else {
      throw new InvalidLocaleDataException(path, "Unrecognized preamble bytes");
    }
    channel.position(preamble.length);
    logger.log(Level.FINEST, () -> String.format("%d byte preamble in %s", preamble.length, path));
    return preamble.clone();
  }

  private static boolean startsWith(byte[] bytes, byte[] prefix) {
    return bytes.length >= prefix.length
        && Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
  }

  /// Reads the metadata header of a .dir file.
  ///
  /// @throws InvalidLocaleDataException if a metadata line cannot be parsed
  public static Metadata readMetadata(Path dir) throws IOException {
    return readDirectory(dir, false).metadata();
  }

  /// Reads the entry locations that follow the metadata header of a .dir file.
  ///
  /// @throws InvalidLocaleDataException if a location line cannot be parsed
  public static List<EntryLocation> readEntryLocations(Path dir) throws IOException {
    return readDirectory(dir, true).locations();
  }

  static Directory readDirectory(Path dir, boolean withLocations) throws IOException {
    final Metadata metadata = new Metadata();
    final List<EntryLocation> locations = new ArrayList<>();
    try (LineReader reader =
        new LineReader(FileChannel.open(dir, StandardOpenOption.READ), UTF_8)) {
      String line = reader.readLine();
      for (; line != null && line.startsWith(Metadata.HEADER_PREFIX); line = reader.readLine()) {
        if (line.equals(Metadata.HEADER_PREFIX)) {
          // marker around an extracted header
          continue;
        }
        final Matcher matcher = METADATA_LINE.matcher(line);
        if (!matcher.matches()) {
          throw new InvalidLocaleDataException(dir, "Invalid metadata line: " + line);
        }
        try {
          metadata.assign(matcher.group(1), matcher.group(2));
        } catch (LocaleFormatException e) {
          throw new InvalidLocaleDataException(dir, "Invalid metadata line: " + line, e);
        }
      }
      for (; withLocations && line != null; line = reader.readLine()) {
        try {
          locations.add(EntryLocation.parse(line));
        } catch (LocaleFormatException e) {
          throw new InvalidLocaleDataException(dir, "Invalid location line: " + line, e);
        }
      }
    }
    logger.log(
        Level.FINE,
        () -> String.format("read metadata and %d locations from %s", locations.size(), dir));
    return new Directory(metadata, locations);
  }

  /// Writes a locale file pair and returns the metadata and locations written.
  ///
  /// Both files are written to temporary siblings first and then moved into place, so a failure
  /// leaves any existing files untouched. The metadata is recomputed for the new .dat file.
  ///
  /// @param dat the .dat file to write
  /// @param dir the .dir file to write
  /// @param preamble the bytes to write at the start of the .dat file
  /// @param metadata the metadata to update and write
  /// @param entries the entries in the order to write them
  /// @param lineSeparator the terminator written after every line of both files
  static Directory write(
      Path dat,
      Path dir,
      byte[] preamble,
      Metadata metadata,
      List<LocaleEntry> entries,
      String lineSeparator)
      throws IOException {
    final byte[] separator = lineSeparator.getBytes(UTF_8);
    final List<EntryLocation> locations = new ArrayList<>(entries.size());
    final Path tempDat = tempSibling(dat);
    Path tempDir = null;
    try {
      final MessageDigest md5 = md5();
      try (OutputStream out =
          new DigestOutputStream(
              new BufferedOutputStream(Files.newOutputStream(tempDat)), md5)) {
        out.write(preamble);
        long offset = preamble.length;
        for (LocaleEntry entry : entries) {
          final byte[] line = entry.toLine().getBytes(UTF_8);
          out.write(line);
          out.write(separator);
          final int size = entry.tag().isBucket() ? bucketSize(line) : line.length;
          locations.add(new EntryLocation(entry.hash(), offset, size));
          offset += line.length + separator.length;
        }
      }
      final String checksum = HexFormat.of().withUpperCase().formatHex(md5.digest());
      final Metadata updated =
          metadata.update(dat.getFileName().toString(), checksum, entries);

      tempDir = tempSibling(dir);
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tempDir))) {
        out.write(updated.toHeader(lineSeparator).getBytes(UTF_8));
        for (EntryLocation location : locations) {
          out.write(location.toLine().getBytes(UTF_8));
          out.write(separator);
        }
      }
      moveIntoPlace(tempDat, dat);
      moveIntoPlace(tempDir, dir);
      logger.log(
          Level.FINE,
          () -> String.format("wrote %d entries to %s and %s", entries.size(), dat, dir));
      return new Directory(updated, locations);
    } catch (IOException | RuntimeException e) {
      deleteQuietly(tempDat, e);
      if (tempDir != null) {
        deleteQuietly(tempDir, e);
      }
      throw e;
    }
  }

  /// The .dir size of a bucket entry: the line's bytes up to the `\t0017` or `\t0006` before its
  /// key.
  ///
  /// @throws LocaleFormatException if the line is too short to hold a key suffix
  static int bucketSize(byte[] line) {
    int firstTab = -1;
    int lastTab = -1;
    for (int i = 0; i < line.length; i++) {
      if (line[i] == '\t') {
        if (firstTab < 0) {
          firstTab = i;
        }
        lastTab = i;
      }
    }
    final int size = lastTab - BUCKET_PRE_KEY_BYTES;
    if (firstTab < 0 || size < firstTab + LocaleEntry.SKIP_TAG_CHARS) {
      throw new LocaleFormatException(
          "Invalid locale entry: {" + new String(line, UTF_8) + "}");
    }
    return size;
  }

  /// Computes the upper case hex MD5 checksum of a file.
  public static String md5Checksum(Path file) throws IOException {
    final MessageDigest md5 = md5();
    try (DigestInputStream in = new DigestInputStream(Files.newInputStream(file), md5)) {
      in.transferTo(OutputStream.nullOutputStream());
    }
    return HexFormat.of().withUpperCase().formatHex(md5.digest());
  }

  /// Number of bytes in the UTF-8 encoding of a string.
  static int utf8Length(CharSequence text) {
    int length = 0;
    for (int i = 0; i < text.length(); i++) {
      final char ch = text.charAt(i);
      if (ch < 0x80) {
        length += 1;
      } else if (ch < 0x800) {
        length += 2;
      } else if (Character.isHighSurrogate(ch)
          && i + 1 < text.length()
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        length += 4;
        i++;
      } else if (Character.isSurrogate(ch)) {
        // lone surrogates encode as '?'
        length += 1;
      } else {
        length += 3;
      }
    }
    return length;
  }

  /// Opens a locale file pair, adds one entry per string, and writes the pair back.
  ///
  /// @return the store for the rewritten files
  public static LocaleRecordStore addEntries(Path dat, Path dir, Collection<String> strings)
      throws IOException {
    final LocaleRecordStore store = new LocaleRecordStoreBuilder().datPath(dat).dirPath(dir).open();
    store.addAll(strings);
    return store.write();
  }

  /// Opens a locale file pair, removes the matching entries, and writes the pair back.
  ///
  /// @return the store for the rewritten files
  public static LocaleRecordStore removeEntries(
      Path dat, Path dir, Predicate<LocaleEntry> predicate) throws IOException {
    final LocaleRecordStore store = new LocaleRecordStoreBuilder().datPath(dat).dirPath(dir).open();
    store.remove(predicate);
    return store.write();
  }

  @SneakyThrows(NoSuchAlgorithmException.class)
  private static MessageDigest md5() {
    return MessageDigest.getInstance("MD5");
  }

  private static Path tempSibling(Path target) throws IOException {
    final Path absolute = target.toAbsolutePath();
    return Files.createTempFile(absolute.getParent(), absolute.getFileName() + ".", ".tmp");
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      logger.log(Level.FINE, () -> "atomic move not supported, moving " + source + " to " + target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp, Exception cause) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Failed to delete temporary file " + temp, e);
    }
  }
}
