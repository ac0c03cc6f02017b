package com.github.simbo1905.lts;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Streams the entries of a locale .dat file front to back without its .dir file.
///
/// Entry text may span several lines. A line that does not parse as an entry continues the entry
/// before it, joined by the line break that separated them in the file. An entry is therefore
/// only complete once the line after it has been read, so the reader always holds one parsed
/// entry ahead of the caller.
public class LocaleReader implements Closeable {

  private static final Logger logger = Logger.getLogger(LocaleReader.class.getName());

  private final Path path;
  private final byte[] preamble;
  private final LineReader lines;
  private LocaleEntry pending;
  private boolean closed;

  public LocaleReader(Path dat) throws IOException {
    this(dat, LineReader.DEFAULT_BUFFER_SIZE);
  }

  /// Opens a .dat file, reads its preamble and parses the first entry.
  ///
  /// @throws InvalidLocaleDataException if the preamble is unknown or the first line that is not
  /// blank is not an entry
  public LocaleReader(Path dat, int bufferSize) throws IOException {
    this.path = dat;
    final FileChannel channel = FileChannel.open(dat, StandardOpenOption.READ);
    try {
      this.preamble = LocaleFiles.readPreamble(channel, dat);
      this.lines = new LineReader(channel, UTF_8, bufferSize);
      this.pending = readFirstEntry();
    } catch (IOException | RuntimeException e) {
      try {
        channel.close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    logger.log(
        Level.FINE,
        () -> String.format("opened %s with a %d byte preamble", dat, preamble.length));
  }

  private LocaleEntry readFirstEntry() throws IOException {
    String line = lines.readLine();
    while (line != null && line.isBlank()) {
      line = lines.readLine();
    }
    if (line == null) {
      return null;
    }
    final LocaleEntry entry = LocaleEntry.tryParse(line);
    if (entry == null) {
      throw new InvalidLocaleDataException(path, "Invalid locale entry: " + line);
    }
    return entry;
  }

  /// A copy of the preamble bytes at the start of the file.
  public byte[] getPreamble() {
    return preamble.clone();
  }

  /// Returns true if there is another entry to read.
  public boolean hasEntry() {
    ensureOpen();
    return pending != null;
  }

  /// Reads the next entry.
  ///
  /// @return the entry, or null at the end of the file
  public LocaleEntry readEntry() throws IOException {
    ensureOpen();
    if (pending == null) {
      return null;
    }
    final LocaleEntry entry = pending;
    String line = lines.readLine();
    LocaleEntry next = parseOrEnd(line);
    if (line != null && next == null) {
      final StringBuilder text =
          new StringBuilder(entry.text().length() + line.length() + 80)
              .append(entry.text())
              .append(lines.separatorEnding().separator())
              .append(line);
      while ((line = lines.readLine()) != null && (next = LocaleEntry.tryParse(line)) == null) {
        text.append(lines.separatorEnding().separator()).append(line);
      }
      pending = next;
      logger.log(Level.FINEST, () -> "multi-line entry " + entry.hashString());
      return entry.withText(text.toString());
    }
    pending = next;
    return entry;
  }

  /// Reads every remaining entry.
  ///
  /// @return the entries, empty at the end of the file
  public List<LocaleEntry> readToEnd() throws IOException {
    ensureOpen();
    final List<LocaleEntry> entries = new ArrayList<>();
    LocaleEntry entry;
    while ((entry = readEntry()) != null) {
      entries.add(entry);
    }
    logger.log(Level.FINE, () -> String.format("streamed %d entries from %s", entries.size(), path));
    return entries;
  }

  private static LocaleEntry parseOrEnd(String line) {
    return line == null ? null : LocaleEntry.tryParse(line);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("LocaleReader for " + path + " is closed");
    }
  }

  @Override
  public void close() throws IOException {
    if (!closed) {
      closed = true;
      lines.close();
    }
  }
}
