package com.github.simbo1905.lts;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// An editable view of a locale file pair.
///
/// The store keeps the entries as read from disk and a hash index of the entries as edited. The
/// hash index is ordered by unsigned hash. Single valued tags hold one entry per hash, bucket tags
/// may hold several. An identifier index is built from the hash index the first time it is
/// needed, which costs a scan of the identifier space, and is kept in step with later edits.
///
/// Edits stay in memory until [#write()], which returns a new store for the written files. This
/// store stays usable afterwards but no longer describes what is on disk.
///
/// Not thread safe.
public class LocaleRecordStore {

  private static final Logger logger = Logger.getLogger(LocaleRecordStore.class.getName());

  /// Default open mode when neither the builder nor the environment names one.
  public static final ParseMode DEFAULT_PARSE_MODE = ParseMode.NORMAL;

  @Getter private final Path datPath;
  @Getter private final Path dirPath;
  private final byte[] preamble;
  private final Metadata metadata;

  /// Locations read from or written to the .dir file; empty when the .dat file was streamed.
  @Getter private final List<EntryLocation> locations;

  /// Entries as read from or written to disk, before any edits.
  @Getter private final List<LocaleEntry> entries;

  /// The terminator written after every line.
  @Getter private final String lineSeparator;

  private final TreeMap<Integer, List<LocaleEntry>> hashToEntry;
  private SortedMap<Integer, LocaleEntry> idToEntry;
  private IdResolver.UnusedIds unusedIds;

  LocaleRecordStore(
      Path datPath,
      Path dirPath,
      byte[] preamble,
      Metadata metadata,
      List<EntryLocation> locations,
      List<LocaleEntry> entries,
      String lineSeparator) {
    this.datPath = Objects.requireNonNull(datPath, "datPath");
    this.dirPath = Objects.requireNonNull(dirPath, "dirPath");
    this.preamble = preamble.clone();
    this.metadata = new Metadata(metadata);
    this.locations = List.copyOf(locations);
    this.entries = List.copyOf(entries);
    this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
    this.hashToEntry = indexHashes(this.entries);
  }

  /// Groups entries by hash. Entries with bucket tags may share a hash with each other, any
  /// other entry must have a hash of its own whatever order the entries come in.
  ///
  /// @throws LocaleFormatException if two entries share a hash and either is not a bucket
  static TreeMap<Integer, List<LocaleEntry>> indexHashes(Collection<LocaleEntry> entries) {
    final TreeMap<Integer, List<LocaleEntry>> index = new TreeMap<>(Integer::compareUnsigned);
    for (LocaleEntry entry : entries) {
      final List<LocaleEntry> bucket = index.get(entry.hash());
      if (bucket == null) {
        index.put(entry.hash(), new ArrayList<>(List.of(entry)));
      } else if (entry.tag().isBucket() && bucket.get(0).tag().isBucket()) {
        bucket.add(entry);
      } else {
        throw new LocaleFormatException("Duplicate locale hash: " + entry.toLine());
      }
    }
    return index;
  }

  /// A copy of the preamble bytes at the start of the .dat file.
  public byte[] getPreamble() {
    return preamble.clone();
  }

  /// A copy of the metadata read from or written to the .dir file.
  public Metadata getMetadata() {
    return new Metadata(metadata);
  }

  /// Returns true unless the files use the foreign identifier scheme.
  public boolean canAddEntries() {
    return !metadata.isForeignIdScheme();
  }

  /// The entries as edited, ordered by unsigned hash.
  public List<LocaleEntry> storedEntries() {
    final List<LocaleEntry> stored = new ArrayList<>(size());
    hashToEntry.values().forEach(stored::addAll);
    return stored;
  }

  /// The entries with the given hash, empty if there are none.
  public List<LocaleEntry> get(int hash) {
    final List<LocaleEntry> bucket = hashToEntry.get(hash);
    return bucket == null ? List.of() : List.copyOf(bucket);
  }

  /// Number of entries as edited.
  public int size() {
    return hashToEntry.values().stream().mapToInt(List::size).sum();
  }

  /// A snapshot of the identifier index, ordered by identifier.
  ///
  /// The first call scans the identifier space.
  ///
  /// @throws UnsupportedOperationException if the files use the foreign identifier scheme
  public SortedMap<Integer, LocaleEntry> idToEntry() {
    return Collections.unmodifiableSortedMap(new TreeMap<>(idIndex()));
  }

  private SortedMap<Integer, LocaleEntry> idIndex() {
    if (!canAddEntries()) {
      throw new UnsupportedOperationException(
          "Cannot create IDs for a locale file of the foreign identifier scheme: " + datPath);
    }
    if (idToEntry == null) {
      logger.log(Level.FINE, () -> String.format("building id index for %s", datPath));
      idToEntry = IdResolver.indexIds(storedEntries());
    }
    return idToEntry;
  }

  private IdResolver.UnusedIds unusedIds() {
    if (unusedIds == null) {
      final SortedMap<Integer, LocaleEntry> index = idIndex();
      unusedIds = new IdResolver.UnusedIds(index::containsKey);
    }
    return unusedIds;
  }

  /// Adds an entry under the next unused identifier whose hash is not taken.
  ///
  /// @return the identifier of the new entry
  /// @throws UnsupportedOperationException if the files use the foreign identifier scheme
  /// @throws IdSpaceExhaustedException if no identifiers remain
  public int add(String text) {
    Objects.requireNonNull(text, "text");
    final IdResolver.UnusedIds ids = unusedIds();
    LocaleEntry entry = IdResolver.generateEntry(ids.next(), text);
    while (hashToEntry.containsKey(entry.hash())) {
      logger.log(Level.FINEST, "hash collision on id {0}", ids.current());
      entry = entry.withHash(IdResolver.hashOf(ids.next()));
    }
    hashToEntry.put(entry.hash(), new ArrayList<>(List.of(entry)));
    final int id = ids.current();
    idIndex().put(id, entry);
    final LocaleEntry added = entry;
    logger.log(Level.FINE, () -> String.format("added id %d as %s", id, added.hashString()));
    return id;
  }

  /// Adds one entry per string, in order.
  ///
  /// @return the identifiers of the new entries
  public List<Integer> addAll(Collection<String> texts) {
    Objects.requireNonNull(texts, "texts");
    final List<Integer> ids = new ArrayList<>(texts.size());
    for (String text : texts) {
      ids.add(add(text));
    }
    return ids;
  }

  /// Replaces the text of every matching entry.
  ///
  /// @return the number of entries changed
  public int replace(Predicate<LocaleEntry> matcher, String text) {
    Objects.requireNonNull(text, "text");
    return replace(matcher, old -> text);
  }

  /// Replaces the text of every matching entry with a function of its old text. Within a bucket
  /// only the entries equal to a match change.
  ///
  /// @return the number of entries changed
  public int replace(Predicate<LocaleEntry> matcher, UnaryOperator<String> replacement) {
    Objects.requireNonNull(replacement, "replacement");
    final Map<LocaleEntry, LocaleEntry> updates = new LinkedHashMap<>();
    for (LocaleEntry entry : matching(matcher)) {
      updates.put(entry, entry.withText(replacement.apply(entry.text())));
    }
    int replaced = 0;
    for (Map.Entry<LocaleEntry, LocaleEntry> update : updates.entrySet()) {
      final List<LocaleEntry> bucket = hashToEntry.get(update.getKey().hash());
      for (int i = 0; i < bucket.size(); i++) {
        if (bucket.get(i).equals(update.getKey())) {
          bucket.set(i, update.getValue());
          replaced++;
        }
      }
    }
    if (idToEntry != null) {
      idToEntry.replaceAll((id, entry) -> updates.getOrDefault(entry, entry));
    }
    final int count = replaced;
    logger.log(Level.FINE, () -> String.format("replaced text of %d entries", count));
    return replaced;
  }

  /// Removes every matching entry. Within a bucket only the entries equal to a match go, and the
  /// hash goes with its last entry.
  ///
  /// @return the number of entries removed
  public int remove(Predicate<LocaleEntry> matcher) {
    final Set<LocaleEntry> matched = matching(matcher);
    int removed = 0;
    for (LocaleEntry entry : matched) {
      if (entry.tag().isBucket()) {
        final List<LocaleEntry> bucket = hashToEntry.get(entry.hash());
        final int before = bucket.size();
        bucket.removeIf(entry::equals);
        removed += before - bucket.size();
        if (bucket.isEmpty()) {
          hashToEntry.remove(entry.hash());
        }
      } else {
        hashToEntry.remove(entry.hash());
        removed++;
      }
    }
    if (idToEntry != null) {
      idToEntry.values().removeIf(matched::contains);
    }
    final int count = removed;
    logger.log(Level.FINE, () -> String.format("removed %d entries", count));
    return removed;
  }

  private Set<LocaleEntry> matching(Predicate<LocaleEntry> matcher) {
    Objects.requireNonNull(matcher, "matcher");
    final Set<LocaleEntry> matched = new LinkedHashSet<>();
    for (LocaleEntry entry : storedEntries()) {
      if (matcher.test(entry)) {
        matched.add(entry);
      }
    }
    return matched;
  }

  /// Writes the stored entries back to the files this store was opened from.
  ///
  /// @return a store for the written files
  public LocaleRecordStore write() throws IOException {
    return write(datPath, dirPath);
  }

  /// Writes the stored entries, ordered by hash, to the given files. The metadata count,
  /// checksum and text length are recomputed.
  ///
  /// @return a store for the written files
  public LocaleRecordStore write(Path dat, Path dir) throws IOException {
    Objects.requireNonNull(dat, "dat");
    Objects.requireNonNull(dir, "dir");
    final List<LocaleEntry> stored = storedEntries();
    final LocaleFiles.Directory written =
        LocaleFiles.write(dat, dir, preamble, metadata, stored, lineSeparator);
    return new LocaleRecordStore(
        dat, dir, preamble, written.metadata(), written.locations(), stored, lineSeparator);
  }

  /// Reads the default parse mode from the environment variable or system property
  /// `com.github.simbo1905.lts.LocaleRecordStore.PARSE_MODE`. The property wins.
  static ParseMode getParseModeOrDefault() {
    final String key = String.format("%s.%s", LocaleRecordStore.class.getName(), "PARSE_MODE");
    String mode = System.getenv(key) == null ? DEFAULT_PARSE_MODE.name() : System.getenv(key);
    mode = System.getProperty(key, mode);
    return ParseMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
  }

  /// Reads the default line separator from the environment variable or system property
  /// `com.github.simbo1905.lts.LocaleRecordStore.LINE_SEPARATOR_STYLE`, one of `CRLF`, `LF` or
  /// `CR`. Falls back to the platform line separator.
  static String getLineSeparatorOrDefault() {
    final String key =
        String.format("%s.%s", LocaleRecordStore.class.getName(), "LINE_SEPARATOR_STYLE");
    final String style = System.getProperty(key, System.getenv(key));
    if (style == null) {
      return System.lineSeparator();
    }
    return LineEnding.valueOf(style.trim().toUpperCase(Locale.ROOT)).separator();
  }
}
