package com.github.simbo1905.lts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Maps between identifiers and the hashes stored in locale files.
///
/// The hash of identifier `n` is the [MixHash] of `Global.Text.<n>`. There is no stored inverse,
/// so recovering identifiers means hashing every identifier from zero up to [#MAX_ID] until each
/// wanted hash has been seen.
public final class IdResolver {

  private static final Logger logger = Logger.getLogger(IdResolver.class.getName());

  /// Largest identifier that can appear in a locale file.
  public static final int MAX_ID = 5103267;

  static final String KEY_PREFIX = "Global.Text.";

  private static final Pattern BUCKET_ID = Pattern.compile("\t0017\tGlobal\\.Text\\.(\\d+)$");

  private IdResolver() {}

  /// Returns the hash of an identifier.
  public static int hashOf(int id) {
    return MixHash.hash(KEY_PREFIX + id);
  }

  /// Finds the identifier of each hash by scanning the identifier space in order.
  ///
  /// The scan reuses one key buffer and increments its decimal digits in place, so it allocates
  /// nothing per identifier. It stops as soon as every hash is found or the space is exhausted.
  /// Hashes with no identifier are left out of the result. When two identifiers share a hash
  /// the smaller one wins.
  ///
  /// @param hashes the hashes to resolve, duplicates allowed
  /// @return identifier to hash, ordered by identifier
  public static SortedMap<Integer, Integer> resolveAll(int[] hashes) {
    final int[] wanted = Arrays.stream(hashes).sorted().distinct().toArray();
    final boolean[] found = new boolean[wanted.length];
    final SortedMap<Integer, Integer> resolved = new TreeMap<>();
    int remaining = wanted.length;

    final char[] key = new char[KEY_PREFIX.length() + String.valueOf(MAX_ID).length() + 1];
    KEY_PREFIX.getChars(0, KEY_PREFIX.length(), key, 0);
    final int digitsStart = KEY_PREFIX.length();
    key[digitsStart] = '0';
    int length = digitsStart + 1;

    final long start = System.nanoTime();
    for (int id = 0; remaining > 0 && id <= MAX_ID; id++) {
      final int hash = MixHash.hash(key, length);
      final int index = Arrays.binarySearch(wanted, hash);
      if (index >= 0 && !found[index]) {
        found[index] = true;
        remaining--;
        resolved.put(id, hash);
      }
      length = increment(key, digitsStart, length);
    }
    final int unresolved = remaining;
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "resolved %d of %d hashes in %d ms, %d unresolved",
                resolved.size(),
                wanted.length,
                (System.nanoTime() - start) / 1_000_000,
                unresolved));
    return resolved;
  }

  /// Adds one to the decimal number held in `key[digitsStart, length)`.
  ///
  /// @return the new length of the key
  private static int increment(char[] key, int digitsStart, int length) {
    int i = length - 1;
    while (i >= digitsStart && key[i] == '9') {
      key[i] = '0';
      i--;
    }
    if (i >= digitsStart) {
      key[i]++;
      return length;
    }
    key[digitsStart] = '1';
    key[length] = '0';
    return length + 1;
  }

  /// Builds the identifier index of a set of entries.
  ///
  /// `ucdt` and `ucdn` entries are resolved by scanning the identifier space. `mcdt` and `mcdn`
  /// entries carry their identifier in their text suffix. Other tags have no identifier.
  ///
  /// @return identifier to entry, ordered by identifier
  /// @throws LocaleFormatException if a bucket entry has no identifier suffix
  public static SortedMap<Integer, LocaleEntry> indexIds(Collection<LocaleEntry> entries) {
    final Map<Integer, LocaleEntry> hashToEntry = new HashMap<>();
    final SortedMap<Integer, LocaleEntry> idToEntry = new TreeMap<>();
    for (LocaleEntry entry : entries) {
      switch (entry.tag()) {
        case UCDT, UCDN -> hashToEntry.putIfAbsent(entry.hash(), entry);
        case MCDT, MCDN -> {
          final int id = parseBucketId(entry.text());
          final LocaleEntry previous = idToEntry.putIfAbsent(id, entry);
          if (previous != null) {
            logger.log(
                Level.FINE,
                () -> String.format("duplicate bucket id %d, keeping %s", id, previous.toLine()));
          }
        }
        case UGDT, UGDN, UTDT, UMDT, UIDT, MGDT -> {}
      }
    }
    final int[] hashes = hashToEntry.keySet().stream().mapToInt(Integer::intValue).toArray();
    resolveAll(hashes).forEach((id, hash) -> idToEntry.putIfAbsent(id, hashToEntry.get(hash)));
    return idToEntry;
  }

  /// Parses the identifier from the `\t0017\tGlobal.Text.<id>` suffix of bucket entry text.
  ///
  /// @throws LocaleFormatException if the text has no such suffix
  public static int parseBucketId(String text) {
    Objects.requireNonNull(text, "text");
    final int id = tryParseBucketId(text);
    if (id < 0) {
      throw new LocaleFormatException("No identifier suffix in bucket text: " + text);
    }
    return id;
  }

  /// Parses the identifier from bucket entry text.
  ///
  /// @return the identifier, or -1 if the text is null or has no valid suffix
  public static int tryParseBucketId(String text) {
    if (text == null) {
      return -1;
    }
    final Matcher matcher = BUCKET_ID.matcher(text);
    if (!matcher.find()) {
      return -1;
    }
    try {
      return Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  /// Creates an entry whose hash is generated from an identifier. Empty text gets the `ucdn` tag,
  /// anything else `ucdt`.
  public static LocaleEntry generateEntry(int id, String text) {
    Objects.requireNonNull(text, "text");
    return new LocaleEntry(hashOf(id), text.isEmpty() ? Tag.UCDN : Tag.UCDT, text);
  }

  /// Creates one entry per string with consecutive identifiers from 1, skipping identifiers whose
  /// hash has already been used.
  ///
  /// @throws IllegalArgumentException if there are more strings than identifiers
  public static List<LocaleEntry> generateEntries(Collection<String> strings) {
    if (strings.size() > MAX_ID) {
      throw new IllegalArgumentException(
          String.format("Collection size (%d) exceeds maximum ID (%d).", strings.size(), MAX_ID));
    }
    final List<LocaleEntry> entries = new ArrayList<>(strings.size());
    final Set<Integer> hashes = new HashSet<>();
    int id = 1;
    for (String text : strings) {
      LocaleEntry entry = generateEntry(id++, text);
      while (!hashes.add(entry.hash())) {
        entry = entry.withHash(hashOf(id++));
      }
      entries.add(entry);
    }
    return entries;
  }

  /// A cursor over the identifiers in `[1, MAX_ID]` that are not in use.
  ///
  /// The test for use is consulted lazily as the cursor advances, so identifiers taken after the
  /// cursor was created are skipped too.
  public static final class UnusedIds {

    private final IntPredicate used;
    private final int last;
    private int current;
    private boolean started;

    /// A cursor over `[1, MAX_ID]`.
    public UnusedIds(IntPredicate used) {
      this(used, 1, MAX_ID);
    }

    UnusedIds(IntPredicate used, int first, int last) {
      if (first < 0 || last < first - 1) {
        throw new IllegalArgumentException(
            String.format("invalid identifier range [%d, %d]", first, last));
      }
      this.used = Objects.requireNonNull(used, "used");
      this.last = last;
      this.current = first - 1;
    }

    /// Advances to the next unused identifier.
    ///
    /// @throws IdSpaceExhaustedException if no identifiers remain
    public int next() {
      int candidate = current;
      do {
        if (candidate >= last) {
          current = last;
          throw new IdSpaceExhaustedException("No more IDs to add entries.");
        }
        candidate++;
      } while (used.test(candidate));
      current = candidate;
      started = true;
      return current;
    }

    /// The identifier most recently returned by [#next()].
    ///
    /// @throws IllegalStateException if [#next()] has not succeeded yet
    public int current() {
      if (!started) {
        throw new IllegalStateException("next() has not been called");
      }
      return current;
    }
  }
}
