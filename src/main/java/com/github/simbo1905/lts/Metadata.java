package com.github.simbo1905.lts;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.function.Function;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/// The `## <name>:\t<value>` header of a locale .dir file.
///
/// A header has one of two shapes. The standard shape lists CidLength, Count, Database, Date,
/// Game, Locale, MD5Checksum, T4Version, TextLength and Version. The extracted shape is wrapped
/// in bare `##` marker lines and lists Extraction Date, Count and Extraction version. Setting
/// either extraction field selects the extracted shape. Unset fields are null and are written as
/// `Unknown`.
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class Metadata {

  static final String HEADER_PREFIX = "##";
  static final String UNKNOWN = "Unknown";

  /// Locale .dat file names such as `en_us_data.dat` have this many characters.
  static final int LOCALE_FILE_NAME_LENGTH = 14;

  private Integer cidLength;
  private Integer count;
  private String database;
  private String date;
  private Game game;
  private LocaleCode locale;
  private String md5Checksum;
  private FormatVersion t4Version;
  private Integer textLength;
  private FormatVersion version;
  private String extractionDate;
  private FormatVersion extractionVersion;

  public Metadata() {}

  /// Copies every field of another metadata instance.
  public Metadata(Metadata other) {
    this.cidLength = other.cidLength;
    this.count = other.count;
    this.database = other.database;
    this.date = other.date;
    this.game = other.game;
    this.locale = other.locale;
    this.md5Checksum = other.md5Checksum;
    this.t4Version = other.t4Version;
    this.textLength = other.textLength;
    this.version = other.version;
    this.extractionDate = other.extractionDate;
    this.extractionVersion = other.extractionVersion;
  }

  /// Returns true if either extraction field is set, which selects the extracted shape.
  public boolean isExtracted() {
    return extractionDate != null || extractionVersion != null;
  }

  /// Returns true for files whose hashes are not generated from `Global.Text.<id>` keys:
  /// extracted headers and the trading card game variants. Ids cannot be recovered for these
  /// files and entries cannot be added to them.
  public boolean isForeignIdScheme() {
    return isExtracted() || (game != null && game.isTradingCardGame());
  }

  /// Parses the date, or the extraction date when there is no date.
  ///
  /// @throws IllegalStateException if neither date is set
  public LocalDateTime getDateTime() {
    final String value = date != null ? date : extractionDate;
    if (value == null) {
      throw new IllegalStateException("Date is not initialized.");
    }
    return MetadataValidator.parseDate(value);
  }

  /// The time zone abbreviation embedded in the date, such as `PDT`, or null if no date is set.
  public String getTimeZone() {
    final String value = date != null ? date : extractionDate;
    return value == null ? null : MetadataValidator.timeZoneOf(value);
  }

  /// Assigns the field with the given .dir name from its text. `Unknown` leaves the field unset.
  ///
  /// @param name the name as written in the .dir file, such as `Count` or `Extraction Date`
  /// @param value the text of the value
  /// @throws LocaleFormatException if the name is unknown or the value is malformed
  public void assign(String name, String value) {
    switch (name) {
      case "CidLength" -> cidLength = parseValue(Metadata::parseInt, value);
      case "Count" -> count = parseValue(Metadata::parseInt, value);
      case "Database" -> database = parseValue(MetadataValidator::validateDatabase, value);
      case "Date" -> date = parseValue(MetadataValidator::validateDate, value);
      case "Game" -> game = parseValue(Metadata::parseGame, value);
      case "Locale" -> locale = parseValue(LocaleCode::parse, value);
      case "MD5Checksum" -> md5Checksum = parseValue(MetadataValidator::validateChecksum, value);
      case "T4Version" -> t4Version = parseValue(FormatVersion::parse, value);
      case "TextLength" -> textLength = parseValue(Metadata::parseInt, value);
      case "Version" -> version = parseValue(FormatVersion::parse, value);
      case "Extraction Date" -> extractionDate = parseValue(MetadataValidator::validateDate, value);
      case "Extraction version" -> extractionVersion = parseValue(FormatVersion::parse, value);
      default -> throw new LocaleFormatException("Unrecognized metadata name: '" + name + "'");
    }
  }

  /// Returns a copy with the derived fields recomputed for a freshly written .dat file: the entry
  /// count, the checksum and the largest text length in UTF-8 bytes. The date is set to now if
  /// unset and the locale is guessed from the file name if unset. Other fields are kept.
  ///
  /// @param datFileName the name of the .dat file, used to guess the locale
  /// @param md5Checksum the upper case hex MD5 of the .dat file
  /// @param entries the entries written
  public Metadata update(String datFileName, String md5Checksum, Collection<LocaleEntry> entries) {
    return update(datFileName, md5Checksum, entries, Clock.systemUTC());
  }

  Metadata update(
      String datFileName, String md5Checksum, Collection<LocaleEntry> entries, Clock clock) {
    final String now =
        LocalDateTime.now(clock).format(MetadataValidator.dateFormat("UTC"));
    final Metadata updated = new Metadata(this);
    updated.count = entries.size();
    updated.date = date != null ? date : now;
    updated.locale = locale != null ? locale : guessLocale(datFileName);
    updated.md5Checksum = md5Checksum;
    updated.textLength =
        entries.stream().mapToInt(e -> LocaleFiles.utf8Length(e.text())).max().orElse(0);
    updated.extractionDate = isExtracted() ? (extractionDate != null ? extractionDate : now) : null;
    return updated;
  }

  /// Creates metadata for a .dat file that has no .dir file.
  public static Metadata create(Path dat, Collection<LocaleEntry> entries) throws IOException {
    return new Metadata()
        .update(dat.getFileName().toString(), LocaleFiles.md5Checksum(dat), entries);
  }

  /// Guesses the locale from a file name like `en_us_data.dat`.
  ///
  /// @return the locale, or null if the name does not follow the convention
  static LocaleCode guessLocale(String datFileName) {
    if (datFileName == null || datFileName.length() != LOCALE_FILE_NAME_LENGTH) {
      return null;
    }
    return LocaleCode.tryParseIgnoreCase(datFileName.substring(0, LocaleCode.LENGTH));
  }

  /// Formats the header as it appears at the top of a .dir file, every line ending with the
  /// given separator.
  public String toHeader(String lineSeparator) {
    final StringBuilder sb = new StringBuilder(512);
    if (!isExtracted()) {
      line(sb, "CidLength", cidLength, lineSeparator);
      line(sb, "Count", count, lineSeparator);
      if (database != null) {
        line(sb, "Database", database, lineSeparator);
      }
      line(sb, "Date", date, lineSeparator);
      line(sb, "Game", game, lineSeparator);
      line(sb, "Locale", locale, lineSeparator);
      line(sb, "MD5Checksum", md5Checksum, lineSeparator);
      line(sb, "T4Version", t4Version, lineSeparator);
      line(sb, "TextLength", textLength, lineSeparator);
      line(sb, "Version", version, lineSeparator);
    } else {
      sb.append(HEADER_PREFIX).append(lineSeparator);
      line(sb, "Extraction Date", extractionDate, lineSeparator);
      line(sb, "Count", count, lineSeparator);
      line(sb, "Extraction version", extractionVersion, lineSeparator);
      sb.append(HEADER_PREFIX).append(lineSeparator);
    }
    return sb.toString();
  }

  private static void line(StringBuilder sb, String name, Object value, String lineSeparator) {
    sb.append(HEADER_PREFIX)
        .append(' ')
        .append(name)
        .append(":\t")
        .append(value == null ? UNKNOWN : value)
        .append(lineSeparator);
  }

  private static <T> T parseValue(Function<String, T> parse, String value) {
    return UNKNOWN.equals(value) ? null : parse.apply(value);
  }

  private static Integer parseInt(String value) {
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      throw new LocaleFormatException("Invalid metadata number: " + value, e);
    }
  }

  private static Game parseGame(String value) {
    try {
      return Game.valueOf(value);
    } catch (IllegalArgumentException e) {
      throw new LocaleFormatException("Unknown game: '" + value + "'", e);
    }
  }
}
