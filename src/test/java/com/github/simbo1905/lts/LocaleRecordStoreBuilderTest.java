package com.github.simbo1905.lts;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LocaleRecordStoreBuilderTest extends JulLoggingConfig {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private static final String PARSE_MODE_KEY = LocaleRecordStore.class.getName() + ".PARSE_MODE";
  private static final String SEPARATOR_KEY =
      LocaleRecordStore.class.getName() + ".LINE_SEPARATOR_STYLE";

  /// In unsigned hash order, which is the order a store writes them in.
  private static final List<LocaleEntry> ENTRIES =
      Stream.of(
              new LocaleEntry(IdResolver.hashOf(1), Tag.UCDT, "one"),
              new LocaleEntry(IdResolver.hashOf(2), Tag.UCDT, "two\nlines"))
          .sorted(Comparator.comparing(LocaleEntry::hash, Integer::compareUnsigned))
          .collect(Collectors.toUnmodifiableList());

  private Path dat;
  private Path dir;

  @Before
  public void setUp() {
    dat = tempFolder.getRoot().toPath().resolve("zh_cn_data.dat");
    dir = tempFolder.getRoot().toPath().resolve("zh_cn_data.dir");
  }

  @After
  public void clearProperties() {
    System.clearProperty(PARSE_MODE_KEY);
    System.clearProperty(SEPARATOR_KEY);
  }

  /// Writes the pair, then replaces the .dir locations with ones that point nowhere.
  private Metadata writeWithBrokenDirectory(Game game) throws IOException {
    final Metadata metadata = new Metadata();
    metadata.setGame(game);
    final Metadata written =
        LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, metadata, ENTRIES, "\n").metadata();
    Files.writeString(
        dir, written.toHeader("\n") + ENTRIES.get(0).hashString() + "\t999\t7\td\n", UTF_8);
    return written;
  }

  private LocaleRecordStoreBuilder builder() {
    return new LocaleRecordStoreBuilder().datPath(dat).dirPath(dir);
  }

  @Test
  public void testStrictPropagatesBadLocations() throws IOException {
    writeWithBrokenDirectory(Game.FRLMCN);
    assertThrows(
        InvalidLocaleDataException.class, () -> builder().parseMode(ParseMode.STRICT).open());
    assertThrows(
        InvalidLocaleDataException.class, () -> builder().parseMode(ParseMode.NORMAL).open());
  }

  @Test
  public void testLenientFallsBackToStreaming() throws IOException {
    final Metadata written = writeWithBrokenDirectory(Game.FRLMCN);
    final LocaleRecordStore store = builder().parseMode(ParseMode.LENIENT).open();
    assertThat(store.getEntries(), is(ENTRIES));
    assertThat(store.getMetadata(), is(written));
  }

  @Test
  public void testOversizedLocationFallsBackUnderLenient() throws IOException {
    final Metadata written =
        LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n")
            .metadata();
    Files.writeString(
        dir,
        written.toHeader("\n") + ENTRIES.get(0).hashString() + "\t3\t2147483647\td\n",
        UTF_8);

    final LocaleRecordStore store = builder().parseMode(ParseMode.LENIENT).open();
    assertThat(store.getEntries(), is(ENTRIES));
    assertThat(store.getMetadata(), is(written));

    final InvalidLocaleDataException e =
        assertThrows(
            InvalidLocaleDataException.class, () -> builder().parseMode(ParseMode.STRICT).open());
    assertThat(e.getMessage(), containsString("size=2147483647"));
  }

  @Test
  public void testLenientWithUnreadableDirectory() throws IOException {
    writeWithBrokenDirectory(Game.FRLM);
    Files.writeString(dir, "## Colour:\tblue\n", UTF_8);
    final LocaleRecordStore store = builder().parseMode(ParseMode.LENIENT).open();
    assertThat(store.getEntries(), is(ENTRIES));
    assertThat(store.getMetadata().getCount(), is(2));
    assertThat(store.getMetadata().getLocale(), is(LocaleCode.ZH_CN));
  }

  @Test
  public void testNormalStreamsSimplifiedChineseTradingCardFiles() throws IOException {
    writeWithBrokenDirectory(Game.FRLMTCGCN);
    final LocaleRecordStore store = builder().parseMode(ParseMode.NORMAL).open();
    assertThat(store.getEntries(), is(ENTRIES));
    assertThat(store.getMetadata().getLocale(), is(LocaleCode.ZH_CN));
    assertThat(store.canAddEntries(), is(false));
  }

  @Test
  public void testParseModeFromSystemProperty() throws IOException {
    writeWithBrokenDirectory(Game.FRLM);
    System.setProperty(PARSE_MODE_KEY, "lenient");
    assertThat(LocaleRecordStore.getParseModeOrDefault(), is(ParseMode.LENIENT));
    assertThat(builder().open().getEntries(), is(ENTRIES));
    System.setProperty(PARSE_MODE_KEY, "STRICT");
    assertThrows(InvalidLocaleDataException.class, () -> builder().open());
  }

  @Test
  public void testLineSeparatorFromSystemProperty() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    System.setProperty(SEPARATOR_KEY, "crlf");
    final LocaleRecordStore store = builder().open();
    assertThat(store.getLineSeparator(), is("\r\n"));
    store.write();
    final int firstLine = LocaleFiles.utf8Length(ENTRIES.get(0).toLine());
    assertThat(LocaleFiles.readEntryLocations(dir).get(1).offset(), is(3L + firstLine + 2));
    assertThat(LocaleFiles.readEntries(dat, dir), is(ENTRIES));
    System.clearProperty(SEPARATOR_KEY);
    assertThat(LocaleRecordStore.getLineSeparatorOrDefault(), is(System.lineSeparator()));
  }

  @Test
  public void testOpenWithoutDirectory() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.DOUBLE_ENCODED_PREAMBLE, new Metadata(), ENTRIES, "\n");
    Files.delete(dir);
    final LocaleRecordStore store = new LocaleRecordStoreBuilder().datPath(dat.toString()).open();
    assertThat(store.getEntries(), is(ENTRIES));
    assertThat(store.getDirPath(), is(dir));
    assertThat(store.getLocations().isEmpty(), is(true));
    assertThat(store.getMetadata().getCount(), is(2));
    assertThat(store.getMetadata().getMd5Checksum(), is(LocaleFiles.md5Checksum(dat)));

    store.write();
    assertThat(LocaleFiles.readEntries(dat, dir), is(ENTRIES));
  }

  @Test
  public void testConvenienceAddAndRemove() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    final LocaleRecordStore added = LocaleFiles.addEntries(dat, dir, List.of("three"));
    assertThat(added.size(), is(3));
    assertThat(LocaleFiles.readEntries(dat, dir).size(), is(3));

    final LocaleRecordStore removed =
        LocaleFiles.removeEntries(dat, dir, e -> e.text().equals("three"));
    assertThat(removed.getEntries(), is(ENTRIES));
    assertThat(LocaleFiles.readEntries(dat, dir), is(ENTRIES));
  }

  @Test
  public void testBuilderValidation() {
    assertThrows(IllegalStateException.class, () -> new LocaleRecordStoreBuilder().open());
    assertThrows(
        IllegalArgumentException.class, () -> new LocaleRecordStoreBuilder().readBufferSize(7));
    assertThrows(NullPointerException.class, () -> new LocaleRecordStoreBuilder().parseMode(null));
  }

  @Test
  public void testSiblingDir() {
    assertThat(
        LocaleRecordStoreBuilder.siblingDir(Path.of("a", "en_us_data.dat")),
        is(Path.of("a", "en_us_data.dir")));
    assertThat(LocaleRecordStoreBuilder.siblingDir(Path.of("plain")), is(Path.of("plain.dir")));
  }
}
