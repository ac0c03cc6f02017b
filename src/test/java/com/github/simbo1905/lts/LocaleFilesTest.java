package com.github.simbo1905.lts;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LocaleFilesTest extends JulLoggingConfig {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private static final int BUCKET_HASH = IdResolver.hashOf(3);

  private static final List<LocaleEntry> ENTRIES =
      List.of(
          new LocaleEntry(905058873, Tag.UCDT, "Coin Flow Saw"),
          new LocaleEntry(BUCKET_HASH, Tag.MCDT, "Hi\t0017\tGlobal.Text.3"),
          new LocaleEntry(BUCKET_HASH, Tag.MCDN, "\t0017\tGlobal.Text.3"),
          new LocaleEntry(IdResolver.hashOf(100), Tag.UCDT, "first line\nsecond line"),
          new LocaleEntry(IdResolver.hashOf(10), Tag.UGDT, "été 中文"),
          new LocaleEntry(MixHash.hash("Clé_中"), Tag.MGDT, "Nom\t0006\tClé_中"));

  private Path dat;
  private Path dir;

  @Before
  public void setUp() {
    dat = tempFolder.getRoot().toPath().resolve("en_us_data.dat");
    dir = tempFolder.getRoot().toPath().resolve("en_us_data.dir");
  }

  @Test
  public void testWriteThenReadBack() throws IOException {
    final LocaleFiles.Directory written =
        LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");

    assertThat(LocaleFiles.readEntries(dat, dir), is(ENTRIES));
    assertThat(LocaleFiles.readEntries(dat), is(ENTRIES));
    assertArrayEquals(LocaleFiles.UTF8_PREAMBLE, LocaleFiles.readPreamble(dat));
    assertThat(LocaleFiles.readEntryLocations(dir), is(written.locations()));
    assertThat(LocaleFiles.readMetadata(dir), is(written.metadata()));
  }

  @Test
  public void testLocationsAndMetadataOfWrittenFiles() throws IOException {
    final LocaleFiles.Directory written =
        LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    final List<EntryLocation> locations = written.locations();

    assertThat(locations.get(0), is(new EntryLocation(905058873, 3, 28)));
    // 3 + 28 + 1; the bucket size stops before "\t0017"
    final String bucketLine = ENTRIES.get(1).toLine();
    assertThat(locations.get(1).offset(), is(32L));
    assertThat(locations.get(1).size(), is(bucketLine.indexOf("\t0017")));

    final Metadata metadata = written.metadata();
    assertThat(metadata.getCount(), is(6));
    assertThat(metadata.getLocale(), is(LocaleCode.EN_US));
    assertThat(metadata.getMd5Checksum(), is(LocaleFiles.md5Checksum(dat)));
    assertThat(metadata.getTextLength(), is("first line\nsecond line".length()));

    final String dirText = Files.readString(dir, UTF_8);
    assertThat(dirText, startsWith("## CidLength:\tUnknown\n## Count:\t6\n"));
    assertThat(dirText, containsString("\n905058873\t3\t28\td\n"));
  }

  @Test
  public void testDoubleEncodedPreambleAndCrLf() throws IOException {
    LocaleFiles.write(
        dat, dir, LocaleFiles.DOUBLE_ENCODED_PREAMBLE, new Metadata(), ENTRIES, "\r\n");
    assertArrayEquals(LocaleFiles.DOUBLE_ENCODED_PREAMBLE, LocaleFiles.readPreamble(dat));
    assertThat(LocaleFiles.readEntries(dat, dir), is(ENTRIES));
    assertThat(LocaleFiles.readEntryLocations(dir).get(0).offset(), is(6L));
    assertThat(LocaleFiles.readEntryLocations(dir).get(1).offset(), is(6L + 28 + 2));
  }

  @Test
  public void testKeyedBucketSuffixIsRecoveredByLocatedRead() throws IOException {
    final LocaleEntry keyed = ENTRIES.get(5);
    final LocaleFiles.Directory written =
        LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\r\n");
    final EntryLocation location = written.locations().get(5);
    // "Nom" is 3 bytes, the size stops before "\t0006\tClé_中"
    assertThat(location.size(), is(keyed.hashString().length() + 6 + 3));
    assertThat(LocaleFiles.readEntries(dat, List.of(location)), is(List.of(keyed)));
  }

  @Test
  public void testBucketSize() {
    assertThat(LocaleFiles.bucketSize("7\tmcdt\tHi\t0017\tGlobal.Text.3".getBytes(UTF_8)), is(9));
    assertThat(LocaleFiles.bucketSize("7\tmcdn\t\t0017\tGlobal.Text.3".getBytes(UTF_8)), is(7));
    assertThat(LocaleFiles.bucketSize("7\tmgdt\té\t0006\tKey".getBytes(UTF_8)), is(9));
    assertThrows(
        LocaleFormatException.class, () -> LocaleFiles.bucketSize("7\tmcdt\tab".getBytes(UTF_8)));
  }

  @Test
  public void testFailedWriteLeavesFilesAlone() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    final byte[] before = Files.readAllBytes(dat);

    final List<LocaleEntry> broken = List.of(new LocaleEntry(1, Tag.MCDT, "no suffix"));
    assertThrows(
        LocaleFormatException.class,
        () -> LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), broken, "\n"));

    assertArrayEquals(before, Files.readAllBytes(dat));
    final File[] files = tempFolder.getRoot().listFiles();
    assertThat(files.length, is(2));
  }

  @Test
  public void testBadLocationIsReportedWithContext() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    final List<EntryLocation> wrong = List.of(new EntryLocation(905058873, 4, 28));
    final InvalidLocaleDataException e =
        assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readEntries(dat, wrong));
    assertThat(e.getMessage(), containsString("hash=905058873, offset=4, size=28"));
    assertThat(e.getPath(), is(dat));

    final List<EntryLocation> pastEnd = List.of(new EntryLocation(905058873, 3, 100_000));
    assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readEntries(dat, pastEnd));
  }

  @Test
  public void testOversizedLocationIsAFormatError() throws IOException {
    LocaleFiles.write(dat, dir, LocaleFiles.UTF8_PREAMBLE, new Metadata(), ENTRIES, "\n");
    final List<EntryLocation> huge = List.of(new EntryLocation(905058873, 3, Integer.MAX_VALUE));
    final InvalidLocaleDataException e =
        assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readEntries(dat, huge));
    assertThat(e.getMessage(), containsString("hash=905058873, offset=3, size=2147483647"));
    assertThat(e.getCause().getMessage(), containsString("past the end"));

    final List<EntryLocation> farOffset = List.of(new EntryLocation(905058873, Long.MAX_VALUE, 1));
    assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readEntries(dat, farOffset));
  }

  @Test
  public void testReadDirectoryWithMarkersAndBadLines() throws IOException {
    Files.writeString(
        dir,
        "##\n## Extraction Date:\tThu Mar 13 10:10:13 PDT 2014\n## Count:\t1\n"
            + "## Extraction version:\t1.2.3\n##\n5\t3\t10\td\n",
        UTF_8);
    final Metadata metadata = LocaleFiles.readMetadata(dir);
    assertThat(metadata.isExtracted(), is(true));
    assertThat(metadata.getCount(), is(1));
    assertThat(metadata.getGame(), nullValue());
    assertThat(LocaleFiles.readEntryLocations(dir), is(List.of(new EntryLocation(5, 3, 10))));

    Files.writeString(dir, "## Colour:\tblue\n", UTF_8);
    assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readMetadata(dir));

    // only a bare "##" may break the name and value pattern
    for (String bad : List.of("## Count 5", "## Colour\tblue", "## Count:5", "##x")) {
      Files.writeString(dir, "## Count:\t1\n" + bad + "\n1\t3\t4\td\n", UTF_8);
      final InvalidLocaleDataException e =
          assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readMetadata(dir));
      assertThat(e.getMessage(), containsString("Invalid metadata line: " + bad));
    }

    Files.writeString(dir, "## Count:\t1\nnot a location\n", UTF_8);
    assertThrows(InvalidLocaleDataException.class, () -> LocaleFiles.readEntryLocations(dir));
  }

  @Test
  public void testUtf8Length() {
    assertThat(LocaleFiles.utf8Length("abc"), is(3));
    assertThat(LocaleFiles.utf8Length("été"), is(5));
    assertThat(LocaleFiles.utf8Length("中文"), is(6));
    assertThat(LocaleFiles.utf8Length("😀"), is(4));
  }
}
