package com.github.simbo1905.lts;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class LocaleEntryTest extends JulLoggingConfig {

  @Test
  public void testParseShippedLine() {
    final String line = "905058873\tucdt\tCoin Flow Saw";
    final LocaleEntry entry = LocaleEntry.parse(line);
    assertThat(Integer.toUnsignedLong(entry.hash()), is(905058873L));
    assertThat(entry.tag(), is(Tag.UCDT));
    assertThat(entry.text(), is("Coin Flow Saw"));
    assertThat(entry.toLine(), is(line));
    assertThat(entry.toLine().length(), is(28));
  }

  @Test
  public void testHashAboveSignedRange() {
    final LocaleEntry entry = LocaleEntry.parse("4041158985\tucdn\t");
    assertThat(entry.hashString(), is("4041158985"));
    assertThat(entry.hash(), is(IdResolver.hashOf(100)));
    assertThat(entry.text(), is(""));
    assertThat(entry.tag(), is(Tag.UCDN));
  }

  @Test
  public void testTextKeepsTabs() {
    final LocaleEntry entry = LocaleEntry.parse("7\tmcdt\tHi\t0017\tGlobal.Text.3");
    assertThat(entry.tag().isBucket(), is(true));
    assertThat(entry.text(), is("Hi\t0017\tGlobal.Text.3"));
  }

  @Test
  public void testNonEntriesAreNotParsed() {
    assertThat(LocaleEntry.tryParse("just some text"), nullValue());
    assertThat(LocaleEntry.tryParse("12\tucdt"), nullValue());
    assertThat(LocaleEntry.tryParse("12\tzzzz\ttext"), nullValue());
    assertThat(LocaleEntry.tryParse("12\tucdtxtext"), nullValue());
    assertThat(LocaleEntry.tryParse("-12\tucdt\ttext"), nullValue());
    assertThat(LocaleEntry.tryParse("4294967296\tucdt\ttext"), nullValue());
    assertThat(LocaleEntry.tryParse("\tucdt\ttext"), nullValue());
    assertThat(LocaleEntry.tryParse(""), nullValue());
    assertThrows(LocaleFormatException.class, () -> LocaleEntry.parse("continuation"));
  }

  @Test
  public void testEqualityCoversHashTagAndText() {
    final LocaleEntry a = new LocaleEntry(1, Tag.UCDT, "x");
    assertThat(a, is(new LocaleEntry(1, Tag.UCDT, "x")));
    assertThat(a, not(a.withText("y")));
    assertThat(a, not(a.withHash(2)));
  }

  @Test
  public void testTagLiterals() {
    for (Tag tag : Tag.values()) {
      assertThat(Tag.parse(tag.literal()), is(tag));
      assertThat(tag.literal().startsWith("m"), is(tag.isBucket()));
    }
    assertThat(Tag.UCDN.isIdentified(), is(true));
    assertThat(Tag.MGDT.isIdentified(), is(false));
    assertThrows(LocaleFormatException.class, () -> Tag.parse("UCDT"));
    assertThrows(LocaleFormatException.class, () -> Tag.parse("ucd"));
  }

  @Test
  public void testLocationLine() {
    final EntryLocation location = EntryLocation.parse("905058873\t3\t24\td");
    assertThat(location, is(new EntryLocation(905058873, 3, 24)));
    assertThat(location.toLine(), is("905058873\t3\t24\td"));
    assertThat(
        EntryLocation.parse("4041158985\t100\t5\td").hash(), is(IdResolver.hashOf(100)));
  }

  @Test
  public void testBadLocationLines() {
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\t3"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("x\t3\t4\td"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\tx\t4\td"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\t3\t-4\td"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse(""));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\t3\t4"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\t3\t4\tx"));
    assertThrows(LocaleFormatException.class, () -> EntryLocation.parse("12\t3\t4\td\t"));
  }
}
