package com.github.simbo1905.lts;

/// The 4-letter tags that can appear in locale entries.
///
/// Tags starting with `u` are single valued: a hash maps to at most one entry. Tags starting
/// with `m` are bucket tags: several entries may share one hash and are told apart by a suffix
/// embedded at the end of their text.
public enum Tag {
  /// Most text.
  UCDT("ucdt"),
  /// Most blank text.
  UCDN("ucdn"),
  /// Some text.
  UGDT("ugdt"),
  /// Some blank text.
  UGDN("ugdn"),
  /// Some text in non-English locales.
  UTDT("utdt"),
  /// Possessive pronoun macros in German locales.
  UMDT("umdt"),
  /// The text "informal" in French and German locales.
  UIDT("uidt"),
  /// Text followed by `\t0017\tGlobal.Text.<id>` where `<id>` hashes to the entry's hash.
  MCDT("mcdt"),
  /// Blank text followed by `\t0017\tGlobal.Text.<id>`.
  MCDN("mcdn"),
  /// Older TCG text followed by `\t0006\t<key>` where `<key>` hashes to the entry's hash.
  MGDT("mgdt");

  /// Number of chars in every tag literal.
  public static final int LENGTH = 4;

  private final String literal;

  Tag(String literal) {
    this.literal = literal;
  }

  /// The lower case literal written to the .dat file.
  public String literal() {
    return literal;
  }

  /// Returns true when many entries may share one hash under this tag.
  public boolean isBucket() {
    return switch (this) {
      case MCDT, MCDN, MGDT -> true;
      case UCDT, UCDN, UGDT, UGDN, UTDT, UMDT, UIDT -> false;
    };
  }

  /// Returns true when entries with this tag take part in the id index.
  public boolean isIdentified() {
    return switch (this) {
      case UCDT, UCDN, MCDT, MCDN -> true;
      case UGDT, UGDN, UTDT, UMDT, UIDT, MGDT -> false;
    };
  }

  @Override
  public String toString() {
    return literal;
  }

  /// Parses a tag literal.
  ///
  /// @param literal exactly four lower case letters
  /// @return the tag
  /// @throws LocaleFormatException if the literal is not a known tag
  public static Tag parse(CharSequence literal) {
    final Tag tag = tryParse(literal);
    if (tag == null) {
      throw new LocaleFormatException("Unknown locale tag: '" + literal + "'");
    }
    return tag;
  }

  /// Parses a tag literal, returning null rather than throwing when it is not a known tag.
  static Tag tryParse(CharSequence literal) {
    if (literal.length() != LENGTH) {
      return null;
    }
    for (Tag tag : values()) {
      if (tag.literal.contentEquals(literal)) {
        return tag;
      }
    }
    return null;
  }
}
