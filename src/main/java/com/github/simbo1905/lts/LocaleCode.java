package com.github.simbo1905.lts;

/// The locales a locale file can hold. The literal is the `language_COUNTRY` code used in the
/// metadata, and in lower case as the first five characters of the .dat file name.
public enum LocaleCode {
  ZH_CN("zh_CN"),
  DE_DE("de_DE"),
  FR_FR("fr_FR"),
  EN_GB("en_GB"),
  JA_JP("ja_JP"),
  KO_KR("ko_KR"),
  ZH_TW("zh_TW"),
  EN_US("en_US"),
  ES_ES("es_ES"),
  IT_IT("it_IT"),
  PT_PT("pt_PT"),
  RU_RU("ru_RU"),
  SV_SE("sv_SE"),
  PT_BR("pt_BR"),
  ES_MX("es_MX");

  /// Length of every locale code.
  static final int LENGTH = 5;

  private final String code;

  LocaleCode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  @Override
  public String toString() {
    return code;
  }

  /// Parses a locale code exactly as written in metadata.
  ///
  /// @throws LocaleFormatException if the code is unknown
  public static LocaleCode parse(String code) {
    for (LocaleCode locale : values()) {
      if (locale.code.equals(code)) {
        return locale;
      }
    }
    throw new LocaleFormatException("Unknown locale: '" + code + "'");
  }

  /// Parses a locale code ignoring case, returning null when it is unknown.
  static LocaleCode tryParseIgnoreCase(String code) {
    for (LocaleCode locale : values()) {
      if (locale.code.equalsIgnoreCase(code)) {
        return locale;
      }
    }
    return null;
  }
}
