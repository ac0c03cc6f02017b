package com.github.simbo1905.lts;

/// The games named in locale metadata.
public enum Game {
  /// All locales except Simplified Chinese.
  FRLM,
  /// The Simplified Chinese locale.
  FRLMCN,
  /// 2009 locales.
  FRLMLV,
  /// All TCG locales except Simplified Chinese.
  FRLMTCG,
  /// The Simplified Chinese TCG locale.
  FRLMTCGCN,
  /// The American English TCG locale.
  LON;

  /// Returns true for the trading card game variants whose hashes are not generated from
  /// `Global.Text.<id>` keys.
  public boolean isTradingCardGame() {
    return switch (this) {
      case FRLMTCG, FRLMTCGCN, LON -> true;
      case FRLM, FRLMCN, FRLMLV -> false;
    };
  }
}
