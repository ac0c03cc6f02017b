package com.github.simbo1905.lts;

/// How a .dat and .dir pair is opened.
public enum ParseMode {
  /// Read entries at the locations listed in the .dir file. Any failure is thrown.
  STRICT,
  /// As [#STRICT], except that Simplified Chinese files of the foreign identifier scheme are
  /// streamed from the .dat file alone, as their .dir files are known to disagree with the data.
  NORMAL,
  /// Try the .dir file first and stream the .dat file alone if that fails for any reason.
  LENIENT
}
