package com.github.simbo1905.lts;

/// Thrown when every identifier in `[1, IdResolver.MAX_ID]` is already taken so no new entry can
/// be added.
public class IdSpaceExhaustedException extends UnsupportedOperationException {

  public IdSpaceExhaustedException(String message) {
    super(message);
  }
}
