// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// The tag byte written before each provider state. The ordinal is the wire value, so constants must never
/// be reordered and new ones may only be appended.
enum ValueStateTag {
  /// followed by the captured failure
  BROKEN,
  /// no payload
  MISSING,
  /// followed by the value written with the fallback codec, which may be null
  FIXED,
  /// followed by the provider written with the changing value bindings
  CHANGING;

  private static final ValueStateTag[] VALUES = values();

  byte tag() {
    return (byte) ordinal();
  }

  static ValueStateTag fromTag(byte tag) {
    if (tag < 0 || tag >= VALUES.length) {
      LOGGER.severe(() -> "Unexpected provider value tag " + tag);
      throw new IllegalStateException("Unexpected provider value tag " + tag);
    }
    return VALUES[tag];
  }
}
