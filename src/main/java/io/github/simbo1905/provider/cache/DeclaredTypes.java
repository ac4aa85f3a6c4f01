// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

final class DeclaredTypes {
  private DeclaredTypes() {
  }

  /// Check the declared type read for a path-like property.
  static void expect(Class<?> actual, Class<?> expected) {
    if (!expected.equals(actual)) {
      LOGGER.severe(() -> "Declared type " + actual.getName() + " read where " + expected.getName() + " was expected");
      throw new IllegalStateException("Declared type " + actual.getName() + " read where " + expected.getName() + " was expected");
    }
  }
}
