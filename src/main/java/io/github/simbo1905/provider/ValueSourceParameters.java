// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.io.Serializable;

/// Marker for the parameters of a [ValueSource].
public interface ValueSourceParameters {

  /// Parameters for a value source that takes none.
  final class None implements ValueSourceParameters, Serializable {
    public static final None INSTANCE = new None();

    private None() {
    }

    private Object readResolve() {
      return INSTANCE;
    }
  }
}
