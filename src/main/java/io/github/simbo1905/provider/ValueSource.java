// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.Nullable;

/// An input read from outside the build, such as an environment variable or the output of an external command.
/// Implementations need a public no-arg constructor.
public interface ValueSource<T, P extends ValueSourceParameters> {

  /// Obtain the value, or null when there is none.
  @Nullable T obtain(P parameters);
}
