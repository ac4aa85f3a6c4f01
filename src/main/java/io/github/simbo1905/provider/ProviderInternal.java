// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.Nullable;

/// A lazily computed value.
public interface ProviderInternal<T> {

  /// The declared type of the value, or null when it is not known.
  @Nullable Class<T> getType();

  /// Compute the value.
  /// @throws IllegalStateException when no value is available
  T get();

  /// Compute the value or return null when no value is available.
  @Nullable T getOrNull();

  default boolean isPresent() {
    return getOrNull() != null;
  }

  /// Classify the value for writing to the cache. Plain providers may throw while computing the value;
  /// properties capture such failures as [ExecutionTimeValue.Broken] themselves.
  ExecutionTimeValue<? extends T> calculateExecutionTimeValue();
}
