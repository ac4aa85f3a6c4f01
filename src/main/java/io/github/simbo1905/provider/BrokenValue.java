// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/// A failure captured while a value was being computed. Capturing does not throw; [#rethrow()] replays the
/// failure at the point where the value is finally consumed.
public record BrokenValue(@NotNull Throwable failure) {
  public BrokenValue {
    Objects.requireNonNull(failure, "failure must not be null");
  }

  /// Replay the captured failure. Unchecked throwables are rethrown as they are, checked ones are wrapped.
  public <T> T rethrow() {
    if (failure instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }
    if (failure instanceof Error error) {
      throw error;
    }
    throw new ProviderEvaluationException("Failed to calculate the value: " + failure.getMessage(), failure);
  }
}
