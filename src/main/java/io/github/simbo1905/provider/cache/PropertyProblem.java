// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// Something that went wrong with a value while it was written but did not stop the session.
public record PropertyProblem(@NotNull String message, @Nullable Throwable exception) {
  public PropertyProblem {
    Objects.requireNonNull(message, "message must not be null");
  }
}
