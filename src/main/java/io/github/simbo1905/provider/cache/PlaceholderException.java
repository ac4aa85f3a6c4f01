// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/// Stands in for a failure that could not be serialized. It keeps the original class name, message and
/// stack trace, and the same for its causes.
public final class PlaceholderException extends RuntimeException {
  private final String exceptionClassName;

  public PlaceholderException(String exceptionClassName, @Nullable String message, @Nullable Throwable cause) {
    super(message, cause);
    this.exceptionClassName = exceptionClassName;
  }

  public String getExceptionClassName() {
    return exceptionClassName;
  }

  static PlaceholderException of(Throwable failure) {
    return of(failure, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private static PlaceholderException of(Throwable failure, Set<Throwable> seen) {
    seen.add(failure);
    final Throwable cause = failure.getCause();
    final PlaceholderException placeholderCause = cause == null || seen.contains(cause) ? null : of(cause, seen);
    final PlaceholderException placeholder = new PlaceholderException(failure.getClass().getName(), failure.getMessage(), placeholderCause);
    placeholder.setStackTrace(failure.getStackTrace());
    return placeholder;
  }

  @Override
  public String toString() {
    final String message = getLocalizedMessage();
    return message == null ? exceptionClassName : exceptionClassName + ": " + message;
  }
}
