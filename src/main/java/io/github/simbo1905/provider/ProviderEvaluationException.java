// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

/// Thrown when evaluating a provider fails with a checked exception.
public class ProviderEvaluationException extends RuntimeException {
  public ProviderEvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
