// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

/// Tuning for cache sessions. [#current()] reads the system properties:
/// - `provider.cache.buffer.size` initial capacity of a write buffer in bytes, default 4096, must be positive
/// - `provider.cache.max.problems` problems logged at WARNING per write session, default 512, must not be negative
public record CacheOptions(int bufferSize, int maxProblems) {

  public static final String BUFFER_SIZE_PROPERTY = "provider.cache.buffer.size";
  public static final String MAX_PROBLEMS_PROPERTY = "provider.cache.max.problems";
  public static final int DEFAULT_BUFFER_SIZE = 4096;
  public static final int DEFAULT_MAX_PROBLEMS = 512;

  public CacheOptions {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException(BUFFER_SIZE_PROPERTY + " must be positive, got: " + bufferSize);
    }
    if (maxProblems < 0) {
      throw new IllegalArgumentException(MAX_PROBLEMS_PROPERTY + " must not be negative, got: " + maxProblems);
    }
  }

  public static CacheOptions defaults() {
    return new CacheOptions(DEFAULT_BUFFER_SIZE, DEFAULT_MAX_PROBLEMS);
  }

  public static CacheOptions current() {
    return new CacheOptions(
        intProperty(BUFFER_SIZE_PROPERTY, DEFAULT_BUFFER_SIZE),
        intProperty(MAX_PROBLEMS_PROPERTY, DEFAULT_MAX_PROBLEMS));
  }

  private static int intProperty(String name, int defaultValue) {
    final String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + name + ": " + value + ". Must be an integer.");
    }
  }
}
