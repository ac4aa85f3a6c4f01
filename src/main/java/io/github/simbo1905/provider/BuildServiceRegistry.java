// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.Nullable;

/// Tracks the shared services of a build by name.
public interface BuildServiceRegistry {

  /// Register a service, or return the provider already registered under the name.
  /// @param maxUsages the number of concurrent users allowed, zero or less for no limit
  <T extends BuildService<P>, P extends BuildServiceParameters> BuildServiceProvider<T, P> register(
      String name,
      Class<T> implementationType,
      @Nullable P parameters,
      int maxUsages
  );

  /// The usage limit recorded when the service was registered.
  int usageLimitOf(BuildServiceProvider<?, ?> provider);
}
