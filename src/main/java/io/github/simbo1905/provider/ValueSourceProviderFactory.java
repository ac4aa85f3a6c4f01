// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

/// Creates providers backed by a [ValueSource] that has not been obtained yet.
public interface ValueSourceProviderFactory {

  <T, P extends ValueSourceParameters> ValueSourceProvider<T, P> instantiateValueSourceProvider(
      Class<? extends ValueSource<T, P>> valueSourceType,
      Class<P> parametersType,
      P parameters
  );
}
