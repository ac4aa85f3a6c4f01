// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.ProviderInternal;

/// Handles providers seen in the object graph.
final class ProviderCodec implements Codec<ProviderInternal<?>> {
  private final FixedValueReplacingProviderCodec providerCodec;

  ProviderCodec(FixedValueReplacingProviderCodec providerCodec) {
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, ProviderInternal<?> value) {
    providerCodec.encodeProvider(context, value);
  }

  @Override
  public ProviderInternal<?> decode(ReadContext context) {
    return providerCodec.decodeProvider(context);
  }
}
