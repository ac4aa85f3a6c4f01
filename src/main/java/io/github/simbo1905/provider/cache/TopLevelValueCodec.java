// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

/// Values in the graph that are neither providers nor properties go straight to the fallback codec.
final class TopLevelValueCodec implements Codec<Object> {

  @Override
  public void encode(WriteContext context, Object value) {
    context.write(value);
  }

  @Override
  public Object decode(ReadContext context) {
    return context.read();
  }
}
