// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

/// Writes and reads one kind of value.
public interface Codec<T> {

  void encode(WriteContext context, T value);

  T decode(ReadContext context);
}
