// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.Nullable;

/// The generic fallback encoder for values that no dedicated codec handles: fixed values, parameter objects
/// and changing providers of any other shape. It is supplied by the caller and must read back exactly what
/// it wrote, including null. It may use the context's stream primitives and identity table.
public interface ValueCodec {

  void write(WriteContext context, @Nullable Object value);

  @Nullable Object read(ReadContext context);
}
