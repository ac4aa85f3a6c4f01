// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import java.util.Objects;

/// One candidate of a [BindingsBackedCodec]: the codec used for values of `type`, written after the `tag` byte.
public record Binding(int tag, Class<?> type, Codec<?> codec) {

  /// Tags are written as a single unsigned byte.
  public static final int MAX_TAG = 255;

  public Binding {
    if (tag < 0 || tag > MAX_TAG) {
      throw new IllegalArgumentException("Binding tags must be between 0 and " + MAX_TAG + ", got: " + tag);
    }
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(codec, "codec must not be null");
  }

  boolean recognizes(Object value) {
    return type.isInstance(value);
  }

  void encode(WriteContext context, Object value) {
    @SuppressWarnings("unchecked") final var typedCodec = (Codec<Object>) codec;
    typedCodec.encode(context, value);
  }

  Object decode(ReadContext context) {
    return codec.decode(context);
  }
}
