// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import java.nio.ByteBuffer;

/// Variable length zig-zag encoding of ints. Small magnitudes, positive or negative, take a single byte.
final class ZigZagEncoding {

  /// An int never needs more than five bytes.
  static final int MAX_BYTES = 5;

  private ZigZagEncoding() {
  }

  static void putInt(ByteBuffer buffer, int value) {
    int zigZag = (value << 1) ^ (value >> 31);
    while ((zigZag & ~0x7F) != 0) {
      buffer.put((byte) ((zigZag & 0x7F) | 0x80));
      zigZag >>>= 7;
    }
    buffer.put((byte) zigZag);
  }

  static int getInt(ByteBuffer buffer) {
    int result = 0;
    int shift = 0;
    byte b;
    do {
      if (shift >= MAX_BYTES * 7) {
        throw new IllegalStateException("Malformed varint at position " + buffer.position());
      }
      b = buffer.get();
      result |= (b & 0x7F) << shift;
      shift += 7;
    } while ((b & 0x80) != 0);
    return (result >>> 1) ^ -(result & 1);
  }

  static int sizeOf(int value) {
    int zigZag = (value << 1) ^ (value >> 31);
    int size = 1;
    while ((zigZag & ~0x7F) != 0) {
      size++;
      zigZag >>>= 7;
    }
    return size;
  }
}
