// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// A [WriteContext] over a heap [ByteBuffer] that doubles its capacity when it runs out of room.
public final class BufferWriteContext implements WriteContext {
  private final ValueCodec valueCodec;
  private final ProblemsListener problems;
  private final WriteIdentities sharedIdentities = new WriteIdentities();
  private ByteBuffer buffer;

  public BufferWriteContext(@NotNull ValueCodec valueCodec, @NotNull ProblemsListener problems, int initialCapacity) {
    this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec must not be null");
    this.problems = Objects.requireNonNull(problems, "problems must not be null");
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive, got: " + initialCapacity);
    }
    this.buffer = ByteBuffer.allocate(initialCapacity).order(ByteOrder.BIG_ENDIAN);
  }

  @Override
  public void writeByte(byte value) {
    ensureRemaining(Byte.BYTES);
    buffer.put(value);
  }

  @Override
  public void writeBoolean(boolean value) {
    writeByte(value ? (byte) 1 : (byte) 0);
  }

  @Override
  public void writeInt(int value) {
    ensureRemaining(ZigZagEncoding.sizeOf(value));
    ZigZagEncoding.putInt(buffer, value);
  }

  @Override
  public void writeString(@NotNull String value) {
    Objects.requireNonNull(value, "value must not be null");
    writeBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void writeClass(@NotNull Class<?> type) {
    Objects.requireNonNull(type, "type must not be null");
    LOGGER.finer(() -> "writeClass " + type.getName() + " at position " + buffer.position());
    writeString(type.getName());
  }

  @Override
  public void writeBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    writeInt(bytes.length);
    ensureRemaining(bytes.length);
    buffer.put(bytes);
  }

  @Override
  public void write(Object value) {
    LOGGER.finer(() -> "write value of " + (value == null ? "null" : value.getClass().getName()) + " at position " + buffer.position());
    valueCodec.write(this, value);
  }

  @Override
  public WriteIdentities sharedIdentities() {
    return sharedIdentities;
  }

  @Override
  public ProblemsListener problems() {
    return problems;
  }

  /// Number of bytes written so far.
  public int size() {
    return buffer.position();
  }

  /// A copy of the bytes written so far.
  public byte[] toByteArray() {
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  private void ensureRemaining(int needed) {
    if (buffer.remaining() >= needed) {
      return;
    }
    int capacity = buffer.capacity();
    while (capacity - buffer.position() < needed) {
      if (capacity > Integer.MAX_VALUE / 2) {
        throw new IllegalStateException("Cannot grow write buffer beyond " + capacity + " bytes");
      }
      capacity *= 2;
    }
    final int newCapacity = capacity;
    LOGGER.finer(() -> "Growing write buffer from " + buffer.capacity() + " to " + newCapacity + " bytes");
    final ByteBuffer grown = ByteBuffer.allocate(newCapacity).order(buffer.order());
    buffer.flip();
    grown.put(buffer);
    buffer = grown;
  }
}
