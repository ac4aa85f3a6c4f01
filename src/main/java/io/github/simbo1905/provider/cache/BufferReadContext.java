// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// A [ReadContext] over a [ByteBuffer] positioned at the start of a session's bytes.
public final class BufferReadContext implements ReadContext {
  private static final Map<String, Class<?>> PRIMITIVE_TYPES = Map.of(
      "boolean", boolean.class,
      "byte", byte.class,
      "short", short.class,
      "char", char.class,
      "int", int.class,
      "long", long.class,
      "float", float.class,
      "double", double.class,
      "void", void.class
  );

  private final ByteBuffer buffer;
  private final ValueCodec valueCodec;
  private final ClassLoader classLoader;
  private final ReadIdentities sharedIdentities = new ReadIdentities();

  public BufferReadContext(@NotNull ByteBuffer buffer, @NotNull ValueCodec valueCodec, @NotNull ClassLoader classLoader) {
    this.buffer = Objects.requireNonNull(buffer, "buffer must not be null").order(ByteOrder.BIG_ENDIAN);
    this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec must not be null");
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
  }

  @Override
  public byte readByte() {
    return buffer.get();
  }

  @Override
  public boolean readBoolean() {
    final byte value = buffer.get();
    if (value != 0 && value != 1) {
      LOGGER.severe(() -> "Invalid boolean byte " + value + " at position " + (buffer.position() - 1));
      throw new IllegalStateException("Invalid boolean byte " + value + " at position " + (buffer.position() - 1));
    }
    return value == 1;
  }

  @Override
  public int readInt() {
    return ZigZagEncoding.getInt(buffer);
  }

  @Override
  public String readString() {
    return new String(readBytes(), StandardCharsets.UTF_8);
  }

  @Override
  public Class<?> readClass() {
    final String name = readString();
    LOGGER.finer(() -> "readClass " + name + " ending at position " + buffer.position());
    final Class<?> primitive = PRIMITIVE_TYPES.get(name);
    if (primitive != null) {
      return primitive;
    }
    try {
      return Class.forName(name, false, classLoader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Cannot resolve class reference " + name, e);
    }
  }

  @Override
  public byte[] readBytes() {
    final int length = readInt();
    if (length < 0 || length > buffer.remaining()) {
      LOGGER.severe(() -> "Invalid byte array length " + length + " with " + buffer.remaining() + " bytes remaining");
      throw new IllegalStateException("Invalid byte array length " + length + " with " + buffer.remaining() + " bytes remaining");
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  @Override
  public Object read() {
    return valueCodec.read(this);
  }

  @Override
  public ReadIdentities sharedIdentities() {
    return sharedIdentities;
  }

  @Override
  public ClassLoader classLoader() {
    return classLoader;
  }

  /// Number of bytes not read yet.
  public int remaining() {
    return buffer.remaining();
  }
}
