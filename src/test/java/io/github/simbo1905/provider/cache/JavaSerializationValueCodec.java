// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;

/// Fallback codec for tests: a presence flag then the Java serialized bytes of the value.
final class JavaSerializationValueCodec implements ValueCodec {

  @Override
  public void write(WriteContext context, Object value) {
    if (value == null) {
      context.writeBoolean(false);
      return;
    }
    context.writeBoolean(true);
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(value);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + value.getClass().getName(), e);
    }
    context.writeBytes(bytes.toByteArray());
  }

  @Override
  public Object read(ReadContext context) {
    if (!context.readBoolean()) {
      return null;
    }
    final byte[] bytes = context.readBytes();
    try (ObjectInputStream in = new BrokenValueCodec.ClassLoaderObjectInputStream(new ByteArrayInputStream(bytes), context.classLoader())) {
      return in.readObject();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(e);
    }
  }
}
