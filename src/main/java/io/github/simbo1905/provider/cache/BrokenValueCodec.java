// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.BrokenValue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.io.UncheckedIOException;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Writes the failure captured by a [BrokenValue] with Java serialization. Writing never fails because of
/// the failure itself: when its object graph is not serializable a [PlaceholderException] is written instead.
///
/// Reading only accepts throwables and the JDK classes they are built from.
final class BrokenValueCodec implements Codec<BrokenValue> {

  static final long MAX_DEPTH = 1000;

  static final ObjectInputFilter FAILURE_FILTER = info -> {
    if (info.depth() > MAX_DEPTH) {
      return ObjectInputFilter.Status.REJECTED;
    }
    Class<?> type = info.serialClass();
    if (type == null) {
      return ObjectInputFilter.Status.UNDECIDED;
    }
    while (type.isArray()) {
      type = type.getComponentType();
    }
    if (type.isPrimitive() || Throwable.class.isAssignableFrom(type) || type.getName().startsWith("java.")) {
      return ObjectInputFilter.Status.ALLOWED;
    }
    final String rejected = type.getName();
    LOGGER.fine(() -> "Rejected " + rejected + " while reading a captured failure");
    return ObjectInputFilter.Status.REJECTED;
  };

  @Override
  public void encode(WriteContext context, BrokenValue value) {
    final Throwable failure = value.failure();
    byte[] bytes;
    try {
      bytes = serialize(failure);
    } catch (IOException | RuntimeException e) {
      LOGGER.fine(() -> "Failure " + failure.getClass().getName() + " is not serializable, writing a placeholder: " + e);
      try {
        bytes = serialize(PlaceholderException.of(failure));
      } catch (IOException placeholderFailure) {
        throw new UncheckedIOException("Could not serialize placeholder for " + failure.getClass().getName(), placeholderFailure);
      }
    }
    context.writeBytes(bytes);
  }

  @Override
  public BrokenValue decode(ReadContext context) {
    final byte[] bytes = context.readBytes();
    try (ObjectInputStream in = new ClassLoaderObjectInputStream(new ByteArrayInputStream(bytes), context.classLoader())) {
      in.setObjectInputFilter(FAILURE_FILTER);
      final Object failure = in.readObject();
      if (!(failure instanceof Throwable throwable)) {
        throw new IllegalStateException("Expected a captured failure but read " + (failure == null ? "null" : failure.getClass().getName()));
      }
      return new BrokenValue(throwable);
    } catch (IOException | ClassNotFoundException e) {
      throw new IllegalStateException("Could not read captured failure", e);
    }
  }

  private static byte[] serialize(Throwable failure) throws IOException {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(failure);
    }
    return bytes.toByteArray();
  }

  /// Resolves classes through the session's class loader.
  static final class ClassLoaderObjectInputStream extends ObjectInputStream {
    private final ClassLoader classLoader;

    ClassLoaderObjectInputStream(InputStream in, ClassLoader classLoader) throws IOException {
      super(in);
      this.classLoader = classLoader;
    }

    @Override
    protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
      try {
        return Class.forName(desc.getName(), false, classLoader);
      } catch (ClassNotFoundException e) {
        return super.resolveClass(desc);
      }
    }
  }
}
