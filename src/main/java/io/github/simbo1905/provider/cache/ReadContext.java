// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/// The read side of one cache session, mirroring [WriteContext].
public interface ReadContext {

  byte readByte();

  boolean readBoolean();

  int readInt();

  String readString();

  Class<?> readClass();

  byte[] readBytes();

  /// Read a value written by [WriteContext#write(Object)].
  @Nullable Object read();

  ReadIdentities sharedIdentities();

  /// The class loader used to resolve class references.
  ClassLoader classLoader();

  /// Read an id written by [WriteContext#encodePreservingSharedIdentityOf(Object, Runnable)]. The first time
  /// an id is read the body is decoded and recorded, later reads return the recorded instance.
  default <T> T decodePreservingSharedIdentity(@NotNull Supplier<T> readBody) {
    final ReadIdentities identities = sharedIdentities();
    final int id = readInt();
    if (identities.contains(id)) {
      @SuppressWarnings("unchecked") final T instance = (T) identities.getInstance(id);
      return instance;
    }
    identities.reserve(id);
    final T instance = Objects.requireNonNull(readBody.get(), "decoded shared instance must not be null");
    identities.putInstance(id, instance);
    return instance;
  }
}
