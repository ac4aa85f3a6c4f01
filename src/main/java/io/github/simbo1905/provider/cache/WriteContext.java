// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/// The write side of one cache session: the stream primitives, the identity table and the problems sink.
/// A context is used by a single traversal and is never shared between sessions.
public interface WriteContext {

  void writeByte(byte value);

  void writeBoolean(boolean value);

  /// Write a signed int as a zig-zag varint.
  void writeInt(int value);

  /// Write a UTF-8 string.
  void writeString(@NotNull String value);

  /// Write a reference to a class that the reader resolves by name.
  void writeClass(@NotNull Class<?> type);

  /// Write a length prefixed byte array.
  void writeBytes(byte[] bytes);

  /// Write an arbitrary, nullable value with the fallback [ValueCodec].
  void write(@Nullable Object value);

  WriteIdentities sharedIdentities();

  ProblemsListener problems();

  /// Write the id of `value` and, the first time the instance is seen in this session, its body.
  /// The id is assigned before the body is written so nested shared instances are numbered after it.
  default void encodePreservingSharedIdentityOf(@NotNull Object value, @NotNull Runnable writeBody) {
    final WriteIdentities identities = sharedIdentities();
    final Integer id = identities.getId(value);
    if (id != null) {
      writeInt(id);
      return;
    }
    final int newId = identities.putInstance(value);
    writeInt(newId);
    writeBody.run();
  }
}
