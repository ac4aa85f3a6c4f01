// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.Directory;
import io.github.simbo1905.provider.DirectoryProperty;
import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.FilePropertyFactory;

final class DirectoryPropertyCodec implements Codec<DirectoryProperty> {
  private final FilePropertyFactory filePropertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  DirectoryPropertyCodec(FilePropertyFactory filePropertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.filePropertyFactory = filePropertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, DirectoryProperty value) {
    context.writeClass(value.getType());
    providerCodec.encodeValue(context, value.calculateExecutionTimeValue());
  }

  @SuppressWarnings("unchecked")
  @Override
  public DirectoryProperty decode(ReadContext context) {
    DeclaredTypes.expect(context.readClass(), Directory.class);
    final ExecutionTimeValue<?> state = providerCodec.decodeValue(context);
    return filePropertyFactory.newDirectoryProperty().fromState((ExecutionTimeValue<? extends Directory>) state);
  }
}
