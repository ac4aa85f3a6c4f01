// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import io.github.simbo1905.provider.ExecutionTimeValue;
import io.github.simbo1905.provider.FilePropertyFactory;
import io.github.simbo1905.provider.RegularFile;
import io.github.simbo1905.provider.RegularFileProperty;

final class RegularFilePropertyCodec implements Codec<RegularFileProperty> {
  private final FilePropertyFactory filePropertyFactory;
  private final FixedValueReplacingProviderCodec providerCodec;

  RegularFilePropertyCodec(FilePropertyFactory filePropertyFactory, FixedValueReplacingProviderCodec providerCodec) {
    this.filePropertyFactory = filePropertyFactory;
    this.providerCodec = providerCodec;
  }

  @Override
  public void encode(WriteContext context, RegularFileProperty value) {
    context.writeClass(value.getType());
    providerCodec.encodeValue(context, value.calculateExecutionTimeValue());
  }

  @SuppressWarnings("unchecked")
  @Override
  public RegularFileProperty decode(ReadContext context) {
    DeclaredTypes.expect(context.readClass(), RegularFile.class);
    final ExecutionTimeValue<?> state = providerCodec.decodeValue(context);
    return filePropertyFactory.newFileProperty().fromState((ExecutionTimeValue<? extends RegularFile>) state);
  }
}
