// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.io.File;

public final class DirectoryProperty extends DefaultProperty<Directory> {

  public DirectoryProperty() {
    super(Directory.class);
  }

  @Override
  public DirectoryProperty fromState(ExecutionTimeValue<? extends Directory> state) {
    super.fromState(state);
    return this;
  }

  public void set(File directory) {
    set(new Directory(directory));
  }

  public ProviderInternal<Directory> dir(String path) {
    return Providers.of(() -> {
      final Directory directory = getOrNull();
      return directory == null ? null : directory.dir(path);
    });
  }

  public ProviderInternal<RegularFile> file(String path) {
    return Providers.of(() -> {
      final Directory directory = getOrNull();
      return directory == null ? null : directory.file(path);
    });
  }
}
