// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import java.io.File;

public final class RegularFileProperty extends DefaultProperty<RegularFile> {

  public RegularFileProperty() {
    super(RegularFile.class);
  }

  @Override
  public RegularFileProperty fromState(ExecutionTimeValue<? extends RegularFile> state) {
    super.fromState(state);
    return this;
  }

  public void set(File file) {
    set(new RegularFile(file));
  }
}
