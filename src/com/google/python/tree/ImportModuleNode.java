/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.python.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** {@code import a, b.c as d}. */
public final class ImportModuleNode extends Node {
  private final ImmutableList<ImportSpec> imports;

  public ImportModuleNode(List<ImportSpec> imports, SourcePosition position) {
    super(Kind.STATEMENT_IMPORT_MODULE, position);
    checkArgument(!imports.isEmpty(), "Nothing imported");
    this.imports = ImmutableList.copyOf(imports);
  }

  public ImmutableList<ImportSpec> getImports() {
    return imports;
  }

  /** Returns the filenames of the modules that were located. */
  public ImmutableList<String> getModuleFilenames() {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (ImportSpec spec : imports) {
      if (spec.getFilename() != null) {
        result.add(spec.getFilename());
      }
    }
    return result.build();
  }

  @Override
  public String getDetail() {
    return Joiner.on(";").join(imports);
  }
}
