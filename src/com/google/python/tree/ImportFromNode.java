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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code from module import a, b as c}. An empty import list means {@code import *}. */
public final class ImportFromNode extends Node {
  private final String moduleName;
  private final @Nullable String modulePackage;
  private final @Nullable String moduleFilename;
  private final ImmutableList<ImportSpec> imports;

  public ImportFromNode(
      String moduleName,
      @Nullable String modulePackage,
      @Nullable String moduleFilename,
      List<ImportSpec> imports,
      SourcePosition position) {
    super(Kind.STATEMENT_IMPORT_FROM, position);
    this.moduleName = checkNotNull(moduleName);
    this.modulePackage = modulePackage;
    this.moduleFilename = moduleFilename;
    this.imports = ImmutableList.copyOf(imports);
  }

  public String getModuleName() {
    return moduleName;
  }

  public @Nullable String getModulePackage() {
    return modulePackage;
  }

  public @Nullable String getModuleFilename() {
    return moduleFilename;
  }

  public ImmutableList<ImportSpec> getImports() {
    return imports;
  }

  public boolean isStarImport() {
    return imports.isEmpty();
  }

  @Override
  public String getDetail() {
    return moduleName + ": " + (isStarImport() ? "*" : Joiner.on(";").join(imports));
  }
}
