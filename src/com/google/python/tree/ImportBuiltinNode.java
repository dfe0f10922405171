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

import org.jspecify.annotations.Nullable;

/** A call of {@code __import__} whose module was determined at compile time. */
public final class ImportBuiltinNode extends Node {
  private final @Nullable PackageNode modulePackage;
  private final String moduleName;
  private final @Nullable String moduleFilename;

  public ImportBuiltinNode(
      @Nullable PackageNode modulePackage,
      String moduleName,
      @Nullable String moduleFilename,
      SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_IMPORT, position);
    this.modulePackage = modulePackage;
    this.moduleName = checkNotNull(moduleName);
    this.moduleFilename = moduleFilename;
  }

  public @Nullable PackageNode getModulePackage() {
    return modulePackage;
  }

  public String getModuleName() {
    return moduleName;
  }

  public @Nullable String getModuleFilename() {
    return moduleFilename;
  }

  @Override
  public String getDetail() {
    return moduleName;
  }
}
