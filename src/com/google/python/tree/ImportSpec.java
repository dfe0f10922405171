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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One imported name: the module or attribute name, the local name it is bound to if renamed, and
 * where the imported module was found. The package and filename are null for modules that were not
 * located at compile time.
 */
public final class ImportSpec {
  private final String name;
  private final @Nullable String localName;
  private final @Nullable String packageName;
  private final @Nullable String filename;

  public ImportSpec(
      String name,
      @Nullable String localName,
      @Nullable String packageName,
      @Nullable String filename) {
    this.name = checkNotNull(name);
    this.localName = localName;
    this.packageName = packageName;
    this.filename = filename;
  }

  public static ImportSpec of(String name) {
    return new ImportSpec(name, null, null, null);
  }

  public String getName() {
    return name;
  }

  /** Returns the name bound in the importing scope. */
  public String getLocalName() {
    return localName != null ? localName : name;
  }

  public @Nullable String getPackageName() {
    return packageName;
  }

  public @Nullable String getFilename() {
    return filename;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ImportSpec)) {
      return false;
    }
    ImportSpec that = (ImportSpec) o;
    return name.equals(that.name)
        && Objects.equals(localName, that.localName)
        && Objects.equals(packageName, that.packageName)
        && Objects.equals(filename, that.filename);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, localName, packageName, filename);
  }

  @Override
  public String toString() {
    return localName == null ? name : name + " as " + localName;
  }
}
