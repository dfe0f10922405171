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
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * A module, the only possible root of a tree. When there are many modules they form a forest.
 *
 * <p>Every name bound or used at module level is a {@link ModuleVariable}, created on first use.
 */
public class ModuleNode extends ScopeNode implements NamedNode {
  private static final ChildSlot BODY = ChildSlot.one(ChildSlot.BODY);

  private final String name;
  private final @Nullable String packageName;
  private @Nullable String doc;

  public ModuleNode(String name, @Nullable String packageName, SourcePosition position) {
    this(Kind.MODULE, name, packageName, position);
  }

  ModuleNode(Kind kind, String name, @Nullable String packageName, SourcePosition position) {
    super(kind, position, "module", BODY);
    checkArgument(!name.contains("."), "Module name '%s' must not be dotted", name);
    checkArgument(packageName == null || !packageName.isEmpty(), "Empty package name");
    this.name = checkNotNull(name);
    this.packageName = packageName;
  }

  @Override
  public String getName() {
    return name;
  }

  public @Nullable String getPackageName() {
    return packageName;
  }

  /** Returns the dotted name, e.g. {@code "os.path"}. */
  @Override
  public String getFullName() {
    return packageName == null ? name : packageName + "." + name;
  }

  public String getFilename() {
    return getSourcePosition().getFilename();
  }

  public @Nullable String getDoc() {
    return doc;
  }

  public void setDoc(@Nullable String doc) {
    this.doc = doc;
  }

  public @Nullable Node getBody() {
    return getChildNode(BODY);
  }

  public void setBody(@Nullable Node body) {
    initChild(BODY, body);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    return new ModuleVariable(this, variableName);
  }

  @Override
  public Variable getVariableForAssignment(String variableName) {
    return getProvidedVariable(variableName);
  }

  @Override
  public Variable getVariableForReference(String variableName) {
    return getProvidedVariable(variableName);
  }

  @Override
  public boolean isEarlyClosure() {
    return true;
  }

  @Override
  public String getDetail() {
    return getFullName();
  }
}
