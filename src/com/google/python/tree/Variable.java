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

/**
 * A resolved name. Variables are created by the {@link VariableProvider} that owns them and are
 * unique per name within that provider.
 *
 * <p>Identity matters: a provider returns the same object for repeated lookups of a name, and code
 * generation relies on that.
 */
public abstract class Variable {

  private final Node owner;
  private final String name;

  Variable(Node owner, String name) {
    this.owner = checkNotNull(owner);
    this.name = checkNotNull(name);
    checkArgument(!name.isEmpty() && name.indexOf(' ') < 0, "Bad variable name '%s'", name);
  }

  public final String getName() {
    return name;
  }

  /** Returns the scope node that created this variable. */
  public final Node getOwner() {
    return owner;
  }

  public boolean isModuleVariable() {
    return false;
  }

  public boolean isLocalVariable() {
    return false;
  }

  public boolean isParameterVariable() {
    return false;
  }

  public boolean isLoopVariable() {
    return false;
  }

  public boolean isClassVariable() {
    return false;
  }

  public boolean isClosureReference() {
    return false;
  }

  /**
   * Returns the variable that actually holds the value: this variable, or for closure references
   * the end of the reference chain.
   */
  public Variable getOriginalVariable() {
    return this;
  }

  /** Returns the identifier used for this variable in generated code. */
  public abstract String getCodeName();

  abstract String getKindDescription();

  @Override
  public String toString() {
    return "<" + getKindDescription() + " '" + name + "' of " + owner.getDescription() + ">";
  }
}
