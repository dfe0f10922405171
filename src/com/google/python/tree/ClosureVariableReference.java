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

/**
 * Binds an inner scope to a variable of an enclosing, non-module scope. Each reference tells code
 * generation that a cell must be allocated for the referenced variable.
 */
public final class ClosureVariableReference extends Variable {

  private final Variable referenced;

  ClosureVariableReference(Node referencer, Variable referenced) {
    super(referencer, referenced.getName());
    checkArgument(
        !referenced.isModuleVariable(), "Module variables need no closure: %s", referenced);
    this.referenced = referenced;
  }

  /** Returns the scope that takes the variable from its enclosing scope. */
  public Node getReferencer() {
    return getOwner();
  }

  /** Returns the variable one scope out, which may itself be a closure reference. */
  public Variable getReferenced() {
    return referenced;
  }

  @Override
  public Variable getOriginalVariable() {
    return referenced.getOriginalVariable();
  }

  @Override
  public boolean isClosureReference() {
    return true;
  }

  @Override
  public String getCodeName() {
    return "_python_closure_" + getName();
  }

  @Override
  String getKindDescription() {
    return "ClosureVariableReference";
  }
}
