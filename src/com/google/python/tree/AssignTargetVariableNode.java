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

/** Assignment to a plain name. The variable is set once the binding is resolved. */
public final class AssignTargetVariableNode extends Node {
  private final String variableName;
  private @Nullable Variable variable;

  public AssignTargetVariableNode(String variableName, SourcePosition position) {
    super(Kind.ASSIGN_TO_VARIABLE, position);
    this.variableName = checkNotNull(variableName);
  }

  public String getTargetVariableName() {
    return variableName;
  }

  public @Nullable Variable getTargetVariable() {
    return variable;
  }

  public void setTargetVariable(Variable variable) {
    this.variable = checkNotNull(variable);
  }

  public boolean isResolved() {
    return variable != null;
  }

  @Override
  public String getDetail() {
    return "to variable " + variableName;
  }
}
