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

/**
 * Thrown when a scope assigns to a name that it already took from an enclosing non-module scope.
 *
 * <p>This is an error in the analyzed program, not in the tree. Drivers catch it and report it as a
 * diagnostic with the position of the offending binding.
 */
public final class BindingConflictException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String variableName;
  private final SourcePosition position;
  private final transient Node scope;

  public BindingConflictException(String variableName, Node scope, SourcePosition position) {
    super(
        "Name '"
            + variableName
            + "' is assigned to in "
            + scope.getDescription()
            + " after being used from an enclosing scope");
    this.variableName = checkNotNull(variableName);
    this.scope = scope;
    this.position = checkNotNull(position);
  }

  public String getVariableName() {
    return variableName;
  }

  /** Returns the scope in which the assignment happened. */
  public Node getScope() {
    return scope;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /** Returns the same conflict, reported at the position of the offending binding. */
  public BindingConflictException atPosition(SourcePosition bindingPosition) {
    return new BindingConflictException(variableName, scope, bindingPosition);
  }
}
