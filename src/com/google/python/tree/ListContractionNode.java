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

/**
 * A list comprehension. Its loop variables leak: they are bound in the enclosing scope and taken
 * from there, so they stay visible after the comprehension.
 */
public final class ListContractionNode extends ContractionNode {

  public ListContractionNode(VariableProvider provider, SourcePosition position) {
    super(Kind.EXPRESSION_LIST_CONTRACTION, position, "listcontr", provider);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    getProvider().getVariableForAssignment(variableName);
    return getClosureVariable(variableName);
  }
}
