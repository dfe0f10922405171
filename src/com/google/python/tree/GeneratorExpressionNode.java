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

/** A generator expression. It runs after its defining scope may have changed, so it binds late. */
public final class GeneratorExpressionNode extends ContractionNode {

  public GeneratorExpressionNode(VariableProvider provider, SourcePosition position) {
    super(Kind.EXPRESSION_GENERATOR_DEF, position, "genexpr", provider);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    return new LocalLoopVariable(this, variableName);
  }

  @Override
  public boolean isEarlyClosure() {
    return false;
  }
}
