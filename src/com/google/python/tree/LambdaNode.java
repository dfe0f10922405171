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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A lambda expression. Binds late like a function; its defaults belong to the enclosing scope. */
public final class LambdaNode extends ClosureTakingNode {
  private static final ChildSlot DEFAULTS = ChildSlot.many("defaults");
  private static final ChildSlot BODY = ChildSlot.one(ChildSlot.BODY);

  private final ParameterSpec parameters;
  private boolean generator;

  public LambdaNode(
      VariableProvider provider,
      ParameterSpec parameters,
      List<? extends Node> defaults,
      SourcePosition position) {
    super(Kind.EXPRESSION_LAMBDA_DEF, position, "lambda", provider, DEFAULTS, BODY);
    this.parameters = parameters;
    parameters.setOwner(this);
    registerProvidedVariables(parameters.getVariables());
    initChildren(DEFAULTS, defaults);
  }

  public ParameterSpec getParameters() {
    return parameters;
  }

  public ImmutableList<Node> getDefaultExpressions() {
    return getChildListOrEmpty(DEFAULTS);
  }

  public ImmutableMap<String, Node> getDefaultParameters() {
    return FunctionNode.zipDefaults(parameters, getDefaultExpressions());
  }

  /** Returns the expression the lambda evaluates to. */
  public @Nullable Node getLambdaExpression() {
    return getChildNode(BODY);
  }

  public void setBody(@Nullable Node body) {
    initChild(BODY, body);
  }

  @Override
  public ImmutableList<Node> getSameScopeNodes() {
    return getDefaultExpressions();
  }

  @Override
  public boolean evaluatesInEnclosingScope(Node child) {
    return getDefaultExpressions().contains(child);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    return new LocalVariable(this, variableName);
  }

  @Override
  public Variable getVariableForAssignment(String variableName) {
    return getProvidedVariable(variableName);
  }

  @Override
  public Variable getVariableForReference(String variableName) {
    return getVariableForReferenceOrTake(variableName);
  }

  @Override
  public boolean isEarlyClosure() {
    return false;
  }

  public boolean isGenerator() {
    return generator;
  }

  /** Marks the lambda as containing a {@code yield}. */
  public void markAsGenerator() {
    generator = true;
  }
}
