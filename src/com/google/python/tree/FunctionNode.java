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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function definition statement.
 *
 * <p>Functions bind late: an assignment anywhere in the body makes a name local for the whole
 * body, so references can only be resolved after all assignments were seen. Defaults and
 * decorators are evaluated in the enclosing scope.
 */
public final class FunctionNode extends ClosureTakingNode implements NamedNode {
  private static final ChildSlot DECORATORS = ChildSlot.many("decorators");
  private static final ChildSlot DEFAULTS = ChildSlot.many("defaults");
  private static final ChildSlot BODY = ChildSlot.one(ChildSlot.BODY);

  private final String name;
  private final @Nullable String doc;
  private final ParameterSpec parameters;
  private @Nullable Variable targetVariable;
  private boolean generator;
  private boolean localsDict;

  public FunctionNode(
      VariableProvider provider,
      String name,
      @Nullable String doc,
      ParameterSpec parameters,
      List<? extends Node> defaults,
      List<? extends Node> decorators,
      SourcePosition position) {
    super(Kind.STATEMENT_FUNCTION_DEF, position, "function", provider, DECORATORS, DEFAULTS, BODY);
    this.name = checkNotNull(name);
    this.doc = doc;
    this.parameters = parameters;
    parameters.setOwner(this);
    registerProvidedVariables(parameters.getVariables());
    initChildren(DECORATORS, decorators);
    initChildren(DEFAULTS, defaults);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getFullName() {
    return NodeUtil.getFullName(this);
  }

  public @Nullable String getDoc() {
    return doc;
  }

  public ParameterSpec getParameters() {
    return parameters;
  }

  /** Returns the variable the function object is bound to, once resolved. */
  public @Nullable Variable getTargetVariable() {
    return targetVariable;
  }

  public void setTargetVariable(Variable variable) {
    this.targetVariable = checkNotNull(variable);
  }

  public ImmutableList<Node> getDecorators() {
    return getChildListOrEmpty(DECORATORS);
  }

  public ImmutableList<Node> getDefaultExpressions() {
    return getChildListOrEmpty(DEFAULTS);
  }

  /** Returns the default expressions keyed by the parameter they belong to. */
  public ImmutableMap<String, Node> getDefaultParameters() {
    return zipDefaults(parameters, getDefaultExpressions());
  }

  static ImmutableMap<String, Node> zipDefaults(ParameterSpec parameters, List<Node> defaults) {
    ImmutableList<String> names = parameters.getDefaultParameterNames();
    ImmutableMap.Builder<String, Node> result = ImmutableMap.builder();
    for (int i = 0; i < Math.min(names.size(), defaults.size()); i++) {
      result.put(names.get(i), defaults.get(i));
    }
    return result.buildOrThrow();
  }

  public @Nullable Node getBody() {
    return getChildNode(BODY);
  }

  public void setBody(@Nullable Node body) {
    initChild(BODY, body);
  }

  @Override
  public ImmutableList<Node> getSameScopeNodes() {
    return ImmutableList.<Node>builder()
        .addAll(getDefaultExpressions())
        .addAll(getDecorators())
        .build();
  }

  @Override
  public boolean evaluatesInEnclosingScope(Node child) {
    return getDefaultExpressions().contains(child) || getDecorators().contains(child);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    return new LocalVariable(this, variableName);
  }

  /**
   * Binds {@code variableName} locally, unless it was already taken. A taken module variable stays
   * global, anything else taken is a conflict.
   */
  @Override
  public Variable getVariableForAssignment(String variableName) {
    Variable taken = getTakenVariable(variableName);
    if (taken != null) {
      if (!taken.isModuleVariable()) {
        throw new BindingConflictException(variableName, this, getSourcePosition());
      }
      return taken;
    }
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

  public void markAsGenerator() {
    generator = true;
  }

  @Override
  public boolean hasLocalsDict() {
    return localsDict;
  }

  public void markAsLocalsDict() {
    localsDict = true;
  }

  @Override
  public String getDescription() {
    return "Function '"
        + name
        + "' with "
        + parameters
        + " at "
        + getSourcePosition().getAsString();
  }

  @Override
  public String getDetail() {
    return name;
  }
}
