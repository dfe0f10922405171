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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A class definition statement.
 *
 * <p>Bases and decorators are evaluated in the scope enclosing the class. Names bound in the class
 * body are {@link ClassVariable}s; they are visible to the class body itself and to list
 * comprehensions in it, but not to functions, lambdas or other comprehensions nested in it.
 */
public final class ClassNode extends ClosureTakingNode implements NamedNode {
  private static final ChildSlot DECORATORS = ChildSlot.many("decorators");
  private static final ChildSlot BASES = ChildSlot.many("bases");
  private static final ChildSlot BODY = ChildSlot.one(ChildSlot.BODY);

  private final String name;
  private final @Nullable String doc;
  private @Nullable Variable targetVariable;
  private boolean localsDict;

  public ClassNode(
      VariableProvider provider,
      String name,
      @Nullable String doc,
      List<? extends Node> bases,
      List<? extends Node> decorators,
      SourcePosition position) {
    super(Kind.STATEMENT_CLASS_DEF, position, "class", provider, DECORATORS, BASES, BODY);
    this.name = checkNotNull(name);
    this.doc = doc;
    initChildren(DECORATORS, decorators);
    initChildren(BASES, bases);
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

  /** Returns the variable the class object is bound to, once resolved. */
  public @Nullable Variable getTargetVariable() {
    return targetVariable;
  }

  public void setTargetVariable(Variable variable) {
    this.targetVariable = checkNotNull(variable);
  }

  public ImmutableList<Node> getBaseClasses() {
    return getChildListOrEmpty(BASES);
  }

  public ImmutableList<Node> getDecorators() {
    return getChildListOrEmpty(DECORATORS);
  }

  public @Nullable Node getBody() {
    return getChildNode(BODY);
  }

  public void setBody(@Nullable Node body) {
    initChild(BODY, body);
  }

  @Override
  public ImmutableList<Node> getSameScopeNodes() {
    return ImmutableList.<Node>builder().addAll(getBaseClasses()).addAll(getDecorators()).build();
  }

  @Override
  public boolean evaluatesInEnclosingScope(Node child) {
    return getBaseClasses().contains(child) || getDecorators().contains(child);
  }

  @Override
  Variable createProvidedVariable(String variableName) {
    return new ClassVariable(this, variableName);
  }

  /** Every binding in a class body creates a new class variable, replacing an earlier one. */
  @Override
  public Variable getVariableForAssignment(String variableName) {
    Variable result = new ClassVariable(this, variableName);
    registerProvidedVariable(result);
    return result;
  }

  /** Class variables first, then the enclosing scopes. Taken names are not remembered. */
  @Override
  public Variable getVariableForReference(String variableName) {
    if (hasProvidedVariable(variableName)) {
      return getProvidedVariable(variableName);
    }
    return getClosureVariable(variableName);
  }

  public ImmutableList<Variable> getClassVariables() {
    ImmutableList.Builder<Variable> result = ImmutableList.builder();
    for (Variable variable : getProvidedVariables()) {
      if (variable.isClassVariable()) {
        result.add(variable);
      }
    }
    return result.build();
  }

  @Override
  public boolean isEarlyClosure() {
    return true;
  }

  @Override
  public boolean hasLocalsDict() {
    return localsDict;
  }

  public void markAsLocalsDict() {
    localsDict = true;
  }

  @Override
  public String getDetail() {
    return name;
  }
}
