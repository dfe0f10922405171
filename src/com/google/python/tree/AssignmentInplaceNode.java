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

/** {@code target op= expression}, e.g. {@code x += 1}. */
public final class AssignmentInplaceNode extends Node {
  private static final ChildSlot EXPRESSION = ChildSlot.one("expression");
  private static final ChildSlot TARGET = ChildSlot.one("target");

  private final String operator;

  public AssignmentInplaceNode(
      Node target, String operator, Node expression, SourcePosition position) {
    super(Kind.STATEMENT_ASSIGNMENT_INPLACE, position, EXPRESSION, TARGET);
    this.operator = checkNotNull(operator);
    initChild(EXPRESSION, expression);
    initChild(TARGET, target);
  }

  public String getOperator() {
    return operator;
  }

  public @Nullable Node getTarget() {
    return getChildNode(TARGET);
  }

  public @Nullable Node getExpression() {
    return getChildNode(EXPRESSION);
  }

  @Override
  public String getDetail() {
    return "to " + getTarget();
  }
}
