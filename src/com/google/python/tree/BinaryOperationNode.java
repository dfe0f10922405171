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

import com.google.common.collect.ImmutableList;

public final class BinaryOperationNode extends Node {
  private static final ChildSlot OPERANDS = ChildSlot.many("operands");

  private final String operator;

  public BinaryOperationNode(String operator, Node left, Node right, SourcePosition position) {
    super(Kind.EXPRESSION_BINARY_OPERATION, position, OPERANDS);
    checkArgument(left.isExpression() && right.isExpression(), "Bad operands %s, %s", left, right);
    this.operator = checkNotNull(operator);
    initChildren(OPERANDS, ImmutableList.of(left, right));
  }

  public String getOperator() {
    return operator;
  }

  public ImmutableList<Node> getOperands() {
    return getChildListOrEmpty(OPERANDS);
  }

  @Override
  public String getDetail() {
    return operator;
  }
}
