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
import org.jspecify.annotations.Nullable;

/** {@code yes if condition else no}. */
public final class ConditionalExpressionNode extends Node {
  private static final ChildSlot CONDITION = ChildSlot.one("condition");
  private static final ChildSlot EXPRESSION_YES = ChildSlot.one("expression_yes");
  private static final ChildSlot EXPRESSION_NO = ChildSlot.one("expression_no");

  public ConditionalExpressionNode(
      Node condition, Node yesExpression, Node noExpression, SourcePosition position) {
    super(Kind.EXPRESSION_CONDITIONAL, position, CONDITION, EXPRESSION_YES, EXPRESSION_NO);
    initChild(CONDITION, condition);
    initChild(EXPRESSION_YES, yesExpression);
    initChild(EXPRESSION_NO, noExpression);
  }

  public @Nullable Node getCondition() {
    return getChildNode(CONDITION);
  }

  public @Nullable Node getExpressionYes() {
    return getChildNode(EXPRESSION_YES);
  }

  public @Nullable Node getExpressionNo() {
    return getChildNode(EXPRESSION_NO);
  }

  public ImmutableList<Node> getBranches() {
    return ImmutableList.of(getExpressionYes(), getExpressionNo());
  }
}
