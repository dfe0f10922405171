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

import org.jspecify.annotations.Nullable;

/** {@code while condition: frame else: else}. */
public final class WhileLoopNode extends Node implements BreakContinueIndicator {
  private static final ChildSlot CONDITION = ChildSlot.one("condition");
  private static final ChildSlot ELSE = ChildSlot.one("else");
  private static final ChildSlot FRAME = ChildSlot.one("frame");

  private boolean exceptionBreakContinue;

  public WhileLoopNode(
      Node condition, Node body, @Nullable Node noEnter, SourcePosition position) {
    super(Kind.STATEMENT_WHILE_LOOP, position, CONDITION, ELSE, FRAME);
    initChild(CONDITION, condition);
    initChild(ELSE, noEnter);
    initChild(FRAME, body);
  }

  public @Nullable Node getCondition() {
    return getChildNode(CONDITION);
  }

  public @Nullable Node getLoopBody() {
    return getChildNode(FRAME);
  }

  public @Nullable Node getNoEnter() {
    return getChildNode(ELSE);
  }

  @Override
  public void markAsExceptionBreakContinue() {
    exceptionBreakContinue = true;
  }

  @Override
  public boolean needsExceptionBreakContinue() {
    return exceptionBreakContinue;
  }
}
