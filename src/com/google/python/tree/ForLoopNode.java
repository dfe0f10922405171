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

/**
 * {@code for target in iterated: frame else: else}. The loop body lives in the {@code frame} slot,
 * which belongs to the same scope as the loop.
 */
public final class ForLoopNode extends Node implements BreakContinueIndicator {
  private static final ChildSlot ITERATED = ChildSlot.one("iterated");
  private static final ChildSlot TARGET = ChildSlot.one("target");
  private static final ChildSlot ELSE = ChildSlot.one("else");
  private static final ChildSlot FRAME = ChildSlot.one("frame");

  private boolean exceptionBreakContinue;

  public ForLoopNode(
      Node source, Node target, Node body, @Nullable Node noBreak, SourcePosition position) {
    super(Kind.STATEMENT_FOR_LOOP, position, ITERATED, TARGET, ELSE, FRAME);
    initChild(ITERATED, source);
    initChild(TARGET, target);
    initChild(ELSE, noBreak);
    initChild(FRAME, body);
  }

  public @Nullable Node getIterated() {
    return getChildNode(ITERATED);
  }

  public @Nullable Node getLoopVariableAssignment() {
    return getChildNode(TARGET);
  }

  public @Nullable Node getBody() {
    return getChildNode(FRAME);
  }

  /** Returns the block run when the loop ends without {@code break}. */
  public @Nullable Node getNoBreak() {
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
