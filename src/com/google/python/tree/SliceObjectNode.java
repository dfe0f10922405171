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

/** An extended slice, {@code lower:upper:step}, used as a subscript. */
public final class SliceObjectNode extends Node {
  private static final ChildSlot LOWER = ChildSlot.one("lower");
  private static final ChildSlot UPPER = ChildSlot.one("upper");
  private static final ChildSlot STEP = ChildSlot.one("step");

  public SliceObjectNode(
      @Nullable Node lower, @Nullable Node upper, @Nullable Node step, SourcePosition position) {
    super(Kind.EXPRESSION_SLICEOBJ_REF, position, LOWER, UPPER, STEP);
    initChild(LOWER, lower);
    initChild(UPPER, upper);
    initChild(STEP, step);
  }

  public @Nullable Node getLower() {
    return getChildNode(LOWER);
  }

  public @Nullable Node getUpper() {
    return getChildNode(UPPER);
  }

  public @Nullable Node getStep() {
    return getChildNode(STEP);
  }
}
