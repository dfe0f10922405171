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

/** {@code expression[lower:upper]}. */
public final class SliceLookupNode extends Node {
  private static final ChildSlot EXPRESSION = ChildSlot.one("expression");
  private static final ChildSlot LOWER = ChildSlot.one("lower");
  private static final ChildSlot UPPER = ChildSlot.one("upper");

  public SliceLookupNode(
      Node expression, @Nullable Node lower, @Nullable Node upper, SourcePosition position) {
    super(Kind.EXPRESSION_SLICE_REF, position, EXPRESSION, LOWER, UPPER);
    initChild(EXPRESSION, expression);
    initChild(LOWER, lower);
    initChild(UPPER, upper);
  }

  public @Nullable Node getLookupSource() {
    return getChildNode(EXPRESSION);
  }

  public @Nullable Node getLower() {
    return getChildNode(LOWER);
  }

  public @Nullable Node getUpper() {
    return getChildNode(UPPER);
  }
}
