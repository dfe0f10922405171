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

public final class TryFinallyNode extends Node {
  private static final ChildSlot TRIED = ChildSlot.one("tried");
  private static final ChildSlot FINAL = ChildSlot.one("final");

  public TryFinallyNode(Node tried, Node fin, SourcePosition position) {
    super(Kind.STATEMENT_TRY_FINALLY, position, TRIED, FINAL);
    initChild(TRIED, tried);
    initChild(FINAL, fin);
  }

  public @Nullable Node getBlockTry() {
    return getChildNode(TRIED);
  }

  public @Nullable Node getBlockFinal() {
    return getChildNode(FINAL);
  }
}
