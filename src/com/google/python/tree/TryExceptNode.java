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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * {@code try}/{@code except}/{@code else}. Each {@code except} clause is an {@link
 * ExceptHandlerNode}; the {@code else} block runs only if the tried block raised nothing.
 */
public final class TryExceptNode extends Node {
  private static final ChildSlot TRIED = ChildSlot.one("tried");
  private static final ChildSlot HANDLERS = ChildSlot.many("handlers");
  private static final ChildSlot NO_RAISE = ChildSlot.one("no_raise");

  public TryExceptNode(
      Node tried,
      List<ExceptHandlerNode> handlers,
      @Nullable Node noRaise,
      SourcePosition position) {
    super(Kind.STATEMENT_TRY_EXCEPT, position, TRIED, HANDLERS, NO_RAISE);
    checkArgument(!handlers.isEmpty(), "try without except clause");
    initChild(TRIED, tried);
    initChildren(HANDLERS, handlers);
    initChild(NO_RAISE, noRaise);
  }

  public @Nullable Node getBlockTry() {
    return getChildNode(TRIED);
  }

  public @Nullable Node getBlockNoRaise() {
    return getChildNode(NO_RAISE);
  }

  public ImmutableList<Node> getHandlers() {
    return getChildListOrEmpty(HANDLERS);
  }
}
