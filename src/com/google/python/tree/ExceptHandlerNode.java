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
 * One {@code except type, target:} clause of a {@link TryExceptNode}. Both the type filter and the
 * target are optional.
 */
public final class ExceptHandlerNode extends Node {
  private static final ChildSlot EXCEPTION_TYPE = ChildSlot.one("exception_type");
  private static final ChildSlot TARGET = ChildSlot.one("target");
  private static final ChildSlot BRANCH = ChildSlot.one("branch");

  public ExceptHandlerNode(
      @Nullable Node exceptionType,
      @Nullable Node target,
      Node branch,
      SourcePosition position) {
    super(Kind.STATEMENT_EXCEPT_HANDLER, position, EXCEPTION_TYPE, TARGET, BRANCH);
    initChild(EXCEPTION_TYPE, exceptionType);
    initChild(TARGET, target);
    initChild(BRANCH, branch);
  }

  public @Nullable Node getExceptionType() {
    return getChildNode(EXCEPTION_TYPE);
  }

  public @Nullable Node getTarget() {
    return getChildNode(TARGET);
  }

  public @Nullable Node getBranch() {
    return getChildNode(BRANCH);
  }
}
