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
import org.jspecify.annotations.Nullable;

/**
 * {@code raise type, value, trace}. Each part may only be present if the ones before it are; a bare
 * {@code raise} has none.
 */
public final class RaiseNode extends Node {
  private static final ChildSlot EXCEPTION_TYPE = ChildSlot.one("exception_type");
  private static final ChildSlot EXCEPTION_VALUE = ChildSlot.one("exception_value");
  private static final ChildSlot EXCEPTION_TRACE = ChildSlot.one("exception_trace");

  public RaiseNode(
      @Nullable Node exceptionType,
      @Nullable Node exceptionValue,
      @Nullable Node exceptionTrace,
      SourcePosition position) {
    super(
        Kind.STATEMENT_RAISE_EXCEPTION, position, EXCEPTION_TYPE, EXCEPTION_VALUE, EXCEPTION_TRACE);
    checkArgument(exceptionValue == null || exceptionType != null, "Value without type");
    checkArgument(exceptionTrace == null || exceptionValue != null, "Trace without value");
    initChild(EXCEPTION_TYPE, exceptionType);
    initChild(EXCEPTION_VALUE, exceptionValue);
    initChild(EXCEPTION_TRACE, exceptionTrace);
  }

  /** Returns the present parts, in order. */
  public ImmutableList<Node> getExceptionParameters() {
    return getVisitableNodes();
  }

  public boolean isReraise() {
    return getChildNode(EXCEPTION_TYPE) == null;
  }
}
