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
import java.util.List;

/** {@code global a, b}. The names are bound to module variables in the enclosing scope. */
public final class DeclareGlobalNode extends Node {
  private final ImmutableList<String> names;

  public DeclareGlobalNode(List<String> names, SourcePosition position) {
    super(Kind.STATEMENT_DECLARE_GLOBAL, position);
    this.names = ImmutableList.copyOf(names);
  }

  public ImmutableList<String> getVariableNames() {
    return names;
  }

  @Override
  public String getDetail() {
    return String.join(", ", names);
  }
}
