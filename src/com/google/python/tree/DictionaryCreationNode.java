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

/** A dict display. Keys and values are parallel sequences. */
public final class DictionaryCreationNode extends Node {
  private static final ChildSlot KEYS = ChildSlot.many("keys");
  private static final ChildSlot VALUES = ChildSlot.many("values");

  public DictionaryCreationNode(
      List<? extends Node> keys, List<? extends Node> values, SourcePosition position) {
    super(Kind.EXPRESSION_MAKE_DICTIONARY, position, KEYS, VALUES);
    checkArgument(
        keys.size() == values.size(), "%s keys for %s values", keys.size(), values.size());
    initChildren(KEYS, keys);
    initChildren(VALUES, values);
  }

  public ImmutableList<Node> getKeys() {
    return getChildListOrEmpty(KEYS);
  }

  public ImmutableList<Node> getValues() {
    return getChildListOrEmpty(VALUES);
  }
}
