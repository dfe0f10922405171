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

/** {@code type(name, bases, dict)}, which creates a class. */
public final class Type3BuiltinNode extends Node {
  private static final ChildSlot TYPE_NAME = ChildSlot.one("type_name");
  private static final ChildSlot BASES = ChildSlot.one("bases");
  private static final ChildSlot DICT = ChildSlot.one("dict");

  public Type3BuiltinNode(Node typeName, Node bases, Node typeDict, SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_TYPE3, position, TYPE_NAME, BASES, DICT);
    initChild(TYPE_NAME, typeName);
    initChild(BASES, bases);
    initChild(DICT, typeDict);
  }

  public @Nullable Node getTypeName() {
    return getChildNode(TYPE_NAME);
  }

  public @Nullable Node getBases() {
    return getChildNode(BASES);
  }

  public @Nullable Node getDict() {
    return getChildNode(DICT);
  }
}
