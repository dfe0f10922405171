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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A call, {@code called(positional, name=value, *list_star, **dict_star)}.
 *
 * <p>The names of the keyword arguments are kept beside the {@code named_args} slot, in the same
 * order as its values.
 */
public final class FunctionCallNode extends Node {
  private static final ChildSlot CALLED = ChildSlot.one("called");
  private static final ChildSlot POSITIONAL_ARGS = ChildSlot.many("positional_args");
  private static final ChildSlot NAMED_ARGS = ChildSlot.many("named_args");
  private static final ChildSlot LIST_STAR_ARG = ChildSlot.one("list_star_arg");
  private static final ChildSlot DICT_STAR_ARG = ChildSlot.one("dict_star_arg");

  private final ImmutableList<String> namedArgumentNames;

  public FunctionCallNode(
      Node called,
      List<? extends Node> positionalArgs,
      Map<String, ? extends Node> namedArgs,
      @Nullable Node listStarArg,
      @Nullable Node dictStarArg,
      SourcePosition position) {
    super(
        Kind.EXPRESSION_FUNCTION_CALL,
        position,
        CALLED,
        POSITIONAL_ARGS,
        NAMED_ARGS,
        LIST_STAR_ARG,
        DICT_STAR_ARG);
    checkArgument(called.isExpression(), "Not callable: %s", called);
    for (Node arg : positionalArgs) {
      checkArgument(arg.isExpression(), "Not an argument: %s", arg);
    }
    this.namedArgumentNames = ImmutableList.copyOf(namedArgs.keySet());
    initChild(CALLED, called);
    initChildren(POSITIONAL_ARGS, positionalArgs);
    initChildren(NAMED_ARGS, ImmutableList.copyOf(namedArgs.values()));
    initChild(LIST_STAR_ARG, listStarArg);
    initChild(DICT_STAR_ARG, dictStarArg);
  }

  public @Nullable Node getCalledExpression() {
    return getChildNode(CALLED);
  }

  public ImmutableList<Node> getPositionalArguments() {
    return getChildListOrEmpty(POSITIONAL_ARGS);
  }

  /** Returns the keyword arguments in source order. */
  public ImmutableMap<String, Node> getNamedArguments() {
    ImmutableList<Node> values = getChildListOrEmpty(NAMED_ARGS);
    ImmutableMap.Builder<String, Node> result = ImmutableMap.builder();
    for (int i = 0; i < namedArgumentNames.size(); i++) {
      result.put(namedArgumentNames.get(i), values.get(i));
    }
    return result.buildOrThrow();
  }

  public @Nullable Node getStarListArg() {
    return getChildNode(LIST_STAR_ARG);
  }

  public @Nullable Node getStarDictArg() {
    return getChildNode(DICT_STAR_ARG);
  }

  public boolean isEmptyCall() {
    return getPositionalArguments().isEmpty() && hasOnlyPositionalArguments();
  }

  public boolean hasOnlyPositionalArguments() {
    return namedArgumentNames.isEmpty() && getStarListArg() == null && getStarDictArg() == null;
  }
}
