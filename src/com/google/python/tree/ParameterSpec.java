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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The parameter list of a function or lambda: the normal parameter names, the optional {@code
 * *args} and {@code **kwargs} names, and how many of the trailing normal parameters have defaults.
 *
 * <p>Once attached to its owner, it creates one {@link ParameterVariable} per name.
 */
public final class ParameterSpec {
  private final ImmutableList<String> normalArgs;
  private final @Nullable String listStarArg;
  private final @Nullable String dictStarArg;
  private final int defaultCount;

  private @Nullable Node owner;
  private ImmutableList<ParameterVariable> variables = ImmutableList.of();

  public ParameterSpec(
      List<String> normalArgs,
      @Nullable String listStarArg,
      @Nullable String dictStarArg,
      int defaultCount) {
    this.normalArgs = ImmutableList.copyOf(normalArgs);
    this.listStarArg = listStarArg;
    this.dictStarArg = dictStarArg;
    checkArgument(
        defaultCount >= 0 && defaultCount <= normalArgs.size(),
        "%s defaults for %s parameters",
        defaultCount,
        normalArgs.size());
    this.defaultCount = defaultCount;

    Set<String> seen = new HashSet<>();
    for (String name : getParameterNames()) {
      checkArgument(seen.add(name), "Duplicate parameter '%s'", name);
    }
  }

  /** A spec without any parameters. */
  public static ParameterSpec empty() {
    return new ParameterSpec(ImmutableList.of(), null, null, 0);
  }

  /** A spec with only normal parameters and no defaults. */
  public static ParameterSpec of(String... normalArgs) {
    return new ParameterSpec(ImmutableList.copyOf(normalArgs), null, null, 0);
  }

  void setOwner(Node newOwner) {
    checkState(owner == null, "Parameters already owned by %s", owner);
    owner = newOwner;
    ImmutableList.Builder<ParameterVariable> builder = ImmutableList.builder();
    for (String name : getParameterNames()) {
      builder.add(new ParameterVariable(newOwner, name));
    }
    variables = builder.build();
  }

  public @Nullable Node getOwner() {
    return owner;
  }

  public ImmutableList<String> getNormalParameterNames() {
    return normalArgs;
  }

  public @Nullable String getListStarArgName() {
    return listStarArg;
  }

  public @Nullable String getDictStarArgName() {
    return dictStarArg;
  }

  public int getDefaultCount() {
    return defaultCount;
  }

  /** Returns the names of the normal parameters that have a default, in order. */
  public ImmutableList<String> getDefaultParameterNames() {
    return normalArgs.subList(normalArgs.size() - defaultCount, normalArgs.size());
  }

  /** Returns all names: normal ones first, then the list star and dict star names if present. */
  public ImmutableList<String> getParameterNames() {
    ImmutableList.Builder<String> result = ImmutableList.<String>builder().addAll(normalArgs);
    if (listStarArg != null) {
      result.add(listStarArg);
    }
    if (dictStarArg != null) {
      result.add(dictStarArg);
    }
    return result.build();
  }

  /** Returns the parameter variables, empty until the owner is set. */
  public ImmutableList<ParameterVariable> getVariables() {
    return variables;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("ParameterSpec(");
    result.append(String.join(", ", normalArgs));
    if (listStarArg != null) {
      result.append(normalArgs.isEmpty() ? "" : ", ").append('*').append(listStarArg);
    }
    if (dictStarArg != null) {
      result
          .append(normalArgs.isEmpty() && listStarArg == null ? "" : ", ")
          .append("**")
          .append(dictStarArg);
    }
    return result.append(')').toString();
  }
}
