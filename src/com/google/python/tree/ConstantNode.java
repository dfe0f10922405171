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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A literal constant.
 *
 * <p>Values are represented with Java types: {@link String}, {@link Number}, {@link Boolean}, the
 * {@link Singleton} values, {@link ImmutableList} for tuples, {@link ImmutableSet} for frozensets,
 * and other {@link List}, {@link Set} and {@link Map} instances for lists, sets and dicts. Any
 * other type is rejected.
 */
public final class ConstantNode extends Node {

  /** The constants that have no natural Java value. */
  public enum Singleton {
    NONE,
    ELLIPSIS
  }

  private final Object constant;
  private final boolean mutable;

  public ConstantNode(Object constant, SourcePosition position) {
    super(Kind.EXPRESSION_CONSTANT_REF, position);
    this.constant = checkNotNull(constant, "Use Singleton.NONE for None");
    this.mutable = isMutable(constant);
  }

  public static ConstantNode none(SourcePosition position) {
    return new ConstantNode(Singleton.NONE, position);
  }

  public Object getConstant() {
    return constant;
  }

  /**
   * Whether the value can change after creation, so that the generated code must not share a single
   * instance of it. Tuples and frozensets are mutable if any element is.
   */
  public boolean isMutable() {
    return mutable;
  }

  private static boolean isMutable(Object constant) {
    if (constant instanceof String
        || constant instanceof Number
        || constant instanceof Boolean
        || constant == Singleton.NONE) {
      return false;
    } else if (constant == Singleton.ELLIPSIS) {
      // Never shared between uses.
      return true;
    } else if (constant instanceof ImmutableList || constant instanceof ImmutableSet) {
      for (Object element : (Collection<?>) constant) {
        if (isMutable(element)) {
          return true;
        }
      }
      return false;
    } else if (constant instanceof List || constant instanceof Set || constant instanceof Map) {
      return true;
    }
    throw new IllegalArgumentException(
        "Unsupported constant type " + constant.getClass().getName() + ": " + constant);
  }

  public boolean isNone() {
    return constant == Singleton.NONE;
  }

  public boolean isNumberConstant() {
    return constant instanceof Number || constant instanceof Boolean;
  }

  public boolean isBoolConstant() {
    return constant instanceof Boolean;
  }

  public boolean isIterableConstant() {
    return constant instanceof String || constant instanceof Collection || constant instanceof Map;
  }

  @Override
  public String getDetail() {
    return constant instanceof String ? "'" + constant + "'" : String.valueOf(constant);
  }
}
