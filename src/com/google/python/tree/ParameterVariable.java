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

/** A local variable that is bound by the call arguments. */
public final class ParameterVariable extends LocalVariable {

  ParameterVariable(Node owner, String name) {
    super(owner, name);
  }

  @Override
  public boolean isParameterVariable() {
    return true;
  }

  @Override
  public String getCodeName() {
    return "_python_par_" + getName();
  }

  @Override
  String getKindDescription() {
    return "ParameterVariable";
  }
}
