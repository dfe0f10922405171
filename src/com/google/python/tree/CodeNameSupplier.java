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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import org.jspecify.annotations.Nullable;

/**
 * Generates the code name of one named-code node and the sequence numbers of its named-code
 * descendants.
 *
 * <p>The generated format is {@code prefix_uid[_name]_of_anchorCodeName}, where the anchor is the
 * nearest named-code ancestor and {@code uid} is the count of same-kind requests made to that
 * anchor so far. Modules use {@code module_} followed by their dotted name, with dots written as
 * {@code __}. Given the same construction order, the names are identical across runs.
 */
final class CodeNameSupplier {
  private final String codePrefix;
  private final Multiset<Kind> counter = EnumMultiset.create(Kind.class);
  private @Nullable String codeName;

  CodeNameSupplier(String codePrefix) {
    this.codePrefix = checkNotNull(codePrefix);
  }

  String getCodePrefix() {
    return codePrefix;
  }

  int nextChildUid(Kind kind) {
    return counter.add(kind, 1) + 1;
  }

  String getCodeName(Node owner) {
    if (codeName == null) {
      codeName = computeCodeName(owner);
    }
    return codeName;
  }

  private String computeCodeName(Node owner) {
    if (owner instanceof ModuleNode) {
      return "module_" + ((ModuleNode) owner).getFullName().replace(".", "__");
    }

    NamedCode anchor = NodeUtil.getEnclosingNamedCode(owner);
    checkState(anchor != null, "No named code encloses %s", owner);

    StringBuilder result = new StringBuilder(codePrefix);
    result.append('_').append(anchor.getChildUid(owner));
    if (owner instanceof NamedNode) {
      result.append('_').append(((NamedNode) owner).getName());
    }
    result.append("_of_").append(anchor.getCodeName());
    return result.toString();
  }
}
