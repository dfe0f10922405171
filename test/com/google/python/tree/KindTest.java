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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Kind} */
@RunWith(JUnit4.class)
public final class KindTest {

  @Test
  public void testEveryKindHasOneFamily() {
    for (Kind kind : Kind.values()) {
      int families = 0;
      families += kind.isModule() ? 1 : 0;
      families += kind.isStatement() ? 1 : 0;
      families += kind.isAssignTarget() ? 1 : 0;
      families += kind.isExpression() ? 1 : 0;
      families += kind == Kind.STATEMENTS_SEQUENCE ? 1 : 0;
      assertThat(families).isEqualTo(1);
    }
  }

  @Test
  public void testBuiltinsAreExpressions() {
    for (Kind kind : Kind.values()) {
      if (kind.isBuiltin()) {
        assertThat(kind.isExpression()).isTrue();
        assertThat(kind.name()).startsWith("EXPRESSION_BUILTIN_");
      }
    }
  }

  @Test
  public void testContractions() {
    assertThat(Kind.EXPRESSION_GENERATOR_DEF.isContraction()).isTrue();
    assertThat(Kind.EXPRESSION_LIST_CONTRACTION.isContraction()).isTrue();
    assertThat(Kind.EXPRESSION_SET_CONTRACTION.isContraction()).isTrue();
    assertThat(Kind.EXPRESSION_DICT_CONTRACTION.isContraction()).isTrue();
    assertThat(Kind.EXPRESSION_LAMBDA_DEF.isContraction()).isFalse();
    assertThat(Kind.EXPRESSION_DICT_PAIR.isContraction()).isFalse();
  }

  @Test
  public void testModuleKinds() {
    assertThat(Kind.MODULE.isModule()).isTrue();
    assertThat(Kind.PACKAGE.isModule()).isTrue();
    assertThat(Kind.MODULE.getFamily()).isEqualTo(Kind.Family.MODULE);
  }
}
