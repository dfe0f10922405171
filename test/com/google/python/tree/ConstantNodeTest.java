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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ConstantNode} */
@RunWith(JUnit4.class)
public final class ConstantNodeTest {
  private static final SourcePosition POS = SourcePosition.of("test.py", 1);

  private static boolean isMutable(Object value) {
    return new ConstantNode(value, POS).isMutable();
  }

  @Test
  public void testImmutableScalars() {
    assertThat(isMutable("text")).isFalse();
    assertThat(isMutable(42)).isFalse();
    assertThat(isMutable(4.2)).isFalse();
    assertThat(isMutable(true)).isFalse();
    assertThat(ConstantNode.none(POS).isMutable()).isFalse();
  }

  @Test
  public void testMutableContainers() {
    assertThat(isMutable(new ArrayList<>())).isTrue();
    assertThat(isMutable(new HashMap<>())).isTrue();
    assertThat(isMutable(ConstantNode.Singleton.ELLIPSIS)).isTrue();
  }

  @Test
  public void testTuplesAreMutableThroughElements() {
    assertThat(isMutable(ImmutableList.of(1, "a"))).isFalse();
    assertThat(isMutable(ImmutableList.of(1, ImmutableList.of(2)))).isFalse();
    assertThat(isMutable(ImmutableList.of(1, new ArrayList<>()))).isTrue();
    assertThat(isMutable(ImmutableSet.of(ImmutableList.of(new HashMap<>())))).isTrue();
  }

  @Test
  public void testUnsupportedType() {
    assertThrows(IllegalArgumentException.class, () -> new ConstantNode(new Object(), POS));
  }

  @Test
  public void testPredicates() {
    ConstantNode none = ConstantNode.none(POS);
    ConstantNode flag = new ConstantNode(false, POS);
    ConstantNode text = new ConstantNode("abc", POS);

    assertThat(none.isNone()).isTrue();
    assertThat(none.isIterableConstant()).isFalse();
    assertThat(flag.isBoolConstant()).isTrue();
    assertThat(flag.isNumberConstant()).isTrue();
    assertThat(text.isNumberConstant()).isFalse();
    assertThat(text.isIterableConstant()).isTrue();
    assertThat(text.getDetail()).isEqualTo("'abc'");
    assertThat(none.getDetail()).isEqualTo("NONE");
  }
}
