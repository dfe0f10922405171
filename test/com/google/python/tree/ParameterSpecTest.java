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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ParameterSpec} */
@RunWith(JUnit4.class)
public final class ParameterSpecTest {
  private static final SourcePosition POS = SourcePosition.of("test.py", 1);

  @Test
  public void testNames() {
    ParameterSpec spec = new ParameterSpec(ImmutableList.of("a", "b", "c"), "rest", "options", 2);

    assertThat(spec.getParameterNames())
        .containsExactly("a", "b", "c", "rest", "options")
        .inOrder();
    assertThat(spec.getDefaultParameterNames()).containsExactly("b", "c").inOrder();
    assertThat(spec.toString()).isEqualTo("ParameterSpec(a, b, c, *rest, **options)");
  }

  @Test
  public void testStarOnlyToString() {
    assertThat(new ParameterSpec(ImmutableList.of(), null, "kw", 0).toString())
        .isEqualTo("ParameterSpec(**kw)");
    assertThat(ParameterSpec.empty().toString()).isEqualTo("ParameterSpec()");
  }

  @Test
  public void testRejectsDuplicates() {
    assertThrows(IllegalArgumentException.class, () -> ParameterSpec.of("a", "a"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ParameterSpec(ImmutableList.of("a"), "a", null, 0));
  }

  @Test
  public void testRejectsBadDefaultCount() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ParameterSpec(ImmutableList.of("a"), null, null, 2));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ParameterSpec(ImmutableList.of("a"), null, null, -1));
  }

  @Test
  public void testVariablesAppearWithOwner() {
    ParameterSpec spec = ParameterSpec.of("x", "y");
    assertThat(spec.getVariables()).isEmpty();

    LambdaNode lambda =
        new LambdaNode(new ModuleNode("m", null, POS), spec, ImmutableList.of(), POS);

    assertThat(spec.getOwner()).isSameInstanceAs(lambda);
    assertThat(NodeUtil.getNames(spec.getVariables())).containsExactly("x", "y").inOrder();
    assertThat(spec.getVariables().get(0).getOwner()).isSameInstanceAs(lambda);
  }

  @Test
  public void testSpecBelongsToOneScope() {
    ModuleNode module = new ModuleNode("m", null, POS);
    ParameterSpec spec = ParameterSpec.of("x");
    new LambdaNode(module, spec, ImmutableList.of(), POS);

    assertThrows(
        IllegalStateException.class,
        () -> new LambdaNode(module, spec, ImmutableList.of(), POS));
  }
}
