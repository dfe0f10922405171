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


package com.google.python.compiler;

import static com.google.common.truth.Truth.assertThat;

import com.google.python.tree.PassNode;
import com.google.python.tree.SourcePosition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PyError} */
@RunWith(JUnit4.class)
public final class PyErrorTest {
  private static final DiagnosticType TYPE =
      DiagnosticType.warning("PY_TEST", "Name ''{0}'' in {1}");

  @Test
  public void testMakeWithoutSource() {
    PyError error = PyError.make(TYPE, "a", "b");

    assertThat(error.description()).isEqualTo("Name 'a' in b");
    assertThat(error.defaultLevel()).isEqualTo(CheckLevel.WARNING);
    assertThat(error.toString())
        .isEqualTo("PY_TEST. Name 'a' in b at (unknown source) line (unknown line)");
  }

  @Test
  public void testMakeFromNode() {
    PassNode pass = new PassNode(SourcePosition.of("m.py", 7));

    PyError error = PyError.make(pass, TYPE, "x", "y");

    assertThat(error.node()).isSameInstanceAs(pass);
    assertThat(error.sourceName()).isEqualTo("m.py");
    assertThat(error.lineno()).isEqualTo(7);
    assertThat(error.format(CheckLevel.ERROR))
        .isEqualTo("PY_TEST. Name 'x' in y at m.py line 7 [ERROR]");
    assertThat(error.format(CheckLevel.OFF)).isNull();
  }

  @Test
  public void testDiagnosticTypeIdentityIsItsKey() {
    assertThat(DiagnosticType.error("PY_TEST", "other")).isEqualTo(TYPE);
    assertThat(TYPE.toString()).isEqualTo("PY_TEST: Name ''{0}'' in {1}");
  }
}
