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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AnalysisOptions}. */
@RunWith(JUnit4.class)
public final class AnalysisOptionsTest {

  @Test
  public void testDefaults() {
    AnalysisOptions options = new AnalysisOptions();

    assertThat(options.shouldCheckTreeIntegrity()).isFalse();
    assertThat(options.shouldPrintTree()).isFalse();
    assertThat(options.getNumParallelModules()).isEqualTo(1);
    options.validate();
  }

  @Test
  public void testValidateParallelism() {
    AnalysisOptions options = new AnalysisOptions();
    options.setNumParallelModules(-2);

    AnalysisOptions.InvalidOptionsException e =
        assertThrows(AnalysisOptions.InvalidOptionsException.class, options::validate);
    assertThat(e).hasMessageThat().contains("-2");
  }
}
