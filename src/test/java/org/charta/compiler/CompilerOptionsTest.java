/*
 * Copyright 2025 The Charta Authors
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

package org.charta.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompilerOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty(CompilerOptions.IR_VERSION_PROPERTY);
    System.clearProperty(CompilerOptions.PRETTY_PRINT_PROPERTY);
  }

  @Test
  public void defaults() {
    assertThat(CompilerOptions.DEFAULT.irVersion).isEqualTo("0.1.0");
    assertThat(CompilerOptions.DEFAULT.prettyPrint).isTrue();
    assertThat(CompilerOptions.DEFAULT.toString())
        .isEqualTo("CompilerOptions{irVersion=0.1.0, prettyPrint=true}");
  }

  @Test
  public void builder() {
    CompilerOptions options =
        CompilerOptions.builder().irVersion("1.2.3").prettyPrint(false).build();
    assertThat(options.irVersion).isEqualTo("1.2.3");
    assertThat(options.prettyPrint).isFalse();
    assertThrows(NullPointerException.class, () -> CompilerOptions.builder().irVersion(null));
  }

  @Test
  public void unsetPropertiesGiveDefaults() {
    CompilerOptions options = CompilerOptions.fromSystemProperties();
    assertThat(options.irVersion).isEqualTo(CompilerOptions.DEFAULT.irVersion);
    assertThat(options.prettyPrint).isTrue();
  }

  @Test
  public void propertiesOverrideDefaults() {
    System.setProperty(CompilerOptions.IR_VERSION_PROPERTY, "0.2.0");
    System.setProperty(CompilerOptions.PRETTY_PRINT_PROPERTY, "false");
    CompilerOptions options = CompilerOptions.fromSystemProperties();
    assertThat(options.irVersion).isEqualTo("0.2.0");
    assertThat(options.prettyPrint).isFalse();
  }

  @Test
  public void compileReadsProperties() {
    assertThat(Compiler.compile("module m")).startsWith("{\n  \"version\": \"0.1.0\",");
    System.setProperty(CompilerOptions.IR_VERSION_PROPERTY, "9.9");
    System.setProperty(CompilerOptions.PRETTY_PRINT_PROPERTY, "false");
    assertThat(Compiler.compile("module m")).startsWith("{\"version\":\"9.9\",\"module\":");
  }
}
