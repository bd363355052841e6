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

import org.charta.ast.ModuleDecl;
import org.charta.ir.IrEmitter;
import org.charta.ir.IrJson;
import org.charta.ir.IrModel.IrDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles Charta source text to IR: {@link Lexer}, then {@link Parser}, then {@link Resolver},
 * then {@link IrEmitter}.
 *
 * <p>Each step either succeeds or throws a {@link CompileError}, which aborts the compilation;
 * nothing is returned for a source with errors. Compilation does no I/O and keeps no state, so
 * independent sources may be compiled concurrently.
 */
public final class Compiler {

  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /**
   * Compiles {@code source} and returns the IR as JSON, using the default options overridden by
   * any {@code charta.*} system properties (see {@link CompilerOptions#fromSystemProperties}).
   */
  public static String compile(String source) {
    return compile(source, CompilerOptions.fromSystemProperties());
  }

  /**
   * Compiles a Charta module and returns the IR as JSON.
   *
   * @param source the program text
   * @param options the IR version and output style
   * @return the serialized IR document; identical inputs give identical output
   * @throws ParseError if {@code source} is not syntactically valid
   * @throws NameResolutionError if a name is declared twice or used without being declared
   * @throws EmissionError if the IR can't be serialized
   */
  public static String compile(String source, CompilerOptions options) {
    IrDocument document = compileToIr(source, options);
    String json = IrJson.get(options.prettyPrint).write(document);
    logger.debug("Module {}: wrote {} chars of IR", document.module.name, json.length());
    return json;
  }

  /** Compiles {@code source} to an IR document without serializing it. */
  public static IrDocument compileToIr(String source, CompilerOptions options) {
    ModuleDecl module = parseAndResolve(source);
    return IrEmitter.emit(module, options.irVersion);
  }

  /** Parses {@code source} and checks its names, returning the AST. */
  public static ModuleDecl parseAndResolve(String source) {
    ModuleDecl module = Parser.parse(source);
    logger.debug(
        "Parsed module {}: {} signals, {} coils, {} rungs, {} blocks, {} networks",
        module.name(),
        module.signals().size(),
        module.coils().size(),
        module.rungs().size(),
        module.blocks().size(),
        module.networks().size());
    Resolver.resolve(module);
    return module;
  }
}
