/*
 * Copyright 2026 The Restyle Authors.
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

package com.google.restyle.engine;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoOneOf;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Restyler formats source files: it parses each file, runs the configured passes over the tree and
 * prints the result.
 *
 * <p>Diagnostics recorded while styling are reported to the {@link ErrorHandler}. Parse errors and,
 * under {@link FailurePolicy#RAISE}, pass failures propagate to the caller and no output is
 * produced for the file.
 */
public final class Restyler {
  private static final Logger logger = Logger.getLogger(Restyler.class.getName());

  private final SourceParser parser;
  private final SourcePrinter printer;
  private final StylePipeline pipeline;
  private final ErrorHandler errorHandler;
  private final int lineLength;

  /**
   * @throws ConfigError if {@code options} name a pass {@code passConfig} does not know
   */
  public Restyler(
      SourceParser parser,
      SourcePrinter printer,
      PassConfig passConfig,
      StyleOptions options,
      ErrorHandler errorHandler) {
    this.parser = checkNotNull(parser);
    this.printer = checkNotNull(printer);
    this.pipeline = StylePipeline.create(passConfig, options);
    this.errorHandler = checkNotNull(errorHandler);
    this.lineLength = options.getLineLength();
  }

  /** The extensions of the files this restyler can format; empty if it can format any file. */
  public ImmutableSet<String> getSupportedExtensions() {
    return parser.getSupportedExtensions();
  }

  /** Whether the parser understands files with the extension of {@code filePath}. */
  public boolean canFormat(String filePath) {
    ImmutableSet<String> extensions = getSupportedExtensions();
    if (extensions.isEmpty()) {
      return true;
    }
    for (String extension : extensions) {
      if (filePath.endsWith(extension)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Parses and styles one file without printing it.
   *
   * @throws ParseError if the source cannot be parsed
   * @throws PassFailure if a pass fails and the policy is {@link FailurePolicy#RAISE}
   */
  public StyleResult style(String source, String filePath) {
    ParsedSource parsed = parser.parse(source, filePath);
    StyleResult result = pipeline.process(parsed.getTree(), parsed.getComments(), filePath);
    for (Diagnostic diagnostic : result.getDiagnostics()) {
      errorHandler.report(diagnostic.defaultLevel(), diagnostic);
    }
    return result;
  }

  /**
   * Formats one file.
   *
   * @throws ParseError if the source cannot be parsed
   * @throws PassFailure if a pass fails and the policy is {@link FailurePolicy#RAISE}
   */
  public String format(String source, String filePath) {
    StyleResult result = style(source, filePath);
    return printer.render(result.getRoot(), result.getComments(), lineLength);
  }

  /**
   * Formats many files on {@code executor}. A file that fails does not affect the others.
   *
   * <p>An {@link Error} thrown while formatting a file is not turned into an outcome. It is
   * rethrown once every file has finished, with the errors of later files added as suppressed.
   *
   * @param sourcesByPath The content of each file, by path.
   * @return The outcome for each file, in the iteration order of {@code sourcesByPath}.
   */
  public ImmutableMap<String, Outcome> formatAll(
      Map<String, String> sourcesByPath, ExecutorService executor) {
    Map<String, Future<String>> pending = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : sourcesByPath.entrySet()) {
      String path = entry.getKey();
      String source = entry.getValue();
      pending.put(path, executor.submit(() -> format(source, path)));
    }

    ImmutableMap.Builder<String, Outcome> outcomes = ImmutableMap.builder();
    Error error = null;
    for (Map.Entry<String, Future<String>> entry : pending.entrySet()) {
      try {
        outcomes.put(entry.getKey(), Outcome.formatted(entry.getValue().get()));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
          logger.severe("Error while formatting " + entry.getKey() + ": " + cause);
          if (error == null) {
            error = (Error) cause;
          } else {
            error.addSuppressed(cause);
          }
          continue;
        }
        if (!(cause instanceof RuntimeException)) {
          throw new IllegalStateException(cause);
        }
        logger.fine("Could not format " + entry.getKey() + ": " + cause.getMessage());
        outcomes.put(entry.getKey(), Outcome.failed((RuntimeException) cause));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeException(e);
      }
    }
    if (error != null) {
      throw error;
    }
    return outcomes.buildOrThrow();
  }

  /** The outcome of formatting one file in a batch: the output or the reason there is none. */
  @AutoOneOf(Outcome.Kind.class)
  public abstract static class Outcome {
    /** The kinds of outcome. */
    public enum Kind {
      FORMATTED,
      FAILED
    }

    public abstract Kind getKind();

    /** The formatted source. */
    public abstract String formatted();

    /** Typically a {@link ParseError} or a {@link PassFailure}. */
    public abstract RuntimeException failed();

    static Outcome formatted(String output) {
      return AutoOneOf_Restyler_Outcome.formatted(output);
    }

    static Outcome failed(RuntimeException failure) {
      return AutoOneOf_Restyler_Outcome.failed(failure);
    }
  }
}
