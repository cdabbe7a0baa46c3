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
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.restyle.tree.CommentAnchoring;
import com.google.restyle.tree.CommentAnchoringPolicy;
import com.google.restyle.tree.Comments;
import com.google.restyle.tree.Node;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an ordered list of passes over the tree of one file.
 *
 * <p>Passes run one after the other, each on the tree and context the previous one produced. A pass
 * whose ignore prefixes cover the file is not run at all. A pass either completes or has no effect:
 * when it throws, its partial edits are discarded and the {@link FailurePolicy} decides whether the
 * run goes on from the pre-pass tree or aborts.
 *
 * <p>A pipeline holds no per-file state and may be shared between threads.
 */
public final class StylePipeline {
  private static final Logger logger = Logger.getLogger(StylePipeline.class.getName());

  private final ImmutableList<PassFactory> passes;
  private final FailurePolicy failurePolicy;
  private final Path workingDirectory;
  private final CommentAnchoringPolicy anchoringPolicy;

  /**
   * @param passes The passes to run, in order.
   * @param failurePolicy What to do when a pass throws.
   * @param workingDirectory The directory relative file paths and ignore prefixes are resolved
   *     against.
   * @param anchoringPolicy The policy passes use for comments of removed code.
   */
  public StylePipeline(
      List<PassFactory> passes,
      FailurePolicy failurePolicy,
      Path workingDirectory,
      CommentAnchoringPolicy anchoringPolicy) {
    this.passes = ImmutableList.copyOf(passes);
    this.failurePolicy = checkNotNull(failurePolicy);
    this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    this.anchoringPolicy = checkNotNull(anchoringPolicy);
  }

  /**
   * Creates the pipeline described by {@code options}.
   *
   * @throws ConfigError if the options name a pass {@code config} does not know
   */
  public static StylePipeline create(PassConfig config, StyleOptions options) {
    return new StylePipeline(
        config.resolve(options.getEnabledPasses()),
        options.getFailurePolicy(),
        options.getWorkingDirectory(),
        options.getCommentAnchoring());
  }

  /**
   * Runs {@code passes} over one file, resolving paths against the current directory and
   * anchoring comments by line.
   */
  public static StyleResult run(
      Node tree,
      Comments comments,
      String filePath,
      List<PassFactory> passes,
      FailurePolicy failurePolicy) {
    return new StylePipeline(
            passes, failurePolicy, Paths.get("").toAbsolutePath(), CommentAnchoring.BY_LINE)
        .process(tree, comments, filePath);
  }

  /**
   * Runs every enabled pass over the tree of one file.
   *
   * @param tree The tree of the file.
   * @param comments The comments of the file.
   * @param filePath The path of the file, absolute or relative to the working directory.
   * @return The final tree and comments, with one diagnostic per pass that failed.
   * @throws PassFailure if a pass throws and the policy is {@link FailurePolicy#RAISE}
   */
  public StyleResult process(Node tree, Comments comments, String filePath) {
    StyleContext context =
        StyleContext.builder()
            .setFilePath(filePath)
            .setComments(comments)
            .setAnchoringPolicy(anchoringPolicy)
            .build();
    Node root = tree;

    for (PassFactory factory : getEnabledPasses(filePath)) {
      if (Thread.interrupted()) {
        throw new RuntimeException(new InterruptedException());
      }
      logger.fine("Running pass " + factory.getName());
      PassResult result = runPass(factory, root, context);
      switch (result.getKind()) {
        case COMPLETED:
          root = result.completed().getRoot();
          context = result.completed().getContext();
          break;
        case FAILED:
          context = handleFailure(result.failed(), context);
          break;
      }
    }
    return StyleResult.create(root, context.getComments(), context.getDiagnostics());
  }

  /** Returns the passes that apply to {@code filePath}, in order. */
  @VisibleForTesting
  ImmutableList<PassFactory> getEnabledPasses(String filePath) {
    ImmutableList.Builder<PassFactory> enabled = ImmutableList.builder();
    for (PassFactory factory : passes) {
      if (isIgnored(factory, filePath)) {
        logger.fine("Skipping pass " + factory.getName() + " for " + filePath);
      } else {
        enabled.add(factory);
      }
    }
    return enabled.build();
  }

  private boolean isIgnored(PassFactory factory, String filePath) {
    if (factory.getIgnorePrefixes().isEmpty()) {
      return false;
    }
    String absolutePath = workingDirectory.resolve(filePath).normalize().toString();
    for (String prefix : factory.getIgnorePrefixes()) {
      if (absolutePath.startsWith(resolvePrefix(prefix))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Resolves a prefix against the working directory. A prefix ending in a separator only matches
   * files inside that directory, so {@code lib/} does not cover {@code library/}.
   */
  private String resolvePrefix(String prefix) {
    String resolved = workingDirectory.resolve(prefix).normalize().toString();
    if (prefix.endsWith("/") && !resolved.endsWith("/")) {
      resolved += "/";
    }
    return resolved;
  }

  private static PassResult runPass(PassFactory factory, Node root, StyleContext context) {
    try {
      return PassResult.completed(TreeTraversal.traverse(root, context, factory.create()));
    } catch (RuntimeException e) {
      return PassResult.failed(new PassFailure(factory.getName(), context.getFilePath(), e));
    } catch (StackOverflowError e) {
      RuntimeException cause = new IllegalStateException("Pass recursed too deeply", e);
      return PassResult.failed(new PassFailure(factory.getName(), context.getFilePath(), cause));
    }
  }

  /**
   * Raises {@code failure} or records it, depending on the policy. The returned context is the one
   * the failed pass started with. A recorded failure is reported by whoever consumes the
   * diagnostics, so it is only logged here at {@code FINE}.
   */
  private StyleContext handleFailure(PassFailure failure, StyleContext context) {
    if (failurePolicy == FailurePolicy.RAISE) {
      throw failure;
    }
    logger.log(Level.FINE, failure.getMessage(), failure);
    RuntimeException cause = failure.getCause();
    return context.withDiagnostic(
        Diagnostic.builder(StyleDiagnostics.PASS_FAILURE, failure.getPassName(), cause)
            .setPassName(failure.getPassName())
            .setSourceLocation(failure.getFilePath(), -1)
            .setCause(cause)
            .build());
  }

  /** The outcome of running a single pass: its traversal result or the failure it raised. */
  @AutoOneOf(PassResult.Kind.class)
  abstract static class PassResult {
    enum Kind {
      COMPLETED,
      FAILED
    }

    abstract Kind getKind();

    abstract TreeTraversal.Result completed();

    abstract PassFailure failed();

    static PassResult completed(TreeTraversal.Result result) {
      return AutoOneOf_StylePipeline_PassResult.completed(result);
    }

    static PassResult failed(PassFailure failure) {
      return AutoOneOf_StylePipeline_PassResult.failed(failure);
    }
  }
}
