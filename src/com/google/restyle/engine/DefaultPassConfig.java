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

import com.google.common.collect.ImmutableList;

/**
 * Pass factories and meta-data for the built-in passes.
 *
 * <p>The default order folds arithmetic first, since a folded statement may turn into a dead
 * literal, and flattens blocks before dead literals are removed, since splicing a block can leave
 * its value in the middle of the outer block.
 */
public final class DefaultPassConfig extends PassConfig {

  /** Folds integer arithmetic. */
  static final PassFactory foldConstants =
      PassFactory.builder()
          .setName(PassNames.FOLD_CONSTANTS)
          .setInternalFactory(FoldConstantArithmetic::new)
          .build();

  /** Splices directly nested blocks into their parent. */
  static final PassFactory flattenBlocks =
      PassFactory.builder()
          .setName(PassNames.FLATTEN_BLOCKS)
          .setInternalFactory(FlattenNestedBlocks::new)
          .build();

  /** Removes literal statements with no effect. */
  static final PassFactory removeDeadLiterals =
      PassFactory.builder()
          .setName(PassNames.REMOVE_DEAD_LITERALS)
          .setInternalFactory(RemoveDeadLiterals::new)
          .build();

  public DefaultPassConfig() {
    super(ImmutableList.of(foldConstants, flattenBlocks, removeDeadLiterals));
  }
}
