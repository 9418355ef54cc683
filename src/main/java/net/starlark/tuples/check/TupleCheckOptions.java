// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.starlark.tuples.check;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * TupleCheckOptions is a set of options that affect how tuple types are analyzed: how wide the
 * inferred types are in the ambiguous cases, and whether results are memoized.
 *
 * <p>The {@link #DEFAULT} options reproduce the behavior expected by existing checker tests. An
 * instance is immutable and may be shared by any number of analysis workers.
 */
@AutoValue
public abstract class TupleCheckOptions {

  /** The default options. New clients should use these defaults. */
  public static final TupleCheckOptions DEFAULT = builder().build();

  /**
   * Whether index and assignability results are cached by the structural identity of their
   * inputs.
   */
  public abstract boolean memoize();

  /** Upper bound on the number of entries of each result cache. */
  public abstract long maximumCacheSize();

  /**
   * When indexing a tuple with an open segment outside its prefix, use the minimal union of the
   * types that can occur at that index (pinning negative indices within the suffix), instead of
   * the union of all element types.
   */
  public abstract boolean narrowVariadicIndexing();

  /**
   * When a literal index is out of range, let the expression have the union of the tuple's element
   * types instead of {@code Unknown}. The failure is reported either way.
   */
  public abstract boolean outOfRangeIndexYieldsElementUnion();

  /**
   * The largest number of fixed elements a tuple literal (or a repetition of one) may have before
   * its inferred type collapses to {@code tuple[T, ...]}.
   */
  public abstract int maxInferredTupleEntryCount();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_TupleCheckOptions.Builder()
        .memoize(true)
        .maximumCacheSize(10_000)
        .narrowVariadicIndexing(false)
        .outOfRangeIndexYieldsElementUnion(false)
        .maxInferredTupleEntryCount(256);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link TupleCheckOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder memoize(boolean value);

    public abstract Builder maximumCacheSize(long value);

    public abstract Builder narrowVariadicIndexing(boolean value);

    public abstract Builder outOfRangeIndexYieldsElementUnion(boolean value);

    public abstract Builder maxInferredTupleEntryCount(int value);

    abstract TupleCheckOptions autoBuild();

    public TupleCheckOptions build() {
      TupleCheckOptions options = autoBuild();
      Preconditions.checkArgument(
          !options.memoize() || options.maximumCacheSize() > 0,
          "memoize requires a positive maximumCacheSize, got %s",
          options.maximumCacheSize());
      Preconditions.checkArgument(
          options.maxInferredTupleEntryCount() > 0,
          "maxInferredTupleEntryCount must be positive, got %s",
          options.maxInferredTupleEntryCount());
      return options;
    }
  }
}
