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

/**
 * The tuple analyses configured by one set of {@link TupleCheckOptions}.
 *
 * <p>An engine holds no state besides its result caches, and may be shared by any number of
 * analysis threads.
 */
public final class TupleEngine {
  private final TupleCheckOptions options;
  private final IndexResolver indexResolver;
  private final AssignabilityChecker assignabilityChecker;
  private final DestructuringAssigner destructuringAssigner;
  private final Specializer specializer;
  private final TupleLiterals literals;

  private TupleEngine(TupleCheckOptions options, ElementAssignability elements) {
    this.options = options;
    this.indexResolver = new IndexResolver(options);
    this.assignabilityChecker = new AssignabilityChecker(options, elements);
    this.destructuringAssigner = new DestructuringAssigner(assignabilityChecker);
    this.specializer = new Specializer(assignabilityChecker);
    this.literals = new TupleLiterals(options);
  }

  public static TupleEngine create(TupleCheckOptions options) {
    return new TupleEngine(options, ElementAssignability.DEFAULT);
  }

  /** Creates an engine deciding assignability of non-tuple types with {@code elements}. */
  public static TupleEngine create(TupleCheckOptions options, ElementAssignability elements) {
    return new TupleEngine(options, elements);
  }

  public TupleCheckOptions getOptions() {
    return options;
  }

  public IndexResolver getIndexResolver() {
    return indexResolver;
  }

  public AssignabilityChecker getAssignabilityChecker() {
    return assignabilityChecker;
  }

  public DestructuringAssigner getDestructuringAssigner() {
    return destructuringAssigner;
  }

  public Specializer getSpecializer() {
    return specializer;
  }

  public TupleLiterals getLiterals() {
    return literals;
  }
}
