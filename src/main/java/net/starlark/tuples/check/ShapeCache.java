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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.flogger.GoogleLogger;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A memo table for results computed from immutable types, keyed by structural equality.
 *
 * <p>Each key is computed at most once while it is cached, even when several analysis threads ask
 * for it concurrently. The loader must not re-enter the same cache.
 */
final class ShapeCache<K, V> {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final String name;
  @Nullable private final Cache<K, V> cache; // null if memoization is disabled

  private ShapeCache(String name, @Nullable Cache<K, V> cache) {
    this.name = name;
    this.cache = cache;
  }

  static <K, V> ShapeCache<K, V> create(String name, TupleCheckOptions options) {
    if (!options.memoize()) {
      return new ShapeCache<>(name, null);
    }
    Cache<K, V> cache =
        Caffeine.newBuilder()
            .executor(Runnable::run) // evict in the calling thread
            .maximumSize(options.maximumCacheSize())
            .build();
    return new ShapeCache<>(name, cache);
  }

  V get(K key, Function<? super K, ? extends V> loader) {
    if (cache == null) {
      return loader.apply(key);
    }
    return cache.get(
        key,
        k -> {
          logger.atFinest().log("%s: computing %s", name, k);
          return loader.apply(k);
        });
  }

  /** Returns the approximate number of cached entries; 0 if memoization is disabled. */
  long size() {
    if (cache == null) {
      return 0;
    }
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
