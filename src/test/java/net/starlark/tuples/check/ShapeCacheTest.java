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

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ShapeCache}. */
@RunWith(JUnit4.class)
public final class ShapeCacheTest {

  private final AtomicInteger loads = new AtomicInteger();

  private String load(Integer key) {
    loads.incrementAndGet();
    return "v" + key;
  }

  @Test
  public void memoized_loadsEachKeyOnce() {
    ShapeCache<Integer, String> cache = ShapeCache.create("test", TupleCheckOptions.DEFAULT);
    assertThat(cache.get(1, this::load)).isEqualTo("v1");
    assertThat(cache.get(1, this::load)).isEqualTo("v1");
    assertThat(cache.get(2, this::load)).isEqualTo("v2");
    assertThat(loads.get()).isEqualTo(2);
    assertThat(cache.size()).isEqualTo(2);
  }

  @Test
  public void notMemoized_loadsEveryTime() {
    ShapeCache<Integer, String> cache =
        ShapeCache.create("test", TupleCheckOptions.builder().memoize(false).build());
    cache.get(1, this::load);
    cache.get(1, this::load);
    assertThat(loads.get()).isEqualTo(2);
    assertThat(cache.size()).isEqualTo(0);
  }

  @Test
  public void concurrentRequests_loadOnce() throws Exception {
    ShapeCache<Integer, String> cache = ShapeCache.create("test", TupleCheckOptions.DEFAULT);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return cache.get(7, this::load);
                }));
      }
      start.countDown();
      for (Future<String> result : results) {
        assertThat(result.get(10, SECONDS)).isEqualTo("v7");
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(loads.get()).isEqualTo(1);
  }
}
