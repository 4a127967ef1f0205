/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.datamesh.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Objects;

/** Counters for the client's retry, session and cache behaviour. */
public final class DatameshMetrics {

  public static final String RETRIES = "datamesh.transport.retries";
  public static final String EXHAUSTED = "datamesh.transport.exhausted";
  public static final String SESSIONS = "datamesh.sessions";
  public static final String CACHE_HITS = "datamesh.cache.hits";
  public static final String CACHE_MISSES = "datamesh.cache.misses";
  public static final String CACHE_STALE = "datamesh.cache.stale";
  public static final String CACHE_ERRORS = "datamesh.cache.errors";

  private final MeterRegistry registry;

  public DatameshMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Metrics kept in a private in-memory registry. */
  public static DatameshMetrics inMemory() {
    return new DatameshMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void recordRetry(String method, String reason) {
    counter(RETRIES, Tag.of("method", method), Tag.of("reason", reason)).increment();
  }

  public void recordExhausted(String method) {
    counter(EXHAUSTED, Tag.of("method", method)).increment();
  }

  public void recordSession(String event) {
    counter(SESSIONS, Tag.of("event", event)).increment();
  }

  public void recordCacheHit(String extension) {
    counter(CACHE_HITS, Tag.of("format", extension)).increment();
  }

  public void recordCacheMiss() {
    counter(CACHE_MISSES).increment();
  }

  public void recordCacheStale(String extension) {
    counter(CACHE_STALE, Tag.of("format", extension)).increment();
  }

  public void recordCacheError(String operation, Throwable error) {
    String exception = error == null ? "none" : error.getClass().getSimpleName();
    counter(CACHE_ERRORS, Tag.of("operation", operation), Tag.of("exception", exception))
        .increment();
  }

  /** Sum of a counter across all of its tag combinations. */
  public double total(String name) {
    return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
  }

  private Counter counter(String name, Tag... tags) {
    return Counter.builder(name).tags(List.of(tags)).register(registry);
  }
}
