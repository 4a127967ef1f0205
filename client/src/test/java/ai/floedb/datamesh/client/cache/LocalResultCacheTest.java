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

package ai.floedb.datamesh.client.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.Geometry;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.DatasourceSchema;
import ai.floedb.datamesh.model.Query;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalResultCacheTest {

  /** Clock the test moves by hand. */
  static final class MutableClock extends Clock {
    private volatile Instant now = Instant.now();

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  @TempDir Path dir;

  private final MutableClock clock = new MutableClock();
  private final DatameshMetrics metrics = DatameshMetrics.inMemory();

  private LocalResultCache cache() {
    return new LocalResultCache(
        dir, Duration.ofHours(1), Duration.ofSeconds(60), clock, metrics);
  }

  private static Query query(String id) {
    return Query.builder(id).parameters(Map.of("run", 0)).build();
  }

  private static LabeledDataset dataset() {
    return LabeledDataset.builder()
        .coord("time", NdArray.vector(0L, 3600L))
        .dataVar("hs", List.of("time"), NdArray.vector(1.0, 1.25))
        .build();
  }

  @Test
  void pathDependsOnlyOnQuery() {
    LocalResultCache cache = cache();

    assertThat(cache.cachePath(query("wave-hindcast")))
        .isEqualTo(cache().cachePath(query("wave-hindcast")))
        .isNotEqualTo(cache.cachePath(query("wind-hindcast")))
        .hasParentRaw(dir);
  }

  @Test
  void extensionFollowsContainerKind() {
    assertThat(LocalResultCache.extension(ContainerKind.DATASET)).isEqualTo(".zarr.zip");
    assertThat(LocalResultCache.extension(ContainerKind.GEO_TABLE)).isEqualTo(".geo.arrow");
    assertThat(LocalResultCache.extension(ContainerKind.TABLE)).isEqualTo(".arrow");
  }

  @Test
  void lockIsNotRefreshedAndExpires() {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");

    cache.lock(q);
    cache.lock(q);
    assertThat(cache.locked(q)).isTrue();

    clock.advance(Duration.ofSeconds(61));
    assertThat(cache.locked(q)).isFalse();

    clock.advance(Duration.ofSeconds(-61));
    cache.unlock(q);
    assertThat(cache.locked(q)).isFalse();
  }

  @Test
  void datasetsRoundTrip() {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");

    cache.put(q, dataset());

    assertThat(Files.exists(dir.resolve(cache.cachePath(q).getFileName() + ".zarr.zip"))).isTrue();
    assertThat(cache.get(q)).contains(dataset());
    assertThat(metrics.total(DatameshMetrics.CACHE_HITS)).isEqualTo(1.0);
  }

  @Test
  void tablesAndGeoTablesRoundTrip() {
    LocalResultCache cache = cache();
    DataTable table =
        DataTable.builder()
            .timestamps("time", Instant.parse("2026-01-01T00:00:00Z"))
            .doubles("hs", 2.5)
            .build();
    GeoTable geo =
        GeoTable.of(
            DataTable.builder().strings("site", "a").build(), List.of(Geometry.point(1, 2)));

    cache.put(query("buoys"), table);
    cache.put(query("sites"), geo);

    assertThat(cache.get(query("buoys"))).contains(table);
    assertThat(cache.get(query("sites"))).contains(geo);
  }

  @Test
  void staleEntriesAreEvicted() {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");
    cache.put(q, dataset());

    clock.advance(Duration.ofHours(2));

    assertThat(cache.get(q)).isEmpty();
    assertThat(Files.exists(dir.resolve(cache.cachePath(q).getFileName() + ".zarr.zip")))
        .isFalse();
    assertThat(metrics.total(DatameshMetrics.CACHE_STALE)).isEqualTo(1.0);
  }

  @Test
  void missAndCorruptEntriesReadAsEmpty() throws Exception {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");

    assertThat(cache.get(q)).isEmpty();

    Files.write(dir.resolve(cache.cachePath(q).getFileName() + ".arrow"), new byte[] {1, 2, 3});
    assertThat(cache.get(q)).isEmpty();
    assertThat(metrics.total(DatameshMetrics.CACHE_ERRORS)).isEqualTo(1.0);
  }

  @Test
  void unsupportedContainersAreRejected() {
    DataContainer other =
        new DataContainer() {
          @Override
          public ContainerKind kind() {
            return ContainerKind.TABLE;
          }

          @Override
          public DatasourceSchema toSchema() {
            return DatasourceSchema.EMPTY;
          }
        };

    assertThatThrownBy(() -> cache().put(query("x-data"), other))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported data type");
  }

  @Test
  void readerWaitsForLockedDownloadThenGivesUp() {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");
    cache.lock(q);

    long start = System.nanoTime();
    Optional<DataContainer> result = cache.get(q, Duration.ofMillis(250));

    assertThat(result).isEmpty();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(
        Duration.ofMillis(200));
  }

  @Test
  void readerSeesResultOfConcurrentDownload() throws Exception {
    LocalResultCache cache = cache();
    Query q = query("wave-hindcast");
    cache.lock(q);

    CompletableFuture<Void> writer =
        CompletableFuture.runAsync(
            () -> {
              try {
                Thread.sleep(300);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              cache().put(q, dataset());
              cache().unlock(q);
            });

    Optional<DataContainer> result = cache.get(q, Duration.ofSeconds(10));
    writer.get(10, TimeUnit.SECONDS);

    assertThat(result).contains(dataset());
  }
}
