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

import ai.floedb.datamesh.arrow.ArrowTables;
import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.error.DatameshCacheException;
import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.Query;
import ai.floedb.datamesh.model.QueryJson;
import ai.floedb.datamesh.zarr.InMemoryChunkStore;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import ai.floedb.datamesh.zarr.ZarrGroup;
import ai.floedb.datamesh.zarr.ZipChunkArchives;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Query results cached on local disk, keyed by the SHA-224 of the canonical query.
 *
 * <p>Layout under the cache directory: {@code {hash}.zarr.zip} for datasets, {@code
 * {hash}.geo.arrow} for geo-tables, {@code {hash}.arrow} for tables, and a {@code {hash}.lock}
 * sentinel while a download is in progress. The directory can be shared between processes. The
 * lock file is advisory: a lock older than the lock timeout counts as released, so a crashed
 * writer never blocks the entry for good, and two writers can occasionally both proceed. Writes
 * land at their final path by an atomic move, so readers never see a partial artifact.
 *
 * <p>Within this process, callers touching the same key are serialized on a shared lock.
 */
public final class LocalResultCache {

  private static final Logger LOG = Logger.getLogger(LocalResultCache.class);

  public static final String DATASET_EXTENSION = ".zarr.zip";
  public static final String GEO_TABLE_EXTENSION = ".geo.arrow";
  public static final String TABLE_EXTENSION = ".arrow";
  static final String LOCK_EXTENSION = ".lock";
  static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private static final List<String> EXTENSIONS =
      List.of(DATASET_EXTENSION, GEO_TABLE_EXTENSION, TABLE_EXTENSION);

  // Shared by every cache instance of this process, like the files they guard.
  private static final LoadingCache<Path, ReentrantLock> KEY_LOCKS =
      Caffeine.newBuilder().weakValues().build(k -> new ReentrantLock());

  private final Path cacheDir;
  private final Duration cacheTimeout;
  private final Duration lockTimeout;
  private final Clock clock;
  private final DatameshMetrics metrics;

  /**
   * @param cacheTimeout age after which an artifact is stale
   * @param lockTimeout age after which a lock file is ignored; also the default wait in {@link
   *     #get(Query)}
   */
  public LocalResultCache(
      Path cacheDir,
      Duration cacheTimeout,
      Duration lockTimeout,
      Clock clock,
      DatameshMetrics metrics) {
    this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
    this.cacheTimeout = Objects.requireNonNull(cacheTimeout, "cacheTimeout");
    this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    try {
      Files.createDirectories(cacheDir);
    } catch (IOException e) {
      throw new DatameshCacheException("Cannot create cache directory " + cacheDir, e);
    }
  }

  public static String extension(ContainerKind kind) {
    switch (kind) {
      case DATASET:
        return DATASET_EXTENSION;
      case GEO_TABLE:
        return GEO_TABLE_EXTENSION;
      case TABLE:
        return TABLE_EXTENSION;
      default:
        throw new IllegalArgumentException("No cache format for " + kind);
    }
  }

  public Path cacheDir() {
    return cacheDir;
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }

  /** Path of the entry for {@code query}, without extension. */
  public Path cachePath(Query query) {
    return cacheDir.resolve(QueryJson.hash(query));
  }

  private Path lockPath(Query query) {
    return cacheDir.resolve(QueryJson.hash(query) + LOCK_EXTENSION);
  }

  /** Creates the lock file unless one exists. Never refreshes an existing lock. */
  public void lock(Query query) {
    Path lock = lockPath(query);
    try {
      Files.createFile(lock);
    } catch (FileAlreadyExistsException e) {
      LOG.debugf("Cache entry %s already locked", lock.getFileName());
    } catch (IOException e) {
      throw new DatameshCacheException("Cannot lock cache entry " + lock, e);
    }
  }

  /** True while a lock file exists that is younger than the lock timeout. */
  public boolean locked(Query query) {
    return isFresh(lockPath(query), lockTimeout);
  }

  /** Removes the lock file if it is currently held. */
  public void unlock(Query query) {
    if (!locked(query)) {
      return;
    }
    try {
      Files.deleteIfExists(lockPath(query));
    } catch (IOException e) {
      throw new DatameshCacheException("Cannot unlock cache entry " + lockPath(query), e);
    }
  }

  public Optional<DataContainer> get(Query query) {
    return get(query, lockTimeout);
  }

  /**
   * Reads the cached result of {@code query}, waiting up to {@code timeout} for a concurrent
   * download to finish. Missing, unreadable and stale entries read as empty; stale artifacts are
   * deleted. Never throws for cache faults.
   */
  public Optional<DataContainer> get(Query query, Duration timeout) {
    Path base = cachePath(query);
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      while (locked(query)) {
        if (System.nanoTime() >= deadline) {
          LOG.debugf("Gave up waiting for locked cache entry %s", base.getFileName());
          metrics.recordCacheMiss();
          return Optional.empty();
        }
        Thread.sleep(POLL_INTERVAL.toMillis());
      }
      // Writers in this process hold the key lock while renaming into place.
      ReentrantLock keyLock = KEY_LOCKS.get(base);
      long remaining = Math.max(0, deadline - System.nanoTime());
      if (!keyLock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
        metrics.recordCacheMiss();
        return Optional.empty();
      }
      try {
        return read(base);
      } finally {
        keyLock.unlock();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  private Optional<DataContainer> read(Path base) {
    for (String ext : EXTENSIONS) {
      Path file = sibling(base, ext);
      if (!Files.exists(file)) {
        continue;
      }
      try {
        if (!isFresh(file, cacheTimeout)) {
          Files.deleteIfExists(file);
          metrics.recordCacheStale(ext);
          LOG.debugf("Evicted stale cache entry %s", file.getFileName());
          return Optional.empty();
        }
        DataContainer container = decode(file, ext);
        metrics.recordCacheHit(ext);
        return Optional.of(container);
      } catch (IOException | RuntimeException e) {
        metrics.recordCacheError("read", e);
        LOG.debugf(e, "Unreadable cache entry %s", file.getFileName());
        return Optional.empty();
      }
    }
    metrics.recordCacheMiss();
    return Optional.empty();
  }

  /**
   * Serializes {@code data} into the entry for {@code query}.
   *
   * @throws IllegalArgumentException for a container this cache cannot store
   * @throws DatameshCacheException when the artifact cannot be written
   */
  public void put(Query query, DataContainer data) {
    Objects.requireNonNull(data, "data");
    if (!(data instanceof LabeledDataset
        || data instanceof ZarrGroup
        || data instanceof DataTable
        || data instanceof GeoTable)) {
      throw new IllegalArgumentException(
          "Unsupported data type for cache: " + data.getClass().getSimpleName());
    }
    String ext = extension(data.kind());
    Path base = cachePath(query);
    ReentrantLock keyLock = KEY_LOCKS.get(base);
    keyLock.lock();
    try {
      Path tmp = Files.createTempFile(cacheDir, base.getFileName().toString(), ".tmp");
      try {
        try (OutputStream out = Files.newOutputStream(tmp)) {
          encode(data, out);
        }
        move(tmp, sibling(base, ext));
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      metrics.recordCacheError("write", e);
      throw new DatameshCacheException("Cannot write cache entry " + base, e);
    } finally {
      keyLock.unlock();
    }
  }

  /** Moves a file produced elsewhere into the entry for {@code query}. */
  public void copy(Query query, Path source, String extension) {
    if (!EXTENSIONS.contains(extension)) {
      throw new IllegalArgumentException("Unknown cache extension " + extension);
    }
    Path base = cachePath(query);
    ReentrantLock keyLock = KEY_LOCKS.get(base);
    keyLock.lock();
    try {
      move(source, sibling(base, extension));
    } catch (IOException e) {
      metrics.recordCacheError("copy", e);
      throw new DatameshCacheException("Cannot move " + source + " into the cache", e);
    } finally {
      keyLock.unlock();
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      // Different file store; copy next to the target first so the final rename is atomic.
      Path staged =
          Files.createTempFile(target.getParent(), target.getFileName().toString(), ".mv");
      try {
        Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING);
        Files.move(
            staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        Files.deleteIfExists(source);
      } finally {
        Files.deleteIfExists(staged);
      }
    }
  }

  private boolean isFresh(Path file, Duration ttl) {
    try {
      Instant modified = Files.getLastModifiedTime(file).toInstant();
      return modified.plus(ttl).isAfter(clock.instant());
    } catch (NoSuchFileException e) {
      return false;
    } catch (IOException e) {
      LOG.debugf(e, "Cannot stat %s", file);
      return false;
    }
  }

  private static Path sibling(Path base, String ext) {
    return base.resolveSibling(base.getFileName() + ext);
  }

  private static void encode(DataContainer data, OutputStream out) throws IOException {
    if (data.kind() == ContainerKind.DATASET) {
      LabeledDataset ds =
          data instanceof ZarrGroup ? ((ZarrGroup) data).load() : (LabeledDataset) data;
      InMemoryChunkStore store = new InMemoryChunkStore();
      ZarrDatasets.write(ds, store);
      out.write(ZipChunkArchives.pack(store));
    } else {
      ArrowTables.write(data, out);
    }
  }

  private static DataContainer decode(Path file, String ext) throws IOException {
    if (DATASET_EXTENSION.equals(ext)) {
      return ZarrDatasets.open(ZipChunkArchives.read(file)).load();
    }
    try (InputStream in = Files.newInputStream(file)) {
      return ArrowTables.read(in);
    }
  }
}
