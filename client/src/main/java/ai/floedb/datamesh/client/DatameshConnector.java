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

package ai.floedb.datamesh.client;

import ai.floedb.datamesh.arrow.ArrowTables;
import ai.floedb.datamesh.client.cache.LocalResultCache;
import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.session.SessionLease;
import ai.floedb.datamesh.client.session.SessionManager;
import ai.floedb.datamesh.client.stage.StageNegotiator;
import ai.floedb.datamesh.client.stage.TransferFormat;
import ai.floedb.datamesh.client.store.OperationPolicy;
import ai.floedb.datamesh.client.store.RemoteChunkStore;
import ai.floedb.datamesh.client.store.StoreApi;
import ai.floedb.datamesh.client.transport.HttpRequestSpec;
import ai.floedb.datamesh.client.transport.HttpResult;
import ai.floedb.datamesh.client.transport.HttpSender;
import ai.floedb.datamesh.client.transport.JdkHttpSender;
import ai.floedb.datamesh.client.transport.RetryTransport;
import ai.floedb.datamesh.client.write.AppendWriter;
import ai.floedb.datamesh.client.write.MetadataSniffer;
import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.error.DatameshCacheException;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.error.DatameshException;
import ai.floedb.datamesh.error.DatameshQueryException;
import ai.floedb.datamesh.error.DatameshWriteException;
import ai.floedb.datamesh.model.Catalog;
import ai.floedb.datamesh.model.CatalogSearch;
import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.DatameshJson;
import ai.floedb.datamesh.model.Datasource;
import ai.floedb.datamesh.model.DatasourceMetadata;
import ai.floedb.datamesh.model.Query;
import ai.floedb.datamesh.model.Stage;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import ai.floedb.datamesh.zarr.ZarrGroup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Entry point to a datamesh service: catalog and metadata lookups, queries, loads, writes and
 * deletes.
 *
 * <p>Construction probes the service version. A service answering the info endpoint speaks the
 * session-aware v1 protocol and by default serves its gateway from the same URL; otherwise the
 * connector falls back to the legacy protocol with the gateway at {@code gateway.<host>}.
 *
 * <p>All operations block. Each one acquires its own session and releases it before returning,
 * except lazily opened datasets, whose {@link ZarrGroup} holds the session until it is closed.
 */
public class DatameshConnector {

  private static final Logger LOG = Logger.getLogger(DatameshConnector.class);

  public static final String CLIENT_NAME = "datamesh-java";
  public static final String CLIENT_VERSION = "0.1.0";

  /** Staged results larger than this are opened lazily. */
  public static final long LAZY_THRESHOLD_BYTES = 1_000_000_000L;

  /** The service truncates tabular results at this many rows. */
  public static final long ROW_LIMIT = 2_000_000L;

  static final int QUERY_SERVER_ERROR_RETRIES = 5;

  private static final Pattern WRITABLE_ID = Pattern.compile("^[a-z0-9_-]*$");

  private final DatameshConfig config;
  private final RetryTransport transport;
  private final RetryTransport.Sleeper sleeper;
  private final DatameshMetrics metrics;
  private final Clock clock;
  private final String service;
  private final String gateway;
  private final boolean legacy;
  private final Map<String, String> authHeaders;
  private final SessionManager sessions;
  private final StageNegotiator stager;
  private final AppendWriter appendWriter;

  public DatameshConnector(DatameshConfig config) {
    this(
        config,
        new JdkHttpSender(config.connectTimeout()),
        RetryTransport.Sleeper.THREAD,
        DatameshMetrics.inMemory(),
        Clock.systemUTC());
  }

  public DatameshConnector(
      DatameshConfig config,
      HttpSender sender,
      RetryTransport.Sleeper sleeper,
      DatameshMetrics metrics,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transport =
        new RetryTransport(sender, config.retries(), config.badGatewayCooldown(), sleeper, metrics);
    this.service = trimSlash(config.service().toString());
    this.authHeaders = authHeaders(config.token(), config.user());

    String probeGateway =
        config.gateway() == null ? service : trimSlash(config.gateway().toString());
    boolean v1 = probe(probeGateway);
    if (v1) {
      this.gateway = probeGateway;
    } else if (config.gateway() != null) {
      this.gateway = probeGateway;
    } else {
      URI s = config.service();
      this.gateway = s.getScheme() + "://gateway." + s.getRawAuthority();
    }
    this.legacy = !v1;
    LOG.infof("Using datamesh API %s at %s", legacy ? "version beta" : "version 1", gateway);
    if (!topLevelDomain(URI.create(service).getHost())
        .equals(topLevelDomain(URI.create(gateway).getHost()))) {
      LOG.warn("Gateway and service domain do not match");
    }

    this.sessions =
        new SessionManager(
            transport,
            gateway,
            authHeaders,
            legacy,
            config.sessionDuration(),
            config.readTimeout(),
            metrics);
    this.stager = new StageNegotiator(transport, gateway, authHeaders, config.stageReadTimeout());
    this.appendWriter =
        new AppendWriter(
            sessions,
            (id, lease) -> chunkStore(id, lease, StoreApi.ZARR, Map.of(), true),
            this::lookupDatasource);
  }

  static Map<String, String> authHeaders(String token, String user) {
    Map<String, String> h = new LinkedHashMap<>();
    if (token.startsWith("Bearer ")) {
      h.put("Authorization", token);
    } else {
      h.put("Authorization", "Token " + token);
      h.put("X-DATAMESH-TOKEN", token);
      if (user != null && !user.isBlank()) {
        h.put("X-DATAMESH-USER", user);
      }
    }
    return Map.copyOf(h);
  }

  private boolean probe(String candidate) {
    HttpRequestSpec request =
        HttpRequestSpec.get(candidate + "/info/" + CLIENT_NAME + "/" + CLIENT_VERSION)
            .withHeaders(authHeaders)
            .withTimeout(config.readTimeout());
    try {
      HttpResult r = transport.execute(request);
      if (r.status() != 200) {
        LOG.debugf("Info probe at %s returned %d", candidate, r.status());
        return false;
      }
      JsonNode info = r.json();
      if (info.hasNonNull("message")) {
        LOG.info(info.get("message").asText());
      }
      return true;
    } catch (RuntimeException e) {
      LOG.debugf(e, "Info probe at %s failed", candidate);
      return false;
    }
  }

  public DatameshConfig config() {
    return config;
  }

  public String service() {
    return service;
  }

  public String gateway() {
    return gateway;
  }

  public boolean isLegacy() {
    return legacy;
  }

  public DatameshMetrics metrics() {
    return metrics;
  }

  public SessionManager sessions() {
    return sessions;
  }

  public Map<String, String> authHeaders() {
    return authHeaders;
  }

  // ---- metadata ----

  /** Lists datasources matching {@code search}. */
  public Catalog getCatalog(CatalogSearch search) {
    HttpResult r = metadataRequest("", search.toParams(clock.instant()));
    return Catalog.fromFeatureCollection(r.json());
  }

  /**
   * @throws DatameshConnectException when the datasource does not exist or is not authorized
   */
  public DatasourceMetadata getDatasource(String datasourceId) {
    return fetchDatasource(datasourceId, false)
        .orElseThrow(() -> notFound(datasourceId));
  }

  /**
   * Like {@link #getDatasource} but empty when the server reports the datasource as missing.
   *
   * @throws DatameshConnectException on any other failure, including server errors and exhausted
   *     retries
   */
  public Optional<DatasourceMetadata> lookupDatasource(String datasourceId) {
    return fetchDatasource(datasourceId, true);
  }

  private Optional<DatasourceMetadata> fetchDatasource(String datasourceId, boolean missingOk) {
    HttpResult r = metadataRequest(datasourceId, Map.of(), missingOk);
    if (r.status() == 404) {
      LOG.debugf("Datasource %s not found", datasourceId);
      return Optional.empty();
    }
    JsonNode json = r.json();
    if (!json.isObject()) {
      throw new DatameshConnectException("Invalid metadata returned for " + datasourceId);
    }
    ObjectNode feature = ((ObjectNode) json).deepCopy();
    feature.put("id", datasourceId);
    return Optional.of(DatasourceMetadata.detailed(Datasource.fromFeature(feature)));
  }

  private HttpResult metadataRequest(String datasourceId, Map<String, String> params) {
    return metadataRequest(datasourceId, params, false);
  }

  private HttpResult metadataRequest(
      String datasourceId, Map<String, String> params, boolean missingOk) {
    HttpResult r =
        transport.execute(
            HttpRequestSpec.get(service + "/datasource/" + datasourceId)
                .withHeaders(authHeaders)
                .withParams(params)
                .withTimeout(config.readTimeout()));
    if (r.status() == 404) {
      if (missingOk) {
        return r;
      }
      throw notFound(datasourceId);
    }
    if (r.status() == 401) {
      throw new DatameshConnectException("Datasource " + datasourceId + " not Authorized");
    }
    return validate(r);
  }

  private static DatameshConnectException notFound(String datasourceId) {
    return new DatameshConnectException("Datasource " + datasourceId + " not found");
  }

  private static HttpResult validate(HttpResult r) {
    if (r.status() >= 400) {
      throw new DatameshConnectException(
          r.detail().orElseGet(() -> "Datamesh server error: " + r.text()));
    }
    return r;
  }

  // ---- reads ----

  /**
   * Loads a whole datasource. Datasets, and any container when {@code lazy} is set, are opened
   * over the remote chunk store and keep their session until closed; tables are downloaded.
   *
   * @return empty when the datasource holds no data
   */
  public Optional<DataContainer> loadDatasource(
      String datasourceId, Map<String, Object> parameters, boolean lazy) {
    Query query = Query.builder(datasourceId).parameters(parameters).build();
    SessionLease lease = sessions.acquire();
    boolean handedOff = false;
    try {
      Optional<Stage> staged = stager.stage(query, lease);
      if (staged.isEmpty()) {
        return Optional.empty();
      }
      Stage stage = staged.get();
      if (stage.container() == ContainerKind.DATASET || lazy) {
        RemoteChunkStore store = chunkStore(datasourceId, lease, StoreApi.ZARR, parameters, false);
        ZarrGroup group = ZarrDatasets.open(store, lease::close);
        handedOff = true;
        return Optional.of(group);
      }
      HttpResult r =
          validate(
              transport.execute(
                  HttpRequestSpec.get(gateway + "/data/" + datasourceId)
                      .withHeaders(withAccept(lease.headers(authHeaders), ArrowTables.MEDIA_TYPE))
                      .withTimeout(config.downloadTimeout())));
      return Optional.of(ArrowTables.fromBytes(r.body()));
    } finally {
      if (!handedOff) {
        lease.close();
      }
    }
  }

  public Optional<DataContainer> loadDatasource(String datasourceId) {
    return loadDatasource(datasourceId, Map.of(), false);
  }

  public Optional<DataContainer> query(Query query) {
    return query(query, QueryOptions.DEFAULT);
  }

  /**
   * Runs a query.
   *
   * @return empty when no data matches
   * @throws DatameshQueryException when the service rejects the query
   */
  public Optional<DataContainer> query(Query query, QueryOptions options) {
    Objects.requireNonNull(query, "query");
    LocalResultCache cache = null;
    if (options.usesCache()) {
      try {
        cache = cache(options.cacheTimeout());
        Optional<DataContainer> hit = cache.get(query);
        if (hit.isPresent()) {
          LOG.debugf("Cache hit for query on %s", query.datasource());
          return hit;
        }
      } catch (DatameshCacheException e) {
        LOG.warnf(e, "Local cache unavailable for query on %s", query.datasource());
        cache = null;
      }
    }
    for (int attempt = 0; ; attempt++) {
      Optional<Optional<DataContainer>> result = queryOnce(query, options.lazy(), cache, attempt);
      if (result.isPresent()) {
        return result.get();
      }
      pause(Duration.ofSeconds(attempt));
    }
  }

  LocalResultCache cache(Duration cacheTimeout) {
    return new LocalResultCache(
        config.cacheDir(), cacheTimeout, config.cacheLockTimeout(), clock, metrics);
  }

  /** One staged attempt; empty when the download hit a server error and should be retried. */
  private Optional<Optional<DataContainer>> queryOnce(
      Query query, boolean lazy, LocalResultCache cache, int attempt) {
    SessionLease lease = sessions.acquire();
    boolean handedOff = false;
    try {
      Optional<Stage> staged = stager.stage(query, lease);
      if (staged.isEmpty()) {
        return Optional.of(Optional.empty());
      }
      Stage stage = staged.get();
      if (stage.dlen() >= ROW_LIMIT && stage.container() != ContainerKind.DATASET) {
        LOG.warnf(
            "Query limited to %d rows, not all data may be returned. Use a more specific query.",
            ROW_LIMIT);
      } else if (stage.size() > LAZY_THRESHOLD_BYTES) {
        LOG.warn("Query is too large for direct access, using lazy access");
        lazy = true;
      }
      if (lazy && stage.container() == ContainerKind.DATASET) {
        RemoteChunkStore store = chunkStore(stage.qhash(), lease, StoreApi.QUERY, Map.of(), false);
        ZarrGroup group = ZarrDatasets.open(store, lease::close);
        handedOff = true;
        return Optional.of(Optional.of(group));
      }
      return download(query, stage, lease, cache, attempt);
    } finally {
      if (!handedOff) {
        lease.close();
      }
    }
  }

  private Optional<Optional<DataContainer>> download(
      Query query, Stage stage, SessionLease lease, LocalResultCache cache, int attempt) {
    TransferFormat format = TransferFormat.negotiate(stage);
    if (cache != null) {
      guarded(() -> cache.lock(query), "lock");
    }
    try {
      Map<String, String> headers = withAccept(lease.headers(authHeaders), format.mediaType());
      headers.put("Content-Type", "application/json");
      HttpResult r =
          transport.execute(
              HttpRequestSpec.of("POST", gateway + "/oceanql/")
                  .withHeaders(headers)
                  .withBody(DatameshJson.write(query).getBytes(StandardCharsets.UTF_8))
                  .withTimeout(config.downloadTimeout()));
      if (r.status() >= 500) {
        if (attempt < QUERY_SERVER_ERROR_RETRIES) {
          LOG.debugf("Query download failed with %d, retrying", r.status());
          return Optional.empty();
        }
        throw new DatameshConnectException("Datamesh server error: " + r.text());
      }
      if (r.status() >= 400) {
        Optional<String> detail = r.detail();
        if (detail.isPresent()) {
          throw new DatameshQueryException(detail.get());
        }
        throw new DatameshConnectException("Datamesh server error: " + r.text());
      }
      return Optional.of(Optional.of(decode(query, stage, format, r.body(), cache)));
    } finally {
      if (cache != null) {
        guarded(() -> cache.unlock(query), "unlock");
      }
    }
  }

  private DataContainer decode(
      Query query, Stage stage, TransferFormat format, byte[] payload, LocalResultCache cache) {
    Path dir = cache != null ? cache.cacheDir() : null;
    Path tmp = null;
    try {
      tmp =
          dir != null
              ? Files.createTempFile(dir, "datamesh-", ".part")
              : Files.createTempFile("datamesh-", ".part");
      Files.write(tmp, payload);
      DataContainer result = format.decode(tmp);
      if (cache != null) {
        Path downloaded = tmp;
        guarded(
            () -> cache.copy(query, downloaded, LocalResultCache.extension(stage.container())),
            "copy");
      }
      return result;
    } catch (IOException e) {
      throw new DatameshConnectException(
          "Cannot decode " + format.mediaType() + " result for " + query.datasource(), e);
    } finally {
      if (tmp != null) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException e) {
          LOG.debugf(e, "Cannot remove %s", tmp);
        }
      }
    }
  }

  private void guarded(Runnable cacheOperation, String name) {
    try {
      cacheOperation.run();
    } catch (DatameshCacheException e) {
      metrics.recordCacheError(name, e);
      LOG.warnf(e, "Local cache %s failed", name);
    }
  }

  // ---- writes ----

  /**
   * Writes data and metadata to a datasource, creating it when needed.
   *
   * @throws DatameshWriteException when the data or metadata cannot be written consistently
   * @throws DatameshConnectException when the existing datasource cannot be looked up; nothing is
   *     written in that case
   */
  public DatasourceMetadata writeDatasource(DatasourceWrite write) {
    String id = write.id();
    if (!WRITABLE_ID.matcher(id).matches()) {
      throw new DatameshWriteException(
          "Datasource ID must only contain lowercase letters, numbers, dashes and underscores");
    }
    DataContainer data = write.data();
    if (data instanceof ZarrGroup) {
      data = ((ZarrGroup) data).load();
    }
    DatasourceUpdate props = write.properties();

    Datasource template;
    try {
      Datasource.Builder b = Datasource.builder(id);
      props.applyTo(b, true);
      if (props.driver() == null) {
        b.driver(data == null ? "_null" : MetadataSniffer.driverFor(data));
      }
      template = b.build();
    } catch (IllegalArgumentException e) {
      throw new DatameshWriteException(
          "Cannot create datasource: " + e.getMessage() + ". Check that the properties are valid",
          e);
    }

    boolean overwrite = write.overwrite();
    Optional<DatasourceMetadata> existing = lookupDatasource(id);
    if (existing.isEmpty()) {
      overwrite = true;
    } else if (overwrite) {
      try {
        deleteDatasource(id);
      } catch (DatameshException e) {
        throw new DatameshWriteException("Cannot delete existing datasource", e);
      }
    }

    Datasource ds;
    boolean registered = existing.isPresent() && !overwrite;
    if (data != null) {
      ds = writeData(id, data, write.append(), overwrite, template);
      registered = true;
    } else if (overwrite) {
      ds = template;
    } else {
      ds = existing.get().datasource();
    }

    Datasource.Builder b = ds.toBuilder();
    props.applyTo(b, false);
    ds = b.build();
    if (write.append() == null && data != null) {
      ds = MetadataSniffer.sniff(ds, data, clock.instant());
    }
    String crs = write.crs();
    if (crs == null && data instanceof GeoTable) {
      crs = ((GeoTable) data).crs();
    }
    ds = MetadataSniffer.withCrs(ds, crs);

    List<String> bad = ds.missingCoordinates();
    if (!bad.isEmpty()) {
      throw new DatameshWriteException("Coordinates " + bad + " not found in data");
    }
    if (MetadataSniffer.isMissingGeometry(ds.geom())) {
      LOG.warn("Geometry not set for datasource, will have a default geometry of Point(0,0)");
    }
    try {
      metadataWrite(ds, registered);
    } catch (DatameshException e) {
      throw new DatameshWriteException(
          "Cannot register datasource " + id + ": " + e.getMessage(), e);
    }
    return DatasourceMetadata.detailed(ds);
  }

  private Datasource writeData(
      String id, DataContainer data, String append, boolean overwrite, Datasource template) {
    try {
      if (data instanceof LabeledDataset) {
        return appendWriter
            .write(id, (LabeledDataset) data, append, overwrite, template)
            .datasource();
      }
      if (data instanceof DataTable || data instanceof GeoTable) {
        return dataWrite(id, ArrowTables.toBytes(data), append, overwrite);
      }
    } catch (DatameshException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DatameshWriteException(e.getMessage(), e);
    }
    throw new DatameshWriteException(
        "Data must be a LabeledDataset, DataTable or GeoTable, not "
            + data.getClass().getSimpleName());
  }

  private Datasource dataWrite(String id, byte[] payload, String append, boolean overwrite) {
    Map<String, String> headers = new LinkedHashMap<>(authHeaders);
    headers.put("Content-Type", ArrowTables.MEDIA_TYPE);
    if (!overwrite && append != null) {
      headers.put("X-Append", append);
    }
    HttpResult r =
        validate(
            transport.execute(
                HttpRequestSpec.of(overwrite ? "PUT" : "PATCH", gateway + "/data/" + id)
                    .withHeaders(headers)
                    .withBody(payload)
                    .withTimeout(config.writeTimeout())));
    JsonNode json = r.json();
    try {
      if (json.has("properties")) {
        ObjectNode feature = ((ObjectNode) json).deepCopy();
        feature.put("id", id);
        return Datasource.fromFeature(feature);
      }
      ObjectNode props = ((ObjectNode) json).deepCopy();
      props.put("id", id);
      return DatameshJson.mapper().treeToValue(props, Datasource.class);
    } catch (JsonProcessingException | ClassCastException e) {
      throw new DatameshConnectException("Invalid datasource returned for " + id, e);
    }
  }

  private void metadataWrite(Datasource ds, boolean registered) {
    Map<String, String> headers = new LinkedHashMap<>(authHeaders);
    headers.put("Content-Type", "application/json");
    HttpRequestSpec request =
        registered
            ? HttpRequestSpec.of("PATCH", service + "/datasource/" + ds.id() + "/")
            : HttpRequestSpec.of("POST", service + "/datasource/");
    validate(
        transport.execute(
            request
                .withHeaders(headers)
                .withBody(DatameshJson.write(ds).getBytes(StandardCharsets.UTF_8))
                .withTimeout(config.readTimeout())));
  }

  /**
   * Updates metadata properties of an existing datasource. Driver changes are ignored with a
   * warning.
   */
  public DatasourceMetadata updateMetadata(String datasourceId, DatasourceUpdate update) {
    DatasourceMetadata current = getDatasource(datasourceId);
    Datasource.Builder b = current.datasource().toBuilder();
    for (String skipped : update.applyTo(b, false)) {
      LOG.warnf("%s is not an updatable property of a datasource", skipped);
    }
    Datasource updated = b.build();
    metadataWrite(updated, true);
    return current.withDatasource(updated);
  }

  /** Deletes the registration and all stored data of a datasource. */
  public boolean deleteDatasource(String datasourceId) {
    validate(
        transport.execute(
            HttpRequestSpec.of("DELETE", gateway + "/data/" + datasourceId)
                .withHeaders(authHeaders)
                .withTimeout(config.readTimeout())));
    return true;
  }

  // ---- plumbing ----

  RemoteChunkStore chunkStore(
      String name,
      SessionLease lease,
      StoreApi api,
      Map<String, Object> parameters,
      boolean nocache) {
    return RemoteChunkStore.builder(transport, gateway, name)
        .api(api)
        .legacy(legacy)
        .session(lease)
        .authHeaders(authHeaders)
        .parameters(parameters)
        .nocache(nocache)
        .listing(OperationPolicy.of(config.readTimeout()))
        .read(OperationPolicy.of(config.chunkReadTimeout()))
        .write(OperationPolicy.of(config.chunkWriteTimeout()))
        .delete(OperationPolicy.of(config.readTimeout()))
        .build();
  }

  private static Map<String, String> withAccept(Map<String, String> headers, String mediaType) {
    Map<String, String> h = new LinkedHashMap<>(headers);
    h.put("Accept", mediaType);
    return h;
  }

  private void pause(Duration d) {
    try {
      sleeper.sleep(d);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DatameshConnectException("Interrupted while waiting to retry a query", e);
    }
  }

  private static String trimSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private static String topLevelDomain(String host) {
    if (host == null) {
      return "";
    }
    int dot = host.lastIndexOf('.');
    return dot < 0 ? host : host.substring(dot + 1);
  }
}
