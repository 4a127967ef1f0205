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

package ai.floedb.datamesh.client.store;

import ai.floedb.datamesh.client.DatameshConfig;
import ai.floedb.datamesh.client.session.SessionLease;
import ai.floedb.datamesh.client.transport.HttpRequestSpec;
import ai.floedb.datamesh.client.transport.HttpResult;
import ai.floedb.datamesh.client.transport.RetryTransport;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.error.DatameshWriteException;
import ai.floedb.datamesh.model.DatameshJson;
import ai.floedb.datamesh.zarr.ChunkNotFoundException;
import ai.floedb.datamesh.zarr.ChunkStore;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * {@link ChunkStore} over the gateway's zarr endpoints, at {@code
 * {gateway}/zarr[/query]/{datasource}/{key}}.
 *
 * <p>Headers (auth, session, parameters, cache bypass) are fixed when the store is built. Each
 * operation kind has its own {@link OperationPolicy}. A {@code 401} from any call is raised as
 * {@link DatameshConnectException}.
 */
public final class RemoteChunkStore implements ChunkStore {

  private static final Logger LOG = Logger.getLogger(RemoteChunkStore.class);

  static final String NO_CACHE = "no-transform,no-cache";

  private final RetryTransport transport;
  private final String base;
  private final String datasource;
  private final StoreApi api;
  private final boolean legacy;
  private final String writeMethod;
  private final Map<String, String> headers;
  private final OperationPolicy listing;
  private final OperationPolicy read;
  private final OperationPolicy write;
  private final OperationPolicy delete;

  private RemoteChunkStore(Builder b) {
    this.transport = Objects.requireNonNull(b.transport, "transport");
    this.datasource = Objects.requireNonNull(b.datasource, "datasource");
    this.legacy = b.legacy;
    this.api = b.legacy ? StoreApi.ZARR : b.api;
    this.base = Objects.requireNonNull(b.gateway, "gateway") + api.path();
    this.writeMethod = b.writeMethod;
    Map<String, String> h = new LinkedHashMap<>(b.authHeaders);
    if (b.lease != null) {
      h = b.lease.headers(h);
    }
    if (b.nocache) {
      h.put("cache-control", NO_CACHE);
    }
    if (b.parameters != null && !b.parameters.isEmpty()) {
      h.put("X-PARAMETERS", DatameshJson.write(b.parameters));
    }
    this.headers = Map.copyOf(h);
    this.listing = b.listing;
    this.read = b.read;
    this.write = b.write;
    this.delete = b.delete;
  }

  public static Builder builder(RetryTransport transport, String gateway, String datasource) {
    return new Builder(transport, gateway, datasource);
  }

  public StoreApi api() {
    return api;
  }

  public String datasource() {
    return datasource;
  }

  Map<String, String> headers() {
    return headers;
  }

  @Override
  public byte[] get(String key) {
    HttpResult r = call("GET", key, null, read);
    if (r.status() >= 300) {
      throw new ChunkNotFoundException(key);
    }
    return r.body();
  }

  @Override
  public boolean contains(String key) {
    return call(legacy ? "GET" : "HEAD", key, null, read).status() == 200;
  }

  @Override
  public void set(String key, byte[] value) {
    requireWritable("write");
    HttpResult r = call(writeMethod, key, value, write);
    if (r.status() >= 300) {
      throw new DatameshWriteException(
          "Failed to write " + key + ": " + r.status() + " - " + r.text());
    }
  }

  @Override
  public void delete(String key) {
    requireWritable("delete");
    HttpResult r = call("DELETE", key, null, delete);
    if (r.status() >= 300 && r.status() != 404) {
      LOG.debugf("Delete of %s/%s returned %d", datasource, key, r.status());
    }
  }

  @Override
  public List<String> keys() {
    HttpResult r = call("GET", "", null, listing);
    if (r.status() >= 400) {
      return List.of();
    }
    return ChunkListingParser.parse(r.text(), URI.create(url("")).getPath());
  }

  /** Removes the whole resource. */
  @Override
  public void clear() {
    delete("");
  }

  private void requireWritable(String operation) {
    if (api == StoreApi.QUERY) {
      throw new DatameshWriteException("Query api does not support " + operation + " operations");
    }
  }

  private String url(String key) {
    return base + "/" + datasource + "/" + key;
  }

  private HttpResult call(String method, String key, byte[] body, OperationPolicy policy) {
    HttpRequestSpec request =
        HttpRequestSpec.of(method, url(key))
            .withHeaders(headers)
            .withBody(body)
            .withTimeout(policy.timeout());
    HttpResult r = transport.execute(request, policy.retries());
    if (r.status() == 401) {
      throw new DatameshConnectException("Not Authorized " + r.text());
    }
    return r;
  }

  @Override
  public String toString() {
    return "RemoteChunkStore{" + base + "/" + datasource + "}";
  }

  public static final class Builder {
    private final RetryTransport transport;
    private final String gateway;
    private final String datasource;
    private StoreApi api = StoreApi.QUERY;
    private boolean legacy;
    private SessionLease lease;
    private Map<String, String> authHeaders = Map.of();
    private Map<String, Object> parameters;
    private boolean nocache;
    private String writeMethod = "POST";
    private OperationPolicy listing = OperationPolicy.of(DatameshConfig.DEFAULT_READ_TIMEOUT);
    private OperationPolicy read = OperationPolicy.of(DatameshConfig.DEFAULT_CHUNK_READ_TIMEOUT);
    private OperationPolicy write = OperationPolicy.of(DatameshConfig.DEFAULT_CHUNK_WRITE_TIMEOUT);
    private OperationPolicy delete = OperationPolicy.of(DatameshConfig.DEFAULT_READ_TIMEOUT);

    private Builder(RetryTransport transport, String gateway, String datasource) {
      this.transport = transport;
      this.gateway = gateway;
      this.datasource = datasource;
    }

    public Builder api(StoreApi api) {
      this.api = Objects.requireNonNull(api, "api");
      return this;
    }

    /** Legacy gateways only serve the {@link StoreApi#ZARR} api and have no HEAD support. */
    public Builder legacy(boolean legacy) {
      this.legacy = legacy;
      return this;
    }

    public Builder session(SessionLease lease) {
      this.lease = lease;
      return this;
    }

    public Builder authHeaders(Map<String, String> authHeaders) {
      this.authHeaders = Map.copyOf(authHeaders);
      return this;
    }

    /** Datasource parameters, sent as JSON in {@code X-PARAMETERS}. */
    public Builder parameters(Map<String, Object> parameters) {
      this.parameters = parameters;
      return this;
    }

    /** Bypass caching proxies between the client and the store. */
    public Builder nocache(boolean nocache) {
      this.nocache = nocache;
      return this;
    }

    public Builder writeMethod(String writeMethod) {
      this.writeMethod = Objects.requireNonNull(writeMethod, "writeMethod");
      return this;
    }

    public Builder listing(OperationPolicy listing) {
      this.listing = Objects.requireNonNull(listing, "listing");
      return this;
    }

    public Builder read(OperationPolicy read) {
      this.read = Objects.requireNonNull(read, "read");
      return this;
    }

    public Builder write(OperationPolicy write) {
      this.write = Objects.requireNonNull(write, "write");
      return this;
    }

    public Builder delete(OperationPolicy delete) {
      this.delete = Objects.requireNonNull(delete, "delete");
      return this;
    }

    public RemoteChunkStore build() {
      return new RemoteChunkStore(this);
    }
  }
}
