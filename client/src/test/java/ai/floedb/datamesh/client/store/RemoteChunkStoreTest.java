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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.session.SessionLease;
import ai.floedb.datamesh.client.session.SessionManager;
import ai.floedb.datamesh.client.transport.JdkHttpSender;
import ai.floedb.datamesh.client.transport.RetryTransport;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.error.DatameshWriteException;
import ai.floedb.datamesh.model.Session;
import ai.floedb.datamesh.zarr.ChunkNotFoundException;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import ai.floedb.datamesh.zarr.ZarrGroup;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteChunkStoreTest {

  private static final String PREFIX = "/zarr/wave-hindcast/";

  private HttpServer server;
  private String gateway;
  private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
  private final List<String> calls = new CopyOnWriteArrayList<>();
  private final Map<String, String> lastHeaders = new ConcurrentHashMap<>();
  private volatile boolean unauthorized;
  private RetryTransport transport;
  private SessionLease lease;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/zarr/", this::handle);
    server.start();
    gateway = "http://127.0.0.1:" + server.getAddress().getPort();
    transport =
        new RetryTransport(
            new JdkHttpSender(Duration.ofSeconds(2)),
            2,
            Duration.ZERO,
            d -> {},
            DatameshMetrics.inMemory());
    lease =
        new SessionManager(
                transport, gateway, Map.of(), true, null, null, DatameshMetrics.inMemory())
            .acquire();
  }

  @AfterEach
  void stopServer() {
    if (server != null) {
      server.stop(0);
    }
  }

  private void handle(HttpExchange exchange) throws IOException {
    String method = exchange.getRequestMethod();
    String path = exchange.getRequestURI().getPath();
    calls.add(method + " " + path);
    exchange.getRequestHeaders().forEach((k, v) -> lastHeaders.put(k.toLowerCase(), v.get(0)));
    byte[] body = exchange.getRequestBody().readAllBytes();
    if (unauthorized) {
      respond(exchange, 401, "token expired".getBytes(StandardCharsets.UTF_8));
      return;
    }
    if (!path.startsWith(PREFIX)) {
      respond(exchange, 404, null);
      return;
    }
    String key = path.substring(PREFIX.length());
    switch (method) {
      case "POST":
      case "PUT":
        objects.put(key, body);
        respond(exchange, 200, null);
        return;
      case "DELETE":
        if (key.isEmpty()) {
          objects.clear();
        } else {
          objects.remove(key);
        }
        respond(exchange, 204, null);
        return;
      case "HEAD":
        exchange.sendResponseHeaders(objects.containsKey(key) ? 200 : 404, -1);
        exchange.close();
        return;
      default:
        if (key.isEmpty()) {
          respond(exchange, 200, listing().getBytes(StandardCharsets.UTF_8));
        } else if (objects.containsKey(key)) {
          respond(exchange, 200, objects.get(key));
        } else {
          respond(exchange, 404, null);
        }
    }
  }

  private String listing() {
    return objects.keySet().stream()
        .map(k -> k.contains("/") ? k.substring(0, k.indexOf('/') + 1) : k)
        .distinct()
        .map(e -> "<a href=\"" + e + "\">" + e + "</a>")
        .collect(
            Collectors.joining(
                "\n", "<html><body><a href=\"../\">../</a>\n", "</body></html>"));
  }

  private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
    if (body == null || body.length == 0) {
      exchange.sendResponseHeaders(status, -1);
      exchange.close();
      return;
    }
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private RemoteChunkStore.Builder store() {
    return RemoteChunkStore.builder(transport, gateway, "wave-hindcast")
        .api(StoreApi.ZARR)
        .authHeaders(Map.of("Authorization", "Token abc"));
  }

  @Test
  void storesAndReadsChunks() {
    RemoteChunkStore store = store().build();

    store.set("hs/0.0", new byte[] {1, 2, 3});

    assertThat(objects).containsKey("hs/0.0");
    assertThat(store.get("hs/0.0")).containsExactly(1, 2, 3);
    assertThat(store.contains("hs/0.0")).isTrue();
    assertThat(store.contains("hs/9.9")).isFalse();
    assertThatThrownBy(() -> store.get("hs/9.9")).isInstanceOf(ChunkNotFoundException.class);
    assertThat(calls)
        .contains("POST /zarr/wave-hindcast/hs/0.0", "HEAD /zarr/wave-hindcast/hs/0.0");
  }

  @Test
  void datasetRoundTripsThroughGateway() {
    RemoteChunkStore store = store().build();
    LabeledDataset ds =
        LabeledDataset.builder()
            .coord("time", NdArray.vector(0L, 1L, 2L))
            .dataVar("hs", List.of("time"), NdArray.vector(1.5, 2.0, 2.5))
            .build();

    ZarrDatasets.write(ds, store);
    objects.remove(".zmetadata");

    assertThat(store.keys()).contains(".zgroup", "hs/", "time/");
    try (ZarrGroup group = ZarrDatasets.open(store)) {
      assertThat(group.load()).isEqualTo(ds);
    }
  }

  @Test
  void clearRemovesWholeResource() {
    RemoteChunkStore store = store().build();
    store.set(".zgroup", new byte[] {1});

    store.clear();

    assertThat(objects).isEmpty();
    assertThat(calls).contains("DELETE /zarr/wave-hindcast/");
  }

  @Test
  void queryApiIsReadOnly() {
    RemoteChunkStore store = store().api(StoreApi.QUERY).build();

    assertThatThrownBy(() -> store.set("hs/0", new byte[] {1}))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessageContaining("Query api");
    assertThatThrownBy(() -> store.delete("hs/0")).isInstanceOf(DatameshWriteException.class);
    assertThat(calls).isEmpty();
  }

  @Test
  void legacyStoresUseZarrPathAndGetForContains() {
    objects.put(".zgroup", new byte[] {1});
    RemoteChunkStore store = store().api(StoreApi.QUERY).legacy(true).build();

    assertThat(store.api()).isEqualTo(StoreApi.ZARR);
    assertThat(store.contains(".zgroup")).isTrue();
    assertThat(calls).containsExactly("GET /zarr/wave-hindcast/.zgroup");
  }

  @Test
  void sendsSessionParametersAndCacheHeaders() {
    RemoteChunkStore store =
        store().session(lease).parameters(Map.of("run", 6)).nocache(true).build();

    store.contains(".zgroup");

    assertThat(lastHeaders)
        .containsEntry("authorization", "Token abc")
        .containsEntry(Session.HEADER.toLowerCase(), lease.id())
        .containsEntry("x-parameters", "{\"run\":6}")
        .containsEntry("cache-control", RemoteChunkStore.NO_CACHE);
  }

  @Test
  void unauthorizedIsConnectError() {
    unauthorized = true;
    RemoteChunkStore store = store().build();

    assertThatThrownBy(() -> store.get(".zgroup"))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessage("Not Authorized token expired");
  }
}
