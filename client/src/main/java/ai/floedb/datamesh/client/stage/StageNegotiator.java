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

package ai.floedb.datamesh.client.stage;

import ai.floedb.datamesh.client.session.SessionLease;
import ai.floedb.datamesh.client.transport.HttpRequestSpec;
import ai.floedb.datamesh.client.transport.HttpResult;
import ai.floedb.datamesh.client.transport.RetryTransport;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.error.DatameshQueryException;
import ai.floedb.datamesh.model.DatameshJson;
import ai.floedb.datamesh.model.Query;
import ai.floedb.datamesh.model.Stage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/** Asks the service what a query would return, without transferring the data. */
public final class StageNegotiator {

  private static final Logger LOG = Logger.getLogger(StageNegotiator.class);

  private final RetryTransport transport;
  private final String gateway;
  private final Map<String, String> authHeaders;
  private final Duration timeout;

  public StageNegotiator(
      RetryTransport transport, String gateway, Map<String, String> authHeaders, Duration timeout) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.authHeaders = Map.copyOf(authHeaders);
    this.timeout = timeout;
  }

  /**
   * Stages {@code query} under {@code lease}.
   *
   * @return the stage, or empty when no data matches the query
   * @throws DatameshQueryException when the service rejects the query with a detail message
   * @throws DatameshConnectException for any other error response
   */
  public Optional<Stage> stage(Query query, SessionLease lease) {
    Map<String, String> headers = new LinkedHashMap<>(lease.headers(authHeaders));
    headers.put("Content-Type", "application/json");
    HttpRequestSpec request =
        HttpRequestSpec.of("POST", gateway + "/oceanql/stage/")
            .withHeaders(headers)
            .withBody(DatameshJson.write(query).getBytes(StandardCharsets.UTF_8))
            .withTimeout(timeout);
    HttpResult result = transport.execute(request);
    if (result.status() >= 400) {
      Optional<String> detail = result.detail();
      if (detail.isPresent()) {
        throw new DatameshQueryException(detail.get());
      }
      throw new DatameshConnectException("Datamesh server error: " + result.text());
    }
    if (result.status() == 204) {
      LOG.warnf("No data found for query on %s", query.datasource());
      return Optional.empty();
    }
    try {
      Stage stage = DatameshJson.mapper().readValue(result.body(), Stage.class);
      LOG.debugf(
          "Staged %s: %s, %d bytes, %d rows",
          query.datasource(), stage.container().wireName(), stage.size(), stage.dlen());
      return Optional.of(stage);
    } catch (IOException e) {
      throw new DatameshConnectException("Invalid stage returned for " + query.datasource(), e);
    }
  }
}
