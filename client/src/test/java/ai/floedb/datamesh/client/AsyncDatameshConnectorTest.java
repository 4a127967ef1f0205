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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.transport.ScriptedSender;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.model.DatasourceMetadata;
import io.smallrye.mutiny.Uni;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncDatameshConnectorTest {

  private static final Duration WAIT = Duration.ofSeconds(10);

  private final ScriptedSender sender = new ScriptedSender();
  private ExecutorService executor;
  private AsyncDatameshConnector async;

  @BeforeEach
  void setUp() {
    sender
        .on("GET", "/info/datamesh-java/0.1.0", 200, "{}")
        .on(
            "GET",
            "/datasource/wave_hindcast",
            200,
            "{\"type\": \"Feature\", \"properties\": {\"name\": \"Wave hindcast\"}}")
        .on("DELETE", "/data/wave_hindcast", 204, "");
    DatameshConfig config =
        DatameshConfig.builder("abc").service("https://datamesh.test").retries(1).build();
    DatameshConnector connector =
        new DatameshConnector(
            config, sender, d -> {}, DatameshMetrics.inMemory(), Clock.systemUTC());
    executor = Executors.newSingleThreadExecutor();
    async = new AsyncDatameshConnector(connector, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void callsRunOnlyWhenSubscribed() {
    Uni<DatasourceMetadata> pending = async.getDatasource("wave_hindcast");

    assertThat(sender.requests("GET", "/datasource/wave_hindcast")).isEmpty();
    DatasourceMetadata meta = pending.await().atMost(WAIT);
    assertThat(meta.id()).isEqualTo("wave_hindcast");
    assertThat(meta.datasource().name()).isEqualTo("Wave hindcast");
  }

  @Test
  void eachSubscriptionRepeatsTheCall() {
    Uni<Boolean> delete = async.deleteDatasource("wave_hindcast");

    assertThat(delete.await().atMost(WAIT)).isTrue();
    assertThat(delete.await().atMost(WAIT)).isTrue();
    assertThat(sender.requests("DELETE", "/data/wave_hindcast")).hasSize(2);
  }

  @Test
  void failuresArePropagated() {
    assertThatThrownBy(() -> async.getDatasource("missing").await().atMost(WAIT))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessage("Datasource missing not found");
  }

  @Test
  void runsOnSuppliedExecutor() {
    String caller = Thread.currentThread().getName();

    String worker =
        async
            .getDatasource("wave_hindcast")
            .map(m -> Thread.currentThread().getName())
            .await()
            .atMost(WAIT);

    assertThat(worker).isNotEqualTo(caller);
    assertThat(async.blocking().isLegacy()).isFalse();
  }
}
